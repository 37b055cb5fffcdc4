package org.dxworks.docframe.collector.category;

import org.dxworks.docframe.collector.Collector;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.Frontmatter;
import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Warehouse;

import java.util.OptionalInt;
import java.util.Set;

/** Key/value data of the first front-matter block, {@code null} when the document has none. */
public class FrontmatterCollector implements Collector {

    private Frontmatter frontmatter;
    private int blockIndex = -1;

    @Override
    public String name() {
        return Categories.FRONTMATTER;
    }

    @Override
    public Set<TokenKind> interest() {
        return Set.of(TokenKind.FRONTMATTER_OPEN, TokenKind.FRONTMATTER_ENTRY);
    }

    @Override
    public void onToken(Token token, Warehouse warehouse) {
        if (token.getKind() == TokenKind.FRONTMATTER_OPEN) {
            if (frontmatter == null) {
                frontmatter = new Frontmatter();
                frontmatter.startLine = token.getLine();
                frontmatter.endLine = token.getEndLine();
                blockIndex = token.getIndex();
            }
            return;
        }
        OptionalInt owner = warehouse.enclosing(token.getIndex(), Container.FRONTMATTER);
        if (frontmatter != null && owner.isPresent() && owner.getAsInt() == blockIndex) {
            String key = token.attrString("key");
            if (key != null) {
                frontmatter.put(key, token.attrList("values"));
            }
        }
    }

    @Override
    public Object finish(Warehouse warehouse) {
        return frontmatter;
    }

    @Override
    public Object emptyResult() {
        return null;
    }
}
