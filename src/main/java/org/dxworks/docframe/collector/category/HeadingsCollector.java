package org.dxworks.docframe.collector.category;

import org.dxworks.docframe.collector.Collector;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.HeadingEntry;
import org.dxworks.docframe.text.Slugs;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Section;
import org.dxworks.docframe.warehouse.Warehouse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Headings with unique slugs; the parent is the heading of the parent section. */
public class HeadingsCollector implements Collector {

    private final List<HeadingEntry> headings = new ArrayList<>();
    private final Map<Integer, String> idsBySection = new HashMap<>();
    private final Slugs slugs = new Slugs();

    @Override
    public String name() {
        return Categories.HEADINGS;
    }

    @Override
    public Set<TokenKind> interest() {
        return Set.of(TokenKind.HEADING_OPEN);
    }

    @Override
    public void onToken(Token token, Warehouse warehouse) {
        HeadingEntry heading = new HeadingEntry();
        heading.level = token.attrInt("level");
        heading.text = warehouse.textOf(token.getIndex()).trim();
        heading.line = token.getLine();
        heading.slug = slugs.unique(heading.text);
        heading.id = "heading_" + heading.slug;

        Section section = warehouse.sectionOf(token.getIndex()).orElse(null);
        if (section != null) {
            heading.parentId = idsBySection.get(section.getParentOrdinal());
            idsBySection.put(section.getOrdinal(), heading.id);
        }
        headings.add(heading);
    }

    @Override
    public Object finish(Warehouse warehouse) {
        return headings;
    }
}
