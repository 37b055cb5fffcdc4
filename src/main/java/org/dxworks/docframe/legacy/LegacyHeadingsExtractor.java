package org.dxworks.docframe.legacy;

import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.HeadingEntry;
import org.dxworks.docframe.text.Slugs;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

class LegacyHeadingsExtractor implements LegacyExtractor {

    @Override
    public String category() {
        return Categories.HEADINGS;
    }

    @Override
    public Object extract(List<Token> tokens) {
        List<HeadingEntry> headings = new ArrayList<>();
        Deque<HeadingEntry> stack = new ArrayDeque<>();
        Slugs slugs = new Slugs();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getKind() != TokenKind.HEADING_OPEN) {
                continue;
            }
            HeadingEntry heading = new HeadingEntry();
            heading.level = token.attrInt("level");
            heading.text = LegacyTokenScans.textOf(tokens, i).trim();
            heading.line = token.getLine();
            heading.slug = slugs.unique(heading.text);
            heading.id = "heading_" + heading.slug;

            while (!stack.isEmpty() && stack.peek().level >= heading.level) {
                stack.pop();
            }
            heading.parentId = stack.isEmpty() ? null : stack.peek().id;
            stack.push(heading);
            headings.add(heading);
        }
        return headings;
    }
}
