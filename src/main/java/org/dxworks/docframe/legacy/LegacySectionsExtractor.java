package org.dxworks.docframe.legacy;

import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.SectionEntry;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Section;

import java.util.ArrayList;
import java.util.List;

class LegacySectionsExtractor implements LegacyExtractor {

    @Override
    public String category() {
        return Categories.SECTIONS;
    }

    @Override
    public Object extract(List<Token> tokens) {
        List<SectionEntry> sections = new ArrayList<>();
        List<Integer> headings = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            if (isSectionHeading(tokens.get(i))) {
                headings.add(i);
            }
        }
        if (headings.isEmpty()) {
            return sections;
        }

        int offset = 0;
        if (headings.get(0) > 0) {
            SectionEntry preamble = new SectionEntry();
            preamble.id = Section.idOf(0);
            preamble.level = 0;
            preamble.startIndex = 0;
            preamble.endIndex = headings.get(0) - 1;
            sections.add(preamble);
            offset = 1;
        }

        for (int h = 0; h < headings.size(); h++) {
            int open = headings.get(h);
            Token token = tokens.get(open);
            int level = token.attrInt("level");

            // Forward scan for the next section heading
            int end = tokens.size() - 1;
            for (int j = open + 1; j < tokens.size(); j++) {
                if (isSectionHeading(tokens.get(j))) {
                    end = j - 1;
                    break;
                }
            }

            String parentId = null;
            for (int p = h - 1; p >= 0; p--) {
                if (tokens.get(headings.get(p)).attrInt("level") < level) {
                    parentId = Section.idOf(p + offset);
                    break;
                }
            }

            SectionEntry section = new SectionEntry();
            section.id = Section.idOf(h + offset);
            section.level = level;
            section.title = LegacyTokenScans.textOf(tokens, open).trim();
            section.headingIndex = open;
            section.startIndex = open;
            section.endIndex = end;
            section.line = token.getLine();
            section.parentId = parentId;
            sections.add(section);
        }
        return sections;
    }

    private static boolean isSectionHeading(Token token) {
        return token.getKind() == TokenKind.HEADING_OPEN;
    }
}
