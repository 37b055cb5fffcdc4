package org.dxworks.docframe.legacy;

import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.TableEntry;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;

import java.util.ArrayList;
import java.util.List;

class LegacyTablesExtractor implements LegacyExtractor {

    @Override
    public String category() {
        return Categories.TABLES;
    }

    @Override
    public Object extract(List<Token> tokens) {
        List<Integer> sectionStarts = LegacyTokenScans.sectionStarts(tokens);
        List<TableEntry> tables = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getKind() != TokenKind.TABLE_OPEN || LegacyTokenScans.insideRaw(tokens, i)) {
                continue;
            }
            TableEntry table = new TableEntry();
            table.id = "table_" + tables.size();
            table.startLine = token.getLine();
            table.endLine = token.getEndLine();
            table.sectionId = LegacyTokenScans.sectionIdAt(sectionStarts, i);

            int close = LegacyTokenScans.matchingClose(tokens, i);
            boolean inBody = false;
            List<String> row = null;
            for (int j = i + 1; j < close; j++) {
                Token cell = tokens.get(j);
                switch (cell.getKind()) {
                    case THEAD_OPEN -> inBody = false;
                    case TBODY_OPEN -> inBody = true;
                    case TR_OPEN -> row = new ArrayList<>();
                    case TR_CLOSE -> {
                        if (inBody && row != null && !row.isEmpty()) {
                            table.rows.add(row);
                        }
                        row = null;
                    }
                    case TH_OPEN -> {
                        table.headers.add(LegacyTokenScans.textOf(tokens, j).trim());
                        table.align.add(cell.attrString("align"));
                    }
                    case TD_OPEN -> {
                        if (row != null) {
                            row.add(LegacyTokenScans.textOf(tokens, j).trim());
                        }
                    }
                    default -> {
                    }
                }
            }
            tables.add(table.summarize());
        }
        return tables;
    }
}
