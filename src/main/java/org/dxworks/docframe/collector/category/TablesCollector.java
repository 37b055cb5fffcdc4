package org.dxworks.docframe.collector.category;

import org.dxworks.docframe.collector.Collector;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.TableEntry;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Warehouse;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class TablesCollector implements Collector {

    private final List<TableEntry> tables = new ArrayList<>();

    @Override
    public String name() {
        return Categories.TABLES;
    }

    @Override
    public Set<TokenKind> interest() {
        return Set.of(TokenKind.TABLE_OPEN);
    }

    @Override
    public boolean shouldProcess(Token token, Warehouse warehouse) {
        return !warehouse.isIgnored(token.getIndex());
    }

    @Override
    public void onToken(Token token, Warehouse warehouse) {
        TableEntry table = new TableEntry();
        table.id = "table_" + tables.size();
        table.startLine = token.getLine();
        table.endLine = token.getEndLine();
        table.sectionId = warehouse.sectionIdOf(token.getIndex());

        for (int part : warehouse.children(token.getIndex())) {
            TokenKind partKind = warehouse.token(part).getKind();
            if (partKind != TokenKind.THEAD_OPEN && partKind != TokenKind.TBODY_OPEN) {
                continue;
            }
            for (int row : warehouse.children(part)) {
                if (warehouse.token(row).getKind() != TokenKind.TR_OPEN) {
                    continue;
                }
                List<String> cells = new ArrayList<>();
                for (int cell : warehouse.children(row)) {
                    Token cellToken = warehouse.token(cell);
                    if (cellToken.getKind() == TokenKind.TH_OPEN) {
                        table.headers.add(warehouse.textOf(cell).trim());
                        table.align.add(cellToken.attrString("align"));
                    } else if (cellToken.getKind() == TokenKind.TD_OPEN) {
                        cells.add(warehouse.textOf(cell).trim());
                    }
                }
                if (partKind == TokenKind.TBODY_OPEN && !cells.isEmpty()) {
                    table.rows.add(cells);
                }
            }
        }
        tables.add(table.summarize());
    }

    @Override
    public Object finish(Warehouse warehouse) {
        return tables;
    }
}
