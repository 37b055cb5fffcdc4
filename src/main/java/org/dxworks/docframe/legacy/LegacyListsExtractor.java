package org.dxworks.docframe.legacy;

import org.dxworks.docframe.model.BlockRef;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.ListEntry;
import org.dxworks.docframe.model.ListItemEntry;
import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

class LegacyListsExtractor implements LegacyExtractor {

    private static final Set<Container> LISTS = Set.of(Container.BULLET_LIST, Container.ORDERED_LIST);
    private static final Set<Container> LIST_ITEM = Set.of(Container.LIST_ITEM);

    @Override
    public String category() {
        return Categories.LISTS;
    }

    @Override
    public Object extract(List<Token> tokens) {
        List<Integer> sectionStarts = LegacyTokenScans.sectionStarts(tokens);
        List<ListEntry> lists = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            boolean listOpen = token.getKind() == TokenKind.BULLET_LIST_OPEN || token.getKind() == TokenKind.ORDERED_LIST_OPEN;
            if (!listOpen || LegacyTokenScans.insideRaw(tokens, i) || LegacyTokenScans.hasAncestor(tokens, i, LISTS)) {
                continue;
            }
            ListEntry list = new ListEntry();
            list.id = "list_" + lists.size();
            list.type = token.getKind() == TokenKind.ORDERED_LIST_OPEN ? "ordered" : "bullet";
            list.startLine = token.getLine();
            list.endLine = token.getEndLine();
            list.sectionId = LegacyTokenScans.sectionIdAt(sectionStarts, i);
            list.items = items(tokens, i);
            lists.add(list.summarize());
        }
        return lists;
    }

    private static List<ListItemEntry> items(List<Token> tokens, int listOpen) {
        List<ListItemEntry> items = new ArrayList<>();
        for (int child : LegacyTokenScans.directChildren(tokens, listOpen)) {
            if (tokens.get(child).getKind() != TokenKind.LIST_ITEM_OPEN) {
                continue;
            }
            ListItemEntry item = new ListItemEntry();
            item.text = itemText(tokens, child);
            item.checked = checked(tokens, child);
            for (int block : LegacyTokenScans.directChildren(tokens, child)) {
                Token blockToken = tokens.get(block);
                if (!blockToken.getKind().isOpen()) {
                    continue;
                }
                Container container = blockToken.getKind().getContainer();
                if (container.isList()) {
                    item.children.addAll(items(tokens, block));
                } else if (BlockRef.typeOf(container) != null) {
                    item.blocks.add(new BlockRef(BlockRef.typeOf(container), blockToken.getLine(), blockToken.getEndLine()));
                }
            }
            items.add(item);
        }
        return items;
    }

    static String itemText(List<Token> tokens, int itemOpen) {
        for (int child : LegacyTokenScans.directChildren(tokens, itemOpen)) {
            if (tokens.get(child).getKind() == TokenKind.PARAGRAPH_OPEN) {
                return LegacyTokenScans.textOf(tokens, child).trim();
            }
        }
        return "";
    }

    private static Boolean checked(List<Token> tokens, int itemOpen) {
        int close = LegacyTokenScans.matchingClose(tokens, itemOpen);
        for (int j = itemOpen + 1; j < close; j++) {
            Token token = tokens.get(j);
            if (token.getKind() == TokenKind.TASK_MARKER
                    && LegacyTokenScans.nearestAncestor(tokens, j, LIST_ITEM) == itemOpen) {
                return token.attrBoolean("checked");
            }
        }
        return null;
    }
}
