package org.dxworks.docframe.collector.category;

import org.dxworks.docframe.collector.Collector;
import org.dxworks.docframe.model.BlockRef;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.ListEntry;
import org.dxworks.docframe.model.ListItemEntry;
import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Pair;
import org.dxworks.docframe.warehouse.Warehouse;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Top-level lists. Items of nested lists are attached to the item that contains them, so the
 * tree is assembled from the warehouse once all list openings are known.
 */
public class ListsCollector implements Collector {

    private static final Set<Container> LISTS = Set.of(Container.BULLET_LIST, Container.ORDERED_LIST);

    private final List<Integer> topLevel = new ArrayList<>();

    @Override
    public String name() {
        return Categories.LISTS;
    }

    @Override
    public Set<TokenKind> interest() {
        return Set.of(TokenKind.BULLET_LIST_OPEN, TokenKind.ORDERED_LIST_OPEN);
    }

    @Override
    public boolean shouldProcess(Token token, Warehouse warehouse) {
        int index = token.getIndex();
        return !warehouse.isIgnored(index) && warehouse.enclosing(index, LISTS).isEmpty();
    }

    @Override
    public void onToken(Token token, Warehouse warehouse) {
        topLevel.add(token.getIndex());
    }

    @Override
    public Object finish(Warehouse warehouse) {
        List<ListEntry> lists = new ArrayList<>(topLevel.size());
        for (int open : topLevel) {
            Token token = warehouse.token(open);
            ListEntry list = new ListEntry();
            list.id = "list_" + lists.size();
            list.type = token.getKind() == TokenKind.ORDERED_LIST_OPEN ? "ordered" : "bullet";
            list.startLine = token.getLine();
            list.endLine = token.getEndLine();
            list.sectionId = warehouse.sectionIdOf(open);
            list.items = items(warehouse, open);
            lists.add(list.summarize());
        }
        return lists;
    }

    private static List<ListItemEntry> items(Warehouse warehouse, int listOpen) {
        List<ListItemEntry> items = new ArrayList<>();
        for (int child : warehouse.children(listOpen)) {
            if (warehouse.token(child).getKind() != TokenKind.LIST_ITEM_OPEN) {
                continue;
            }
            ListItemEntry item = new ListItemEntry();
            item.text = itemText(warehouse, child);
            item.checked = itemChecked(warehouse, child);
            for (int block : warehouse.children(child)) {
                Token blockToken = warehouse.token(block);
                Container container = blockToken.getKind().getContainer();
                if (container != null && container.isList() && blockToken.getKind().isOpen()) {
                    item.children.addAll(items(warehouse, block));
                    continue;
                }
                String type = BlockRef.typeOf(container);
                if (type != null && blockToken.getKind().isOpen()) {
                    item.blocks.add(new BlockRef(type, blockToken.getLine(), blockToken.getEndLine()));
                }
            }
            items.add(item);
        }
        return items;
    }

    /** Text of the first paragraph directly inside the item. */
    static String itemText(Warehouse warehouse, int itemOpen) {
        for (int child : warehouse.children(itemOpen)) {
            if (warehouse.token(child).getKind() == TokenKind.PARAGRAPH_OPEN) {
                return warehouse.textOf(child).trim();
            }
        }
        return "";
    }

    private static Boolean itemChecked(Warehouse warehouse, int itemOpen) {
        Pair pair = warehouse.rangeFor(itemOpen).orElse(null);
        if (pair == null) {
            return null;
        }
        for (int i = pair.getOpenIndex() + 1; i < pair.getCloseIndex(); i++) {
            Token token = warehouse.token(i);
            if (token.getKind() != TokenKind.TASK_MARKER) {
                continue;
            }
            OptionalInt owner = warehouse.enclosing(i, Container.LIST_ITEM);
            if (owner.isPresent() && owner.getAsInt() == itemOpen) {
                return token.attrBoolean("checked");
            }
        }
        return null;
    }
}
