package org.dxworks.docframe.collector.category;

import org.dxworks.docframe.collector.Collector;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.TaskEntry;
import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Warehouse;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

public class TasklistsCollector implements Collector {

    private final List<TaskEntry> tasks = new ArrayList<>();

    @Override
    public String name() {
        return Categories.TASKLISTS;
    }

    @Override
    public Set<TokenKind> interest() {
        return Set.of(TokenKind.TASK_MARKER);
    }

    @Override
    public boolean shouldProcess(Token token, Warehouse warehouse) {
        return !warehouse.isIgnored(token.getIndex());
    }

    @Override
    public void onToken(Token token, Warehouse warehouse) {
        TaskEntry task = new TaskEntry();
        task.checked = token.attrBoolean("checked");
        OptionalInt item = warehouse.enclosing(token.getIndex(), Container.LIST_ITEM);
        if (item.isPresent()) {
            Token itemToken = warehouse.token(item.getAsInt());
            task.text = ListsCollector.itemText(warehouse, item.getAsInt());
            task.line = itemToken.getLine();
            task.sectionId = warehouse.sectionIdOf(item.getAsInt());
        } else {
            task.text = "";
            task.line = token.getLine();
            task.sectionId = warehouse.sectionIdOf(token.getIndex());
        }
        tasks.add(task);
    }

    @Override
    public Object finish(Warehouse warehouse) {
        return tasks;
    }
}
