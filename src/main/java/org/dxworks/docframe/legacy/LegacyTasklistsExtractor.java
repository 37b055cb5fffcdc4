package org.dxworks.docframe.legacy;

import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.TaskEntry;
import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

class LegacyTasklistsExtractor implements LegacyExtractor {

    private static final Set<Container> LIST_ITEM = Set.of(Container.LIST_ITEM);

    @Override
    public String category() {
        return Categories.TASKLISTS;
    }

    @Override
    public Object extract(List<Token> tokens) {
        List<Integer> sectionStarts = LegacyTokenScans.sectionStarts(tokens);
        List<TaskEntry> tasks = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getKind() != TokenKind.TASK_MARKER || LegacyTokenScans.insideRaw(tokens, i)) {
                continue;
            }
            TaskEntry task = new TaskEntry();
            task.checked = token.attrBoolean("checked");
            int item = LegacyTokenScans.nearestAncestor(tokens, i, LIST_ITEM);
            if (item >= 0) {
                task.text = LegacyListsExtractor.itemText(tokens, item);
                task.line = tokens.get(item).getLine();
                task.sectionId = LegacyTokenScans.sectionIdAt(sectionStarts, item);
            } else {
                task.text = "";
                task.line = token.getLine();
                task.sectionId = LegacyTokenScans.sectionIdAt(sectionStarts, i);
            }
            tasks.add(task);
        }
        return tasks;
    }
}
