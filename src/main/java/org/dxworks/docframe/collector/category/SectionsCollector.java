package org.dxworks.docframe.collector.category;

import org.dxworks.docframe.collector.Collector;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.SectionEntry;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Section;
import org.dxworks.docframe.warehouse.Warehouse;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class SectionsCollector implements Collector {

    private final List<SectionEntry> sections = new ArrayList<>();

    @Override
    public String name() {
        return Categories.SECTIONS;
    }

    @Override
    public Set<TokenKind> interest() {
        return Set.of(TokenKind.HEADING_OPEN);
    }

    @Override
    public void onToken(Token token, Warehouse warehouse) {
        Section section = warehouse.sectionOf(token.getIndex())
                .filter(s -> s.getHeadingIndex() == token.getIndex())
                .orElseThrow(() -> new IllegalStateException("heading " + token.getIndex() + " opens no section"));
        sections.add(toEntry(section, token.getLine()));
    }

    @Override
    public Object finish(Warehouse warehouse) {
        List<Section> all = warehouse.sections();
        if (!all.isEmpty() && all.get(0).isPreamble()) {
            sections.add(0, toEntry(all.get(0), null));
        }
        return sections;
    }

    private static SectionEntry toEntry(Section section, Integer line) {
        SectionEntry entry = new SectionEntry();
        entry.id = section.getId();
        entry.level = section.getLevel();
        entry.title = section.getTitle();
        entry.headingIndex = section.isPreamble() ? null : section.getHeadingIndex();
        entry.startIndex = section.getStartIndex();
        entry.endIndex = section.getEndIndex();
        entry.line = line;
        entry.parentId = section.getParentOrdinal() == Section.NO_PARENT ? null : Section.idOf(section.getParentOrdinal());
        return entry;
    }
}
