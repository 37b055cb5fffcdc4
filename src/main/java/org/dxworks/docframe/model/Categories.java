package org.dxworks.docframe.model;

import java.util.List;

/** Category keys of the extraction result, in output order. */
public final class Categories {
    public static final String SECTIONS = "sections";
    public static final String PARAGRAPHS = "paragraphs";
    public static final String LISTS = "lists";
    public static final String TABLES = "tables";
    public static final String CODE_BLOCKS = "code_blocks";
    public static final String HEADINGS = "headings";
    public static final String LINKS = "links";
    public static final String IMAGES = "images";
    public static final String BLOCKQUOTES = "blockquotes";
    public static final String FRONTMATTER = "frontmatter";
    public static final String TASKLISTS = "tasklists";
    public static final String MATH = "math";

    public static final List<String> ORDER = List.of(
            SECTIONS, PARAGRAPHS, LISTS, TABLES, CODE_BLOCKS, HEADINGS,
            LINKS, IMAGES, BLOCKQUOTES, FRONTMATTER, TASKLISTS, MATH);

    private Categories() {
    }
}
