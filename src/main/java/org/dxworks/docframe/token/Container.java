package org.dxworks.docframe.token;

/**
 * Structural containers a pair of open/close tokens can delimit.
 * Raw containers hold literal content that other extractors must not look into.
 */
public enum Container {
    HEADING("heading", false),
    PARAGRAPH("paragraph", false),
    BLOCKQUOTE("blockquote", false),
    BULLET_LIST("bullet_list", false),
    ORDERED_LIST("ordered_list", false),
    LIST_ITEM("list_item", false),
    TABLE("table", false),
    THEAD("thead", false),
    TBODY("tbody", false),
    TR("tr", false),
    TH("th", false),
    TD("td", false),
    FENCE("fence", true),
    CODE_BLOCK("code_block", true),
    CODE_INLINE("code_inline", true),
    HTML_BLOCK("html_block", true),
    FRONTMATTER("frontmatter", false),
    EM("em", false),
    STRONG("strong", false),
    LINK("link", false),
    IMAGE("image", false);

    private final String label;
    private final boolean raw;

    Container(String label, boolean raw) {
        this.label = label;
        this.raw = raw;
    }

    public String getLabel() {
        return label;
    }

    public boolean isRaw() {
        return raw;
    }

    public boolean isList() {
        return this == BULLET_LIST || this == ORDERED_LIST;
    }
}
