package org.dxworks.docframe.token;

import java.util.EnumMap;
import java.util.Map;

public enum TokenKind {
    HEADING_OPEN(Nesting.OPEN, Container.HEADING),
    HEADING_CLOSE(Nesting.CLOSE, Container.HEADING),
    PARAGRAPH_OPEN(Nesting.OPEN, Container.PARAGRAPH),
    PARAGRAPH_CLOSE(Nesting.CLOSE, Container.PARAGRAPH),
    BLOCKQUOTE_OPEN(Nesting.OPEN, Container.BLOCKQUOTE),
    BLOCKQUOTE_CLOSE(Nesting.CLOSE, Container.BLOCKQUOTE),
    BULLET_LIST_OPEN(Nesting.OPEN, Container.BULLET_LIST),
    BULLET_LIST_CLOSE(Nesting.CLOSE, Container.BULLET_LIST),
    ORDERED_LIST_OPEN(Nesting.OPEN, Container.ORDERED_LIST),
    ORDERED_LIST_CLOSE(Nesting.CLOSE, Container.ORDERED_LIST),
    LIST_ITEM_OPEN(Nesting.OPEN, Container.LIST_ITEM),
    LIST_ITEM_CLOSE(Nesting.CLOSE, Container.LIST_ITEM),
    TABLE_OPEN(Nesting.OPEN, Container.TABLE),
    TABLE_CLOSE(Nesting.CLOSE, Container.TABLE),
    THEAD_OPEN(Nesting.OPEN, Container.THEAD),
    THEAD_CLOSE(Nesting.CLOSE, Container.THEAD),
    TBODY_OPEN(Nesting.OPEN, Container.TBODY),
    TBODY_CLOSE(Nesting.CLOSE, Container.TBODY),
    TR_OPEN(Nesting.OPEN, Container.TR),
    TR_CLOSE(Nesting.CLOSE, Container.TR),
    TH_OPEN(Nesting.OPEN, Container.TH),
    TH_CLOSE(Nesting.CLOSE, Container.TH),
    TD_OPEN(Nesting.OPEN, Container.TD),
    TD_CLOSE(Nesting.CLOSE, Container.TD),
    FENCE_OPEN(Nesting.OPEN, Container.FENCE),
    FENCE_CLOSE(Nesting.CLOSE, Container.FENCE),
    CODE_BLOCK_OPEN(Nesting.OPEN, Container.CODE_BLOCK),
    CODE_BLOCK_CLOSE(Nesting.CLOSE, Container.CODE_BLOCK),
    CODE_INLINE_OPEN(Nesting.OPEN, Container.CODE_INLINE),
    CODE_INLINE_CLOSE(Nesting.CLOSE, Container.CODE_INLINE),
    HTML_BLOCK_OPEN(Nesting.OPEN, Container.HTML_BLOCK),
    HTML_BLOCK_CLOSE(Nesting.CLOSE, Container.HTML_BLOCK),
    FRONTMATTER_OPEN(Nesting.OPEN, Container.FRONTMATTER),
    FRONTMATTER_CLOSE(Nesting.CLOSE, Container.FRONTMATTER),
    EM_OPEN(Nesting.OPEN, Container.EM),
    EM_CLOSE(Nesting.CLOSE, Container.EM),
    STRONG_OPEN(Nesting.OPEN, Container.STRONG),
    STRONG_CLOSE(Nesting.CLOSE, Container.STRONG),
    LINK_OPEN(Nesting.OPEN, Container.LINK),
    LINK_CLOSE(Nesting.CLOSE, Container.LINK),
    IMAGE_OPEN(Nesting.OPEN, Container.IMAGE),
    IMAGE_CLOSE(Nesting.CLOSE, Container.IMAGE),

    TEXT(Nesting.LEAF, null),
    SOFTBREAK(Nesting.LEAF, null),
    HARDBREAK(Nesting.LEAF, null),
    HTML_INLINE(Nesting.LEAF, null),
    HR(Nesting.LEAF, null),
    TASK_MARKER(Nesting.LEAF, null),
    FRONTMATTER_ENTRY(Nesting.LEAF, null);

    private static final Map<Container, TokenKind> OPENS = new EnumMap<>(Container.class);
    private static final Map<Container, TokenKind> CLOSES = new EnumMap<>(Container.class);

    static {
        for (TokenKind kind : values()) {
            if (kind.nesting == Nesting.OPEN) {
                OPENS.put(kind.container, kind);
            } else if (kind.nesting == Nesting.CLOSE) {
                CLOSES.put(kind.container, kind);
            }
        }
    }

    private final Nesting nesting;
    private final Container container;

    TokenKind(Nesting nesting, Container container) {
        this.nesting = nesting;
        this.container = container;
    }

    public Nesting getNesting() {
        return nesting;
    }

    /** The container this marker opens or closes, {@code null} for leaves. */
    public Container getContainer() {
        return container;
    }

    public boolean isOpen() {
        return nesting == Nesting.OPEN;
    }

    public boolean isClose() {
        return nesting == Nesting.CLOSE;
    }

    /** Text-bearing leaves that make up the visible text of a container. */
    public boolean isTextual() {
        return this == TEXT || this == SOFTBREAK || this == HARDBREAK;
    }

    public static TokenKind openOf(Container container) {
        return OPENS.get(container);
    }

    public static TokenKind closeOf(Container container) {
        return CLOSES.get(container);
    }
}
