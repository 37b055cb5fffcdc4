package org.dxworks.docframe.token;

public enum Nesting {
    OPEN,
    CLOSE,
    LEAF
}
