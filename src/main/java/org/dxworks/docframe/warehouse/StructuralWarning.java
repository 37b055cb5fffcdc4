package org.dxworks.docframe.warehouse;

/** Recoverable malformed structure found while building the warehouse. */
public final class StructuralWarning {

    private final int tokenIndex;
    private final String message;

    public StructuralWarning(int tokenIndex, String message) {
        this.tokenIndex = tokenIndex;
        this.message = message;
    }

    public int getTokenIndex() {
        return tokenIndex;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "#" + tokenIndex + ": " + message;
    }
}
