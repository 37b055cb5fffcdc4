package org.dxworks.docframe.warehouse;

/**
 * Thrown when the token sequence breaks an assumption the builder cannot recover from.
 * The document is aborted; no partial warehouse is returned.
 */
public class BuilderInvariantViolation extends RuntimeException {

    private final int tokenIndex;

    public BuilderInvariantViolation(int tokenIndex, String message) {
        super("Token " + tokenIndex + ": " + message);
        this.tokenIndex = tokenIndex;
    }

    public int getTokenIndex() {
        return tokenIndex;
    }
}
