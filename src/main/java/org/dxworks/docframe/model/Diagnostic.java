package org.dxworks.docframe.model;

public class Diagnostic {
    public DiagnosticKind kind;
    public String source; // "warehouse" or the failing category
    public Integer tokenIndex; // null when raised outside token dispatch
    public String message;

    public Diagnostic() {
    }

    public Diagnostic(DiagnosticKind kind, String source, Integer tokenIndex, String message) {
        this.kind = kind;
        this.source = source;
        this.tokenIndex = tokenIndex;
        this.message = message;
    }

    public static Diagnostic collectorFailure(String source, Integer tokenIndex, RuntimeException e) {
        String message = e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
        return new Diagnostic(DiagnosticKind.COLLECTOR_FAILURE, source, tokenIndex, message);
    }

    @Override
    public String toString() {
        return kind + "[" + source + (tokenIndex == null ? "" : "@" + tokenIndex) + "] " + message;
    }
}
