package org.dxworks.docframe.model;

public enum DiagnosticKind {
    STRUCTURAL_WARNING,
    COLLECTOR_FAILURE
}
