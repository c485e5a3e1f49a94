package org.dxworks.codegraph.model;

public enum DiagnosticKind {
    PARSE_FAILURE,
    IO_FAILURE,
    FILE_TOO_LARGE,
    /** The grammar could not be loaded; the file was extracted with patterns instead. */
    GRAMMAR_UNAVAILABLE,
    /** Extraction or analysis of the file failed unexpectedly; the file was dropped. */
    ANALYSIS_FAILURE
}
