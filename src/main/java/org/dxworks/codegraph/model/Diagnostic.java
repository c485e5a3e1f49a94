package org.dxworks.codegraph.model;

public class Diagnostic {
    private final String filePath;
    private final DiagnosticKind kind;
    private final String message;

    public Diagnostic(String filePath, DiagnosticKind kind, String message) {
        this.filePath = filePath;
        this.kind = kind;
        this.message = message;
    }

    public String getFilePath() {
        return filePath;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    /** Whether the file was dropped from the batch, as opposed to analyzed with reduced fidelity. */
    public boolean isSkip() {
        return kind != DiagnosticKind.GRAMMAR_UNAVAILABLE;
    }

    @Override
    public String toString() {
        return kind + " " + filePath + ": " + message;
    }
}
