package org.dxworks.codegraph.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.codegraph.model.Diagnostic;
import org.dxworks.codegraph.model.DiagnosticKind;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/** Append-only, safe to share between worker threads. Every diagnostic is also logged. */
public class DiagnosticCollector {
    private static final Logger logger = LogManager.getLogger(DiagnosticCollector.class);

    private final ConcurrentLinkedQueue<Diagnostic> diagnostics = new ConcurrentLinkedQueue<>();

    public void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        logger.warn("{}", diagnostic);
    }

    public void add(String filePath, DiagnosticKind kind, String message) {
        add(new Diagnostic(filePath, kind, message));
    }

    public List<Diagnostic> list() {
        return new ArrayList<>(diagnostics);
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getKind() == kind) {
                result.add(diagnostic);
            }
        }
        return result;
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }
}
