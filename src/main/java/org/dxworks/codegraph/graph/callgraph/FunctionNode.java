package org.dxworks.codegraph.graph.callgraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function registered in the call graph. Files with top-level calls also get a
 * synthetic {@code <module>} function standing for the module body.
 */
public class FunctionNode {
    public final int id;
    public final String name;
    public final String qualifiedName;
    public final String filePath;
    public final String modulePath;
    public final int line;
    public final String language;
    public final boolean synthetic;
    private final List<String> unresolvedCalls = new ArrayList<>();
    private boolean recursive;
    private boolean entryPoint;

    FunctionNode(int id, FunctionNameTable.Registration registration) {
        this.id = id;
        this.name = registration.name;
        this.qualifiedName = registration.qualifiedName;
        this.filePath = registration.filePath;
        this.modulePath = registration.modulePath;
        this.line = registration.line;
        this.language = registration.language;
        this.synthetic = registration.synthetic;
    }

    /** Callee names no registered function matched, such as library calls. */
    public List<String> getUnresolvedCalls() {
        synchronized (unresolvedCalls) {
            return Collections.unmodifiableList(new ArrayList<>(unresolvedCalls));
        }
    }

    void addUnresolvedCall(String callee) {
        synchronized (unresolvedCalls) {
            if (!unresolvedCalls.contains(callee)) {
                unresolvedCalls.add(callee);
            }
        }
    }

    public boolean isRecursive() {
        return recursive;
    }

    void setRecursive(boolean recursive) {
        this.recursive = recursive;
    }

    public boolean isEntryPoint() {
        return entryPoint;
    }

    void setEntryPoint(boolean entryPoint) {
        this.entryPoint = entryPoint;
    }

    @Override
    public String toString() {
        return qualifiedName;
    }
}
