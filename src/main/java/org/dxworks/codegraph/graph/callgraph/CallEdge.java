package org.dxworks.codegraph.graph.callgraph;

import java.util.Objects;

/**
 * Call-site data carried by a call-graph edge. Calls from the same caller to the same
 * callee on different lines are separate edges.
 */
public final class CallEdge {
    private final int line;
    private final boolean ambiguous;

    public CallEdge(int line, boolean ambiguous) {
        this.line = line;
        this.ambiguous = ambiguous;
    }

    public int getLine() {
        return line;
    }

    /** The callee name matched several functions and every one of them got an edge. */
    public boolean isAmbiguous() {
        return ambiguous;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallEdge)) return false;
        CallEdge callEdge = (CallEdge) o;
        return line == callEdge.line && ambiguous == callEdge.ambiguous;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, ambiguous);
    }

    @Override
    public String toString() {
        return ambiguous ? "line " + line + " (ambiguous)" : "line " + line;
    }
}
