package org.dxworks.codegraph.graph.deps;

import java.util.Objects;

/** The import statement behind a dependency edge. */
public final class DependencyEdge {
    private final String target;
    private final int line;

    public DependencyEdge(String target, int line) {
        this.target = target;
        this.line = line;
    }

    /** Import text as written, before resolution. */
    public String getTarget() {
        return target;
    }

    public int getLine() {
        return line;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependencyEdge)) return false;
        DependencyEdge that = (DependencyEdge) o;
        return line == that.line && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, line);
    }

    @Override
    public String toString() {
        return target + "@" + line;
    }
}
