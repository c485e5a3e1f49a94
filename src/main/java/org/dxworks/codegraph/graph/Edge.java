package org.dxworks.codegraph.graph;

import java.util.Objects;

/** Typed edge between two arena indices. */
public final class Edge<K> {
    private final int from;
    private final int to;
    private final K kind;

    public Edge(int from, int to, K kind) {
        this.from = from;
        this.to = to;
        this.kind = kind;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public K getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge<?> edge = (Edge<?>) o;
        return from == edge.from && to == edge.to && Objects.equals(kind, edge.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, kind);
    }

    @Override
    public String toString() {
        return from + " -" + kind + "-> " + to;
    }
}
