package org.dxworks.codegraph.graph.cfg;

public enum BlockKind {
    ENTRY,
    NORMAL,
    BRANCH,
    LOOP,
    RETURN,
    EXIT;

    public boolean isDecision() {
        return this == BRANCH || this == LOOP;
    }
}
