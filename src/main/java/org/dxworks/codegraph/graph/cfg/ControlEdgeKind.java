package org.dxworks.codegraph.graph.cfg;

public enum ControlEdgeKind {
    SEQUENTIAL,
    TRUE_BRANCH,
    FALSE_BRANCH,
    LOOP_BACK,
    BREAK,
    CONTINUE
}
