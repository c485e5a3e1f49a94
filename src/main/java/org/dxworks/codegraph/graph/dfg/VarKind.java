package org.dxworks.codegraph.graph.dfg;

public enum VarKind {
    DEFINITION,
    USE,
    PARAMETER,
    CONSTANT,
    OPERATION,
    CALL
}
