package org.dxworks.codegraph.graph.dfg;

public enum DataEdgeKind {
    /** A definition reaching a use of the same name. */
    DEF_USE,
    /** An operand feeding the value a statement computes or defines. */
    VALUE_FLOW
}
