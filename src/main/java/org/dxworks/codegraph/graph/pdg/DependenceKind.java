package org.dxworks.codegraph.graph.pdg;

public enum DependenceKind {
    CONTROL,
    DATA
}
