package org.dxworks.codegraph.model;

public enum DeclKind {
    FUNCTION,
    CLASS,
    IMPORT,
    VARIABLE,
    CALL_SITE
}
