package org.dxworks.codegraph.model;

public enum StatementKind {
    /** Function signature; the first statement of every body, holds parameter definitions. */
    ENTRY,
    SIMPLE,
    IF,
    LOOP,
    SWITCH,
    CASE,
    TRY,
    HANDLER,
    BLOCK,
    RETURN,
    THROW,
    BREAK,
    CONTINUE,
    GOTO,
    LABEL
}
