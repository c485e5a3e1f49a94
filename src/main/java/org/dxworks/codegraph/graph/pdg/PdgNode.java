package org.dxworks.codegraph.graph.pdg;

import org.dxworks.codegraph.model.StatementKind;

/** A statement of the function, placed in control-flow block {@code block}. */
public class PdgNode {
    public final int id;
    public final int statementId;
    public final StatementKind kind;
    public final int line;
    public final String text;
    public final int block;
    /** Heads a branch or loop block, so other statements can depend on it. */
    public final boolean predicate;

    PdgNode(int id, int statementId, StatementKind kind, int line, String text, int block, boolean predicate) {
        this.id = id;
        this.statementId = statementId;
        this.kind = kind;
        this.line = line;
        this.text = text;
        this.block = block;
        this.predicate = predicate;
    }

    @Override
    public String toString() {
        return line + ": " + text;
    }
}
