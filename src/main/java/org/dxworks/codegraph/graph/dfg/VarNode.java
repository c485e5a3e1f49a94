package org.dxworks.codegraph.graph.dfg;

/**
 * One data-flow node. For definitions, uses and parameters {@code name} is the variable;
 * for constants the literal, for operations the expression and for calls the callee.
 */
public class VarNode {
    public final int id;
    public final VarKind kind;
    public final String name;
    public final int line;
    public final int statementId;
    public final String text;

    VarNode(int id, VarKind kind, String name, int line, int statementId, String text) {
        this.id = id;
        this.kind = kind;
        this.name = name;
        this.line = line;
        this.statementId = statementId;
        this.text = text;
    }

    public boolean isDefinition() {
        return kind == VarKind.DEFINITION || kind == VarKind.PARAMETER;
    }

    @Override
    public String toString() {
        return kind + " " + name + "@" + line;
    }
}
