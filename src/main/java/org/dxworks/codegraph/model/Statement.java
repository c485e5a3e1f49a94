package org.dxworks.codegraph.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One node of a function's structured statement tree. Compound statements keep their
 * nested bodies; the text of a compound statement is its header (condition, loop header,
 * case label, handler clause).
 */
public class Statement {
    private int id = -1;
    private final StatementKind kind;
    private final String text;
    private final int line;

    public final List<Statement> body = new ArrayList<>();
    /** Else branch of an IF; null when the IF has no else. */
    public List<Statement> elseBody;
    /** CASE statements of a SWITCH, HANDLER statements of a TRY. */
    public final List<Statement> clauses = new ArrayList<>();
    /** Finally block of a TRY; null when absent. */
    public List<Statement> finallyBody;

    /** LOOP whose condition is evaluated after the body (do-while, repeat-while). */
    public boolean postCondition;
    /** LOOP without an exit condition (Rust loop, Go bare for, while(true)). */
    public boolean unconditional;
    /** SWITCH whose arms do not fall through into the next arm. */
    public boolean matchStyle;
    /** CASE that matches everything (default, _, else). */
    public boolean defaultCase;
    /** SIMPLE statement containing a ternary or an if/match expression. */
    public boolean inlineBranch;
    /** Target of a GOTO or name of a LABEL. */
    public String label;

    public Statement(StatementKind kind, String text, int line) {
        this.kind = kind;
        this.text = text;
        this.line = line;
    }

    public int getId() {
        return id;
    }

    void setId(int id) {
        this.id = id;
    }

    public StatementKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public boolean hasElse() {
        return elseBody != null;
    }

    @Override
    public String toString() {
        return kind + "@" + line + ": " + text;
    }
}
