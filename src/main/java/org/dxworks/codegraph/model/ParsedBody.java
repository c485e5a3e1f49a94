package org.dxworks.codegraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function body as a statement tree, plus every statement indexed by id in
 * pre-order. The entry statement always has id 0.
 */
public class ParsedBody {
    private final FunctionUnit function;
    private final Statement entry;
    private final List<Statement> statements;
    private final List<Statement> byId;

    public ParsedBody(FunctionUnit function, Statement entry, List<Statement> statements) {
        this.function = function;
        this.entry = entry;
        this.statements = Collections.unmodifiableList(statements);
        List<Statement> all = new ArrayList<>();
        number(entry, all);
        for (Statement statement : statements) {
            number(statement, all);
        }
        this.byId = Collections.unmodifiableList(all);
    }

    private static void number(Statement statement, List<Statement> all) {
        statement.setId(all.size());
        all.add(statement);
        for (Statement child : statement.body) {
            number(child, all);
        }
        if (statement.elseBody != null) {
            for (Statement child : statement.elseBody) {
                number(child, all);
            }
        }
        for (Statement clause : statement.clauses) {
            number(clause, all);
        }
        if (statement.finallyBody != null) {
            for (Statement child : statement.finallyBody) {
                number(child, all);
            }
        }
    }

    public FunctionUnit getFunction() {
        return function;
    }

    public Statement getEntry() {
        return entry;
    }

    /** Top-level statements of the body, in source order. */
    public List<Statement> getStatements() {
        return statements;
    }

    public Statement statement(int id) {
        return byId.get(id);
    }

    public int size() {
        return byId.size();
    }
}
