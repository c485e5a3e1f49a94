package org.dxworks.codegraph.graph.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Straight-line run of statements. Statements are referenced by their id in the
 * function's {@link org.dxworks.codegraph.model.ParsedBody}.
 */
public class BasicBlock {
    private final int id;
    private BlockKind kind;
    private final List<Integer> statements = new ArrayList<>();
    private final List<Integer> lines = new ArrayList<>();
    private boolean followsJump;

    BasicBlock(int id, BlockKind kind) {
        this.id = id;
        this.kind = kind;
    }

    public int getId() {
        return id;
    }

    public BlockKind getKind() {
        return kind;
    }

    void setKind(BlockKind kind) {
        this.kind = kind;
    }

    public List<Integer> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    void addStatement(int statementId, int line) {
        statements.add(statementId);
        lines.add(line);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public int getStartLine() {
        return lines.isEmpty() ? -1 : lines.get(0);
    }

    public int getEndLine() {
        return lines.isEmpty() ? -1 : lines.get(lines.size() - 1);
    }

    /** True when the block was opened with no predecessor, right after a jump. */
    public boolean isFollowsJump() {
        return followsJump;
    }

    void setFollowsJump(boolean followsJump) {
        this.followsJump = followsJump;
    }

    @Override
    public String toString() {
        return "B" + id + "[" + kind + "]" + statements;
    }
}
