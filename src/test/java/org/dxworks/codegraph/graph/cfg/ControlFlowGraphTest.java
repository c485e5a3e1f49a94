package org.dxworks.codegraph.graph.cfg;

import org.dxworks.codegraph.TestUtils;
import org.dxworks.codegraph.model.ParsedBody;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ControlFlowGraphTest {

    private final ControlFlowBuilder builder = new ControlFlowBuilder();

    @Test
    void codeAfterReturnInBothBranchesIsUnreachable() throws IOException {
        ControlFlowGraph cfg = build("typescript/branches.ts", "classify");

        assertEquals(BlockKind.ENTRY, cfg.entry().getKind());
        assertEquals(BlockKind.BRANCH, cfg.block(1).getKind());
        assertTrue(cfg.graph().hasEdge(1, 2, ControlEdgeKind.TRUE_BRANCH));
        assertTrue(cfg.graph().hasEdge(1, 3, ControlEdgeKind.FALSE_BRANCH));
        assertEquals(BlockKind.RETURN, cfg.block(2).getKind());
        assertEquals(BlockKind.RETURN, cfg.block(3).getKind());

        assertEquals(Set.of(4), cfg.unreachable());
        assertEquals(Set.of(4), cfg.codeAfterJump());
        assertTrue(cfg.statementsIn(4).get(0).getText().startsWith("log"));
        assertEquals(7, cfg.block(4).getStartLine());
        assertEquals(2, cfg.cyclomaticComplexity());
    }

    @Test
    void loopsGetBackEdgesAndNaturalLoops() throws IOException {
        ControlFlowGraph cfg = build("typescript/loops.ts", "sum");

        assertEquals(BlockKind.LOOP, cfg.block(1).getKind());
        assertEquals(BlockKind.LOOP, cfg.block(5).getKind());
        assertTrue(cfg.graph().hasEdge(4, 1, ControlEdgeKind.LOOP_BACK));
        assertTrue(cfg.graph().hasEdge(3, 1, ControlEdgeKind.CONTINUE));
        assertTrue(cfg.graph().hasEdge(1, 5, ControlEdgeKind.FALSE_BRANCH));
        assertTrue(cfg.graph().hasEdge(6, 5, ControlEdgeKind.LOOP_BACK));

        Map<Integer, Set<Integer>> loops = cfg.naturalLoops();
        assertEquals(Set.of(1, 2, 3, 4), loops.get(1));
        assertEquals(Set.of(5, 6), loops.get(5));

        assertEquals(4, cfg.cyclomaticComplexity());
        assertEquals(List.of(7), cfg.exitBlocks());
        assertTrue(cfg.unreachable().isEmpty());
    }

    @Test
    void emptyBodyIsASingleEntryBlock() {
        ControlFlowGraph cfg = builder.build(TestUtils.parse(TestUtils.extract("noop.ts", "function noop() {}\n"), "noop"));

        assertEquals(1, cfg.blockCount());
        assertEquals(0, cfg.edgeCount());
        assertEquals(List.of(ControlFlowGraph.ENTRY), cfg.exitBlocks());
        assertEquals(1, cfg.cyclomaticComplexity());
    }

    @Test
    void straightLineBodyStaysInTheEntryBlock() throws IOException {
        ControlFlowGraph cfg = build("typescript/flow.ts", "compute");

        assertEquals(1, cfg.blockCount());
        assertFalse(cfg.entry().isEmpty());
        assertEquals(List.of(ControlFlowGraph.ENTRY), cfg.exitBlocks());
    }

    @Test
    void everyStatementIsPlacedInOneBlock() throws IOException {
        ControlFlowGraph cfg = build("typescript/loops.ts", "sum");
        ParsedBody body = cfg.getBody();

        for (int id = 0; id < body.size(); id++) {
            assertTrue(cfg.blockOf(id) >= 0, "statement " + id + " has no block");
        }
    }

    private ControlFlowGraph build(String sample, String function) throws IOException {
        return builder.build(TestUtils.parse(TestUtils.extractSample(sample), function));
    }
}
