package org.dxworks.codegraph.graph.pdg;

import org.dxworks.codegraph.TestUtils;
import org.dxworks.codegraph.graph.cfg.ControlFlowBuilder;
import org.dxworks.codegraph.graph.cfg.ControlFlowGraph;
import org.dxworks.codegraph.graph.dfg.DataFlowBuilder;
import org.dxworks.codegraph.graph.dfg.DataFlowGraph;
import org.dxworks.codegraph.graph.dfg.VarKind;
import org.dxworks.codegraph.graph.dfg.VarNode;
import org.dxworks.codegraph.model.ParsedBody;
import org.dxworks.codegraph.model.StatementKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgramDependencyGraphTest {

    @Test
    void slicesContainTheirStartingStatement() throws IOException {
        ProgramDependencyGraph pdg = build("typescript/taint.ts", "handle");

        for (PdgNode node : pdg.nodes()) {
            assertTrue(pdg.backwardSlice(node.id).contains(node));
            assertTrue(pdg.forwardSlice(node.id).contains(node));
        }
    }

    @Test
    void backwardSliceFollowsDataDependences() throws IOException {
        ProgramDependencyGraph pdg = build("typescript/taint.ts", "handle");

        List<Integer> backward = lines(pdg.sliceAtLine(4, true));
        assertTrue(backward.contains(2));
        assertTrue(backward.contains(4));
        assertFalse(backward.contains(3));
        assertFalse(backward.contains(5));

        List<Integer> forward = lines(pdg.sliceAtLine(3, false));
        assertEquals(List.of(3, 5), forward);

        assertTrue(pdg.sliceAtLine(42, true).isEmpty());
    }

    @Test
    void independentPairsHaveNoPathEitherWay() throws IOException {
        ProgramDependencyGraph pdg = build("typescript/taint.ts", "handle");

        List<List<Integer>> pairs = pdg.independentPairs().stream().map(ProgramDependencyGraphTest::lines)
                .collect(Collectors.toList());
        assertEquals(List.of(List.of(2, 3), List.of(2, 5), List.of(3, 4), List.of(4, 5)), pairs);
        assertEquals(2, pdg.nodeOf(2));
        assertEquals(-1, pdg.nodeOf(99));
    }

    @Test
    void branchBodiesAreControlDependentOnTheCondition() throws IOException {
        ProgramDependencyGraph pdg = build("typescript/branches.ts", "classify");

        PdgNode condition = pdg.nodesAtLine(2).get(0);
        assertEquals(StatementKind.IF, condition.kind);
        assertTrue(condition.predicate);
        PdgNode thenReturn = pdg.nodesAtLine(3).get(0);
        PdgNode elseReturn = pdg.nodesAtLine(5).get(0);
        assertTrue(pdg.graph().hasEdge(condition.id, thenReturn.id, DependenceKind.CONTROL));
        assertTrue(pdg.graph().hasEdge(condition.id, elseReturn.id, DependenceKind.CONTROL));
    }

    @Test
    void taintReachesSinkThroughAssignments() throws IOException {
        ProgramDependencyGraph pdg = build("typescript/taint.ts", "handle");

        TaintReport report = pdg.taint("input", "exec");
        assertTrue(report.hasFlows());
        TaintReport.Flow flow = report.getFlows().get(0);
        assertEquals(VarKind.PARAMETER, flow.source.kind);
        assertEquals("input", flow.source.name);
        assertEquals(VarKind.CALL, flow.sink.kind);
        assertEquals(4, flow.sink.line);
        assertTrue(flow.path.stream().anyMatch(step -> step.kind == VarKind.DEFINITION && step.name.equals("cmd")));
        assertEquals(report.getSinks(), report.taintedSinks());
    }

    @Test
    void untaintedSinkHasNoFlow() throws IOException {
        ProgramDependencyGraph pdg = build("typescript/taint.ts", "handle");

        TaintReport report = pdg.taint("input", "log");
        assertEquals(1, report.getSinks().size());
        assertFalse(report.hasFlows());
        for (VarNode sink : report.getSinks()) {
            assertFalse(report.isTainted(sink.id));
        }
    }

    @Test
    void independentStatementsFormAParallelGroup() throws IOException {
        ProgramDependencyGraph pdg = build("typescript/taint.ts", "handle");

        List<List<PdgNode>> groups = pdg.parallelGroups();
        assertFalse(groups.isEmpty());
        List<Integer> first = lines(groups.get(0));
        assertEquals(List.of(2, 3), first);
    }

    private static ProgramDependencyGraph build(String sample, String function) throws IOException {
        ParsedBody body = TestUtils.parse(TestUtils.extractSample(sample), function);
        ControlFlowGraph cfg = new ControlFlowBuilder().build(body);
        DataFlowGraph dfg = new DataFlowBuilder().build(body);
        return new ProgramDependencyBuilder().build(cfg, dfg);
    }

    private static List<Integer> lines(List<PdgNode> nodes) {
        return nodes.stream().map(n -> n.line).collect(Collectors.toList());
    }
}
