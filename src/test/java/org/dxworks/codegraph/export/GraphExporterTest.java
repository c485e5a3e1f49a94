package org.dxworks.codegraph.export;

import org.dxworks.codegraph.CodegraphConfig;
import org.dxworks.codegraph.TestUtils;
import org.dxworks.codegraph.graph.callgraph.CallGraphBuilder;
import org.dxworks.codegraph.graph.cfg.ControlFlowBuilder;
import org.dxworks.codegraph.graph.cfg.ControlFlowGraph;
import org.dxworks.codegraph.graph.deps.DependencyGraphBuilder;
import org.dxworks.codegraph.graph.dfg.DataFlowBuilder;
import org.dxworks.codegraph.graph.dfg.DataFlowGraph;
import org.dxworks.codegraph.graph.pdg.ProgramDependencyBuilder;
import org.dxworks.codegraph.graph.pdg.ProgramDependencyGraph;
import org.dxworks.codegraph.model.ParsedBody;
import org.dxworks.codegraph.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphExporterTest {

    private final GraphExporter exporter = new GraphExporter();

    @Test
    void controlFlowCarriesComplexityAndReachability() throws IOException {
        ParsedBody body = TestUtils.parse(TestUtils.extractSample("typescript/branches.ts"), "classify");
        ControlFlowGraph cfg = new ControlFlowBuilder().build(body);

        GraphDocument document = exporter.controlFlow(cfg);

        assertEquals(GraphExporter.CONTROL_FLOW, document.getGraph());
        assertEquals("branches::classify", document.getTitle());
        assertEquals(2, document.metadata.get("complexity"));
        assertEquals(List.of(4), document.metadata.get("unreachable"));
        assertEquals(5, document.nodes.size());
        assertEquals("branch", document.nodes.get(1).kind);
        assertEquals(Boolean.FALSE, document.nodes.get(4).get("reachable"));
        assertTrue(document.edges.stream().anyMatch(e -> e.from == 1 && e.to == 2 && e.kind.equals("true_branch")));
    }

    @Test
    void dataFlowListsUnusedDefinitions() throws IOException {
        ParsedBody body = TestUtils.parse(TestUtils.extractSample("typescript/flow.ts"), "compute");
        DataFlowGraph dfg = new DataFlowBuilder().build(body);

        GraphDocument document = exporter.dataFlow(dfg);

        assertEquals(List.of("b@3"), document.metadata.get("unused"));
        assertTrue(document.nodes.stream().anyMatch(n -> n.kind.equals("definition") && "a".equals(n.get("name"))));
    }

    @Test
    void callGraphMarksRecursionAndDeadCode() throws IOException {
        GraphDocument document = exporter.callGraph(new CallGraphBuilder(CodegraphConfig.defaults())
                .build(List.of(TestUtils.extractSample("typescript/calls.ts"))));

        assertEquals(List.of("calls::f", "calls::g"), document.metadata.get("recursive"));
        assertEquals(List.of("calls::unused"), document.metadata.get("dead"));
        assertEquals(4, document.metadata.get("functions"));
        GraphDocument.Node main = document.nodes.stream()
                .filter(n -> "main".equals(n.get("name"))).findFirst().orElseThrow();
        assertTrue(main.is("entryPoint"));
        assertTrue(main.is("root"));
        assertEquals(Map.of("function", 4), GraphExporter.kindCounts(document));
    }

    @Test
    void dependencyGraphFlagsModulesInCycles() throws IOException {
        List<SourceFile> files = new ArrayList<>();
        for (String name : List.of("a.ts", "b.ts", "c.ts")) {
            files.add(new SourceFile(TestUtils.sample("deps/" + name), name, TestUtils.readSample("deps/" + name)));
        }

        GraphDocument document = exporter.dependencyGraph(new DependencyGraphBuilder(TestUtils.REGISTRY).build(files));

        assertEquals(Boolean.TRUE, document.metadata.get("hasCycles"));
        assertEquals(List.of(List.of("a.ts", "b.ts", "c.ts", "a.ts")), document.metadata.get("cycles"));
        assertTrue(document.nodes.stream().allMatch(n -> n.is("inCycle")));
        assertEquals(2, document.nodes.get(2).get("depth"));
        assertEquals("./c", document.edges.get(1).get("target"));
    }

    @Test
    void sliceAndTaintFindingsAreAddedToTheDocument() throws IOException {
        ParsedBody body = TestUtils.parse(TestUtils.extractSample("typescript/taint.ts"), "handle");
        ProgramDependencyGraph pdg = new ProgramDependencyBuilder()
                .build(new ControlFlowBuilder().build(body), new DataFlowBuilder().build(body));
        GraphDocument document = exporter.programDependency(pdg);

        exporter.addSlice(document, pdg, 4);
        exporter.addTaint(document, pdg.taint("input", "exec"));

        assertEquals(4, document.metadata.get("sliceLine"));
        List<?> backward = (List<?>) document.metadata.get("backwardSlice");
        assertTrue(backward.contains(2));
        assertFalse(backward.contains(3));
        assertEquals(List.of(4), document.metadata.get("forwardSlice"));
        assertEquals(List.of("exec@4"), document.metadata.get("taintedSinks"));
        List<?> paths = (List<?>) document.metadata.get("taintPaths");
        List<?> path = (List<?>) paths.get(0);
        assertTrue(path.get(0).toString().startsWith("parameter input@"));
        assertEquals("call exec@4", path.get(path.size() - 1));
    }

    @Test
    void sliceAtALineWithoutStatementsLeavesTheDocumentAlone() throws IOException {
        ParsedBody body = TestUtils.parse(TestUtils.extractSample("typescript/taint.ts"), "handle");
        ProgramDependencyGraph pdg = new ProgramDependencyBuilder()
                .build(new ControlFlowBuilder().build(body), new DataFlowBuilder().build(body));
        GraphDocument document = exporter.programDependency(pdg);

        exporter.addSlice(document, pdg, 42);

        assertFalse(document.metadata.containsKey("sliceLine"));
    }
}
