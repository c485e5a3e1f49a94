package org.dxworks.codegraph.graph.callgraph;

import org.dxworks.codegraph.CodegraphConfig;
import org.dxworks.codegraph.TestUtils;
import org.dxworks.codegraph.model.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallGraphTest {

    private final CallGraphBuilder builder = new CallGraphBuilder(CodegraphConfig.defaults());

    @Test
    void mutualRecursionIsDetected() throws IOException {
        CallGraph graph = builder.build(List.of(TestUtils.extractSample("typescript/calls.ts")));

        FunctionNode f = graph.find("f").orElseThrow();
        FunctionNode g = graph.find("g").orElseThrow();
        FunctionNode main = graph.find("main").orElseThrow();
        assertTrue(f.isRecursive());
        assertTrue(g.isRecursive());
        assertFalse(main.isRecursive());
        assertEquals(List.of("f", "g"), names(graph.recursiveFunctions()));

        assertEquals(1, graph.callDepth(f.id, g.id));
        assertEquals(1, graph.callDepth(g.id, f.id));
        assertEquals(2, graph.callDepth(main.id, g.id));
        assertEquals(-1, graph.callDepth(f.id, main.id));
        assertEquals(List.of("g", "main"), names(graph.callersOf(f.id)));
        assertEquals(2, graph.maxCallDepth(main.id));
        assertEquals(1, graph.maxCallDepth(f.id));
    }

    @Test
    void entryPointsAndDeadFunctions() throws IOException {
        CallGraph graph = builder.build(List.of(TestUtils.extractSample("typescript/calls.ts")));

        assertEquals(List.of("main"), names(graph.entryPoints()));
        assertEquals(List.of("unused"), names(graph.deadFunctions()));
        assertEquals(List.of("main", "unused"), names(graph.rootFunctions()));
        assertEquals(List.of("log"), graph.find("main").orElseThrow().getUnresolvedCalls());
        assertEquals(1, graph.unresolvedCallCount());
    }

    @Test
    void callChainsThroughARecursiveFunction() throws IOException {
        CallGraph graph = builder.build(List.of(TestUtils.extractSample("typescript/calls.ts")));
        FunctionNode f = graph.find("f").orElseThrow();

        List<List<FunctionNode>> cycles = graph.callChains(f.id, f.id);
        assertEquals(1, cycles.size());
        assertEquals(List.of("f", "g", "f"), names(cycles.get(0)));
    }

    @Test
    void sameModuleCandidatesWinOverOtherModules() {
        SyntaxTree first = TestUtils.extract("first.ts", "function helper() {\n}\nfunction run() {\n    helper();\n}\n");
        SyntaxTree second = TestUtils.extract("second.ts", "function helper() {\n}\nfunction go() {\n    helper();\n    run();\n}\n");
        CallGraph graph = builder.build(List.of(first, second));

        FunctionNode run = graph.find("first::run").orElseThrow();
        FunctionNode go = graph.find("second::go").orElseThrow();
        assertEquals(List.of("first::helper"), qualifiedNames(graph.calleesOf(run.id)));
        assertEquals(List.of("first::run", "second::helper"), sorted(qualifiedNames(graph.calleesOf(go.id))));
    }

    @Test
    void ambiguousCallsReachEveryCandidate() {
        SyntaxTree first = TestUtils.extract("first.ts", "function helper() {\n}\n");
        SyntaxTree second = TestUtils.extract("second.ts", "function helper() {\n}\n");
        SyntaxTree caller = TestUtils.extract("caller.ts", "function main() {\n    helper();\n}\n");
        CallGraph graph = builder.build(List.of(first, second, caller));

        FunctionNode main = graph.find("main").orElseThrow();
        assertEquals(2, graph.calleesOf(main.id).size());
        assertTrue(graph.graph().outgoing(main.id).stream().allMatch(edge -> edge.getKind().isAmbiguous()));
    }

    @Test
    void topLevelCallsBelongToTheModuleFunction() {
        SyntaxTree script = TestUtils.extract("script.ts", "function setup() {\n}\nsetup();\n");
        CallGraph graph = builder.build(List.of(script));

        FunctionNode module = graph.find("script::<module>").orElseThrow();
        assertTrue(module.synthetic);
        assertTrue(module.isEntryPoint());
        assertEquals(List.of("setup"), names(graph.calleesOf(module.id)));
    }

    @Test
    void filesSharingAModulePathKeepTheFirstInPathOrder() {
        SyntaxTree ts = TestUtils.extract("util.ts", "function helper() {\n}\n");
        SyntaxTree js = TestUtils.extract("util.js", "\nfunction helper() {\n}\n");
        FunctionNameTable table = new FunctionNameTable();
        table.register(ts);
        table.register(js);
        table.seal();

        assertEquals(1, table.size());
        FunctionNode helper = table.byQualifiedName("util::helper").orElseThrow();
        assertEquals("util.js", helper.filePath);
        assertEquals(2, helper.line);
    }

    @Test
    void tableMustBeSealedBeforeLookups() {
        FunctionNameTable table = new FunctionNameTable();
        table.register(TestUtils.extract("a.ts", "function a() {\n}\n"));

        assertThrows(IllegalStateException.class, () -> table.bySimpleName("a"));
        assertFalse(table.isSealed());
        table.seal();
        assertTrue(table.isSealed());
        assertEquals(1, table.size());
        assertThrows(IllegalStateException.class, () -> table.register(TestUtils.extract("b.ts", "function b() {\n}\n")));
    }

    private static List<String> names(List<FunctionNode> functions) {
        return functions.stream().map(f -> f.name).collect(Collectors.toList());
    }

    private static List<String> qualifiedNames(List<FunctionNode> functions) {
        return functions.stream().map(f -> f.qualifiedName).collect(Collectors.toList());
    }

    private static List<String> sorted(List<String> values) {
        return values.stream().sorted().collect(Collectors.toList());
    }
}
