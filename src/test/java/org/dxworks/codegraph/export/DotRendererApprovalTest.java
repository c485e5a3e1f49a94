package org.dxworks.codegraph.export;

import org.approvaltests.Approvals;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

public class DotRendererApprovalTest {

    private final DotRenderer renderer = new DotRenderer();

    @Test
    void render_ControlFlow_BranchWithUnreachableTail() {
        GraphDocument document = new GraphDocument(GraphExporter.CONTROL_FLOW, "demo::check");
        document.addNode(0, "entry").attr("statements", List.of()).attr("reachable", true);
        document.addNode(1, "branch").attr("statements", List.of("if (x > \"a\")")).attr("reachable", true);
        document.addNode(2, "return").attr("statements", List.of("return 1;")).attr("reachable", true);
        document.addNode(3, "normal").attr("statements", List.of("log(x);")).attr("reachable", false);
        document.addEdge(0, 1, "sequential");
        document.addEdge(1, 2, "true_branch");
        document.addEdge(1, 3, "false_branch");

        Approvals.verify(renderer.render(document));
    }

    @Test
    void ambiguousCallsAreDashed() {
        GraphDocument document = new GraphDocument(GraphExporter.CALL_GRAPH, "project");
        document.addNode(0, "function").attr("qualifiedName", "app::main").attr("entryPoint", true);
        document.addNode(1, "function").attr("qualifiedName", "a::run");
        document.addEdge(0, 1, "calls").attr("ambiguous", true);

        String dot = renderer.render(document);

        assertTrue(dot.contains("rankdir=LR;"));
        assertTrue(dot.contains("n0 [label=\"app::main\", shape=box, style=filled, fillcolor=palegreen];"));
        assertTrue(dot.contains("n0 -> n1 [style=dashed];"));
    }

    @Test
    void longStatementsAreShortened() {
        GraphDocument document = new GraphDocument(GraphExporter.PROGRAM_DEPENDENCY, "demo::f");
        StringBuilder text = new StringBuilder("call(");
        for (int i = 0; i < 20; i++) {
            text.append("argument").append(i).append(", ");
        }
        document.addNode(0, "statement").attr("line", 3).attr("text", text.append(");").toString());

        String dot = renderer.render(document);

        assertTrue(dot.contains("[label=\"3: call(argument0, "));
        assertTrue(dot.contains("...\"];"));
    }
}
