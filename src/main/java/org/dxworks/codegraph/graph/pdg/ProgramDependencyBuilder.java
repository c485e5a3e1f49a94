package org.dxworks.codegraph.graph.pdg;

import org.dxworks.codegraph.graph.Edge;
import org.dxworks.codegraph.graph.Graph;
import org.dxworks.codegraph.graph.cfg.BasicBlock;
import org.dxworks.codegraph.graph.cfg.ControlEdgeKind;
import org.dxworks.codegraph.graph.cfg.ControlFlowGraph;
import org.dxworks.codegraph.graph.dfg.DataEdgeKind;
import org.dxworks.codegraph.graph.dfg.DataFlowGraph;
import org.dxworks.codegraph.model.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges a function's control-flow and data-flow graphs over its statements.
 * <p>
 * Control dependence is approximated without dominator trees: a block depends on a
 * decision block B when it is reached from some of B's successors but not all of them,
 * walking forward without passing through B again. Blocks every successor reaches lie
 * past the join point and depend on nothing in B. Nested and irregular branches may be
 * over- or under-reported.
 */
public class ProgramDependencyBuilder {

    public ProgramDependencyGraph build(ControlFlowGraph cfg, DataFlowGraph dfg) {
        Graph<PdgNode, DependenceKind> graph = new Graph<>();
        Map<Integer, Integer> nodeOfStatement = new HashMap<>();
        Map<Integer, Integer> blockOfStatement = new TreeMap<>();
        for (BasicBlock block : cfg.blocks()) {
            for (Integer statementId : block.getStatements()) {
                blockOfStatement.put(statementId, block.getId());
            }
        }
        for (Map.Entry<Integer, Integer> placed : blockOfStatement.entrySet()) {
            Statement statement = cfg.getBody().statement(placed.getKey());
            BasicBlock block = cfg.block(placed.getValue());
            boolean predicate = block.getKind().isDecision();
            int id = graph.nodeCount();
            graph.addNode(new PdgNode(id, statement.getId(), statement.getKind(), statement.getLine(),
                    statement.getText(), block.getId(), predicate));
            nodeOfStatement.put(statement.getId(), id);
        }

        addControlDependences(cfg, graph, nodeOfStatement);
        addDataDependences(dfg, graph, nodeOfStatement);
        return new ProgramDependencyGraph(cfg, dfg, graph);
    }

    private static void addControlDependences(ControlFlowGraph cfg, Graph<PdgNode, DependenceKind> graph,
                                              Map<Integer, Integer> nodeOfStatement) {
        Graph<BasicBlock, ControlEdgeKind> flow = cfg.graph();
        for (BasicBlock decision : cfg.blocks()) {
            Set<Integer> successors = flow.successors(decision.getId());
            if (!decision.getKind().isDecision() || successors.size() < 2 || decision.isEmpty()) {
                continue;
            }
            int decisionId = decision.getId();
            List<Set<Integer>> regions = new ArrayList<>();
            for (Integer successor : successors) {
                Set<Integer> region = flow.traverse(Collections.singleton(successor),
                        edge -> edge.getTo() != decisionId, false);
                region.remove(decisionId);
                regions.add(region);
            }

            List<Integer> headers = decision.getStatements();
            int header = nodeOfStatement.get(headers.get(headers.size() - 1));
            for (BasicBlock block : cfg.blocks()) {
                int count = 0;
                for (Set<Integer> region : regions) {
                    if (region.contains(block.getId())) {
                        count++;
                    }
                }
                if (count == 0 || count == regions.size()) {
                    continue;
                }
                for (Integer statementId : block.getStatements()) {
                    int dependent = nodeOfStatement.get(statementId);
                    if (dependent != header) {
                        graph.addEdge(header, dependent, DependenceKind.CONTROL);
                    }
                }
            }
        }
    }

    private static void addDataDependences(DataFlowGraph dfg, Graph<PdgNode, DependenceKind> graph,
                                           Map<Integer, Integer> nodeOfStatement) {
        for (Edge<DataEdgeKind> edge : dfg.edges()) {
            if (edge.getKind() != DataEdgeKind.DEF_USE) {
                continue;
            }
            Integer from = nodeOfStatement.get(dfg.node(edge.getFrom()).statementId);
            Integer to = nodeOfStatement.get(dfg.node(edge.getTo()).statementId);
            if (from != null && to != null && !from.equals(to)) {
                graph.addEdge(from, to, DependenceKind.DATA);
            }
        }
    }
}
