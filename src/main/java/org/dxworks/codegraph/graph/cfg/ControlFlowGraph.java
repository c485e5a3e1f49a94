package org.dxworks.codegraph.graph.cfg;

import org.dxworks.codegraph.graph.Edge;
import org.dxworks.codegraph.graph.Graph;
import org.dxworks.codegraph.model.FunctionUnit;
import org.dxworks.codegraph.model.ParsedBody;
import org.dxworks.codegraph.model.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Basic blocks of one function and the control edges between them. Block 0 is the entry.
 * Blocks that follow an unconditional jump are kept but get no incoming edge, so they show
 * up as unreachable.
 */
public class ControlFlowGraph {
    public static final int ENTRY = 0;

    private final ParsedBody body;
    private final Graph<BasicBlock, ControlEdgeKind> graph;
    private final List<Integer> exits;
    private final Map<Integer, Integer> blockOfStatement;
    private Set<Integer> reachable;

    ControlFlowGraph(ParsedBody body, Graph<BasicBlock, ControlEdgeKind> graph, List<Integer> exits) {
        this.body = body;
        this.graph = graph;
        this.exits = Collections.unmodifiableList(exits);
        Map<Integer, Integer> index = new LinkedHashMap<>();
        for (BasicBlock block : graph.nodes()) {
            for (Integer statementId : block.getStatements()) {
                index.put(statementId, block.getId());
            }
        }
        this.blockOfStatement = index;
    }

    public FunctionUnit getFunction() {
        return body.getFunction();
    }

    public ParsedBody getBody() {
        return body;
    }

    public Graph<BasicBlock, ControlEdgeKind> graph() {
        return graph;
    }

    public List<BasicBlock> blocks() {
        return graph.nodes();
    }

    public BasicBlock block(int id) {
        return graph.node(id);
    }

    public BasicBlock entry() {
        return graph.node(ENTRY);
    }

    public List<Edge<ControlEdgeKind>> edges() {
        return graph.edges();
    }

    /** Return blocks and fall-off exit blocks. */
    public List<Integer> exitBlocks() {
        return exits;
    }

    /** Block holding the statement, or -1 when the statement was never placed. */
    public int blockOf(int statementId) {
        Integer block = blockOfStatement.get(statementId);
        return block == null ? -1 : block;
    }

    public List<Statement> statementsIn(int blockId) {
        List<Statement> result = new ArrayList<>();
        for (Integer statementId : graph.node(blockId).getStatements()) {
            result.add(body.statement(statementId));
        }
        return result;
    }

    public Set<Integer> reachable() {
        if (reachable == null) {
            reachable = Collections.unmodifiableSet(graph.reachableFrom(ENTRY));
        }
        return reachable;
    }

    public Set<Integer> unreachable() {
        Set<Integer> result = new TreeSet<>();
        for (int i = 0; i < graph.nodeCount(); i++) {
            if (!reachable().contains(i)) {
                result.add(i);
            }
        }
        return result;
    }

    /** Unreachable blocks opened directly after a return, throw, break, continue or goto. */
    public Set<Integer> codeAfterJump() {
        Set<Integer> result = new TreeSet<>();
        for (Integer id : unreachable()) {
            BasicBlock block = graph.node(id);
            if (block.isFollowsJump() && !block.isEmpty()) {
                result.add(id);
            }
        }
        return result;
    }

    /**
     * 1 + the extra out-edges of every decision block. Equals edges - nodes + 2 on a
     * connected graph with a single exit, and stays meaningful when dead blocks exist.
     */
    public int cyclomaticComplexity() {
        int complexity = 1;
        for (BasicBlock block : graph.nodes()) {
            if (block.getKind().isDecision()) {
                complexity += Math.max(0, graph.outgoing(block.getId()).size() - 1);
            }
        }
        return complexity;
    }

    /** Loop header block to the blocks of its natural loop, header included. */
    public Map<Integer, Set<Integer>> naturalLoops() {
        Map<Integer, Set<Integer>> latches = new LinkedHashMap<>();
        for (Edge<ControlEdgeKind> edge : graph.edges()) {
            if (edge.getKind() == ControlEdgeKind.LOOP_BACK && reachable().contains(edge.getFrom())) {
                latches.computeIfAbsent(edge.getTo(), k -> new LinkedHashSet<>()).add(edge.getFrom());
            }
        }
        for (Edge<ControlEdgeKind> edge : graph.edges()) {
            if (edge.getKind() == ControlEdgeKind.CONTINUE && latches.containsKey(edge.getTo())
                    && reachable().contains(edge.getFrom())) {
                latches.get(edge.getTo()).add(edge.getFrom());
            }
        }

        Map<Integer, Set<Integer>> loops = new LinkedHashMap<>();
        for (Map.Entry<Integer, Set<Integer>> entry : latches.entrySet()) {
            int header = entry.getKey();
            List<Integer> starts = new ArrayList<>(entry.getValue());
            starts.add(header);
            Set<Integer> members = graph.traverse(starts, edge -> edge.getTo() != header, true);
            loops.put(header, new TreeSet<>(members));
        }
        return loops;
    }

    public int blockCount() {
        return graph.nodeCount();
    }

    public int edgeCount() {
        return graph.edgeCount();
    }
}
