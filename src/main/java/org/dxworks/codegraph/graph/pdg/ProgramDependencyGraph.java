package org.dxworks.codegraph.graph.pdg;

import org.dxworks.codegraph.graph.Edge;
import org.dxworks.codegraph.graph.Graph;
import org.dxworks.codegraph.graph.cfg.ControlFlowGraph;
import org.dxworks.codegraph.graph.dfg.DataEdgeKind;
import org.dxworks.codegraph.graph.dfg.DataFlowGraph;
import org.dxworks.codegraph.graph.dfg.VarKind;
import org.dxworks.codegraph.graph.dfg.VarNode;
import org.dxworks.codegraph.model.FunctionUnit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Statements of one function linked by control and data dependences. A pair of
 * statements may be linked under both kinds.
 */
public class ProgramDependencyGraph {
    private final ControlFlowGraph cfg;
    private final DataFlowGraph dfg;
    private final Graph<PdgNode, DependenceKind> graph;
    private final Map<Integer, Integer> nodeOfStatement;

    ProgramDependencyGraph(ControlFlowGraph cfg, DataFlowGraph dfg, Graph<PdgNode, DependenceKind> graph) {
        this.cfg = cfg;
        this.dfg = dfg;
        this.graph = graph;
        Map<Integer, Integer> index = new HashMap<>();
        for (PdgNode node : graph.nodes()) {
            index.put(node.statementId, node.id);
        }
        this.nodeOfStatement = index;
    }

    public FunctionUnit getFunction() {
        return cfg.getFunction();
    }

    public ControlFlowGraph getControlFlow() {
        return cfg;
    }

    public DataFlowGraph getDataFlow() {
        return dfg;
    }

    public Graph<PdgNode, DependenceKind> graph() {
        return graph;
    }

    public List<PdgNode> nodes() {
        return graph.nodes();
    }

    public PdgNode node(int id) {
        return graph.node(id);
    }

    public List<Edge<DependenceKind>> edges() {
        return graph.edges();
    }

    /** Node of a statement, or -1 when the statement is not in the graph. */
    public int nodeOf(int statementId) {
        Integer node = nodeOfStatement.get(statementId);
        return node == null ? -1 : node;
    }

    public List<PdgNode> nodesAtLine(int line) {
        List<PdgNode> result = new ArrayList<>();
        for (PdgNode node : graph.nodes()) {
            if (node.line == line) {
                result.add(node);
            }
        }
        return result;
    }

    /** Statements that can affect {@code node}, itself included. */
    public List<PdgNode> backwardSlice(int node) {
        return slice(Collections.singleton(node), true);
    }

    /** Statements {@code node} can affect, itself included. */
    public List<PdgNode> forwardSlice(int node) {
        return slice(Collections.singleton(node), false);
    }

    /** Slice from every statement on {@code line}; empty when no statement starts there. */
    public List<PdgNode> sliceAtLine(int line, boolean backward) {
        List<Integer> starts = new ArrayList<>();
        for (PdgNode node : nodesAtLine(line)) {
            starts.add(node.id);
        }
        if (starts.isEmpty()) {
            return Collections.emptyList();
        }
        return slice(starts, backward);
    }

    private List<PdgNode> slice(Collection<Integer> starts, boolean backward) {
        Set<Integer> reached = new TreeSet<>(graph.traverse(starts, edge -> true, backward));
        List<PdgNode> result = new ArrayList<>();
        for (Integer id : reached) {
            result.add(graph.node(id));
        }
        return result;
    }

    /**
     * Statement pairs with no dependence path between them in either direction. The
     * function entry is left out since every parameter flows from it.
     */
    public List<List<PdgNode>> independentPairs() {
        List<Set<Integer>> reach = reachability();
        List<List<PdgNode>> pairs = new ArrayList<>();
        for (int i = 0; i < graph.nodeCount(); i++) {
            for (int j = i + 1; j < graph.nodeCount(); j++) {
                if (isCandidate(i) && isCandidate(j) && independent(reach, i, j)) {
                    List<PdgNode> pair = new ArrayList<>();
                    pair.add(graph.node(i));
                    pair.add(graph.node(j));
                    pairs.add(pair);
                }
            }
        }
        return pairs;
    }

    /** Greedy grouping of mutually independent statements, in statement order; groups of two or more. */
    public List<List<PdgNode>> parallelGroups() {
        List<Set<Integer>> reach = reachability();
        Set<Integer> assigned = new LinkedHashSet<>();
        List<List<PdgNode>> groups = new ArrayList<>();
        for (int i = 0; i < graph.nodeCount(); i++) {
            if (!isCandidate(i) || assigned.contains(i)) {
                continue;
            }
            List<Integer> group = new ArrayList<>();
            group.add(i);
            for (int j = i + 1; j < graph.nodeCount(); j++) {
                if (!isCandidate(j) || assigned.contains(j)) {
                    continue;
                }
                boolean fits = true;
                for (Integer member : group) {
                    if (!independent(reach, member, j)) {
                        fits = false;
                        break;
                    }
                }
                if (fits) {
                    group.add(j);
                }
            }
            if (group.size() >= 2) {
                List<PdgNode> nodes = new ArrayList<>();
                for (Integer member : group) {
                    nodes.add(graph.node(member));
                    assigned.add(member);
                }
                groups.add(nodes);
            }
        }
        return groups;
    }

    private boolean isCandidate(int node) {
        return graph.node(node).statementId != 0;
    }

    private static boolean independent(List<Set<Integer>> reach, int a, int b) {
        return !reach.get(a).contains(b) && !reach.get(b).contains(a);
    }

    private List<Set<Integer>> reachability() {
        List<Set<Integer>> reach = new ArrayList<>();
        for (int i = 0; i < graph.nodeCount(); i++) {
            reach.add(graph.reachableFrom(i));
        }
        return reach;
    }

    /**
     * Data-flow nodes in {@code sinkIds} reached from {@code sourceIds} over data edges only.
     * Control dependences do not carry taint, and nothing crosses into other functions.
     */
    public TaintReport taint(Collection<Integer> sourceIds, Collection<Integer> sinkIds) {
        Graph<VarNode, DataEdgeKind> data = dfg.graph();
        Map<Integer, Integer> parent = new HashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        List<VarNode> sources = new ArrayList<>();
        for (Integer source : sourceIds) {
            if (!parent.containsKey(source)) {
                parent.put(source, -1);
                queue.add(source);
                sources.add(data.node(source));
            }
        }
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (Integer next : data.successors(current)) {
                if (!parent.containsKey(next)) {
                    parent.put(next, current);
                    queue.add(next);
                }
            }
        }

        List<VarNode> sinks = new ArrayList<>();
        for (Integer sink : sinkIds) {
            sinks.add(data.node(sink));
        }
        TaintReport report = new TaintReport(sources, sinks);
        for (Integer sink : new LinkedHashSet<>(sinkIds)) {
            if (!parent.containsKey(sink)) {
                continue;
            }
            List<VarNode> path = new ArrayList<>();
            for (int at = sink; at != -1; at = parent.get(at)) {
                path.add(data.node(at));
            }
            Collections.reverse(path);
            report.addFlow(path);
        }
        return report;
    }

    /** Sources are definitions and parameters named {@code sourceName}; sinks are uses and calls named {@code sinkName}. */
    public TaintReport taint(String sourceName, String sinkName) {
        List<Integer> sources = new ArrayList<>();
        List<Integer> sinks = new ArrayList<>();
        for (VarNode node : dfg.nodes()) {
            if (node.isDefinition() && node.name.equals(sourceName)) {
                sources.add(node.id);
            }
            if ((node.kind == VarKind.USE || node.kind == VarKind.CALL) && node.name.equals(sinkName)) {
                sinks.add(node.id);
            }
        }
        return taint(sources, sinks);
    }

    public int nodeCount() {
        return graph.nodeCount();
    }

    public int edgeCount() {
        return graph.edgeCount();
    }
}
