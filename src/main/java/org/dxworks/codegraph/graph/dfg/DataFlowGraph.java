package org.dxworks.codegraph.graph.dfg;

import org.dxworks.codegraph.graph.Edge;
import org.dxworks.codegraph.graph.Graph;
import org.dxworks.codegraph.model.FunctionUnit;
import org.dxworks.codegraph.model.ParsedBody;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Variable-level data flow of one function. {@link DataEdgeKind#DEF_USE} edges are the
 * def-use chains; {@link DataEdgeKind#VALUE_FLOW} edges carry operands into the values
 * computed from them.
 */
public class DataFlowGraph {

    /** Line range from a definition (or the first definition of a name) to its last reached use. */
    public static class Lifetime {
        public final String name;
        public final int startLine;
        public final int endLine;

        Lifetime(String name, int startLine, int endLine) {
            this.name = name;
            this.startLine = startLine;
            this.endLine = endLine;
        }

        public int length() {
            return endLine - startLine + 1;
        }
    }

    /** Two operations over the same operand definitions; {@code second} recomputes {@code first}. */
    public static class RedundantComputation {
        public final VarNode first;
        public final VarNode second;

        RedundantComputation(VarNode first, VarNode second) {
            this.first = first;
            this.second = second;
        }
    }

    private final ParsedBody body;
    private final Graph<VarNode, DataEdgeKind> graph;
    private final Set<String> exports;
    private final Map<Integer, List<Integer>> operands;

    DataFlowGraph(ParsedBody body, Graph<VarNode, DataEdgeKind> graph, Set<String> exports,
                  Map<Integer, List<Integer>> operands) {
        this.body = body;
        this.graph = graph;
        this.exports = Collections.unmodifiableSet(exports);
        this.operands = operands;
    }

    public FunctionUnit getFunction() {
        return body.getFunction();
    }

    public ParsedBody getBody() {
        return body;
    }

    public Graph<VarNode, DataEdgeKind> graph() {
        return graph;
    }

    public List<VarNode> nodes() {
        return graph.nodes();
    }

    public VarNode node(int id) {
        return graph.node(id);
    }

    public List<Edge<DataEdgeKind>> edges() {
        return graph.edges();
    }

    /** Names declared global, nonlocal or exported inside the function. */
    public Set<String> getExports() {
        return exports;
    }

    public List<VarNode> nodesOfStatement(int statementId) {
        List<VarNode> result = new ArrayList<>();
        for (VarNode node : graph.nodes()) {
            if (node.statementId == statementId) {
                result.add(node);
            }
        }
        return result;
    }

    /** Parameter and definition nodes of {@code name}, in order of creation. */
    public List<VarNode> definitionsOf(String name) {
        List<VarNode> result = new ArrayList<>();
        for (VarNode node : graph.nodes()) {
            if (node.isDefinition() && node.name.equals(name)) {
                result.add(node);
            }
        }
        return result;
    }

    /** Uses reached by the definition or parameter node {@code definitionId}. */
    public List<VarNode> usesOf(int definitionId) {
        List<VarNode> result = new ArrayList<>();
        for (Edge<DataEdgeKind> edge : graph.outgoing(definitionId)) {
            if (edge.getKind() == DataEdgeKind.DEF_USE) {
                result.add(graph.node(edge.getTo()));
            }
        }
        return result;
    }

    /**
     * Definitions no use is reached from. Parameters, exported names and the {@code _}
     * placeholder are never reported.
     */
    public List<VarNode> unusedDefinitions() {
        List<VarNode> result = new ArrayList<>();
        for (VarNode node : graph.nodes()) {
            if (node.kind == VarKind.DEFINITION && !exports.contains(node.name) && !node.name.equals("_")
                    && usesOf(node.id).isEmpty()) {
                result.add(node);
            }
        }
        return result;
    }

    public Lifetime lifetime(int definitionId) {
        VarNode definition = graph.node(definitionId);
        int end = definition.line;
        for (VarNode use : usesOf(definitionId)) {
            end = Math.max(end, use.line);
        }
        return new Lifetime(definition.name, definition.line, end);
    }

    /** Span of a name across all of its definitions and the uses they reach. */
    public Optional<Lifetime> variableLifetime(String name) {
        List<VarNode> definitions = definitionsOf(name);
        if (definitions.isEmpty()) {
            return Optional.empty();
        }
        int start = Integer.MAX_VALUE;
        int end = Integer.MIN_VALUE;
        for (VarNode definition : definitions) {
            Lifetime lifetime = lifetime(definition.id);
            start = Math.min(start, lifetime.startLine);
            end = Math.max(end, lifetime.endLine);
        }
        return Optional.of(new Lifetime(name, start, end));
    }

    /**
     * Operations repeating an earlier one: same expression over the same reaching operand
     * definitions, so no operand was redefined in between.
     */
    public List<RedundantComputation> redundantComputations() {
        Map<String, VarNode> seen = new LinkedHashMap<>();
        List<RedundantComputation> result = new ArrayList<>();
        for (VarNode node : graph.nodes()) {
            if (node.kind != VarKind.OPERATION || node.text.contains("++") || node.text.contains("--")) {
                continue;
            }
            String key = node.text.replaceAll("\\s+", "") + operands.getOrDefault(node.id, Collections.emptyList());
            VarNode earlier = seen.get(key);
            if (earlier != null && earlier.statementId != node.statementId) {
                result.add(new RedundantComputation(earlier, node));
            }
            seen.put(key, node);
        }
        return result;
    }

    public int nodeCount() {
        return graph.nodeCount();
    }

    public int edgeCount() {
        return graph.edgeCount();
    }
}
