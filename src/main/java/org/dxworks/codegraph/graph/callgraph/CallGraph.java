package org.dxworks.codegraph.graph.callgraph;

import org.dxworks.codegraph.graph.Edge;
import org.dxworks.codegraph.graph.Graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Functions of the project and the resolved calls between them. */
public class CallGraph {
    static final int MAX_CHAINS = 1000;

    private final Graph<FunctionNode, CallEdge> graph;

    CallGraph(Graph<FunctionNode, CallEdge> graph) {
        this.graph = graph;
    }

    public Graph<FunctionNode, CallEdge> graph() {
        return graph;
    }

    public List<FunctionNode> functions() {
        return graph.nodes();
    }

    public FunctionNode function(int id) {
        return graph.node(id);
    }

    public List<Edge<CallEdge>> edges() {
        return graph.edges();
    }

    /** Looks a function up by qualified name, then by simple name (first in id order). */
    public Optional<FunctionNode> find(String name) {
        for (FunctionNode function : graph.nodes()) {
            if (function.qualifiedName.equals(name)) {
                return Optional.of(function);
            }
        }
        for (FunctionNode function : graph.nodes()) {
            if (function.name.equals(name)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }

    public List<FunctionNode> callersOf(int id) {
        List<FunctionNode> result = new ArrayList<>();
        for (Integer caller : graph.predecessors(id)) {
            result.add(graph.node(caller));
        }
        return result;
    }

    public List<FunctionNode> calleesOf(int id) {
        List<FunctionNode> result = new ArrayList<>();
        for (Integer callee : graph.successors(id)) {
            result.add(graph.node(callee));
        }
        return result;
    }

    public List<FunctionNode> recursiveFunctions() {
        List<FunctionNode> result = new ArrayList<>();
        for (FunctionNode function : graph.nodes()) {
            if (function.isRecursive()) {
                result.add(function);
            }
        }
        return result;
    }

    public List<FunctionNode> entryPoints() {
        List<FunctionNode> result = new ArrayList<>();
        for (FunctionNode function : graph.nodes()) {
            if (function.isEntryPoint()) {
                result.add(function);
            }
        }
        return result;
    }

    /** Functions nothing else calls that are not entry points. Calls to itself do not count. */
    public List<FunctionNode> deadFunctions() {
        List<FunctionNode> result = new ArrayList<>();
        for (FunctionNode function : graph.nodes()) {
            if (function.isEntryPoint()) {
                continue;
            }
            boolean called = false;
            for (Integer caller : graph.predecessors(function.id)) {
                if (caller != function.id) {
                    called = true;
                    break;
                }
            }
            if (!called) {
                result.add(function);
            }
        }
        return result;
    }

    /** Shortest call distance from {@code root} to every function it reaches; the root is at 0. */
    public Map<Integer, Integer> depthsFrom(int root) {
        Map<Integer, Integer> depths = new LinkedHashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        depths.put(root, 0);
        queue.add(root);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (Integer callee : graph.successors(current)) {
                if (!depths.containsKey(callee)) {
                    depths.put(callee, depths.get(current) + 1);
                    queue.add(callee);
                }
            }
        }
        return depths;
    }

    /** Shortest call distance from {@code from} to {@code to}, or -1 when unreachable. */
    public int callDepth(int from, int to) {
        Integer depth = depthsFrom(from).get(to);
        return depth == null ? -1 : depth;
    }

    public int maxCallDepth(int root) {
        int max = 0;
        for (Integer depth : depthsFrom(root).values()) {
            max = Math.max(max, depth);
        }
        return max;
    }

    /**
     * Every simple call path from {@code from} to {@code to}, both ends included. With
     * {@code from == to} these are the call cycles through the function. Stops after
     * {@value #MAX_CHAINS} chains.
     */
    public List<List<FunctionNode>> callChains(int from, int to) {
        List<List<FunctionNode>> chains = new ArrayList<>();
        List<Integer> path = new ArrayList<>();
        path.add(from);
        Set<Integer> onPath = new HashSet<>(path);
        extend(from, to, path, onPath, chains);
        return chains;
    }

    private void extend(int current, int to, List<Integer> path, Set<Integer> onPath,
                        List<List<FunctionNode>> chains) {
        for (Integer next : graph.successors(current)) {
            if (chains.size() >= MAX_CHAINS) {
                return;
            }
            if (next == to) {
                List<FunctionNode> chain = new ArrayList<>();
                for (Integer id : path) {
                    chain.add(graph.node(id));
                }
                chain.add(graph.node(to));
                chains.add(chain);
                continue;
            }
            if (onPath.contains(next)) {
                continue;
            }
            path.add(next);
            onPath.add(next);
            extend(next, to, path, onPath, chains);
            path.remove(path.size() - 1);
            onPath.remove(next);
        }
    }

    public int unresolvedCallCount() {
        int count = 0;
        for (FunctionNode function : graph.nodes()) {
            count += function.getUnresolvedCalls().size();
        }
        return count;
    }

    public List<FunctionNode> rootFunctions() {
        List<FunctionNode> result = new ArrayList<>();
        for (FunctionNode function : graph.nodes()) {
            if (graph.incoming(function.id).isEmpty()) {
                result.add(function);
            }
        }
        return Collections.unmodifiableList(result);
    }

    public int functionCount() {
        return graph.nodeCount();
    }

    public int edgeCount() {
        return graph.edgeCount();
    }
}
