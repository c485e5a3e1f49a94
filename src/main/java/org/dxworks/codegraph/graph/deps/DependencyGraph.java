package org.dxworks.codegraph.graph.deps;

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

/**
 * Modules of the project and the imports between them. Node ids follow file path order,
 * so cycles and depths come out the same on every run.
 */
public class DependencyGraph {
    private static final int WHITE = 0;
    private static final int GRAY = 1;
    private static final int BLACK = 2;

    private final Graph<ModuleNode, DependencyEdge> graph;
    private List<List<Integer>> cycles;
    private Set<Long> backEdges;

    DependencyGraph(Graph<ModuleNode, DependencyEdge> graph) {
        this.graph = graph;
    }

    public Graph<ModuleNode, DependencyEdge> graph() {
        return graph;
    }

    public List<ModuleNode> modules() {
        return graph.nodes();
    }

    public ModuleNode module(int id) {
        return graph.node(id);
    }

    public List<Edge<DependencyEdge>> edges() {
        return graph.edges();
    }

    /** Finds a module by its file path or its module path. */
    public Optional<ModuleNode> find(String path) {
        for (ModuleNode module : graph.nodes()) {
            if (module.filePath.equals(path) || module.modulePath.equals(path)) {
                return Optional.of(module);
            }
        }
        return Optional.empty();
    }

    /** Modules {@code id} imports directly. */
    public List<ModuleNode> dependenciesOf(int id) {
        List<ModuleNode> result = new ArrayList<>();
        for (Integer target : graph.successors(id)) {
            result.add(graph.node(target));
        }
        return result;
    }

    /** Modules that import {@code id} directly. */
    public List<ModuleNode> dependentsOf(int id) {
        List<ModuleNode> result = new ArrayList<>();
        for (Integer source : graph.predecessors(id)) {
            result.add(graph.node(source));
        }
        return result;
    }

    /** Modules nothing else imports. */
    public List<ModuleNode> roots() {
        List<ModuleNode> result = new ArrayList<>();
        for (ModuleNode module : graph.nodes()) {
            if (othersOnly(graph.predecessors(module.id), module.id).isEmpty()) {
                result.add(module);
            }
        }
        return result;
    }

    /** Modules that import nothing else in the project. */
    public List<ModuleNode> leaves() {
        List<ModuleNode> result = new ArrayList<>();
        for (ModuleNode module : graph.nodes()) {
            if (othersOnly(graph.successors(module.id), module.id).isEmpty()) {
                result.add(module);
            }
        }
        return result;
    }

    private static Set<Integer> othersOnly(Set<Integer> ids, int self) {
        Set<Integer> result = new HashSet<>(ids);
        result.remove(self);
        return result;
    }

    public boolean hasCycles() {
        return !cycleIds().isEmpty();
    }

    /**
     * One cycle per back edge of a depth-first search in id order. Each cycle starts at its
     * smallest module and repeats it at the end, so A imports B imports C imports A reads
     * {@code [A, B, C, A]}. A module that imports itself gives {@code [A, A]}.
     */
    public List<List<ModuleNode>> cycles() {
        List<List<ModuleNode>> result = new ArrayList<>();
        for (List<Integer> cycle : cycleIds()) {
            List<ModuleNode> modules = new ArrayList<>();
            for (Integer id : cycle) {
                modules.add(graph.node(id));
            }
            result.add(modules);
        }
        return result;
    }

    /** Same as {@link #cycles()} with file paths in place of nodes. */
    public List<List<String>> cyclePaths() {
        List<List<String>> result = new ArrayList<>();
        for (List<ModuleNode> cycle : cycles()) {
            List<String> paths = new ArrayList<>();
            for (ModuleNode module : cycle) {
                paths.add(module.filePath);
            }
            result.add(paths);
        }
        return result;
    }

    private synchronized List<List<Integer>> cycleIds() {
        if (cycles == null) {
            search();
        }
        return cycles;
    }

    private void search() {
        int size = graph.nodeCount();
        int[] color = new int[size];
        List<List<Integer>> adjacency = new ArrayList<>();
        for (int id = 0; id < size; id++) {
            adjacency.add(new ArrayList<>(graph.successors(id)));
        }
        Map<List<Integer>, Boolean> found = new LinkedHashMap<>();
        Set<Long> back = new HashSet<>();

        for (int start = 0; start < size; start++) {
            if (color[start] != WHITE) {
                continue;
            }
            List<Integer> path = new ArrayList<>();
            Deque<int[]> work = new ArrayDeque<>();
            color[start] = GRAY;
            path.add(start);
            work.push(new int[]{start, 0});
            while (!work.isEmpty()) {
                int[] frame = work.peek();
                int node = frame[0];
                List<Integer> successors = adjacency.get(node);
                if (frame[1] < successors.size()) {
                    int next = successors.get(frame[1]++);
                    if (color[next] == WHITE) {
                        color[next] = GRAY;
                        path.add(next);
                        work.push(new int[]{next, 0});
                    } else if (color[next] == GRAY) {
                        back.add(key(node, next));
                        List<Integer> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                        found.putIfAbsent(rotate(cycle), Boolean.TRUE);
                    }
                    continue;
                }
                work.pop();
                path.remove(path.size() - 1);
                color[node] = BLACK;
            }
        }
        cycles = Collections.unmodifiableList(new ArrayList<>(found.keySet()));
        backEdges = back;
    }

    private static List<Integer> rotate(List<Integer> cycle) {
        int smallest = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i) < cycle.get(smallest)) {
                smallest = i;
            }
        }
        List<Integer> rotated = new ArrayList<>();
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((smallest + i) % cycle.size()));
        }
        rotated.add(rotated.get(0));
        return rotated;
    }

    private static long key(int from, int to) {
        return ((long) from << 32) | (to & 0xffffffffL);
    }

    /**
     * Longest import chain from a root to each module, roots at 0. Back edges found by the
     * cycle search are ignored, which leaves a DAG.
     */
    public Map<Integer, Integer> depths() {
        cycleIds();
        int size = graph.nodeCount();
        int[] inDegree = new int[size];
        List<List<Integer>> forward = new ArrayList<>();
        for (int id = 0; id < size; id++) {
            List<Integer> targets = new ArrayList<>();
            for (Integer next : graph.successors(id)) {
                if (!backEdges.contains(key(id, next))) {
                    targets.add(next);
                    inDegree[next]++;
                }
            }
            forward.add(targets);
        }
        int[] depth = new int[size];
        Deque<Integer> ready = new ArrayDeque<>();
        for (int id = 0; id < size; id++) {
            if (inDegree[id] == 0) {
                ready.add(id);
            }
        }
        while (!ready.isEmpty()) {
            int current = ready.poll();
            for (Integer next : forward.get(current)) {
                depth[next] = Math.max(depth[next], depth[current] + 1);
                if (--inDegree[next] == 0) {
                    ready.add(next);
                }
            }
        }
        Map<Integer, Integer> result = new LinkedHashMap<>();
        for (int id = 0; id < size; id++) {
            result.put(id, depth[id]);
        }
        return result;
    }

    public int depthOf(int id) {
        return depths().get(id);
    }

    public int maxDepth() {
        int max = 0;
        for (Integer depth : depths().values()) {
            max = Math.max(max, depth);
        }
        return max;
    }

    public int moduleCount() {
        return graph.nodeCount();
    }

    public int edgeCount() {
        return graph.edgeCount();
    }
}
