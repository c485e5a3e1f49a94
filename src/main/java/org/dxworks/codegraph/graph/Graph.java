package org.dxworks.codegraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Node arena plus typed edges between arena indices. Nodes are never removed, so indices
 * stay valid for the life of the graph and cycles need no special handling. Adding an
 * edge that already exists with the same kind is a no-op.
 */
public class Graph<N, K> {
    private final List<N> nodes = new ArrayList<>();
    private final List<Edge<K>> edges = new ArrayList<>();
    private final Set<Edge<K>> edgeSet = new HashSet<>();
    private final List<List<Edge<K>>> outgoing = new ArrayList<>();
    private final List<List<Edge<K>>> incoming = new ArrayList<>();

    public int addNode(N node) {
        nodes.add(node);
        outgoing.add(new ArrayList<>());
        incoming.add(new ArrayList<>());
        return nodes.size() - 1;
    }

    public boolean addEdge(int from, int to, K kind) {
        checkIndex(from);
        checkIndex(to);
        Edge<K> edge = new Edge<>(from, to, kind);
        if (!edgeSet.add(edge)) {
            return false;
        }
        edges.add(edge);
        outgoing.get(from).add(edge);
        incoming.get(to).add(edge);
        return true;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IndexOutOfBoundsException("No node " + index + " in graph of " + nodes.size());
        }
    }

    public N node(int index) {
        return nodes.get(index);
    }

    public List<N> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public List<Edge<K>> edges() {
        return Collections.unmodifiableList(edges);
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean hasEdge(int from, int to, K kind) {
        return edgeSet.contains(new Edge<>(from, to, kind));
    }

    public boolean hasEdge(int from, int to) {
        for (Edge<K> edge : outgoing.get(from)) {
            if (edge.getTo() == to) return true;
        }
        return false;
    }

    public List<Edge<K>> outgoing(int index) {
        return Collections.unmodifiableList(outgoing.get(index));
    }

    public List<Edge<K>> incoming(int index) {
        return Collections.unmodifiableList(incoming.get(index));
    }

    /** Distinct successor indices in edge order. */
    public Set<Integer> successors(int index) {
        Set<Integer> result = new LinkedHashSet<>();
        for (Edge<K> edge : outgoing.get(index)) {
            result.add(edge.getTo());
        }
        return result;
    }

    public Set<Integer> predecessors(int index) {
        Set<Integer> result = new LinkedHashSet<>();
        for (Edge<K> edge : incoming.get(index)) {
            result.add(edge.getFrom());
        }
        return result;
    }

    public Set<Integer> reachableFrom(int start) {
        return traverse(Collections.singleton(start), edge -> true, false);
    }

    /**
     * Breadth-first closure from {@code starts}, following only edges accepted by
     * {@code follow}, against edge direction when {@code backward} is set. The starts are
     * always part of the result.
     */
    public Set<Integer> traverse(Collection<Integer> starts, Predicate<Edge<K>> follow, boolean backward) {
        Set<Integer> visited = new LinkedHashSet<>(starts);
        Deque<Integer> queue = new ArrayDeque<>(starts);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            List<Edge<K>> next = backward ? incoming.get(current) : outgoing.get(current);
            for (Edge<K> edge : next) {
                if (!follow.test(edge)) continue;
                int target = backward ? edge.getFrom() : edge.getTo();
                if (visited.add(target)) {
                    queue.add(target);
                }
            }
        }
        return visited;
    }
}
