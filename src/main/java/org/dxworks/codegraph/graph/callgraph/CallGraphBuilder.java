package org.dxworks.codegraph.graph.callgraph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.codegraph.CodegraphConfig;
import org.dxworks.codegraph.graph.Edge;
import org.dxworks.codegraph.graph.Graph;
import org.dxworks.codegraph.model.DeclKind;
import org.dxworks.codegraph.model.DeclNode;
import org.dxworks.codegraph.model.SyntaxTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Resolves call sites to functions across files. {@link #build} runs both phases on the
 * calling thread; {@link org.dxworks.codegraph.engine.AnalysisEngine} runs registration and
 * resolution on its worker pool with the table's {@link FunctionNameTable#seal()} between them.
 */
public class CallGraphBuilder {
    private static final Logger logger = LogManager.getLogger(CallGraphBuilder.class);

    private final CodegraphConfig config;

    public CallGraphBuilder(CodegraphConfig config) {
        this.config = config;
    }

    public CallGraph build(List<SyntaxTree> trees) {
        FunctionNameTable table = new FunctionNameTable();
        for (SyntaxTree tree : trees) {
            table.register(tree);
        }
        table.seal();
        List<List<Edge<CallEdge>>> resolved = new ArrayList<>();
        for (SyntaxTree tree : trees) {
            resolved.add(resolve(tree, table));
        }
        return assemble(table, resolved);
    }

    /**
     * Resolves the call sites of one file against a sealed table: functions of the same
     * module first, then any function in the project with the callee's name. Calls that
     * match nothing are recorded on the caller. Safe to run for several files at once.
     */
    public List<Edge<CallEdge>> resolve(SyntaxTree tree, FunctionNameTable table) {
        List<Edge<CallEdge>> edges = new ArrayList<>();
        String module = FunctionNameTable.moduleFunctionOf(tree.getModulePath());
        for (DeclNode call : tree.ofKind(DeclKind.CALL_SITE)) {
            Optional<FunctionNode> caller = table.byQualifiedName(call.enclosingFunction);
            if (caller.isEmpty()) {
                caller = table.byQualifiedName(module);
            }
            if (caller.isEmpty()) {
                logger.debug("No caller registered for call to {} at {}:{}", call.name, tree.getFilePath(), call.startLine);
                continue;
            }
            List<FunctionNode> callees = table.candidates(call.name, tree.getModulePath());
            if (callees.isEmpty()) {
                caller.get().addUnresolvedCall(call.name);
                continue;
            }
            boolean ambiguous = callees.size() > 1;
            for (FunctionNode callee : callees) {
                edges.add(new Edge<>(caller.get().id, callee.id, new CallEdge(call.startLine, ambiguous)));
            }
        }
        return edges;
    }

    /** Builds the graph from per-file resolution results, in file order, then marks recursion and entry points. */
    public CallGraph assemble(FunctionNameTable table, List<List<Edge<CallEdge>>> resolved) {
        Graph<FunctionNode, CallEdge> graph = new Graph<>();
        for (FunctionNode function : table.functions()) {
            graph.addNode(function);
            function.setEntryPoint(function.synthetic || config.isEntryPoint(function.name));
        }
        for (List<Edge<CallEdge>> edges : resolved) {
            for (Edge<CallEdge> edge : edges) {
                graph.addEdge(edge.getFrom(), edge.getTo(), edge.getKind());
            }
        }
        markRecursive(graph);
        logger.info("Call graph: {} functions, {} calls", graph.nodeCount(), graph.edgeCount());
        return new CallGraph(graph);
    }

    /**
     * A function is recursive when it calls itself or shares a strongly connected
     * component with another function. Tarjan's algorithm, iterative so deep call chains
     * cannot overflow the stack.
     */
    static void markRecursive(Graph<FunctionNode, CallEdge> graph) {
        int size = graph.nodeCount();
        int[] index = new int[size];
        int[] low = new int[size];
        boolean[] onStack = new boolean[size];
        Arrays.fill(index, -1);
        Deque<Integer> stack = new ArrayDeque<>();
        List<List<Integer>> adjacency = new ArrayList<>();
        for (int id = 0; id < size; id++) {
            adjacency.add(new ArrayList<>(graph.successors(id)));
        }
        int counter = 0;

        for (int start = 0; start < size; start++) {
            if (index[start] != -1) {
                continue;
            }
            Deque<int[]> work = new ArrayDeque<>();
            index[start] = counter;
            low[start] = counter++;
            stack.push(start);
            onStack[start] = true;
            work.push(new int[]{start, 0});

            while (!work.isEmpty()) {
                int[] frame = work.peek();
                int node = frame[0];
                List<Integer> successors = adjacency.get(node);
                if (frame[1] < successors.size()) {
                    int next = successors.get(frame[1]++);
                    if (index[next] == -1) {
                        index[next] = counter;
                        low[next] = counter++;
                        stack.push(next);
                        onStack[next] = true;
                        work.push(new int[]{next, 0});
                    } else if (onStack[next]) {
                        low[node] = Math.min(low[node], index[next]);
                    }
                    continue;
                }
                work.pop();
                if (!work.isEmpty()) {
                    int parent = work.peek()[0];
                    low[parent] = Math.min(low[parent], low[node]);
                }
                if (low[node] == index[node]) {
                    List<Integer> component = new ArrayList<>();
                    int member;
                    do {
                        member = stack.pop();
                        onStack[member] = false;
                        component.add(member);
                    } while (member != node);
                    boolean recursive = component.size() > 1 || graph.hasEdge(node, node);
                    for (Integer id : component) {
                        graph.node(id).setRecursive(recursive);
                    }
                }
            }
        }
    }
}
