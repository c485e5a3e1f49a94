package org.dxworks.codegraph.export;

import org.dxworks.codegraph.graph.Edge;
import org.dxworks.codegraph.graph.callgraph.CallEdge;
import org.dxworks.codegraph.graph.callgraph.CallGraph;
import org.dxworks.codegraph.graph.callgraph.FunctionNode;
import org.dxworks.codegraph.graph.cfg.BasicBlock;
import org.dxworks.codegraph.graph.cfg.ControlEdgeKind;
import org.dxworks.codegraph.graph.cfg.ControlFlowGraph;
import org.dxworks.codegraph.graph.deps.DependencyEdge;
import org.dxworks.codegraph.graph.deps.DependencyGraph;
import org.dxworks.codegraph.graph.deps.ModuleNode;
import org.dxworks.codegraph.graph.dfg.DataEdgeKind;
import org.dxworks.codegraph.graph.dfg.DataFlowGraph;
import org.dxworks.codegraph.graph.dfg.VarNode;
import org.dxworks.codegraph.graph.pdg.DependenceKind;
import org.dxworks.codegraph.graph.pdg.PdgNode;
import org.dxworks.codegraph.graph.pdg.ProgramDependencyGraph;
import org.dxworks.codegraph.graph.pdg.TaintReport;
import org.dxworks.codegraph.model.DeclKind;
import org.dxworks.codegraph.model.DeclNode;
import org.dxworks.codegraph.model.Statement;
import org.dxworks.codegraph.model.SyntaxTree;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns each analysis result into a {@link GraphDocument}. Node ids are the arena indices
 * of the source graph, kinds are lower-case enum names, and the findings a reader looks
 * for first (complexity, unused definitions, cycles, recursion) go into the metadata.
 */
public class GraphExporter {
    public static final String SYNTAX_TREE = "syntax-tree";
    public static final String CONTROL_FLOW = "control-flow";
    public static final String DATA_FLOW = "data-flow";
    public static final String CALL_GRAPH = "call-graph";
    public static final String DEPENDENCY_GRAPH = "dependency-graph";
    public static final String PROGRAM_DEPENDENCY = "program-dependency";

    public GraphDocument syntaxTree(SyntaxTree tree) {
        GraphDocument document = new GraphDocument(SYNTAX_TREE, tree.getFilePath())
                .meta("module", tree.getModulePath())
                .meta("language", tree.getLanguage())
                .meta("heuristic", tree.isHeuristic())
                .meta("functions", tree.getFunctions().size())
                .meta("imports", tree.ofKind(DeclKind.IMPORT).size())
                .meta("callSites", tree.ofKind(DeclKind.CALL_SITE).size());
        for (DeclNode decl : tree.getNodes()) {
            GraphDocument.Node node = document.addNode(decl.id, lower(decl.kind))
                    .attr("name", decl.name)
                    .attr("qualifiedName", decl.qualifiedName)
                    .attr("startLine", decl.startLine)
                    .attr("endLine", decl.endLine)
                    .attr("visibility", decl.visibility)
                    .attr("target", decl.target)
                    .attr("receiver", decl.receiver)
                    .attr("enclosingFunction", decl.enclosingFunction);
            if (decl.kind == DeclKind.FUNCTION) {
                node.attr("parameters", decl.parameters);
            }
            if (decl.parentId >= 0) {
                document.addEdge(decl.parentId, decl.id, "contains");
            }
        }
        return document;
    }

    public GraphDocument controlFlow(ControlFlowGraph cfg) {
        List<Integer> loops = new ArrayList<>();
        List<List<Integer>> loopBodies = new ArrayList<>();
        for (Map.Entry<Integer, Set<Integer>> loop : cfg.naturalLoops().entrySet()) {
            loops.add(loop.getKey());
            loopBodies.add(new ArrayList<>(loop.getValue()));
        }
        GraphDocument document = new GraphDocument(CONTROL_FLOW, cfg.getFunction().qualifiedName)
                .meta("file", cfg.getFunction().filePath)
                .meta("line", cfg.getFunction().startLine)
                .meta("complexity", cfg.cyclomaticComplexity())
                .meta("exits", cfg.exitBlocks())
                .meta("unreachable", new ArrayList<>(cfg.unreachable()))
                .meta("codeAfterJump", new ArrayList<>(cfg.codeAfterJump()))
                .meta("loopHeaders", loops)
                .meta("loopBodies", loopBodies);
        Set<Integer> reachable = cfg.reachable();
        for (BasicBlock block : cfg.blocks()) {
            List<String> statements = new ArrayList<>();
            for (Statement statement : cfg.statementsIn(block.getId())) {
                statements.add(statement.getText());
            }
            GraphDocument.Node node = document.addNode(block.getId(), lower(block.getKind()))
                    .attr("statements", statements)
                    .attr("reachable", reachable.contains(block.getId()));
            if (!block.isEmpty()) {
                node.attr("startLine", block.getStartLine()).attr("endLine", block.getEndLine());
            }
        }
        for (Edge<ControlEdgeKind> edge : cfg.edges()) {
            document.addEdge(edge.getFrom(), edge.getTo(), lower(edge.getKind()));
        }
        return document;
    }

    public GraphDocument dataFlow(DataFlowGraph dfg) {
        List<String> unused = new ArrayList<>();
        for (VarNode definition : dfg.unusedDefinitions()) {
            unused.add(definition.name + "@" + definition.line);
        }
        List<String> redundant = new ArrayList<>();
        for (DataFlowGraph.RedundantComputation computation : dfg.redundantComputations()) {
            redundant.add(computation.first.text + "@" + computation.first.line + " = @" + computation.second.line);
        }
        GraphDocument document = new GraphDocument(DATA_FLOW, dfg.getFunction().qualifiedName)
                .meta("file", dfg.getFunction().filePath)
                .meta("line", dfg.getFunction().startLine)
                .meta("unused", unused)
                .meta("redundant", redundant)
                .meta("exports", new ArrayList<>(dfg.getExports()));
        for (VarNode variable : dfg.nodes()) {
            document.addNode(variable.id, lower(variable.kind))
                    .attr("name", variable.name)
                    .attr("line", variable.line)
                    .attr("statement", variable.statementId)
                    .attr("text", variable.text);
        }
        for (Edge<DataEdgeKind> edge : dfg.edges()) {
            document.addEdge(edge.getFrom(), edge.getTo(), lower(edge.getKind()));
        }
        return document;
    }

    public GraphDocument callGraph(CallGraph callGraph) {
        List<String> recursive = new ArrayList<>();
        for (FunctionNode function : callGraph.recursiveFunctions()) {
            recursive.add(function.qualifiedName);
        }
        List<String> dead = new ArrayList<>();
        for (FunctionNode function : callGraph.deadFunctions()) {
            dead.add(function.qualifiedName);
        }
        Set<Integer> roots = new HashSet<>();
        for (FunctionNode function : callGraph.rootFunctions()) {
            roots.add(function.id);
        }
        GraphDocument document = new GraphDocument(CALL_GRAPH, "project")
                .meta("functions", callGraph.functionCount())
                .meta("calls", callGraph.edgeCount())
                .meta("recursive", recursive)
                .meta("dead", dead)
                .meta("unresolvedCalls", callGraph.unresolvedCallCount());
        for (FunctionNode function : callGraph.functions()) {
            document.addNode(function.id, "function")
                    .attr("name", function.name)
                    .attr("qualifiedName", function.qualifiedName)
                    .attr("file", function.filePath)
                    .attr("line", function.line)
                    .attr("language", function.language)
                    .attr("recursive", function.isRecursive())
                    .attr("entryPoint", function.isEntryPoint())
                    .attr("root", roots.contains(function.id))
                    .attr("synthetic", function.synthetic)
                    .attr("unresolvedCalls", function.getUnresolvedCalls());
        }
        for (Edge<CallEdge> edge : callGraph.edges()) {
            document.addEdge(edge.getFrom(), edge.getTo(), "calls")
                    .attr("line", edge.getKind().getLine())
                    .attr("ambiguous", edge.getKind().isAmbiguous());
        }
        return document;
    }

    public GraphDocument dependencyGraph(DependencyGraph dependencies) {
        Set<Integer> inCycle = new HashSet<>();
        for (List<ModuleNode> cycle : dependencies.cycles()) {
            for (ModuleNode module : cycle) {
                inCycle.add(module.id);
            }
        }
        List<String> roots = new ArrayList<>();
        for (ModuleNode module : dependencies.roots()) {
            roots.add(module.filePath);
        }
        List<String> leaves = new ArrayList<>();
        for (ModuleNode module : dependencies.leaves()) {
            leaves.add(module.filePath);
        }
        Map<Integer, Integer> depths = dependencies.depths();
        GraphDocument document = new GraphDocument(DEPENDENCY_GRAPH, "project")
                .meta("modules", dependencies.moduleCount())
                .meta("imports", dependencies.edgeCount())
                .meta("hasCycles", dependencies.hasCycles())
                .meta("cycles", dependencies.cyclePaths())
                .meta("roots", roots)
                .meta("leaves", leaves)
                .meta("maxDepth", dependencies.maxDepth());
        for (ModuleNode module : dependencies.modules()) {
            document.addNode(module.id, "module")
                    .attr("path", module.filePath)
                    .attr("module", module.modulePath)
                    .attr("language", module.language)
                    .attr("exports", module.getExports())
                    .attr("unresolvedImports", module.getUnresolvedImports())
                    .attr("selfImport", module.isSelfImport())
                    .attr("inCycle", inCycle.contains(module.id))
                    .attr("depth", depths.get(module.id));
        }
        for (Edge<DependencyEdge> edge : dependencies.edges()) {
            document.addEdge(edge.getFrom(), edge.getTo(), "imports")
                    .attr("target", edge.getKind().getTarget())
                    .attr("line", edge.getKind().getLine());
        }
        return document;
    }

    public GraphDocument programDependency(ProgramDependencyGraph pdg) {
        List<List<Integer>> groups = new ArrayList<>();
        for (List<PdgNode> group : pdg.parallelGroups()) {
            List<Integer> lines = new ArrayList<>();
            for (PdgNode node : group) {
                lines.add(node.line);
            }
            groups.add(lines);
        }
        GraphDocument document = new GraphDocument(PROGRAM_DEPENDENCY, pdg.getFunction().qualifiedName)
                .meta("file", pdg.getFunction().filePath)
                .meta("line", pdg.getFunction().startLine)
                .meta("parallelGroups", groups);
        for (PdgNode node : pdg.nodes()) {
            document.addNode(node.id, lower(node.kind))
                    .attr("statement", node.statementId)
                    .attr("line", node.line)
                    .attr("text", node.text)
                    .attr("block", node.block)
                    .attr("predicate", node.predicate);
        }
        for (Edge<DependenceKind> edge : pdg.edges()) {
            document.addEdge(edge.getFrom(), edge.getTo(), lower(edge.getKind()));
        }
        return document;
    }

    /** Adds the backward and forward slices from {@code line}, when a statement starts there. */
    public GraphDocument addSlice(GraphDocument document, ProgramDependencyGraph pdg, int line) {
        List<PdgNode> backward = pdg.sliceAtLine(line, true);
        if (backward.isEmpty()) {
            return document;
        }
        return document.meta("sliceLine", line)
                .meta("backwardSlice", lines(backward))
                .meta("forwardSlice", lines(pdg.sliceAtLine(line, false)));
    }

    public GraphDocument addTaint(GraphDocument document, TaintReport report) {
        List<String> sinks = new ArrayList<>();
        for (VarNode sink : report.taintedSinks()) {
            sinks.add(sink.name + "@" + sink.line);
        }
        List<List<String>> paths = new ArrayList<>();
        for (TaintReport.Flow flow : report.getFlows()) {
            List<String> path = new ArrayList<>();
            for (VarNode step : flow.path) {
                path.add(step.kind.name().toLowerCase(Locale.ROOT) + " " + step.name + "@" + step.line);
            }
            paths.add(path);
        }
        return document.meta("taintSources", report.getSources().size())
                .meta("taintedSinks", sinks)
                .meta("taintPaths", paths);
    }

    private static List<Integer> lines(List<PdgNode> nodes) {
        Set<Integer> lines = new TreeSet<>();
        for (PdgNode node : nodes) {
            lines.add(node.line);
        }
        return new ArrayList<>(lines);
    }

    /** Counts nodes per kind, in first-seen order. */
    public static Map<String, Integer> kindCounts(GraphDocument document) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (GraphDocument.Node node : document.nodes) {
            counts.merge(node.kind, 1, Integer::sum);
        }
        return counts;
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
