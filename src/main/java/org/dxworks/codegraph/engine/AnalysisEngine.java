package org.dxworks.codegraph.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.codegraph.CodegraphConfig;
import org.dxworks.codegraph.Language;
import org.dxworks.codegraph.LanguageProfile;
import org.dxworks.codegraph.LanguageRegistry;
import org.dxworks.codegraph.extract.ParseFailureException;
import org.dxworks.codegraph.extract.StatementParser;
import org.dxworks.codegraph.extract.SyntaxExtractor;
import org.dxworks.codegraph.graph.Edge;
import org.dxworks.codegraph.graph.callgraph.CallEdge;
import org.dxworks.codegraph.graph.callgraph.CallGraph;
import org.dxworks.codegraph.graph.callgraph.CallGraphBuilder;
import org.dxworks.codegraph.graph.callgraph.FunctionNameTable;
import org.dxworks.codegraph.graph.cfg.ControlFlowBuilder;
import org.dxworks.codegraph.graph.cfg.ControlFlowGraph;
import org.dxworks.codegraph.graph.deps.DependencyGraph;
import org.dxworks.codegraph.graph.deps.DependencyGraphBuilder;
import org.dxworks.codegraph.graph.dfg.DataFlowBuilder;
import org.dxworks.codegraph.graph.dfg.DataFlowGraph;
import org.dxworks.codegraph.graph.pdg.ProgramDependencyBuilder;
import org.dxworks.codegraph.model.DiagnosticKind;
import org.dxworks.codegraph.model.FunctionUnit;
import org.dxworks.codegraph.model.ParsedBody;
import org.dxworks.codegraph.model.SourceFile;
import org.dxworks.codegraph.model.SyntaxTree;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the analyses on a fixed worker pool, one task per file or per function. Files that
 * cannot be read or parsed, or whose analysis throws, are dropped with a diagnostic and the
 * rest of the batch carries on. The call graph registers every file before any call is resolved.
 */
public class AnalysisEngine implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(AnalysisEngine.class);

    private final CodegraphConfig config;
    private final LanguageRegistry registry;
    private final ExecutorService executor;
    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private final SourceCollector collector;
    private final SourceReader reader = new SourceReader();
    private final SyntaxExtractor extractor;
    private final ControlFlowBuilder controlFlowBuilder = new ControlFlowBuilder();
    private final DataFlowBuilder dataFlowBuilder = new DataFlowBuilder();
    private final ProgramDependencyBuilder programDependencyBuilder = new ProgramDependencyBuilder();

    public AnalysisEngine(CodegraphConfig config, LanguageRegistry registry) {
        this(config, registry, new SyntaxExtractor(config.isFailOnParseError()));
    }

    public AnalysisEngine(CodegraphConfig config, LanguageRegistry registry, SyntaxExtractor extractor) {
        this.config = config;
        this.registry = registry;
        this.extractor = extractor;
        this.collector = new SourceCollector(config, registry);
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(config.getWorkerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "codegraph-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public DiagnosticCollector getDiagnostics() {
        return diagnostics;
    }

    /**
     * Reads every source file under {@code target}. Paths in the results are relative to the
     * target directory, or to the parent of a file target.
     */
    public List<SourceFile> read(Path target, Collection<String> extensions) {
        List<Path> paths = collector.collect(target, extensions, diagnostics);
        Path root = SourceCollector.rootOf(target);
        List<Callable<Optional<SourceFile>>> tasks = new ArrayList<>();
        for (Path path : paths) {
            tasks.add(() -> read(root, path));
        }
        List<SourceFile> files = new ArrayList<>();
        for (Optional<SourceFile> file : runAll(tasks)) {
            file.ifPresent(files::add);
        }
        logger.info("Read {} of {} source files under {}", files.size(), paths.size(), target);
        return files;
    }

    private Optional<SourceFile> read(Path root, Path path) {
        String relative = SourceCollector.relativePath(root, path);
        try {
            SourceFile file = reader.read(path, relative);
            if (file.lineCount() > config.getMaxFileLines()) {
                diagnostics.add(relative, DiagnosticKind.FILE_TOO_LARGE,
                        file.lineCount() + " lines exceeds the limit of " + config.getMaxFileLines());
                return Optional.empty();
            }
            return Optional.of(file);
        } catch (SourceReadException e) {
            diagnostics.add(relative, DiagnosticKind.IO_FAILURE, e.getMessage());
            return Optional.empty();
        }
    }

    /** Syntax trees of the files that parse, in input order. */
    public List<SyntaxTree> extract(List<SourceFile> files) {
        List<Callable<Optional<SyntaxTree>>> tasks = new ArrayList<>();
        for (SourceFile file : files) {
            tasks.add(() -> extract(file));
        }
        List<SyntaxTree> trees = new ArrayList<>();
        for (Optional<SyntaxTree> tree : runAll(tasks)) {
            tree.ifPresent(trees::add);
        }
        return trees;
    }

    public Optional<SyntaxTree> extract(SourceFile file) {
        Optional<LanguageProfile> profile = registry.profileFor(Paths.get(file.getRelativePath()));
        if (profile.isEmpty()) {
            logger.debug("No language profile for {}", file.getRelativePath());
            return Optional.empty();
        }
        LanguageProfile effective = extractor.effectiveProfile(profile.get());
        if (effective.getStrategy() != profile.get().getStrategy()) {
            diagnostics.add(file.getRelativePath(), DiagnosticKind.GRAMMAR_UNAVAILABLE,
                    "extracted with patterns, " + profile.get().getLanguage().getName() + " grammar not loaded");
        }
        try {
            return Optional.of(extractor.extract(file, profile.get()));
        } catch (ParseFailureException e) {
            diagnostics.add(file.getRelativePath(), DiagnosticKind.PARSE_FAILURE, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            recordFailure(file.getRelativePath(), "extraction", e);
            return Optional.empty();
        }
    }

    /** Builds the CFG, DFG and PDG of one function on the calling thread. */
    public FunctionAnalysis analyzeFunction(SyntaxTree tree, FunctionUnit function) {
        Language language = Language.fromName(tree.getLanguage())
                .orElseThrow(() -> new IllegalArgumentException("Unknown language " + tree.getLanguage()));
        LanguageProfile profile = registry.profileFor(language)
                .orElseThrow(() -> new IllegalArgumentException("No profile for " + language.getName()));
        ParsedBody body = new StatementParser(profile).parse(function);
        ControlFlowGraph controlFlow = controlFlowBuilder.build(body);
        DataFlowGraph dataFlow = dataFlowBuilder.build(body);
        return new FunctionAnalysis(body, controlFlow, dataFlow, programDependencyBuilder.build(controlFlow, dataFlow));
    }

    /**
     * Every function of the file, one task each, in declaration order. A function whose
     * analysis fails is left out with a diagnostic.
     */
    public List<FunctionAnalysis> analyzeFunctions(SyntaxTree tree) {
        List<Callable<Optional<FunctionAnalysis>>> tasks = new ArrayList<>();
        for (FunctionUnit function : tree.getFunctions()) {
            tasks.add(() -> {
                try {
                    return Optional.of(analyzeFunction(tree, function));
                } catch (RuntimeException e) {
                    recordFailure(tree.getFilePath(), "analysis of " + function.qualifiedName, e);
                    return Optional.empty();
                }
            });
        }
        List<FunctionAnalysis> analyses = new ArrayList<>();
        for (Optional<FunctionAnalysis> analysis : runAll(tasks)) {
            analysis.ifPresent(analyses::add);
        }
        return analyses;
    }

    /**
     * Registration runs for all files and completes before the table is sealed; resolution
     * tasks only start after that, so each one sees every function of the project.
     */
    public CallGraph callGraph(List<SyntaxTree> trees) {
        FunctionNameTable table = new FunctionNameTable();
        List<Callable<Void>> registrations = new ArrayList<>();
        for (SyntaxTree tree : trees) {
            registrations.add(() -> {
                try {
                    table.register(tree);
                } catch (RuntimeException e) {
                    recordFailure(tree.getFilePath(), "call graph registration", e);
                }
                return null;
            });
        }
        runAll(registrations);
        table.seal();

        CallGraphBuilder builder = new CallGraphBuilder(config);
        List<Callable<List<Edge<CallEdge>>>> resolutions = new ArrayList<>();
        for (SyntaxTree tree : trees) {
            resolutions.add(() -> {
                try {
                    return builder.resolve(tree, table);
                } catch (RuntimeException e) {
                    recordFailure(tree.getFilePath(), "call resolution", e);
                    return List.<Edge<CallEdge>>of();
                }
            });
        }
        return builder.assemble(table, runAll(resolutions));
    }

    public DependencyGraph dependencyGraph(List<SourceFile> files) {
        DependencyGraphBuilder builder = new DependencyGraphBuilder(registry);
        List<Callable<Optional<DependencyGraphBuilder.ModuleImports>>> tasks = new ArrayList<>();
        for (SourceFile file : files) {
            tasks.add(() -> {
                try {
                    return builder.scan(file);
                } catch (RuntimeException e) {
                    recordFailure(file.getRelativePath(), "import scan", e);
                    return Optional.empty();
                }
            });
        }
        List<DependencyGraphBuilder.ModuleImports> scanned = new ArrayList<>();
        for (Optional<DependencyGraphBuilder.ModuleImports> module : runAll(tasks)) {
            module.ifPresent(scanned::add);
        }
        return builder.assemble(scanned);
    }

    private void recordFailure(String filePath, String stage, RuntimeException e) {
        logger.debug("{} failed for {}", stage, filePath, e);
        diagnostics.add(filePath, DiagnosticKind.ANALYSIS_FAILURE, stage + " failed: " + e);
    }

    /** Runs the tasks on the pool and returns their results in task order. */
    private <T> List<T> runAll(List<Callable<T>> tasks) {
        List<T> results = new ArrayList<>();
        try {
            for (Future<T> future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analysis interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Analysis task failed", cause);
        }
        return results;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
