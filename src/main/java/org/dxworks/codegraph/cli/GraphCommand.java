package org.dxworks.codegraph.cli;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.codegraph.CodegraphConfig;
import org.dxworks.codegraph.LanguageRegistry;
import org.dxworks.codegraph.engine.AnalysisEngine;
import org.dxworks.codegraph.engine.InvalidRequestException;
import org.dxworks.codegraph.export.ExportFormat;
import org.dxworks.codegraph.export.GraphDocument;
import org.dxworks.codegraph.model.Diagnostic;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Options and output handling shared by every graph command. Subclasses only turn the
 * analyzed target into documents.
 */
abstract class GraphCommand implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(GraphCommand.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "<target>", description = "Source file or directory to analyze.")
    Path target;

    @CommandLine.Option(
            names = "--ext",
            split = ",",
            paramLabel = "<ext>",
            description = "Only analyze files with these extensions, e.g. --ext js,ts.")
    List<String> extensions = new ArrayList<>();

    @CommandLine.Option(
            names = "--format",
            defaultValue = "TEXT",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: text).")
    ExportFormat format = ExportFormat.TEXT;

    @CommandLine.Option(names = "--export", paramLabel = "<path>", description = "Write the output to this file instead of stdout.")
    Path exportPath;

    @CommandLine.Option(names = "--config", paramLabel = "<path>", description = "Configuration file (default: ./codegraph-config.yml).")
    Path configPath;

    @Override
    public Integer call() throws Exception {
        checkExportPath();
        CodegraphConfig config = configPath == null ? CodegraphConfig.load() : CodegraphConfig.load(configPath);
        try (AnalysisEngine engine = new AnalysisEngine(config, LanguageRegistry.defaults())) {
            List<GraphDocument> documents = documents(engine);
            String rendered = format.render(documents);
            PrintWriter out = spec.commandLine().getOut();
            if (exportPath == null) {
                out.print(rendered);
            } else {
                write(rendered);
                out.println("Wrote " + documents.size() + " graph(s) to " + exportPath.toAbsolutePath());
            }
            out.flush();
            reportDiagnostics(engine.getDiagnostics().list());
            return 0;
        }
    }

    protected abstract List<GraphDocument> documents(AnalysisEngine engine);

    private void checkExportPath() {
        if (exportPath == null) {
            return;
        }
        if (Files.isDirectory(exportPath)) {
            throw new InvalidRequestException("Export path is a directory: " + exportPath);
        }
        if (Files.exists(exportPath) && !Files.isWritable(exportPath)) {
            throw new InvalidRequestException("Export path is not writable: " + exportPath);
        }
        Path parent = exportPath.toAbsolutePath().getParent();
        if (parent != null && Files.exists(parent) && !Files.isDirectory(parent)) {
            throw new InvalidRequestException("Export path is not writable: " + parent + " is not a directory");
        }
    }

    private void write(String rendered) {
        try {
            Path parent = exportPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(exportPath, rendered, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidRequestException("Export path is not writable: " + exportPath + " (" + e.getMessage() + ")", e);
        }
    }

    private void reportDiagnostics(List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return;
        }
        PrintWriter err = spec.commandLine().getErr();
        long skipped = diagnostics.stream().filter(Diagnostic::isSkip).count();
        // each diagnostic was already logged when it was recorded
        err.println(diagnostics.size() + " diagnostic(s), " + skipped + " file(s) skipped");
        err.flush();
        logger.debug("Finished {} with {} diagnostics", spec.name(), diagnostics.size());
    }
}
