package org.dxworks.codegraph.cli;

import org.dxworks.codegraph.engine.AnalysisEngine;
import org.dxworks.codegraph.engine.FunctionAnalysis;
import org.dxworks.codegraph.engine.InvalidRequestException;
import org.dxworks.codegraph.model.Diagnostic;
import org.dxworks.codegraph.model.FunctionUnit;
import org.dxworks.codegraph.model.SourceFile;
import org.dxworks.codegraph.model.SyntaxTree;
import picocli.CommandLine;

import java.nio.file.Files;
import java.util.List;
import java.util.Optional;

/** Commands that build per-function graphs; they need a single source file. */
abstract class FunctionGraphCommand extends GraphCommand {

    @CommandLine.Option(names = "--function", paramLabel = "<name>", description = "Only this function (simple or qualified name).")
    String functionName;

    protected SourceFile singleFile(AnalysisEngine engine) {
        if (Files.isDirectory(target)) {
            throw new InvalidRequestException(spec.name() + " needs a source file, but " + target + " is a directory");
        }
        List<SourceFile> files = engine.read(target, extensions);
        if (files.isEmpty()) {
            throw new InvalidRequestException("Cannot analyze " + target + describe(engine.getDiagnostics().list()));
        }
        return files.get(0);
    }

    protected SyntaxTree singleTree(AnalysisEngine engine, SourceFile file) {
        Optional<SyntaxTree> tree = engine.extract(file);
        if (tree.isEmpty()) {
            throw new InvalidRequestException("Cannot analyze " + target + describe(engine.getDiagnostics().list()));
        }
        return tree.get();
    }

    protected List<FunctionAnalysis> functions(AnalysisEngine engine, SyntaxTree tree) {
        if (functionName == null) {
            return engine.analyzeFunctions(tree);
        }
        FunctionUnit function = tree.function(functionName)
                .orElseThrow(() -> new InvalidRequestException("No function named " + functionName + " in " + target));
        return List.of(engine.analyzeFunction(tree, function));
    }

    private static String describe(List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return ": not a file of a supported language";
        }
        return ": " + diagnostics.get(diagnostics.size() - 1).getMessage();
    }
}
