package org.dxworks.codegraph.cli;

import org.dxworks.codegraph.engine.AnalysisEngine;
import org.dxworks.codegraph.engine.FunctionAnalysis;
import org.dxworks.codegraph.export.GraphDocument;
import org.dxworks.codegraph.export.GraphExporter;
import org.dxworks.codegraph.model.SourceFile;
import org.dxworks.codegraph.model.SyntaxTree;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

@CommandLine.Command(name = "all", mixinStandardHelpOptions = true,
        description = "Every graph for one file: syntax tree, per-function graphs, calls and imports.")
class AllGraphsCommand extends FunctionGraphCommand {

    @Override
    protected List<GraphDocument> documents(AnalysisEngine engine) {
        SourceFile file = singleFile(engine);
        SyntaxTree tree = singleTree(engine, file);
        GraphExporter exporter = new GraphExporter();
        List<GraphDocument> documents = new ArrayList<>();
        documents.add(exporter.syntaxTree(tree));
        for (FunctionAnalysis analysis : functions(engine, tree)) {
            documents.add(exporter.controlFlow(analysis.getControlFlow()));
            documents.add(exporter.dataFlow(analysis.getDataFlow()));
            documents.add(exporter.programDependency(analysis.getProgramDependency()));
        }
        documents.add(exporter.callGraph(engine.callGraph(List.of(tree))));
        documents.add(exporter.dependencyGraph(engine.dependencyGraph(List.of(file))));
        return documents;
    }
}
