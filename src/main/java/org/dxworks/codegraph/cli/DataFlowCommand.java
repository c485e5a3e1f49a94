package org.dxworks.codegraph.cli;

import org.dxworks.codegraph.engine.AnalysisEngine;
import org.dxworks.codegraph.engine.FunctionAnalysis;
import org.dxworks.codegraph.export.GraphDocument;
import org.dxworks.codegraph.export.GraphExporter;
import org.dxworks.codegraph.model.SyntaxTree;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

@CommandLine.Command(name = "data-flow", mixinStandardHelpOptions = true,
        description = "Definitions, uses and unused variables of each function in a file.")
class DataFlowCommand extends FunctionGraphCommand {

    @Override
    protected List<GraphDocument> documents(AnalysisEngine engine) {
        SyntaxTree tree = singleTree(engine, singleFile(engine));
        GraphExporter exporter = new GraphExporter();
        List<GraphDocument> documents = new ArrayList<>();
        for (FunctionAnalysis analysis : functions(engine, tree)) {
            documents.add(exporter.dataFlow(analysis.getDataFlow()));
        }
        return documents;
    }
}
