package org.dxworks.codegraph.cli;

import org.dxworks.codegraph.engine.AnalysisEngine;
import org.dxworks.codegraph.export.GraphDocument;
import org.dxworks.codegraph.export.GraphExporter;
import org.dxworks.codegraph.model.SyntaxTree;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

@CommandLine.Command(name = "syntax-tree", mixinStandardHelpOptions = true,
        description = "Declarations, imports and call sites of each file.")
class SyntaxTreeCommand extends GraphCommand {

    @Override
    protected List<GraphDocument> documents(AnalysisEngine engine) {
        GraphExporter exporter = new GraphExporter();
        List<GraphDocument> documents = new ArrayList<>();
        for (SyntaxTree tree : engine.extract(engine.read(target, extensions))) {
            documents.add(exporter.syntaxTree(tree));
        }
        return documents;
    }
}
