package org.dxworks.codegraph.cli;

import org.dxworks.codegraph.engine.AnalysisEngine;
import org.dxworks.codegraph.engine.FunctionAnalysis;
import org.dxworks.codegraph.engine.InvalidRequestException;
import org.dxworks.codegraph.export.GraphDocument;
import org.dxworks.codegraph.export.GraphExporter;
import org.dxworks.codegraph.graph.pdg.ProgramDependencyGraph;
import org.dxworks.codegraph.model.SyntaxTree;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

@CommandLine.Command(name = "program-dependency", mixinStandardHelpOptions = true,
        description = "Control and data dependences of each function in a file, with slicing and taint tracking.")
class ProgramDependencyCommand extends FunctionGraphCommand {

    @CommandLine.Option(names = "--slice", paramLabel = "<line>", description = "Report the backward and forward slice from this line.")
    Integer sliceLine;

    @CommandLine.Option(names = "--taint-source", paramLabel = "<var>", description = "Variable whose definitions are tainted.")
    String taintSource;

    @CommandLine.Option(names = "--taint-sink", paramLabel = "<var>", description = "Variable or function whose uses are checked for taint.")
    String taintSink;

    @Override
    protected List<GraphDocument> documents(AnalysisEngine engine) {
        if ((taintSource == null) != (taintSink == null)) {
            throw new InvalidRequestException("--taint-source and --taint-sink must be given together");
        }
        SyntaxTree tree = singleTree(engine, singleFile(engine));
        GraphExporter exporter = new GraphExporter();
        List<GraphDocument> documents = new ArrayList<>();
        for (FunctionAnalysis analysis : functions(engine, tree)) {
            ProgramDependencyGraph pdg = analysis.getProgramDependency();
            GraphDocument document = exporter.programDependency(pdg);
            if (sliceLine != null) {
                exporter.addSlice(document, pdg, sliceLine);
            }
            if (taintSource != null) {
                exporter.addTaint(document, pdg.taint(taintSource, taintSink));
            }
            documents.add(document);
        }
        return documents;
    }
}
