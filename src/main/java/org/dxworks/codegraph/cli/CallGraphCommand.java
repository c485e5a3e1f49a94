package org.dxworks.codegraph.cli;

import org.dxworks.codegraph.engine.AnalysisEngine;
import org.dxworks.codegraph.export.GraphDocument;
import org.dxworks.codegraph.export.GraphExporter;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(name = "call-graph", mixinStandardHelpOptions = true,
        description = "Calls between the functions of a file or project, with recursion and dead functions.")
class CallGraphCommand extends GraphCommand {

    @Override
    protected List<GraphDocument> documents(AnalysisEngine engine) {
        return List.of(new GraphExporter().callGraph(engine.callGraph(engine.extract(engine.read(target, extensions)))));
    }
}
