package org.dxworks.codegraph.cli;

import org.dxworks.codegraph.engine.AnalysisEngine;
import org.dxworks.codegraph.export.GraphDocument;
import org.dxworks.codegraph.export.GraphExporter;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(name = "dependency-graph", mixinStandardHelpOptions = true,
        description = "Imports between the modules of a project, with circular dependencies.")
class DependencyGraphCommand extends GraphCommand {

    @Override
    protected List<GraphDocument> documents(AnalysisEngine engine) {
        return List.of(new GraphExporter().dependencyGraph(engine.dependencyGraph(engine.read(target, extensions))));
    }
}
