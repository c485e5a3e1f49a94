package org.dxworks.codegraph.graph.deps;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.codegraph.Language;
import org.dxworks.codegraph.LanguageProfile;
import org.dxworks.codegraph.LanguageRegistry;
import org.dxworks.codegraph.extract.ImportScanner;
import org.dxworks.codegraph.graph.Graph;
import org.dxworks.codegraph.model.SourceFile;
import org.dxworks.codegraph.model.SyntaxTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the module dependency graph from import statements. Scanning a file needs only its
 * text, so {@link #scan} can run for many files at once; {@link #assemble} then resolves the
 * imports against the full set of modules.
 */
public class DependencyGraphBuilder {
    private static final Logger logger = LogManager.getLogger(DependencyGraphBuilder.class);

    private final LanguageRegistry registry;
    private final ImportScanner scanner = new ImportScanner();

    public DependencyGraphBuilder(LanguageRegistry registry) {
        this.registry = registry;
    }

    /** Imports and exports of one file, before resolution. */
    public static class ModuleImports {
        public final String filePath;
        public final Language language;
        public final List<ImportScanner.ImportRef> imports;
        public final List<String> exports;

        public ModuleImports(String filePath, Language language, List<ImportScanner.ImportRef> imports, List<String> exports) {
            this.filePath = filePath;
            this.language = language;
            this.imports = imports;
            this.exports = exports;
        }
    }

    public DependencyGraph build(List<SourceFile> files) {
        List<ModuleImports> scanned = new ArrayList<>();
        for (SourceFile file : files) {
            scan(file).ifPresent(scanned::add);
        }
        return assemble(scanned);
    }

    /** Empty for files in a language without a profile. */
    public Optional<ModuleImports> scan(SourceFile file) {
        Optional<LanguageProfile> profile = registry.profileFor(file.getPath());
        if (profile.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ModuleImports(
                file.getRelativePath(),
                profile.get().getLanguage(),
                scanner.scan(file.getText(), profile.get()),
                scanner.exports(file.getText(), profile.get())));
    }

    /**
     * One node per file in path order, one edge per import that names a project file. An
     * import of the file itself leaves a self-edge and marks the module; anything else that
     * does not resolve is kept on the importing module.
     */
    public DependencyGraph assemble(List<ModuleImports> scanned) {
        List<ModuleImports> ordered = new ArrayList<>(scanned);
        ordered.sort(Comparator.comparing(m -> m.filePath));

        Graph<ModuleNode, DependencyEdge> graph = new Graph<>();
        Map<String, Integer> ids = new HashMap<>();
        Map<String, Language> languages = new LinkedHashMap<>();
        List<ModuleImports> modules = new ArrayList<>();
        for (ModuleImports module : ordered) {
            if (ids.containsKey(module.filePath)) {
                logger.warn("Skipping duplicate module {}", module.filePath);
                continue;
            }
            modules.add(module);
            int id = graph.nodeCount();
            graph.addNode(new ModuleNode(id, module.filePath, SyntaxTree.modulePathOf(module.filePath),
                    module.language.getName(), module.exports));
            ids.put(module.filePath, id);
            languages.put(module.filePath, module.language);
        }

        ImportResolver resolver = new ImportResolver(languages);
        int unresolved = 0;
        for (ModuleImports module : modules) {
            int from = ids.get(module.filePath);
            ModuleNode node = graph.node(from);
            for (ImportScanner.ImportRef ref : module.imports) {
                List<String> targets = resolver.resolve(module.filePath, module.language, ref.target);
                if (targets.isEmpty()) {
                    node.addUnresolvedImport(ref.target);
                    unresolved++;
                    logger.debug("Unresolved import {} in {}:{}", ref.target, module.filePath, ref.line);
                    continue;
                }
                for (String target : targets) {
                    int to = ids.get(target);
                    if (to == from && targets.size() > 1) {
                        // package or namespace imports name the importer's own directory
                        continue;
                    }
                    if (to == from) {
                        node.setSelfImport(true);
                    }
                    graph.addEdge(from, to, new DependencyEdge(ref.target, ref.line));
                }
            }
        }
        logger.info("Dependency graph: {} modules, {} imports, {} unresolved", graph.nodeCount(), graph.edgeCount(), unresolved);
        return new DependencyGraph(graph);
    }
}
