package org.dxworks.codegraph.graph.callgraph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.codegraph.extract.GrammarExtractor;
import org.dxworks.codegraph.model.DeclKind;
import org.dxworks.codegraph.model.DeclNode;
import org.dxworks.codegraph.model.SyntaxTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Project-wide function table, filled in two phases. Any number of threads may
 * {@link #register} files concurrently; once every file is registered, {@link #seal()}
 * is the barrier that freezes the table and assigns ids in a stable order (file, line,
 * name). Lookups are only valid after sealing and registration is rejected after it.
 */
public class FunctionNameTable {

    static final class Registration {
        final String name;
        final String qualifiedName;
        final String filePath;
        final String modulePath;
        final int line;
        final String language;
        final boolean synthetic;

        Registration(String name, String qualifiedName, String filePath, String modulePath, int line,
                     String language, boolean synthetic) {
            this.name = name;
            this.qualifiedName = qualifiedName;
            this.filePath = filePath;
            this.modulePath = modulePath;
            this.line = line;
            this.language = language;
            this.synthetic = synthetic;
        }
    }

    private static final Logger logger = LogManager.getLogger(FunctionNameTable.class);

    private static final Comparator<Registration> ORDER = Comparator.comparing((Registration r) -> r.filePath)
            .thenComparingInt(r -> r.line)
            .thenComparing(r -> r.qualifiedName);

    private final ConcurrentHashMap<String, Registration> registrations = new ConcurrentHashMap<>();
    private volatile boolean sealed;
    private List<FunctionNode> functions;
    private Map<String, FunctionNode> byQualifiedName;
    private Map<String, List<FunctionNode>> bySimpleName;

    public static String moduleFunctionOf(String modulePath) {
        return modulePath + "::" + GrammarExtractor.MODULE_FUNCTION;
    }

    /**
     * Adds every function of the file. Overloads share a qualified name and are kept once.
     * Files with calls outside any function also get their synthetic module function. When
     * two files share a module path ({@code util.ts} next to {@code util.js}) the function
     * of the first file in path order wins, whatever order the files register in.
     */
    public void register(SyntaxTree tree) {
        if (sealed) {
            throw new IllegalStateException("Function table is sealed, cannot register " + tree.getFilePath());
        }
        Set<String> declared = new HashSet<>();
        for (DeclNode function : tree.ofKind(DeclKind.FUNCTION)) {
            declared.add(function.qualifiedName);
            add(new Registration(function.name, function.qualifiedName,
                    tree.getFilePath(), tree.getModulePath(), function.startLine, tree.getLanguage(), false));
        }
        for (DeclNode call : tree.ofKind(DeclKind.CALL_SITE)) {
            if (!declared.contains(call.enclosingFunction)) {
                String module = moduleFunctionOf(tree.getModulePath());
                add(new Registration(GrammarExtractor.MODULE_FUNCTION, module,
                        tree.getFilePath(), tree.getModulePath(), 0, tree.getLanguage(), true));
                break;
            }
        }
    }

    private void add(Registration registration) {
        registrations.merge(registration.qualifiedName, registration, FunctionNameTable::keepFirst);
    }

    private static Registration keepFirst(Registration kept, Registration other) {
        Registration first = ORDER.compare(kept, other) <= 0 ? kept : other;
        Registration dropped = first == kept ? other : kept;
        if (kept.filePath.equals(other.filePath)) {
            logger.debug("Collapsing overload of {} at line {}", dropped.qualifiedName, dropped.line);
        } else {
            logger.warn("{} is declared in both {} and {}, keeping the one in {}", first.qualifiedName,
                    first.filePath, dropped.filePath, first.filePath);
        }
        return first;
    }

    public synchronized void seal() {
        if (sealed) {
            throw new IllegalStateException("Function table is already sealed");
        }
        List<Registration> ordered = new ArrayList<>(registrations.values());
        ordered.sort(ORDER);

        List<FunctionNode> nodes = new ArrayList<>();
        Map<String, FunctionNode> qualified = new HashMap<>();
        Map<String, List<FunctionNode>> simple = new HashMap<>();
        for (Registration registration : ordered) {
            FunctionNode node = new FunctionNode(nodes.size(), registration);
            nodes.add(node);
            qualified.put(node.qualifiedName, node);
            if (!node.synthetic) {
                simple.computeIfAbsent(node.name, k -> new ArrayList<>()).add(node);
            }
        }
        functions = Collections.unmodifiableList(nodes);
        byQualifiedName = qualified;
        bySimpleName = simple;
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkSealed() {
        if (!sealed) {
            throw new IllegalStateException("Function table must be sealed before lookups");
        }
    }

    public List<FunctionNode> functions() {
        checkSealed();
        return functions;
    }

    public int size() {
        checkSealed();
        return functions.size();
    }

    public Optional<FunctionNode> byQualifiedName(String qualifiedName) {
        checkSealed();
        return Optional.ofNullable(byQualifiedName.get(qualifiedName));
    }

    public List<FunctionNode> bySimpleName(String name) {
        checkSealed();
        return bySimpleName.getOrDefault(name, Collections.emptyList());
    }

    /** Functions named {@code callee} in {@code modulePath}, or project-wide when the module has none. */
    public List<FunctionNode> candidates(String callee, String modulePath) {
        List<FunctionNode> all = bySimpleName(callee);
        List<FunctionNode> local = new ArrayList<>();
        for (FunctionNode function : all) {
            if (function.modulePath.equals(modulePath)) {
                local.add(function);
            }
        }
        return local.isEmpty() ? all : local;
    }
}
