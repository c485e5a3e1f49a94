package org.dxworks.codegraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Declarations of one source file. The arena order is extraction order: a container is
 * always added before its members.
 */
public class SyntaxTree {
    private final String filePath;
    private final String modulePath;
    private final String language;
    private final boolean heuristic;
    private final List<DeclNode> nodes;
    private final List<FunctionUnit> functions;

    private SyntaxTree(Builder builder) {
        this.filePath = builder.filePath;
        this.modulePath = builder.modulePath;
        this.language = builder.language;
        this.heuristic = builder.heuristic;
        this.nodes = Collections.unmodifiableList(builder.nodes);
        this.functions = Collections.unmodifiableList(builder.functions);
    }

    public static Builder builder(String filePath, String language, boolean heuristic) {
        return new Builder(filePath, language, heuristic);
    }

    /** Project-relative path without extension, with '/' separators. */
    public static String modulePathOf(String filePath) {
        String normalized = filePath.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        int dot = normalized.lastIndexOf('.');
        return dot > slash ? normalized.substring(0, dot) : normalized;
    }

    public String getFilePath() {
        return filePath;
    }

    public String getModulePath() {
        return modulePath;
    }

    public String getLanguage() {
        return language;
    }

    /** True when the tree came from line patterns rather than a grammar. */
    public boolean isHeuristic() {
        return heuristic;
    }

    public List<DeclNode> getNodes() {
        return nodes;
    }

    public DeclNode node(int id) {
        return nodes.get(id);
    }

    public List<DeclNode> ofKind(DeclKind kind) {
        return nodes.stream().filter(n -> n.kind == kind).collect(Collectors.toList());
    }

    public List<DeclNode> childrenOf(int id) {
        return nodes.stream().filter(n -> n.parentId == id).collect(Collectors.toList());
    }

    public List<FunctionUnit> getFunctions() {
        return functions;
    }

    /**
     * Finds a function by simple or qualified name; with several matches the first in
     * source order wins.
     */
    public Optional<FunctionUnit> function(String name) {
        for (FunctionUnit unit : functions) {
            if (unit.qualifiedName.equals(name) || unit.name.equals(name)
                    || unit.qualifiedName.endsWith("." + name)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }

    public static class Builder {
        private final String filePath;
        private final String modulePath;
        private final String language;
        private final boolean heuristic;
        private final List<DeclNode> nodes = new ArrayList<>();
        private final List<FunctionUnit> functions = new ArrayList<>();

        private Builder(String filePath, String language, boolean heuristic) {
            this.filePath = filePath;
            this.modulePath = modulePathOf(filePath);
            this.language = language;
            this.heuristic = heuristic;
        }

        public String getModulePath() {
            return modulePath;
        }

        public DeclNode add(DeclNode.Draft draft) {
            draft.filePath = filePath;
            draft.language = language;
            if (draft.qualifiedName == null) {
                draft.qualifiedName = modulePath + "::" + draft.name;
            }
            DeclNode node = new DeclNode(nodes.size(), draft);
            nodes.add(node);
            return node;
        }

        public void addFunction(FunctionUnit unit) {
            functions.add(unit);
        }

        public SyntaxTree build() {
            return new SyntaxTree(this);
        }
    }
}
