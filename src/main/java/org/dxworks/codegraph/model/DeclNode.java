package org.dxworks.codegraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One declaration extracted from a source file. Nodes live in their {@link SyntaxTree}'s arena
 * and reference their container by index ({@code parentId}, -1 at file level).
 */
public class DeclNode {
    public final int id;
    public final DeclKind kind;
    public final String name;
    public final String qualifiedName;
    public final String filePath;
    public final int startLine;
    public final int endLine;
    public final String visibility;
    public final String language;
    public final int parentId;
    /** Parameter names, for functions. */
    public final List<String> parameters;
    /** Import target for imports, callee text for call sites, initializer for variables. */
    public final String target;
    /** Receiver of a call site ({@code obj} in {@code obj.run()}), or null. */
    public final String receiver;
    /** Qualified name of the enclosing function for call sites and variables. */
    public final String enclosingFunction;

    DeclNode(int id, Draft draft) {
        this.id = id;
        this.kind = draft.kind;
        this.name = draft.name;
        this.qualifiedName = draft.qualifiedName;
        this.filePath = draft.filePath;
        this.startLine = draft.startLine;
        this.endLine = draft.endLine;
        this.visibility = draft.visibility;
        this.language = draft.language;
        this.parentId = draft.parentId;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(draft.parameters));
        this.target = draft.target;
        this.receiver = draft.receiver;
        this.enclosingFunction = draft.enclosingFunction;
    }

    public boolean isTopLevel() {
        return parentId < 0;
    }

    @Override
    public String toString() {
        return kind + " " + qualifiedName + " [" + startLine + "-" + endLine + "]";
    }

    /** Mutable form used while a file is being extracted. */
    public static class Draft {
        public DeclKind kind;
        public String name;
        public String qualifiedName;
        public String filePath;
        public int startLine;
        public int endLine;
        public String visibility = "public";
        public String language;
        public int parentId = -1;
        public List<String> parameters = new ArrayList<>();
        public String target;
        public String receiver;
        public String enclosingFunction;

        public Draft(DeclKind kind, String name) {
            this.kind = kind;
            this.name = name;
        }

        public Draft lines(int start, int end) {
            this.startLine = start;
            this.endLine = end;
            return this;
        }
    }
}
