package org.dxworks.codegraph.model;

import java.util.Collections;
import java.util.List;

/**
 * The body of one function as handed to the statement parser: the text between the
 * body delimiters (brace languages) or the indented block (indentation languages),
 * plus the line it starts on.
 */
public class FunctionUnit {
    public final int declId;
    public final String name;
    public final String qualifiedName;
    public final String filePath;
    public final String language;
    public final String signature;
    public final int startLine;
    public final int endLine;
    public final List<String> parameters;
    public final String bodyText;
    public final int bodyStartLine;
    /** Arrow function whose body is a single expression rather than a block. */
    public final boolean expressionBody;

    public FunctionUnit(DeclNode decl, String signature, String bodyText, int bodyStartLine, boolean expressionBody) {
        this.declId = decl.id;
        this.name = decl.name;
        this.qualifiedName = decl.qualifiedName;
        this.filePath = decl.filePath;
        this.language = decl.language;
        this.signature = signature;
        this.startLine = decl.startLine;
        this.endLine = decl.endLine;
        this.parameters = Collections.unmodifiableList(decl.parameters);
        this.bodyText = bodyText;
        this.bodyStartLine = bodyStartLine;
        this.expressionBody = expressionBody;
    }

    @Override
    public String toString() {
        return qualifiedName + " [" + startLine + "-" + endLine + "]";
    }
}
