package org.dxworks.codegraph.extract;

/** The grammar parse of a file produced error nodes. */
public class ParseFailureException extends Exception {
    private final int line;

    public ParseFailureException(String message, int line) {
        super(message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
