package org.dxworks.codegraph.extract;

import java.util.List;

/** A statement or block header as cut out of the body text, before keywords are interpreted. */
final class RawNode {
    final String text;
    final int line;
    final int indent;
    /** Children when this node heads a delimited block; null for a plain statement. */
    List<RawNode> block;

    RawNode(String text, int line) {
        this(text, line, 0, null);
    }

    RawNode(String text, int line, int indent, List<RawNode> block) {
        this.text = text;
        this.line = line;
        this.indent = indent;
        this.block = block;
    }

    boolean hasBlock() {
        return block != null;
    }

    RawNode withText(String newText) {
        return new RawNode(newText, line, indent, block);
    }

    @Override
    public String toString() {
        return line + ": " + text + (block == null ? "" : " {" + block.size() + "}");
    }
}
