package org.dxworks.codegraph.extract;

/**
 * How declarations are extracted for a language. Chosen once per language when the
 * profile is looked up.
 */
public enum ExtractionStrategy {
    /** Concrete syntax tree from a tree-sitter grammar. */
    GRAMMAR,
    /** Line-by-line regular expressions from the language profile; nesting is inferred. */
    PATTERN
}
