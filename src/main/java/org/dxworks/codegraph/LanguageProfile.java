package org.dxworks.codegraph;

import org.dxworks.codegraph.extract.ExtractionStrategy;
import org.dxworks.codegraph.extract.Keywords;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Per-language table of declaration, import and comment patterns.
 * <p>
 * Function and class patterns capture the declared name in the group {@code name};
 * import patterns capture the imported path in the group {@code target}.
 */
public class LanguageProfile {

    private final Language language;
    private final ExtractionStrategy strategy;
    private final boolean braceDelimited;
    private final boolean switchFallsThrough;
    private final List<Pattern> functionPatterns;
    private final List<Pattern> classPatterns;
    private final List<Pattern> importPatterns;
    private final Pattern importBlockEntryPattern;
    private final List<String> lineCommentPrefixes;
    private final String blockCommentStart;
    private final String blockCommentEnd;

    private LanguageProfile(Builder builder) {
        this.language = builder.language;
        this.strategy = builder.strategy;
        this.braceDelimited = builder.braceDelimited;
        this.switchFallsThrough = builder.switchFallsThrough;
        this.functionPatterns = Collections.unmodifiableList(builder.functionPatterns);
        this.classPatterns = Collections.unmodifiableList(builder.classPatterns);
        this.importPatterns = Collections.unmodifiableList(builder.importPatterns);
        this.importBlockEntryPattern = builder.importBlockEntryPattern;
        this.lineCommentPrefixes = Collections.unmodifiableList(builder.lineCommentPrefixes);
        this.blockCommentStart = builder.blockCommentStart;
        this.blockCommentEnd = builder.blockCommentEnd;
    }

    public static Builder builder(Language language) {
        return new Builder(language);
    }

    public Language getLanguage() {
        return language;
    }

    public ExtractionStrategy getStrategy() {
        return strategy;
    }

    /** Pattern extraction is a deliberate fidelity reduction; trees built from it are marked heuristic. */
    public boolean isHeuristic() {
        return strategy == ExtractionStrategy.PATTERN;
    }

    public boolean isBraceDelimited() {
        return braceDelimited;
    }

    public boolean isSwitchFallsThrough() {
        return switchFallsThrough;
    }

    /** Words of this language that never name a function or variable. */
    public Set<String> getReservedWords() {
        return Keywords.reservedFor(language);
    }

    public List<Pattern> getFunctionPatterns() {
        return functionPatterns;
    }

    public List<Pattern> getClassPatterns() {
        return classPatterns;
    }

    public List<Pattern> getImportPatterns() {
        return importPatterns;
    }

    /** Pattern for the entries of a parenthesised import block (Go), or null. */
    public Pattern getImportBlockEntryPattern() {
        return importBlockEntryPattern;
    }

    public List<String> getLineCommentPrefixes() {
        return lineCommentPrefixes;
    }

    public String getBlockCommentStart() {
        return blockCommentStart;
    }

    public String getBlockCommentEnd() {
        return blockCommentEnd;
    }

    /**
     * Returns a copy of this profile that extracts with {@code fallback} instead. Used when a
     * grammar cannot be loaded on the current platform.
     */
    public LanguageProfile withStrategy(ExtractionStrategy fallback) {
        Builder copy = new Builder(language);
        copy.strategy = fallback;
        copy.braceDelimited = braceDelimited;
        copy.switchFallsThrough = switchFallsThrough;
        copy.functionPatterns.addAll(functionPatterns);
        copy.classPatterns.addAll(classPatterns);
        copy.importPatterns.addAll(importPatterns);
        copy.importBlockEntryPattern = importBlockEntryPattern;
        copy.lineCommentPrefixes.addAll(lineCommentPrefixes);
        copy.blockCommentStart = blockCommentStart;
        copy.blockCommentEnd = blockCommentEnd;
        return new LanguageProfile(copy);
    }

    public static class Builder {
        private final Language language;
        private ExtractionStrategy strategy = ExtractionStrategy.PATTERN;
        private boolean braceDelimited = true;
        private boolean switchFallsThrough = true;
        private final List<Pattern> functionPatterns = new ArrayList<>();
        private final List<Pattern> classPatterns = new ArrayList<>();
        private final List<Pattern> importPatterns = new ArrayList<>();
        private Pattern importBlockEntryPattern;
        private final List<String> lineCommentPrefixes = new ArrayList<>();
        private String blockCommentStart;
        private String blockCommentEnd;

        private Builder(Language language) {
            this.language = language;
        }

        public Builder grammar() {
            this.strategy = ExtractionStrategy.GRAMMAR;
            return this;
        }

        public Builder indentation() {
            this.braceDelimited = false;
            return this;
        }

        public Builder noSwitchFallthrough() {
            this.switchFallsThrough = false;
            return this;
        }

        public Builder function(String regex) {
            functionPatterns.add(Pattern.compile(regex));
            return this;
        }

        public Builder type(String regex) {
            classPatterns.add(Pattern.compile(regex));
            return this;
        }

        public Builder imports(String regex) {
            importPatterns.add(Pattern.compile(regex));
            return this;
        }

        public Builder importBlockEntry(String regex) {
            this.importBlockEntryPattern = Pattern.compile(regex);
            return this;
        }

        public Builder lineComment(String... prefixes) {
            lineCommentPrefixes.addAll(List.of(prefixes));
            return this;
        }

        public Builder blockComment(String start, String end) {
            this.blockCommentStart = start;
            this.blockCommentEnd = end;
            return this;
        }

        public LanguageProfile build() {
            return new LanguageProfile(this);
        }
    }
}
