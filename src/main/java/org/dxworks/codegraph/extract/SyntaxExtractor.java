package org.dxworks.codegraph.extract;

import org.dxworks.codegraph.LanguageProfile;
import org.dxworks.codegraph.model.SourceFile;
import org.dxworks.codegraph.model.SyntaxTree;

/**
 * Dispatches on the profile's {@link ExtractionStrategy} tag. A grammar profile whose
 * grammar failed to load is resolved to the pattern strategy by {@link #effectiveProfile}.
 */
public class SyntaxExtractor {

    private final GrammarExtractor grammarExtractor;
    private final PatternExtractor patternExtractor = new PatternExtractor();

    public SyntaxExtractor(boolean failOnParseError) {
        this(new GrammarExtractor(failOnParseError));
    }

    public SyntaxExtractor(GrammarExtractor grammarExtractor) {
        this.grammarExtractor = grammarExtractor;
    }

    public LanguageProfile effectiveProfile(LanguageProfile profile) {
        if (profile.getStrategy() == ExtractionStrategy.GRAMMAR && !grammarExtractor.supports(profile.getLanguage())) {
            return profile.withStrategy(ExtractionStrategy.PATTERN);
        }
        return profile;
    }

    public SyntaxTree extract(SourceFile file, LanguageProfile profile) throws ParseFailureException {
        return extract(file.getRelativePath(), file.getText(), profile);
    }

    public SyntaxTree extract(String filePath, String text, LanguageProfile profile) throws ParseFailureException {
        LanguageProfile effective = effectiveProfile(profile);
        return switch (effective.getStrategy()) {
            case GRAMMAR -> grammarExtractor.extract(filePath, text, effective);
            case PATTERN -> patternExtractor.extract(filePath, text, effective);
        };
    }
}
