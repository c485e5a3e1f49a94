package org.dxworks.codegraph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.codegraph.extract.GrammarExtractor;
import org.dxworks.codegraph.extract.ParseFailureException;
import org.dxworks.codegraph.extract.PatternExtractor;
import org.dxworks.codegraph.extract.StatementParser;
import org.dxworks.codegraph.model.FunctionUnit;
import org.dxworks.codegraph.model.ParsedBody;
import org.dxworks.codegraph.model.SyntaxTree;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static final LanguageRegistry REGISTRY = LanguageRegistry.defaults();

    public static Path sample(String relative) {
        return Paths.get("src/test/resources/samples", relative);
    }

    public static String readSample(String relative) throws IOException {
        return Files.readString(sample(relative));
    }

    public static LanguageProfile profile(String filePath) {
        return REGISTRY.profileFor(Paths.get(filePath))
                .orElseThrow(() -> new IllegalArgumentException("No profile for " + filePath));
    }

    /** Pattern extraction keeps these tests independent of the native grammars. */
    public static SyntaxTree extract(String filePath, String source) {
        return new PatternExtractor().extract(filePath, source, profile(filePath));
    }

    /** Grammar extraction for Java, Python and JavaScript; syntax errors are fatal. */
    public static SyntaxTree extractWithGrammar(String filePath, String source) throws ParseFailureException {
        return new GrammarExtractor(true).extract(filePath, source, profile(filePath));
    }

    public static SyntaxTree extractSampleWithGrammar(String relative) throws IOException, ParseFailureException {
        return extractWithGrammar(Paths.get(relative).getFileName().toString(), readSample(relative));
    }

    public static SyntaxTree extractSample(String relative) throws IOException {
        return extract(Paths.get(relative).getFileName().toString(), readSample(relative));
    }

    public static ParsedBody parse(SyntaxTree tree, String function) {
        FunctionUnit unit = tree.function(function)
                .orElseThrow(() -> new IllegalArgumentException("No function " + function + " in " + tree.getFilePath()));
        return new StatementParser(profile(tree.getFilePath())).parse(unit);
    }
}
