package org.dxworks.codegraph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public class CodegraphConfig {
    private static final Logger logger = LogManager.getLogger(CodegraphConfig.class);

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "codegraph-config.yml";
    private static final boolean DEFAULT_FAIL_ON_PARSE_ERROR = true;
    private static final List<String> DEFAULT_ENTRY_POINT_PATTERNS =
            List.of("main", "__init__", "__main__", "<module>", "test.*", "Test.*");
    private static final Set<String> DEFAULT_EXCLUDE_DIRECTORIES =
            Set.of(".git", "node_modules", "target", "build", "dist", "__pycache__", ".venv");
    private static final String DEFAULT_IGNORE_FILE = ".ignore";

    private final int maxFileLines;
    private final int workerThreads;
    private final List<Pattern> entryPointPatterns;
    private final Set<String> excludeDirectories;
    private final Path ignoreFile;
    private final boolean failOnParseError;

    private CodegraphConfig(int maxFileLines, int workerThreads, List<Pattern> entryPointPatterns,
                            Set<String> excludeDirectories, Path ignoreFile, boolean failOnParseError) {
        this.maxFileLines = maxFileLines;
        this.workerThreads = workerThreads;
        this.entryPointPatterns = List.copyOf(entryPointPatterns);
        this.excludeDirectories = Set.copyOf(excludeDirectories);
        this.ignoreFile = ignoreFile;
        this.failOnParseError = failOnParseError;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public Set<String> getExcludeDirectories() {
        return excludeDirectories;
    }

    /** Ignore file of glob rules for collected files, resolved against the working directory. */
    public Path getIgnoreFile() {
        return ignoreFile;
    }

    public CodegraphConfig withIgnoreFile(Path ignoreFile) {
        return new CodegraphConfig(maxFileLines, workerThreads, entryPointPatterns, excludeDirectories, ignoreFile,
                failOnParseError);
    }

    /** Whether a file whose grammar parse contains error nodes is skipped. */
    public boolean isFailOnParseError() {
        return failOnParseError;
    }

    public boolean isEntryPoint(String functionName) {
        for (Pattern pattern : entryPointPatterns) {
            if (pattern.matcher(functionName).matches()) {
                return true;
            }
        }
        return false;
    }

    public static CodegraphConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CodegraphConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                int effectiveWorkers = (yamlConfig.workerThreads != null && yamlConfig.workerThreads > 0)
                        ? yamlConfig.workerThreads
                        : defaultWorkerThreads();
                List<String> effectiveEntryPoints = (yamlConfig.entryPointPatterns != null)
                        ? yamlConfig.entryPointPatterns
                        : DEFAULT_ENTRY_POINT_PATTERNS;
                Set<String> effectiveExcludes = (yamlConfig.excludeDirectories != null)
                        ? Set.copyOf(yamlConfig.excludeDirectories)
                        : DEFAULT_EXCLUDE_DIRECTORIES;
                Path effectiveIgnoreFile = (yamlConfig.ignoreFile != null && !yamlConfig.ignoreFile.isBlank())
                        ? Paths.get(yamlConfig.ignoreFile)
                        : Paths.get(DEFAULT_IGNORE_FILE);
                boolean effectiveFailOnParseError = (yamlConfig.failOnParseError != null)
                        ? yamlConfig.failOnParseError
                        : DEFAULT_FAIL_ON_PARSE_ERROR;

                return new CodegraphConfig(effectiveMaxFileLines, effectiveWorkers, compile(effectiveEntryPoints),
                        effectiveExcludes, effectiveIgnoreFile, effectiveFailOnParseError);
            }
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Ignoring unreadable config {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static CodegraphConfig defaults() {
        return new CodegraphConfig(DEFAULT_MAX_FILE_LINES, defaultWorkerThreads(), compile(DEFAULT_ENTRY_POINT_PATTERNS),
                DEFAULT_EXCLUDE_DIRECTORIES, Paths.get(DEFAULT_IGNORE_FILE), DEFAULT_FAIL_ON_PARSE_ERROR);
    }

    public static CodegraphConfig with(int maxFileLines, int workerThreads, boolean failOnParseError) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        int effectiveWorkers = workerThreads > 0 ? workerThreads : defaultWorkerThreads();
        return new CodegraphConfig(effectiveMaxFileLines, effectiveWorkers, compile(DEFAULT_ENTRY_POINT_PATTERNS),
                DEFAULT_EXCLUDE_DIRECTORIES, Paths.get(DEFAULT_IGNORE_FILE), failOnParseError);
    }

    private static List<Pattern> compile(List<String> patterns) {
        return patterns.stream()
                .map(Pattern::compile)
                .collect(Collectors.toUnmodifiableList());
    }

    private static int defaultWorkerThreads() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer workerThreads;
        public List<String> entryPointPatterns;
        public List<String> excludeDirectories;
        public String ignoreFile;
        public Boolean failOnParseError;
    }
}
