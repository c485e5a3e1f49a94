package org.dxworks.codegraph;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CodegraphConfigTest {

    @TempDir
    Path dir;

    @Test
    void missingFileGivesDefaults() {
        CodegraphConfig config = CodegraphConfig.load(dir.resolve("codegraph-config.yml"));

        assertEquals(20000, config.getMaxFileLines());
        assertTrue(config.isFailOnParseError());
        assertTrue(config.isEntryPoint("main"));
        assertTrue(config.isEntryPoint("test_parser"));
        assertFalse(config.isEntryPoint("helper"));
        assertTrue(config.getExcludeDirectories().contains("node_modules"));
    }

    @Test
    void yamlOverridesOnlyWhatItNames() throws IOException {
        Path file = dir.resolve("codegraph-config.yml");
        Files.writeString(file, "maxFileLines: 500\n"
                + "workerThreads: 3\n"
                + "entryPointPatterns:\n"
                + "  - handle.*\n"
                + "excludeDirectories: [vendor]\n");

        CodegraphConfig config = CodegraphConfig.load(file);

        assertEquals(500, config.getMaxFileLines());
        assertEquals(3, config.getWorkerThreads());
        assertTrue(config.isEntryPoint("handleRequest"));
        assertFalse(config.isEntryPoint("main"));
        assertEquals(Set.of("vendor"), config.getExcludeDirectories());
        assertTrue(config.isFailOnParseError());
    }

    @Test
    void nonPositiveLimitsFallBackToDefaults() throws IOException {
        Path file = dir.resolve("codegraph-config.yml");
        Files.writeString(file, "maxFileLines: 0\nfailOnParseError: false\n");

        CodegraphConfig config = CodegraphConfig.load(file);

        assertEquals(20000, config.getMaxFileLines());
        assertTrue(config.getWorkerThreads() >= 1);
        assertFalse(config.isFailOnParseError());
    }

    @Test
    void unreadableYamlGivesDefaults() throws IOException {
        Path file = dir.resolve("codegraph-config.yml");
        Files.writeString(file, "maxFileLines: [not, a, number\n");

        assertEquals(20000, CodegraphConfig.load(file).getMaxFileLines());
    }
}
