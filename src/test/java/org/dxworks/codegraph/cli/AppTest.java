package org.dxworks.codegraph.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.codegraph.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppTest {

    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = App.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    private int run(String... args) {
        return commandLine.execute(args);
    }

    @Test
    void controlFlowSummaryIsPrintedPerFunction() {
        int exit = run("control-flow", TestUtils.sample("typescript/branches.ts").toString());

        assertEquals(0, exit);
        assertTrue(out.toString().startsWith("control-flow branches::classify\n"));
        assertTrue(out.toString().contains("  complexity: 2\n"));
    }

    @Test
    void functionGraphsRejectDirectories() {
        int exit = run("control-flow", TestUtils.sample("typescript").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().startsWith("Error: control-flow needs a source file"));
    }

    @Test
    void unknownFunctionIsAnError() {
        int exit = run("data-flow", "--function", "nope", TestUtils.sample("typescript/flow.ts").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().contains("No function named nope"));
    }

    @Test
    void callGraphAsJson() throws Exception {
        int exit = run("call-graph", "--format", "json", TestUtils.sample("typescript/calls.ts").toString());

        assertEquals(0, exit);
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertEquals("call-graph", json.get("metadata").get("graph").asText());
        assertEquals(4, json.get("nodes").size());
    }

    @Test
    void taintNeedsBothEnds() {
        int exit = run("program-dependency", "--taint-source", "input", TestUtils.sample("typescript/taint.ts").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().contains("--taint-source and --taint-sink must be given together"));
    }

    @Test
    void taintedSinksAreReported() {
        int exit = run("program-dependency", "--taint-source", "input", "--taint-sink", "exec",
                TestUtils.sample("typescript/taint.ts").toString());

        assertEquals(0, exit);
        assertTrue(out.toString().contains("taintedSinks: [exec@4]"));
    }

    @Test
    void exportWritesTheRenderedGraphToAFile(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("out/deps.dot");

        int exit = run("dependency-graph", "--format", "dot", "--export", target.toString(),
                TestUtils.sample("deps").toString());

        assertEquals(0, exit);
        String dot = Files.readString(target);
        assertTrue(dot.startsWith("digraph \"dependency-graph project\" {"));
        assertTrue(dot.contains("n0 -> n1;"));
        assertTrue(out.toString().startsWith("Wrote 1 graph(s) to "));
    }

    @Test
    void exportIntoADirectoryIsRejected(@TempDir Path dir) {
        int exit = run("call-graph", "--export", dir.toString(), TestUtils.sample("typescript/calls.ts").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().contains("Export path is a directory"));
    }

    @Test
    void missingSubcommandIsAUsageError() {
        assertNotEquals(0, run());
    }
}
