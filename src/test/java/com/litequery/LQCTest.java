package com.litequery;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class LQCTest {
    private static final String LESS_THAN = """
            {"kind":"lambda","parameter":"doc","body":
              {"kind":"binary","operator":"<",
               "left":{"kind":"member","target":{"kind":"parameter","name":"doc"},"name":"a"},
               "right":{"kind":"constant","value":5}}}""";

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new LQC());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    public void testCompileInlineExpression() {
        int exitCode = run("-c", "-e", LESS_THAN);

        assertEquals(0, exitCode);
        assertEquals("[\"<\",[\"a\"],5]", out.toString().trim());
    }

    @Test
    public void testCompileFromFile(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("predicate.json");
        Files.writeString(input, LESS_THAN, StandardCharsets.UTF_8);

        int exitCode = run("--compact-output", input.toString());

        assertEquals(0, exitCode);
        assertEquals("[\"<\",[\"a\"],5]", out.toString().trim());
    }

    @Test
    public void testUnsupportedPredicate() {
        String predicate = LESS_THAN.replace("\"<\"", "\"+\"");

        int exitCode = run("-e", predicate);

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Unsupported binary operator: +"));
        assertEquals("", out.toString());
    }

    @Test
    public void testMalformedInput() {
        int exitCode = run("-e", "{\"kind\":\"lambda\"");

        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("Error: "));
    }
}
