package com.jexfmt;

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

public class JExfmtTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new JExfmt());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("tree.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void testFormatsFile() throws IOException {
        Path file = write("""
            {"kind": "qualified_call",
             "path": {"kind": "alias", "segments": ["Foo", "Bar"]},
             "name": "baz",
             "args": [1]}
            """);

        assertEquals(0, run(file.toString()));
        assertEquals("Foo.Bar.baz(1)", out.toString().strip());
        assertEquals("", err.toString());
    }

    @Test
    public void testWidthOption() throws IOException {
        Path file = write("{\"kind\": \"call\", \"name\": \"foo\", \"args\": [100000, 200000, 300000]}");

        assertEquals(0, run("-w", "20", file.toString()));
        assertEquals("foo(100000,\n    200000,\n    300000)", out.toString().strip().replace("\r\n", "\n"));
    }

    @Test
    public void testInvalidTreeReportsError() throws IOException {
        Path file = write("{\"kind\": \"nope\"}");

        assertEquals(1, run(file.toString()));
        assertTrue(err.toString().startsWith("Error: Unknown node kind: nope"));
        assertEquals("", out.toString());
    }

    @Test
    public void testMissingFile() {
        assertEquals(1, run(tempDir.resolve("missing.json").toString()));
        assertTrue(err.toString().startsWith("Error:"));
    }

    @Test
    public void testInvalidWidth() throws IOException {
        Path file = write("1");

        assertEquals(1, run("--width", "0", file.toString()));
        assertTrue(err.toString().contains("Max width must be positive"));
    }

    @Test
    public void testDepthOption() throws IOException {
        Path file = write("[[[1]]]");

        assertEquals(1, run("--max-depth", "2", file.toString()));
        assertTrue(err.toString().contains("deeper than 2"));
    }
}
