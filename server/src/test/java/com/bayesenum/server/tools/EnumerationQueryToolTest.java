package com.bayesenum.server.tools;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnumerationQueryToolTest {

    @TempDir
    Path dir;

    private Path structure;
    private Path cpts;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void writeNetwork() throws Exception {
        structure = dir.resolve("structure.txt");
        cpts = dir.resolve("cpts.txt");
        Files.write(structure, List.of("Rain -> Umbrella"), StandardCharsets.UTF_8);
        Files.write(cpts, List.of(
                "NODE Rain", "VALUES yes no", "TABLE", "0.2 0.8", "ENDNODE",
                "NODE Umbrella", "VALUES yes no", "PARENTS Rain", "TABLE", "yes 0.9 0.1", "no 0.2 0.8", "ENDNODE"),
                StandardCharsets.UTF_8);
    }

    private int run(String... args) {
        return EnumerationQueryTool.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void parsesArguments() {
        EnumerationQueryTool.Arguments a = EnumerationQueryTool.parseArguments(
                new String[] { "s.txt", "--verbose", "c.txt", "Rain", "Umbrella=yes", "Wind = strong" });
        assertEquals("s.txt", a.structureFile);
        assertEquals("c.txt", a.cptFile);
        assertEquals("Rain", a.queryVariable);
        assertEquals(Map.of("Umbrella", "yes", "Wind", "strong"), a.evidence);
        assertTrue(a.verbose);
        assertFalse(a.showNetwork);

        assertThrows(IllegalArgumentException.class,
                () -> EnumerationQueryTool.parseArguments(new String[] { "only-one" }));
        assertThrows(IllegalArgumentException.class,
                () -> EnumerationQueryTool.parseArguments(new String[] { "s", "c", "Q", "novalue=" }));
        assertThrows(IllegalArgumentException.class,
                () -> EnumerationQueryTool.parseArguments(new String[] { "s", "c", "--bogus" }));
    }

    @Test
    void answersQuery() {
        assertEquals(0, run(structure.toString(), cpts.toString(), "Rain", "Umbrella=yes"));
        assertTrue(stdout().contains("Computing P(Rain | Umbrella=yes)"), stdout());
        assertTrue(stdout().contains("P(Rain=yes | evidence) = 0.529412"), stdout());
        assertFalse(stdout().contains("BAYESIAN NETWORK STRUCTURE"));
    }

    @Test
    void verbosePrintsTrace() {
        assertEquals(0, run(structure.toString(), cpts.toString(), "Umbrella", "-v"));
        assertTrue(stdout().contains("  Rain hidden, summing over its values"), stdout());
    }

    @Test
    void withoutQueryPrintsNetwork() {
        assertEquals(0, run(structure.toString(), cpts.toString()));
        assertTrue(stdout().contains("BAYESIAN NETWORK STRUCTURE"));
        assertTrue(stdout().contains("CONDITIONAL PROBABILITY TABLES"));
    }

    @Test
    void reportsErrors() {
        assertEquals(1, run(structure.toString(), cpts.toString(), "Snow"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Snow"));

        assertEquals(1, run(dir.resolve("missing.txt").toString(), cpts.toString()));
        assertEquals(2, run());
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
    }
}
