package com.rowreduction;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MainEndToEndTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return Main.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() { return out.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n"); }

    private Path write(String name, String... lines) throws IOException {
        Path p = dir.resolve(name);
        Files.writeString(p, String.join("\n", lines) + "\n");
        return p;
    }

    @Test
    public void rrefOfAugmentedSystem() throws IOException {
        Path p = write("system.txt",
                "begin", "3 4 integer",
                "1 -2  1  0",
                "0  2 -8  8",
                "5  0 -5 10",
                "end");
        assertEquals(0, run("-notime", p.toString()));
        assertEquals("system\nbegin\n3 4 integer\n1 0 0 1\n0 1 0 0\n0 0 1 -1\nend\n", stdout());
    }

    @Test
    public void rrefWithStatsAndTiming() throws IOException {
        Path p = write("m.txt", "begin", "2 2 integer", "0 2", "3 4", "end");
        assertEquals(0, run("-stats", p.toString()));
        String s = stdout();
        assertTrue(s.contains("*rank=2 swaps=1 pivot_product=6"), s);
        assertTrue(s.contains("*Time="), s);
    }

    @Test
    public void determinant() throws IOException {
        Path p = write("big.txt",
                "four by four",
                "begin", "4 4 integer",
                "1 -2  1  0",
                "0  2 -8  8",
                "5  0 -5 10",
                "9 -5 -5  6",
                "end");
        assertEquals(0, run("-det", "-notime", p.toString()));
        assertEquals("four by four\ndet=-480\n", stdout());
    }

    @Test
    public void solveUsesLastColumnAsRightHandSide() throws IOException {
        Path p = write("ab.txt", "begin", "3 4 integer", "1 -2 1 0", "0 2 -8 8", "5 0 -5 10", "end");
        assertEquals(0, run("-solve", "-notime", p.toString()));
        assertEquals("ab\nx = 1 0 -1\n", stdout());

        out.reset();
        Path q = write("bad.txt", "begin", "2 3 integer", "1 2 1", "2 4 3", "end");
        assertEquals(0, run("-solve", "-notime", q.toString()));
        assertEquals("bad\nno unique solution (inconsistent)\n", stdout());
    }

    @Test
    public void independenceAndRankAndInverse() throws IOException {
        Path p = write("dep.txt", "begin", "2 2 integer", "1 2", "2 4", "end");
        assertEquals(0, run("-indep", "-notime", p.toString()));
        assertEquals("dep\ncolumns are NOT linearly independent\n", stdout());

        out.reset();
        assertEquals(0, run("-rank", "-notime", p.toString()));
        assertEquals("dep\nrank=1\n", stdout());

        out.reset();
        Path q = write("inv.txt", "begin", "2 2 integer", "1 2", "3 4", "end");
        assertEquals(0, run("-inverse", "-notime", q.toString()));
        assertEquals("inv\nbegin\n2 2 rational\n-2 1\n3/2 -1/2\nend\n", stdout());
    }

    @Test
    public void errorsMapToExitCodes() throws IOException {
        assertEquals(Main.EXIT_USAGE, run("-bogus", "x.txt"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown option"));

        assertEquals(Main.EXIT_IO, run(dir.resolve("missing.txt").toString()));

        Path p = write("rect.txt", "begin", "2 3 integer", "1 2 3", "4 5 6", "end");
        assertEquals(Main.EXIT_MATH, run("-det", p.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("square"));

        Path q = write("sing.txt", "begin", "2 2 integer", "1 2", "2 4", "end");
        assertEquals(Main.EXIT_MATH, run("-inverse", q.toString()));

        Path huge = write("huge.txt", "begin", "99999999999 2 integer", "1 2", "end");
        assertEquals(Main.EXIT_IO, run("-notime", huge.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Bad row count"));
    }
}
