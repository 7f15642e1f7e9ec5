package com.rowreduction;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A rational matrix in plain-text form:
 *
 * <pre>
 * * comment
 * name
 * begin
 * 3 3 integer
 *  1 -2  1
 *  0  2 -8
 *  5  0 -5
 * end
 * </pre>
 *
 * Entries are integers or {@code n/d}.  The size line may also be
 * {@code ***** cols rational}, in which case rows are read up to {@code end}.
 */
public final class MatrixFile {
    private final String name;
    private final boolean integerData;
    private final DenseMatrix<Fraction> matrix;

    public MatrixFile(String name, boolean integerData, DenseMatrix<Fraction> matrix) {
        this.name = name;
        this.integerData = integerData;
        this.matrix = Objects.requireNonNull(matrix, "matrix");
    }

    /** Name line preceding {@code begin}, or null when the file has none. */
    public String getName() { return name; }
    public boolean isIntegerData() { return integerData; }
    public DenseMatrix<Fraction> getMatrix() { return matrix; }

    public static MatrixFile read(Path path) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(br);
        }
    }

    public static MatrixFile parse(Reader in) throws IOException {
        BufferedReader br = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        String line;
        String name = null;
        boolean sawBegin = false;

        // ---- header: comments, optional name, then 'begin' ----
        while ((line = br.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) continue;
            if (line.startsWith("*") || line.startsWith("#")) continue;
            if (line.toLowerCase(Locale.ROOT).equals("begin")) { sawBegin = true; break; }
            if (name == null) name = line;
        }
        if (!sawBegin) throw new IOException("No 'begin' line found");

        String[] header = nextNonEmpty(br).split("\\s+");
        if (header.length < 2 || header.length > 3) {
            throw new IOException("Expected 'rows cols [integer|rational]', got: " + String.join(" ", header));
        }
        boolean starHeader = header[0].equals("*****");
        int n = parseCount(header[1], "column");
        boolean integerData = header.length == 3 && header[2].equalsIgnoreCase("integer");
        if (header.length == 3 && !integerData && !header[2].equalsIgnoreCase("rational")) {
            throw new IOException("Unknown number type: " + header[2]);
        }

        List<Fraction> values = new ArrayList<>();
        int m;
        if (starHeader) {
            m = 0;
            while (true) {
                String t = nextNonEmpty(br);
                if (t.equalsIgnoreCase("end")) break;
                readRow(t, n, ++m, integerData, values);
            }
        } else {
            m = parseCount(header[0], "row");
            for (int i = 1; i <= m; i++) readRow(nextNonEmpty(br), n, i, integerData, values);
            String end = nextNonEmpty(br);
            if (!end.equalsIgnoreCase("end")) throw new IOException("Expected 'end', got: " + end);
        }
        if (m == 0 || n == 0) throw new IOException("Matrix must have at least one row and one column");
        return new MatrixFile(name, integerData, new DenseMatrix<>(m, n, values));
    }

    /** Writes the same layout back, with an explicit row count. */
    public void write(PrintWriter out) {
        if (name != null) out.println(name);
        out.println("begin");
        out.printf("%d %d %s%n", matrix.rows(), matrix.cols(), integerData ? "integer" : "rational");
        for (int i = 0; i < matrix.rows(); i++) {
            StringBuilder sb = new StringBuilder();
            for (Fraction f : matrix.rowValues(i)) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(f);
            }
            out.println(sb);
        }
        out.println("end");
    }

    private static void readRow(String line, int n, int lineNo, boolean integerData, List<Fraction> out)
            throws IOException {
        String[] tokens = line.split("\\s+");
        if (tokens.length != n) {
            throw new IOException("Expected " + n + " columns on row " + lineNo + ", got " + tokens.length);
        }
        for (String tok : tokens) {
            Fraction f;
            try {
                f = Fraction.parse(tok);
            } catch (NumberFormatException | ArithmeticException e) {
                throw new IOException("Bad entry '" + tok + "' on row " + lineNo, e);
            }
            if (integerData && !f.isInteger()) {
                throw new IOException("Non-integer entry '" + tok + "' in integer data on row " + lineNo);
            }
            out.add(f);
        }
    }

    private static String nextNonEmpty(BufferedReader br) throws IOException {
        String line;
        do {
            line = br.readLine();
            if (line == null) throw new IOException("Unexpected end of file");
            line = line.trim();
        } while (line.isEmpty());
        return line;
    }

    private static int parseCount(String tok, String what) throws IOException {
        if (!tok.matches("\\d+")) throw new IOException("Bad " + what + " count: " + tok);
        try {
            return Integer.parseInt(tok);
        } catch (NumberFormatException e) {
            throw new IOException("Bad " + what + " count: " + tok, e);
        }
    }
}
