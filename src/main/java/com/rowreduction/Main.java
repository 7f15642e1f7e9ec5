package com.rowreduction;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

public class Main {

    static final int EXIT_IO = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_MATH = 3;

    private static void usage(PrintStream err) {
        err.println(
                "Usage: rowreduction [options] <input-file>\n" +
                        "Operations (pick one):\n" +
                        "  -rref         reduced row echelon form  [default]\n" +
                        "  -det          determinant (square input)\n" +
                        "  -rank         number of pivots\n" +
                        "  -indep        are the columns linearly independent?\n" +
                        "  -solve        solve A x = b, with b the last input column\n" +
                        "  -inverse      inverse of a square input\n" +
                        "Options:\n" +
                        "  -stats        with -rref, also print swap count and pivot product\n" +
                        "  -notime       omit the *Time line\n"
        );
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        OptionsParser.Parsed parsed;
        try {
            parsed = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage(err);
            err.println("Argument error: " + e.getMessage());
            return EXIT_USAGE;
        }

        RunOptions opts = parsed.options;
        String filename = parsed.inputPath;
        long t0 = System.nanoTime();

        try {
            Path path = Paths.get(filename);
            MatrixFile in = MatrixFile.read(path);

            // name line: the file's own name, else base filename without extension
            String base = in.getName();
            if (base == null) {
                base = path.getFileName().toString();
                int dot = base.lastIndexOf('.');
                if (dot > 0) base = base.substring(0, dot);
            }
            out.println(base);

            execute(opts, in, out);

            if (opts.timing) {
                double secs = (System.nanoTime() - t0) / 1_000_000_000.0;
                out.printf("*Time=%.3fs%n", secs);
            }
            out.flush();
            return 0;
        } catch (NoSuchFileException e) {
            err.println("File not found: " + filename);
            return EXIT_IO;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        } catch (DimensionException | ArithmeticException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_MATH;
        }
    }

    private static void execute(RunOptions opts, MatrixFile in, PrintStream out) {
        DenseMatrix<Fraction> input = in.getMatrix();
        switch (opts.operation) {
            case RREF: {
                RrefResult<Fraction> rr = RowReducer.reduce(input);
                writeMatrix(rr.matrix(), in.isIntegerData(), out);
                if (opts.stats) out.println(rr);
                break;
            }
            case DET:
                out.println("det=" + input.det());
                break;
            case RANK:
                out.println("rank=" + input.rank());
                break;
            case INDEP:
                out.println("columns are " + (input.linearlyIndependent() ? "" : "NOT ") + "linearly independent");
                break;
            case SOLVE: {
                if (input.cols() < 2) {
                    throw new DimensionException(DimensionException.Reason.SIZE_MISMATCH,
                            "Solve needs at least one coefficient column and a right-hand side");
                }
                DenseMatrix<Fraction> coeff = input.columns(0, input.cols() - 1);
                List<Fraction> b = input.column(input.cols() - 1);
                Solution<Fraction> x = coeff.solve(b);
                if (x.isUnique()) {
                    StringBuilder sb = new StringBuilder("x =");
                    for (Fraction v : x.values()) sb.append(' ').append(v);
                    out.println(sb);
                } else {
                    out.println("no unique solution (" + x.status().name().toLowerCase(Locale.ROOT) + ")");
                }
                break;
            }
            case INVERSE:
                writeMatrix(input.inverse(), false, out);
                break;
            default:
                throw new IllegalStateException("Unhandled operation " + opts.operation);
        }
    }

    private static void writeMatrix(DenseMatrix<Fraction> matrix, boolean integerData, PrintStream out) {
        boolean allIntegers = integerData;
        if (allIntegers) {
            for (int i = 0; i < matrix.rows() && allIntegers; i++)
                for (Fraction f : matrix.rowValues(i)) if (!f.isInteger()) { allIntegers = false; break; }
        }
        PrintWriter pw = new PrintWriter(out);
        new MatrixFile(null, allIntegers, matrix).write(pw);
        pw.flush();
    }
}
