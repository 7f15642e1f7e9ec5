package com.rowreduction;

public final class OptionsParser {

    public static final class Parsed {
        public final RunOptions options;
        public final String inputPath;
        private Parsed(RunOptions o, String p){ options=o; inputPath=p; }
    }

    private OptionsParser() {}

    public static Parsed parse(String[] args){
        RunOptions.Builder b = new RunOptions.Builder();
        String input = null;

        for (String a : args) {
            switch (a) {
                case "-rref":    b.operation(RunOptions.Operation.RREF); break;     // default
                case "-det":     b.operation(RunOptions.Operation.DET); break;
                case "-rank":    b.operation(RunOptions.Operation.RANK); break;
                case "-indep":   b.operation(RunOptions.Operation.INDEP); break;
                case "-solve":   b.operation(RunOptions.Operation.SOLVE); break;    // last column is b
                case "-inverse": b.operation(RunOptions.Operation.INVERSE); break;
                case "-stats":   b.stats(true); break;
                case "-notime":  b.timing(false); break;
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (input != null) throw new IllegalArgumentException("Multiple inputs: " + a);
                    input = a;
            }
        }
        if (input == null) throw new IllegalArgumentException("Missing input file");
        return new Parsed(b.build(), input);
    }
}
