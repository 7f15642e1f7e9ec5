package com.rowreduction;

public final class RunOptions {
    public enum Operation { RREF, DET, RANK, INDEP, SOLVE, INVERSE }

    public final Operation operation;
    public final boolean stats;             // print swaps / pivot product after RREF
    public final boolean timing;            // print *Time line

    private RunOptions(Builder b) {
        this.operation = b.operation;
        this.stats = b.stats;
        this.timing = b.timing;
    }

    public static final class Builder {
        private Operation operation = Operation.RREF;
        private boolean operationSet;
        private boolean stats;
        private boolean timing = true;

        public Builder operation(Operation op) {
            if (operationSet && op != operation) {
                throw new IllegalArgumentException("Conflicting operations: " + operation + " and " + op);
            }
            this.operation = op;
            this.operationSet = true;
            return this;
        }
        public Builder stats(boolean v){ this.stats=v; return this; }
        public Builder timing(boolean v){ this.timing=v; return this; }
        public RunOptions build(){ return new RunOptions(this); }
    }
}
