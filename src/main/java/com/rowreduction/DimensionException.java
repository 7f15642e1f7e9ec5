package com.rowreduction;

/** Thrown when matrix shapes are invalid or incompatible for the requested operation. */
public final class DimensionException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public enum Reason {
        INVALID_DIMENSION,   // zero rows or columns
        SIZE_MISMATCH,       // element count or operand shapes disagree
        RAGGED_INPUT,        // nested rows/columns of unequal length
        NOT_SQUARE
    }

    private final Reason reason;

    public DimensionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() { return reason; }
}
