package com.rowreduction;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Outcome of solving {@code A x = b}; carries a vector only when the solution is unique. */
public final class Solution<T extends Numeric<T>> {

    public enum Status { UNIQUE, INCONSISTENT, INFINITE }

    private final Status status;
    private final List<T> values;

    private Solution(Status status, List<T> values) {
        this.status = status;
        this.values = values;
    }

    static <T extends Numeric<T>> Solution<T> unique(List<T> values) {
        return new Solution<>(Status.UNIQUE, Collections.unmodifiableList(Objects.requireNonNull(values)));
    }

    static <T extends Numeric<T>> Solution<T> none(Status status) {
        if (status == Status.UNIQUE) throw new IllegalArgumentException("A unique solution needs values");
        return new Solution<>(status, null);
    }

    public Status status() { return status; }

    public boolean isUnique() { return status == Status.UNIQUE; }

    /** The solution vector; fails unless {@link #isUnique()}. */
    public List<T> values() {
        if (values == null) throw new IllegalStateException("No unique solution (" + status + ")");
        return values;
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Solution)) return false;
        Solution<?> o = (Solution<?>) obj;
        return status == o.status && Objects.equals(values, o.values);
    }

    @Override public int hashCode() { return Objects.hash(status, values); }

    @Override public String toString() {
        return status == Status.UNIQUE ? values.toString() : status.toString();
    }
}
