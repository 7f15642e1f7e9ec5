package com.rowreduction;

/**
 * Minimal number abstraction for the elimination code.  Identities are
 * obtained from an existing value so generic code never needs the concrete
 * element class.
 */
public interface Numeric<T extends Numeric<T>> extends Comparable<T> {
    T add(T o);
    T subtract(T o);
    T multiply(T o);
    T divide(T o);
    T negate();
    T abs();
    int signum();
    boolean isZero();
    boolean isOne();

    /** Additive identity of this value's type. */
    T zero();

    /** Multiplicative identity of this value's type. */
    T one();
}
