package com.rowreduction;

/**
 * Double-backed {@link Numeric}.  Zero tests are exact, so elimination over
 * this type still takes the first nonzero entry as pivot and can lose accuracy
 * on ill-conditioned input; there is no partial pivoting.
 */
public final class Real implements Numeric<Real> {
    public static final Real ZERO = new Real(0.0);
    public static final Real ONE  = new Real(1.0);

    private final double v;

    private Real(double v) { this.v = v; }

    public static Real of(double v) {
        if (Double.isNaN(v)) throw new ArithmeticException("NaN");
        return v == 0.0 ? ZERO : new Real(v);   // folds -0.0
    }

    public double doubleValue() { return v; }

    @Override public Real add(Real o)      { return of(v + o.v); }
    @Override public Real subtract(Real o) { return of(v - o.v); }
    @Override public Real multiply(Real o) { return of(v * o.v); }

    @Override public Real divide(Real o) {
        if (o.v == 0.0) throw new ArithmeticException("Divide by zero");
        return of(v / o.v);
    }

    @Override public Real negate()    { return of(-v); }
    @Override public Real abs()       { return of(Math.abs(v)); }
    @Override public int signum()     { return (int) Math.signum(v); }
    @Override public boolean isZero() { return v == 0.0; }
    @Override public boolean isOne()  { return v == 1.0; }
    @Override public Real zero()      { return ZERO; }
    @Override public Real one()       { return ONE; }

    @Override public int compareTo(Real o) { return Double.compare(v, o.v); }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Real)) return false;
        return Double.compare(v, ((Real) obj).v) == 0;
    }

    @Override public int hashCode() { return Double.hashCode(v); }

    @Override public String toString() {
        return v == Math.rint(v) && Math.abs(v) < 1e15 ? Long.toString((long) v) : Double.toString(v);
    }
}
