package com.signalsentinel.core.model;

import java.io.Serializable;

/**
 * Aggregated 2×2 report counts for one drug-event pair.
 *
 * <pre>
 *                 event     other events
 *   drug            a            b
 *   other drugs     c            d
 * </pre>
 *
 * <p>
 * All four cells must be non-negative. A table whose total is zero may be
 * constructed, but every statistic computed over it reports insufficient
 * data.
 * </p>
 *
 * @since 1.0.0
 */
public final class ContingencyTable implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long a;
    private final long b;
    private final long c;
    private final long d;

    /**
     * @throws IllegalArgumentException if any cell is negative
     */
    public ContingencyTable(long a, long b, long c, long d) {
        requireNonNegative(a, "a");
        requireNonNegative(b, "b");
        requireNonNegative(c, "c");
        requireNonNegative(d, "d");
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
    }

    /** Reports of the drug with the event (observed count). */
    public long getA() {
        return a;
    }

    /** Reports of the drug with any other event. */
    public long getB() {
        return b;
    }

    /** Reports of the event with any other drug. */
    public long getC() {
        return c;
    }

    /** Reports with neither the drug nor the event. */
    public long getD() {
        return d;
    }

    public long getDrugTotal() {
        return a + b;
    }

    public long getEventTotal() {
        return a + c;
    }

    public long getTotal() {
        return a + b + c + d;
    }

    /**
     * Count of {@code a} expected under independence, {@code (a+b)(a+c)/N}.
     *
     * @return the expected count, or {@code 0} for an empty table
     */
    public double getExpected() {
        long n = getTotal();
        if (n == 0) {
            return 0.0;
        }
        return (double) getDrugTotal() * (double) getEventTotal() / n;
    }

    /**
     * @return {@code true} if any of the four cells is zero
     */
    public boolean hasZeroCell() {
        return a == 0 || b == 0 || c == 0 || d == 0;
    }

    /**
     * Copy of this table with {@code a} replaced. Handy for sensitivity
     * checks.
     */
    public ContingencyTable withA(long newA) {
        return new ContingencyTable(newA, b, c, d);
    }

    private static void requireNonNegative(long value, String cell) {
        if (value < 0) {
            throw new IllegalArgumentException(
                    "Contingency cell '" + cell + "' must be >= 0, got: " + value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ContingencyTable that))
            return false;
        return a == that.a && b == that.b && c == that.c && d == that.d;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(a) * 31 * 31 * 31
                + Long.hashCode(b) * 31 * 31
                + Long.hashCode(c) * 31
                + Long.hashCode(d);
    }

    @Override
    public String toString() {
        return "ContingencyTable{a=" + a + ", b=" + b + ", c=" + c + ", d=" + d + '}';
    }
}
