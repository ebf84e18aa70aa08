package org.calista.specopt.ai.encode;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-length numeric encoding of a (prompt, spec) pair. Immutable.
 */
public final class Observation {

    private final double[] values;
    private final long fingerprint;

    public Observation(double[] values) {
        Objects.requireNonNull(values, "values");
        this.values = values.clone();
        this.fingerprint = fingerprintOf(this.values);
    }

    public int dim() {
        return values.length;
    }

    public double get(int i) {
        return values[i];
    }

    /** Defensive copy. */
    public double[] values() {
        return values.clone();
    }

    /** Stable 64-bit key; equal observations have equal fingerprints across runs. */
    public long fingerprint() {
        return fingerprint;
    }

    public void copyInto(double[] dst) {
        if (dst.length != values.length) throw new IllegalArgumentException("dim mismatch: " + dst.length + " != " + values.length);
        System.arraycopy(values, 0, dst, 0, values.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Observation other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(fingerprint);
    }

    @Override
    public String toString() {
        return "Observation{dim=" + values.length + ", fp=" + Long.toHexString(fingerprint) + "}";
    }

    private static long fingerprintOf(double[] v) {
        long h = 0xcbf29ce484222325L;
        for (double d : v) {
            long bits = Double.doubleToLongBits(d);
            h ^= bits;
            h *= 0x100000001b3L;
            h ^= (h >>> 29);
        }
        return h;
    }
}
