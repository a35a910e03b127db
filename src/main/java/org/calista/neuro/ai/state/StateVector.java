package org.calista.neuro.ai.state;

import java.util.Arrays;

/**
 * Learner input: normalised needs in fixed order (hunger, fatigue, thirst).
 *
 * <p>Immutable. {@link #values()} hands out a copy, so a vector passed to the
 * learner can never be changed behind its back.</p>
 */
public final class StateVector {

    public static final int WIDTH = 3;

    private final double[] v;

    private StateVector(double[] v) {
        this.v = v;
    }

    public static StateVector of(double hunger, double fatigue, double thirst) {
        return new StateVector(new double[]{clamp01(hunger), clamp01(fatigue), clamp01(thirst)});
    }

    /** Wider vectors are allowed; every component is clamped to [0,1]. */
    public static StateVector of(double[] values) {
        if (values == null || values.length == 0) throw new IllegalArgumentException("empty state vector");
        double[] c = new double[values.length];
        for (int i = 0; i < values.length; i++) c[i] = clamp01(values[i]);
        return new StateVector(c);
    }

    public int width() {
        return v.length;
    }

    public double get(int i) {
        return v[i];
    }

    public double[] values() {
        return v.clone();
    }

    private static double clamp01(double x) {
        if (!Double.isFinite(x)) return 0.0;
        return Math.max(0.0, Math.min(1.0, x));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateVector other)) return false;
        return Arrays.equals(v, other.v);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(v);
    }

    @Override
    public String toString() {
        return Arrays.toString(v);
    }
}
