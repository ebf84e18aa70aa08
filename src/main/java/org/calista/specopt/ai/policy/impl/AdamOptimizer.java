package org.calista.specopt.ai.policy.impl;

import java.util.Objects;

/**
 * Adam over a flat parameter vector. Moments are exposed so a run can be checkpointed and resumed
 * with identical optimizer state.
 */
public final class AdamOptimizer {

    private final double learningRate;
    private final double beta1;
    private final double beta2;
    private final double epsilon;

    private final double[] m;
    private final double[] v;
    private long t;

    public AdamOptimizer(int size, double learningRate) {
        this(size, learningRate, 0.9, 0.999, 1e-8);
    }

    public AdamOptimizer(int size, double learningRate, double beta1, double beta2, double epsilon) {
        if (size < 1) throw new IllegalArgumentException("size must be >= 1");
        if (!(learningRate > 0.0)) throw new IllegalArgumentException("learningRate must be > 0");
        this.learningRate = learningRate;
        this.beta1 = beta1;
        this.beta2 = beta2;
        this.epsilon = epsilon;
        this.m = new double[size];
        this.v = new double[size];
    }

    /** Restores moments and step counter (arrays are copied). */
    public void restore(double[] m, double[] v, long t) {
        Objects.requireNonNull(m, "m");
        Objects.requireNonNull(v, "v");
        if (m.length != this.m.length || v.length != this.v.length) {
            throw new IllegalArgumentException("optimizer state size mismatch");
        }
        System.arraycopy(m, 0, this.m, 0, m.length);
        System.arraycopy(v, 0, this.v, 0, v.length);
        this.t = t;
    }

    public void step(double[] params, double[] grad) {
        if (params.length != m.length || grad.length != m.length) throw new IllegalArgumentException("size mismatch");
        t++;
        double c1 = 1.0 - Math.pow(beta1, t);
        double c2 = 1.0 - Math.pow(beta2, t);
        for (int i = 0; i < params.length; i++) {
            double g = grad[i];
            m[i] = beta1 * m[i] + (1.0 - beta1) * g;
            v[i] = beta2 * v[i] + (1.0 - beta2) * g * g;
            double mh = m[i] / c1;
            double vh = v[i] / c2;
            params[i] -= learningRate * mh / (Math.sqrt(vh) + epsilon);
        }
    }

    public double[] firstMoment() {
        return m.clone();
    }

    public double[] secondMoment() {
        return v.clone();
    }

    public long stepCount() {
        return t;
    }

    public int size() {
        return m.length;
    }
}
