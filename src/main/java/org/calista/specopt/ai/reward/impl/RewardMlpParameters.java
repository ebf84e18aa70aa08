package org.calista.specopt.ai.reward.impl;

import java.util.Arrays;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Mutable weights of the reward MLP: {@code r = w2 . relu(W1 x + b1) + b2}.
 * Only the offline trainer mutates them; {@link MlpRewardModel} keeps a frozen copy.
 */
public final class RewardMlpParameters {

    public final int inputDim;
    public final int hidden;
    /** row-major [hidden][inputDim] */
    public final double[] w1;
    public final double[] b1;
    public final double[] w2;
    public double b2;

    public RewardMlpParameters(int inputDim, int hidden, double[] w1, double[] b1, double[] w2, double b2) {
        if (inputDim < 1 || hidden < 1) throw new IllegalArgumentException("inputDim/hidden must be >= 1");
        Objects.requireNonNull(w1, "w1");
        Objects.requireNonNull(b1, "b1");
        Objects.requireNonNull(w2, "w2");
        if (w1.length != inputDim * hidden) throw new IllegalArgumentException("w1 shape mismatch: " + w1.length);
        if (b1.length != hidden) throw new IllegalArgumentException("b1 shape mismatch: " + b1.length);
        if (w2.length != hidden) throw new IllegalArgumentException("w2 shape mismatch: " + w2.length);
        this.inputDim = inputDim;
        this.hidden = hidden;
        this.w1 = w1;
        this.b1 = b1;
        this.w2 = w2;
        this.b2 = b2;
    }

    /** Glorot-uniform weights, small positive hidden bias so ReLUs start active. */
    public static RewardMlpParameters initial(int inputDim, int hidden, long seed) {
        SplittableRandom rnd = new SplittableRandom(seed);
        double a1 = Math.sqrt(6.0 / (inputDim + hidden));
        double a2 = Math.sqrt(6.0 / (hidden + 1));

        double[] w1 = new double[inputDim * hidden];
        for (int i = 0; i < w1.length; i++) w1[i] = rnd.nextDouble(-a1, a1);
        double[] b1 = new double[hidden];
        Arrays.fill(b1, 0.01);
        double[] w2 = new double[hidden];
        for (int i = 0; i < w2.length; i++) w2[i] = rnd.nextDouble(-a2, a2);
        return new RewardMlpParameters(inputDim, hidden, w1, b1, w2, 0.0);
    }

    public RewardMlpParameters copy() {
        return new RewardMlpParameters(inputDim, hidden, w1.clone(), b1.clone(), w2.clone(), b2);
    }

    /**
     * Forward pass. {@code preAct} (length hidden) receives the hidden pre-activations when non-null.
     */
    public double forward(double[] x, double[] preAct) {
        if (x.length != inputDim) throw new IllegalArgumentException("input dim " + x.length + " != " + inputDim);
        double out = b2;
        for (int h = 0; h < hidden; h++) {
            double z = b1[h];
            int row = h * inputDim;
            for (int i = 0; i < inputDim; i++) {
                double xi = x[i];
                if (xi != 0.0) z += w1[row + i] * xi;
            }
            if (preAct != null) preAct[h] = z;
            if (z > 0.0) out += w2[h] * z;
        }
        return out;
    }

    /**
     * SGD step on {@code coef * r(x)}: params -= lr * coef * dr/dparams.
     * {@code preAct} must come from {@link #forward} on the same x with the current weights.
     */
    public void step(double[] x, double[] preAct, double coef, double lr) {
        double g = lr * coef;
        for (int h = 0; h < hidden; h++) {
            double z = preAct[h];
            if (z <= 0.0) continue;
            double dz = w2[h];
            w2[h] -= g * z;
            b1[h] -= g * dz;
            int row = h * inputDim;
            for (int i = 0; i < inputDim; i++) {
                double xi = x[i];
                if (xi != 0.0) w1[row + i] -= g * dz * xi;
            }
        }
        b2 -= g;
    }
}
