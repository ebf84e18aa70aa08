package org.calista.specopt.ai.policy.impl;

import org.calista.specopt.ai.encode.Observation;
import org.calista.specopt.ai.policy.Policy;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Two-headed MLP: {@code h = tanh(W1 x + b1)}, logits {@code = Wp h + bp}, value {@code = wv . h + bv}.
 *
 * <p>All weights live in one flat array (layout below) so the optimizer and the checkpoint
 * treat them as a single vector:</p>
 * <pre>
 * [ W1 (hidden x obsDim) | b1 (hidden) | Wp (actions x hidden) | bp (actions) | wv (hidden) | bv ]
 * </pre>
 * Reads are safe from several threads as long as nobody is updating the parameters.
 */
public final class ActorCriticPolicy implements Policy {

    private final int obsDim;
    private final int hidden;
    private final int actions;
    private final double[] params;

    private final int oB1;
    private final int oWp;
    private final int oBp;
    private final int oWv;
    private final int oBv;

    /** Forward-pass intermediates for one observation. */
    public record Forward(double[] hidden, double[] logits, double[] probs, double value) {
    }

    private ActorCriticPolicy(int obsDim, int hidden, int actions, double[] params) {
        if (obsDim < 1 || hidden < 1 || actions < 1) {
            throw new IllegalArgumentException("obsDim/hidden/actions must be >= 1");
        }
        this.obsDim = obsDim;
        this.hidden = hidden;
        this.actions = actions;
        this.oB1 = hidden * obsDim;
        this.oWp = oB1 + hidden;
        this.oBp = oWp + actions * hidden;
        this.oWv = oBp + actions;
        this.oBv = oWv + hidden;
        if (params.length != parameterCount(obsDim, hidden, actions)) {
            throw new IllegalArgumentException("parameter vector length " + params.length
                    + " != expected " + parameterCount(obsDim, hidden, actions));
        }
        this.params = params;
    }

    public static int parameterCount(int obsDim, int hidden, int actions) {
        return hidden * obsDim + hidden + actions * hidden + actions + hidden + 1;
    }

    /** Fresh policy: Glorot trunk, near-zero heads (uniform initial distribution). */
    public static ActorCriticPolicy initialize(int obsDim, int hidden, int actions, long seed) {
        double[] p = new double[parameterCount(obsDim, hidden, actions)];
        ActorCriticPolicy pol = new ActorCriticPolicy(obsDim, hidden, actions, p);
        SplittableRandom rnd = new SplittableRandom(seed);

        double a1 = Math.sqrt(6.0 / (obsDim + hidden));
        for (int i = 0; i < pol.oB1; i++) p[i] = rnd.nextDouble(-a1, a1);
        for (int i = pol.oWp; i < pol.oBp; i++) p[i] = rnd.nextDouble(-0.01, 0.01);
        for (int i = pol.oWv; i < pol.oBv; i++) p[i] = rnd.nextDouble(-0.1, 0.1);
        return pol;
    }

    /** Wraps a copy of {@code params}. */
    public static ActorCriticPolicy fromParameters(int obsDim, int hidden, int actions, double[] params) {
        Objects.requireNonNull(params, "params");
        return new ActorCriticPolicy(obsDim, hidden, actions, params.clone());
    }

    @Override
    public int observationDim() {
        return obsDim;
    }

    @Override
    public int actionCount() {
        return actions;
    }

    public int hidden() {
        return hidden;
    }

    /** Live parameter vector; mutate only from the optimizer thread. */
    public double[] parameters() {
        return params;
    }

    public int parameterCount() {
        return params.length;
    }

    @Override
    public double[] probabilities(Observation observation) {
        return forward(observation.values()).probs();
    }

    @Override
    public double value(Observation observation) {
        return forward(observation.values()).value();
    }

    public Forward forward(double[] x) {
        if (x.length != obsDim) throw new IllegalArgumentException("observation dim " + x.length + " != " + obsDim);

        double[] h = new double[hidden];
        for (int j = 0; j < hidden; j++) {
            double z = params[oB1 + j];
            int row = j * obsDim;
            for (int i = 0; i < obsDim; i++) {
                double xi = x[i];
                if (xi != 0.0) z += params[row + i] * xi;
            }
            h[j] = Math.tanh(z);
        }

        double[] logits = new double[actions];
        double max = Double.NEGATIVE_INFINITY;
        for (int a = 0; a < actions; a++) {
            double z = params[oBp + a];
            int row = oWp + a * hidden;
            for (int j = 0; j < hidden; j++) z += params[row + j] * h[j];
            logits[a] = z;
            if (z > max) max = z;
        }

        double[] probs = new double[actions];
        double sum = 0.0;
        for (int a = 0; a < actions; a++) {
            double e = Math.exp(logits[a] - max);
            probs[a] = e;
            sum += e;
        }
        for (int a = 0; a < actions; a++) probs[a] /= sum;

        double v = params[oBv];
        for (int j = 0; j < hidden; j++) v += params[oWv + j] * h[j];

        return new Forward(h, logits, probs, v);
    }

    /**
     * Accumulates into {@code grad} the gradient of a scalar loss whose partials w.r.t. the
     * logits and the value output are {@code dLogits} and {@code dValue}.
     */
    public void backward(double[] x, Forward f, double[] dLogits, double dValue, double[] grad) {
        if (grad.length != params.length) throw new IllegalArgumentException("grad length mismatch");
        double[] h = f.hidden();
        double[] dh = new double[hidden];

        for (int a = 0; a < actions; a++) {
            double g = dLogits[a];
            if (g == 0.0) continue;
            int row = oWp + a * hidden;
            for (int j = 0; j < hidden; j++) {
                grad[row + j] += g * h[j];
                dh[j] += g * params[row + j];
            }
            grad[oBp + a] += g;
        }

        if (dValue != 0.0) {
            for (int j = 0; j < hidden; j++) {
                grad[oWv + j] += dValue * h[j];
                dh[j] += dValue * params[oWv + j];
            }
            grad[oBv] += dValue;
        }

        for (int j = 0; j < hidden; j++) {
            double dz = dh[j] * (1.0 - h[j] * h[j]);
            if (dz == 0.0) continue;
            grad[oB1 + j] += dz;
            int row = j * obsDim;
            for (int i = 0; i < obsDim; i++) {
                double xi = x[i];
                if (xi != 0.0) grad[row + i] += dz * xi;
            }
        }
    }

    public ActorCriticPolicy copy() {
        return new ActorCriticPolicy(obsDim, hidden, actions, params.clone());
    }
}
