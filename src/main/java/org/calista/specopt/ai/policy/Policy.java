package org.calista.specopt.ai.policy;

import org.calista.specopt.ai.encode.Observation;

import java.util.SplittableRandom;

/**
 * Stochastic policy over the fixed action space plus a state-value estimate.
 */
public interface Policy {

    int observationDim();

    int actionCount();

    /** Softmax distribution over actions; length {@link #actionCount()}, sums to 1. */
    double[] probabilities(Observation observation);

    double value(Observation observation);

    /** Most probable action; lowest index wins ties. */
    default int argmax(Observation observation) {
        double[] p = probabilities(observation);
        int best = 0;
        for (int i = 1; i < p.length; i++) if (p[i] > p[best]) best = i;
        return best;
    }

    default int sample(Observation observation, SplittableRandom rnd) {
        return sampleIndex(probabilities(observation), rnd);
    }

    static int sampleIndex(double[] probs, SplittableRandom rnd) {
        double r = rnd.nextDouble();
        double acc = 0.0;
        for (int i = 0; i < probs.length; i++) {
            acc += probs[i];
            if (r < acc) return i;
        }
        // rounding left r above the cumulative sum: last non-zero entry
        for (int i = probs.length - 1; i >= 0; i--) if (probs[i] > 0.0) return i;
        return probs.length - 1;
    }
}
