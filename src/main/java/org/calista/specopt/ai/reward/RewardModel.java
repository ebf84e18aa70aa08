package org.calista.specopt.ai.reward;

import org.calista.specopt.ai.encode.Observation;
import org.calista.specopt.ai.encode.SpecEncoder;
import org.calista.specopt.ai.spec.DesignSpecification;

/**
 * Frozen design-quality estimator. Higher is better.
 *
 * <p>A pure function of its parameters and the encoder output; safe to share between threads.
 * Scores of different {@link #version()}s are not on a common scale.</p>
 */
public interface RewardModel {

    double scoreObservation(Observation observation);

    SpecEncoder encoder();

    String version();

    default double score(String prompt, DesignSpecification spec) {
        return scoreObservation(encoder().encode(prompt, spec));
    }
}
