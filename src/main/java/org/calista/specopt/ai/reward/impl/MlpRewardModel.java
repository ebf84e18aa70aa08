package org.calista.specopt.ai.reward.impl;

import org.calista.specopt.ai.encode.Observation;
import org.calista.specopt.ai.encode.SpecEncoder;
import org.calista.specopt.ai.reward.RewardModel;

import java.util.Objects;

/**
 * Reward model over hashed bag-of-tokens observations: one ReLU hidden layer, scalar head.
 * Holds a private copy of its weights, so it is immutable and freely shared across environments.
 */
public final class MlpRewardModel implements RewardModel {

    private final RewardMlpParameters params;
    private final SpecEncoder encoder;
    private final String version;

    public MlpRewardModel(RewardMlpParameters params, SpecEncoder encoder, String version) {
        Objects.requireNonNull(params, "params");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        if (params.inputDim != encoder.dim()) {
            throw new IllegalArgumentException("reward model inputDim " + params.inputDim + " != encoder dim " + encoder.dim());
        }
        this.params = params.copy();
        this.version = version == null ? "unversioned" : version;
    }

    @Override
    public double scoreObservation(Observation observation) {
        Objects.requireNonNull(observation, "observation");
        return params.forward(observation.values(), null);
    }

    @Override
    public SpecEncoder encoder() {
        return encoder;
    }

    @Override
    public String version() {
        return version;
    }

    public int hidden() {
        return params.hidden;
    }

    /** Copy of the frozen weights (for re-training from this point). */
    public RewardMlpParameters parameters() {
        return params.copy();
    }
}
