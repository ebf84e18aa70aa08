package org.calista.specopt.ai.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.calista.specopt.ai.policy.impl.ActorCriticPolicy;
import org.calista.specopt.ai.policy.impl.AdamOptimizer;

/**
 * Serialized training state: policy weights, Adam moments and the update counter.
 * Everything else a resumed run needs is derived from the seed and the update index.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PolicyCheckpoint {

    public static final String SCHEMA = "ppo-policy-v1";

    public String schema = SCHEMA;
    public long createdAtEpochMs;
    public int update;
    public long envSteps;
    public long seed;
    public int observationDim;
    public int hidden;
    public int actionCount;
    public double[] params;
    public double[] adamM;
    public double[] adamV;
    public long adamT;
    public double meanReward;

    public static PolicyCheckpoint capture(ActorCriticPolicy policy, AdamOptimizer adam,
                                           int update, long envSteps, long seed, double meanReward) {
        PolicyCheckpoint cp = new PolicyCheckpoint();
        cp.createdAtEpochMs = System.currentTimeMillis();
        cp.update = update;
        cp.envSteps = envSteps;
        cp.seed = seed;
        cp.observationDim = policy.observationDim();
        cp.hidden = policy.hidden();
        cp.actionCount = policy.actionCount();
        cp.params = policy.parameters().clone();
        cp.adamM = adam.firstMoment();
        cp.adamV = adam.secondMoment();
        cp.adamT = adam.stepCount();
        cp.meanReward = meanReward;
        return cp;
    }

    public ActorCriticPolicy toPolicy() {
        return ActorCriticPolicy.fromParameters(observationDim, hidden, actionCount, params);
    }

    /** Optimizer restored to the captured moments, or a fresh one if none were stored. */
    public AdamOptimizer toOptimizer(double learningRate) {
        AdamOptimizer adam = new AdamOptimizer(params.length, learningRate);
        if (adamM != null && adamV != null) adam.restore(adamM, adamV, adamT);
        return adam;
    }
}
