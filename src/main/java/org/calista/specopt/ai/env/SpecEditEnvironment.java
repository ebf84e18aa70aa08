package org.calista.specopt.ai.env;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.specopt.ai.action.ActionDecoder;
import org.calista.specopt.ai.action.ActionKind;
import org.calista.specopt.ai.action.DecodedAction;
import org.calista.specopt.ai.encode.Observation;
import org.calista.specopt.ai.encode.SpecEncoder;
import org.calista.specopt.ai.reward.RewardModel;
import org.calista.specopt.ai.spec.DesignSpecification;

import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;

/**
 * SpecEditEnvironment — episodic MDP over spec edits.
 *
 * <p>State machine: {@code UNINITIALIZED -> READY} on {@link #reset}, {@code READY -> TERMINAL}
 * when a step terminates or truncates. {@link #reset} is legal from every state;
 * {@link #step} only in READY.</p>
 *
 * <ul>
 *   <li>terminated: the agent chose the explicit NO_OP, or the edit broke a hard constraint</li>
 *   <li>truncated: the step counter reached the horizon</li>
 *   <li>reward: reward-model score of the edited spec, minus the penalty on violation</li>
 * </ul>
 *
 * Not thread-safe; one instance per rollout worker.
 */
public final class SpecEditEnvironment {
    private static final Logger log = LogManager.getLogger(SpecEditEnvironment.class);

    // ----------------------------
    // Config
    // ----------------------------

    public static final class Config {
        public final int horizon;
        public final double violationPenalty;
        public final HardConstraints constraints;

        private Config(Builder b) {
            this.horizon = b.horizon;
            this.violationPenalty = b.violationPenalty;
            this.constraints = b.constraints;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private int horizon = 16;
            private double violationPenalty = 1.0;
            private HardConstraints constraints = HardConstraints.defaults();

            public Builder horizon(int v) {
                if (v < 1) throw new IllegalArgumentException("horizon must be >= 1");
                this.horizon = v;
                return this;
            }

            public Builder violationPenalty(double v) {
                if (!(v >= 0.0)) throw new IllegalArgumentException("violationPenalty must be >= 0");
                this.violationPenalty = v;
                return this;
            }

            public Builder constraints(HardConstraints v) {
                this.constraints = Objects.requireNonNull(v, "constraints");
                return this;
            }

            public Config build() {
                return new Config(this);
            }
        }
    }

    private final SpecEncoder encoder;
    private final ActionDecoder decoder;
    private final RewardModel rewardModel;
    private final Config cfg;

    private EnvironmentState state = EnvironmentState.UNINITIALIZED;
    private DesignSpecification current;
    private String prompt;
    private int stepCount;

    public SpecEditEnvironment(SpecEncoder encoder, ActionDecoder decoder, RewardModel rewardModel, Config cfg) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.rewardModel = Objects.requireNonNull(rewardModel, "rewardModel");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        if (rewardModel.encoder().dim() != encoder.dim()) {
            throw new IllegalArgumentException("reward model expects dim " + rewardModel.encoder().dim()
                    + ", encoder produces " + encoder.dim());
        }
    }

    public Observation reset(DesignSpecification spec, String prompt) {
        Objects.requireNonNull(spec, "spec");
        // records are immutable, so holding the validated instance is a private copy
        this.current = spec.validate();
        this.prompt = prompt == null ? "" : prompt;
        this.stepCount = 0;
        this.state = EnvironmentState.READY;
        return encoder.encode(this.prompt, current);
    }

    public StepResult step(int actionIndex) {
        if (state != EnvironmentState.READY) {
            throw new InvalidStateException("step() called in state " + state + "; call reset() first");
        }

        DecodedAction decoded = decoder.decode(actionIndex, current);
        DesignSpecification next = decoded.spec();
        stepCount++;

        Optional<String> violation = cfg.constraints.introduced(current, next);
        Observation obs = encoder.encode(prompt, next);
        double score = rewardModel.scoreObservation(obs);

        boolean explicitNoOp = decoded.action().kind() == ActionKind.NO_OP;
        boolean terminated = explicitNoOp || violation.isPresent();
        boolean truncated = !terminated && stepCount >= cfg.horizon;
        double reward = violation.isPresent() ? score - cfg.violationPenalty : score;

        LinkedHashMap<String, Object> info = new LinkedHashMap<>();
        info.put(StepResult.INFO_ACTION, decoded.action().describe());
        info.put(StepResult.INFO_DEGRADED, decoded.degraded());
        violation.ifPresent(v -> info.put(StepResult.INFO_VIOLATION, v));
        info.put(StepResult.INFO_STEP, stepCount);
        info.put(StepResult.INFO_SCORE, score);

        if (violation.isPresent() && log.isDebugEnabled()) {
            log.debug("step {}: {} violates: {}", stepCount, decoded.action().describe(), violation.get());
        }

        current = next;
        if (terminated || truncated) state = EnvironmentState.TERMINAL;
        return new StepResult(obs, reward, terminated, truncated, info);
    }

    public EnvironmentState state() {
        return state;
    }

    /** Spec after the last step (or the reset spec). Null before the first reset. */
    public DesignSpecification currentSpec() {
        return current;
    }

    public int stepCount() {
        return stepCount;
    }

    public int actionCount() {
        return decoder.space().size();
    }

    public int observationDim() {
        return encoder.dim();
    }
}
