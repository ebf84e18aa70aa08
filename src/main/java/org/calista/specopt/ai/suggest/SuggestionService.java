package org.calista.specopt.ai.suggest;

import org.calista.specopt.ai.action.ActionDecoder;
import org.calista.specopt.ai.core.Availability;
import org.calista.specopt.ai.encode.Observation;
import org.calista.specopt.ai.encode.SpecEncoder;
import org.calista.specopt.ai.env.SpecEditEnvironment;
import org.calista.specopt.ai.env.StepResult;
import org.calista.specopt.ai.policy.Policy;
import org.calista.specopt.ai.reward.RewardModel;
import org.calista.specopt.ai.spec.DesignSpecification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SuggestionService — synchronous "improve this spec" entry point.
 *
 * <p>Model availability is settled once, at construction; each request only picks a path:</p>
 * <ul>
 *   <li>POLICY_ROLLOUT needs both policy and reward model, otherwise it runs the heuristic</li>
 *   <li>REWARD_ONLY scores the spec unchanged (neutral score without a reward model)</li>
 *   <li>HEURISTIC_FALLBACK runs the rule-based improver, scored by the reward model when present</li>
 * </ul>
 * An invalid spec is rejected with InvalidSpecException; a missing model never fails a request.
 */
public final class SuggestionService {

    private static final Logger log = LoggerFactory.getLogger(SuggestionService.class);

    // ----------------------------
    // Config
    // ----------------------------

    public static final class Config {
        public final double neutralScore;
        public final SpecEditEnvironment.Config environment;

        private Config(Builder b) {
            this.neutralScore = b.neutralScore;
            this.environment = b.environment;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private double neutralScore = 0.0;
            private SpecEditEnvironment.Config environment = SpecEditEnvironment.Config.builder().build();

            public Builder neutralScore(double v) {
                this.neutralScore = v;
                return this;
            }

            /** Horizon and hard constraints of policy rollouts (and constraints of the heuristic). */
            public Builder environment(SpecEditEnvironment.Config v) {
                this.environment = Objects.requireNonNull(v, "environment");
                return this;
            }

            public Config build() {
                return new Config(this);
            }
        }
    }

    private final SpecEncoder encoder;
    private final ActionDecoder decoder;
    private final Availability<RewardModel> rewardModel;
    private final Availability<Policy> policy;
    private final HeuristicImprover heuristic;
    private final Config cfg;

    public SuggestionService(SpecEncoder encoder,
                             ActionDecoder decoder,
                             Availability<RewardModel> rewardModel,
                             Availability<Policy> policy,
                             Config cfg) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.rewardModel = Objects.requireNonNull(rewardModel, "rewardModel");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.cfg = cfg == null ? Config.builder().build() : cfg;

        SpecScorer scorer = rewardModel.isAvailable()
                ? rewardModel.get()::score
                : SpecScorer.constant(this.cfg.neutralScore);
        this.heuristic = new HeuristicImprover(scorer, this.cfg.environment.constraints);

        if (policy.isAvailable() && policy.get().actionCount() != decoder.space().size()) {
            throw new IllegalArgumentException("policy has " + policy.get().actionCount()
                    + " actions, action space has " + decoder.space().size());
        }

        log.info("SuggestionService ready: rewardModel={}, policy={}", describe(rewardModel), describe(policy));
    }

    public boolean policyRolloutAvailable() {
        return rewardModel.isAvailable() && policy.isAvailable();
    }

    public Availability<RewardModel> rewardModel() {
        return rewardModel;
    }

    public Availability<Policy> policy() {
        return policy;
    }

    public Suggestion suggest(DesignSpecification spec, String prompt, Strategy strategy) {
        Objects.requireNonNull(spec, "spec");
        Strategy requested = strategy == null ? Strategy.POLICY_ROLLOUT : strategy;
        String p = prompt == null ? "" : prompt;
        DesignSpecification input = spec.validate();

        return switch (requested) {
            case POLICY_ROLLOUT -> policyRolloutAvailable()
                    ? rollout(input, p)
                    : heuristic(input, p, requested, fallbackReason());
            case REWARD_ONLY -> rewardOnly(input, p);
            case HEURISTIC_FALLBACK -> heuristic(input, p, requested, null);
        };
    }

    // ---------------------------------------------------------------------

    private Suggestion rollout(DesignSpecification input, String prompt) {
        RewardModel rm = rewardModel.get();
        Policy pol = policy.get();
        SpecEditEnvironment env = new SpecEditEnvironment(encoder, decoder, rm, cfg.environment);

        Observation obs = env.reset(input, prompt);
        DesignSpecification lastValid = input;
        int applied = 0;
        ArrayList<String> notes = new ArrayList<>();

        while (true) {
            int a = pol.argmax(obs);
            StepResult r = env.step(a);
            String action = String.valueOf(r.info().get(StepResult.INFO_ACTION));
            if (r.violated()) {
                notes.add("discarded " + action + ": " + r.info().get(StepResult.INFO_VIOLATION));
                break;
            }
            if (!env.currentSpec().equals(lastValid)) {
                lastValid = env.currentSpec();
                applied++;
                notes.add(action);
            }
            if (r.done()) break;
            obs = r.observation();
        }

        double score = rm.score(prompt, lastValid);
        log.debug("policy rollout: {} edits, score={}", applied, score);
        return new Suggestion(lastValid, score, Strategy.POLICY_ROLLOUT, Strategy.POLICY_ROLLOUT, applied, notes);
    }

    private Suggestion rewardOnly(DesignSpecification input, String prompt) {
        if (rewardModel.isAvailable()) {
            return new Suggestion(input, rewardModel.get().score(prompt, input),
                    Strategy.REWARD_ONLY, Strategy.REWARD_ONLY, 0, List.of());
        }
        return new Suggestion(input, cfg.neutralScore, Strategy.REWARD_ONLY, Strategy.REWARD_ONLY, 0,
                List.of("reward model unavailable: " + rewardModel.reason()));
    }

    private Suggestion heuristic(DesignSpecification input, String prompt, Strategy requested, String reason) {
        HeuristicImprover.Result res = heuristic.improve(input, prompt);
        ArrayList<String> notes = new ArrayList<>();
        if (reason != null) notes.add(reason);
        notes.addAll(res.applied());
        if (reason != null) log.debug("{} requested, using heuristic: {}", requested, reason);
        return new Suggestion(res.spec(), res.score(), Strategy.HEURISTIC_FALLBACK, requested,
                res.applied().size(), notes);
    }

    private String fallbackReason() {
        if (!policy.isAvailable()) return "policy unavailable: " + policy.reason();
        return "reward model unavailable: " + rewardModel.reason();
    }

    private static String describe(Availability<?> a) {
        return a.isAvailable() ? "available" : "unavailable (" + a.kind() + ": " + a.reason() + ")";
    }
}
