package org.calista.specopt.ai.suggest;

import java.util.Locale;

public enum Strategy {
    /** Greedy rollout of the trained policy, scored by the reward model. */
    POLICY_ROLLOUT,
    /** Score the spec as-is. */
    REWARD_ONLY,
    /** Deterministic rule-based edits, each kept only if the score does not drop. */
    HEURISTIC_FALLBACK;

    public static Strategy parse(String s) {
        if (s == null || s.isBlank()) return POLICY_ROLLOUT;
        return switch (s.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "policy", "policy_rollout", "rl" -> POLICY_ROLLOUT;
            case "reward", "reward_only", "score" -> REWARD_ONLY;
            case "heuristic", "heuristic_fallback", "rules" -> HEURISTIC_FALLBACK;
            default -> throw new IllegalArgumentException("unknown strategy: " + s);
        };
    }
}
