package org.calista.specopt.ai.env;

import org.calista.specopt.ai.encode.Observation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one {@link SpecEditEnvironment#step(int)}.
 *
 * <p>{@code info} keys: {@code action}, {@code degraded}, {@code violation} (absent when none),
 * {@code step}, {@code score}.</p>
 */
public record StepResult(Observation observation,
                         double reward,
                         boolean terminated,
                         boolean truncated,
                         Map<String, Object> info) {

    public static final String INFO_ACTION = "action";
    public static final String INFO_DEGRADED = "degraded";
    public static final String INFO_VIOLATION = "violation";
    public static final String INFO_STEP = "step";
    public static final String INFO_SCORE = "score";

    public StepResult {
        Objects.requireNonNull(observation, "observation");
        info = info == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(info));
    }

    /** Episode over for either reason. */
    public boolean done() {
        return terminated || truncated;
    }

    public boolean violated() {
        return info.containsKey(INFO_VIOLATION);
    }
}
