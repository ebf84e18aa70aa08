package org.calista.specopt.ai.suggest;

import org.calista.specopt.ai.spec.DesignSpecification;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link SuggestionService#suggest}.
 *
 * @param predictedScore reward-model score of {@code improvedSpec}, or the neutral constant without a model
 * @param steps          edits applied (policy actions or accepted heuristic edits)
 * @param notes          human-readable trace: applied actions, fallback reasons
 */
public record Suggestion(DesignSpecification improvedSpec,
                         double predictedScore,
                         Strategy strategyUsed,
                         Strategy requestedStrategy,
                         int steps,
                         List<String> notes) {

    public Suggestion {
        Objects.requireNonNull(improvedSpec, "improvedSpec");
        Objects.requireNonNull(strategyUsed, "strategyUsed");
        Objects.requireNonNull(requestedStrategy, "requestedStrategy");
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public boolean fellBack() {
        return strategyUsed != requestedStrategy;
    }
}
