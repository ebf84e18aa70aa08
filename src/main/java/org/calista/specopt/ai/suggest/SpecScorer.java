package org.calista.specopt.ai.suggest;

import org.calista.specopt.ai.spec.DesignSpecification;

/** Scalar quality of a spec for a prompt. {@code RewardModel::score} fits. */
@FunctionalInterface
public interface SpecScorer {

    double score(String prompt, DesignSpecification spec);

    static SpecScorer constant(double value) {
        return (prompt, spec) -> value;
    }
}
