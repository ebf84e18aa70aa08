package org.calista.specopt.ai.reward.train;

import org.calista.specopt.ai.spec.DesignSpecification;

import java.util.Objects;

/** {@code preferred} was judged better than {@code other} for the same prompt. */
public record PreferencePair(String prompt, DesignSpecification preferred, DesignSpecification other) {

    public PreferencePair {
        Objects.requireNonNull(preferred, "preferred");
        Objects.requireNonNull(other, "other");
        if (prompt == null) prompt = "";
    }
}
