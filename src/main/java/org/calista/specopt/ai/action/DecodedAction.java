package org.calista.specopt.ai.action;

import org.calista.specopt.ai.spec.DesignSpecification;

/**
 * Result of decoding an action index against a spec.
 *
 * @param action   the template that was chosen
 * @param spec     the resulting spec (the input instance itself when nothing changed)
 * @param degraded true when a non-NO_OP template could not apply and acted as a no-op
 * @param note     why it degraded; null otherwise
 */
public record DecodedAction(Action action, DesignSpecification spec, boolean degraded, String note) {

    public boolean isNoOp() {
        return action.kind() == ActionKind.NO_OP;
    }

    public boolean changed() {
        return !isNoOp() && !degraded;
    }
}
