package org.calista.specopt.ai.reward;

import org.calista.specopt.ai.core.ErrorKind;
import org.calista.specopt.ai.core.SpecOptException;

/**
 * Reward model or policy checkpoint cannot be read or has an incompatible shape.
 * Recoverable at inference time (fallback), fatal when starting a training run.
 */
public final class ModelUnavailableException extends SpecOptException {

    public ModelUnavailableException(String message, String checkpoint) {
        super(ErrorKind.MODEL_UNAVAILABLE, message, checkpoint);
    }

    public ModelUnavailableException(String message, String checkpoint, Throwable cause) {
        super(ErrorKind.MODEL_UNAVAILABLE, message, checkpoint, cause);
    }
}
