package org.calista.specopt.ai.core;

/**
 * Failure taxonomy shared by every layer of the engine.
 */
public enum ErrorKind {
    /** Malformed input spec. The single request/episode is rejected. */
    INVALID_SPEC,
    /** Reward model or policy checkpoint missing or corrupt. */
    MODEL_UNAVAILABLE,
    /** API misuse, e.g. stepping a terminal environment. Not retried. */
    INVALID_STATE,
    /** Cooperative cancellation or resource exhaustion mid-run. Resume from the last checkpoint. */
    TRAINING_INTERRUPTED
}
