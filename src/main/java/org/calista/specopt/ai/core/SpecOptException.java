package org.calista.specopt.ai.core;

import java.util.Objects;

/**
 * Base of the engine's failures. Carries the {@link ErrorKind} plus a short context
 * (spec id, checkpoint path) so callers can retry or fall back.
 */
public class SpecOptException extends RuntimeException {

    private final ErrorKind kind;
    private final String context;

    public SpecOptException(ErrorKind kind, String message, String context) {
        this(kind, message, context, null);
    }

    public SpecOptException(ErrorKind kind, String message, String context, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.context = context;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** Spec id / checkpoint path the failure refers to. Nullable. */
    public String context() {
        return context;
    }

    @Override
    public String getMessage() {
        String m = super.getMessage();
        return context == null ? m : m + " [" + context + "]";
    }
}
