package org.calista.specopt.ai.core;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A model handle that is either present or absent with a reason.
 * Probed once (typically at service construction) and then used to pick a code path.
 */
public final class Availability<T> {

    private final T value;
    private final ErrorKind kind;
    private final String reason;

    private Availability(T value, ErrorKind kind, String reason) {
        this.value = value;
        this.kind = kind;
        this.reason = reason;
    }

    public static <T> Availability<T> of(T value) {
        return new Availability<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> Availability<T> unavailable(ErrorKind kind, String reason) {
        return new Availability<>(null, Objects.requireNonNull(kind, "kind"), reason == null ? "" : reason);
    }

    /** Runs {@code loader}; a {@link SpecOptException} becomes an unavailable result with its kind and message. */
    public static <T> Availability<T> probe(Supplier<T> loader) {
        try {
            return of(loader.get());
        } catch (SpecOptException e) {
            return unavailable(e.kind(), e.getMessage());
        }
    }

    public boolean isAvailable() {
        return value != null;
    }

    public T get() {
        if (value == null) throw new NoSuchElementException("unavailable (" + kind + "): " + reason);
        return value;
    }

    public T orElse(T other) {
        return value != null ? value : other;
    }

    /** Null when available. */
    public ErrorKind kind() {
        return kind;
    }

    /** Null when available. */
    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return value != null ? "Available[" + value.getClass().getSimpleName() + "]" : "Unavailable[" + kind + ": " + reason + "]";
    }
}
