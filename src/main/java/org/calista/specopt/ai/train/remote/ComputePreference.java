package org.calista.specopt.ai.train.remote;

import java.util.Locale;

/**
 * Where training runs: {@code AUTO} routes by job size, {@code LOCAL} and {@code REMOTE} force a side.
 */
public enum ComputePreference {
    AUTO,
    LOCAL,
    REMOTE;

    /** Lenient parse; "remote" aliases such as "cloud" map to REMOTE, anything unknown to AUTO. */
    public static ComputePreference parse(String s) {
        if (s == null) return AUTO;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "local", "cpu", "gpu" -> LOCAL;
            case "remote", "cloud", "yotta" -> REMOTE;
            default -> AUTO;
        };
    }
}
