package org.calista.specopt.ai.train;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for a training run. The trainer polls it between updates only,
 * so an update in progress always completes.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
