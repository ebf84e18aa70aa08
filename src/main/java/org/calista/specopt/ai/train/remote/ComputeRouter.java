package org.calista.specopt.ai.train.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a training request runs in-process or is handed to remote compute.
 *
 * <p>Requests of at least {@code localStepThreshold} env steps always go remote, whatever the
 * preference. Below the threshold the preference decides: AUTO and LOCAL run in-process, REMOTE
 * goes remote. A remote decision without a configured client is an {@link IllegalStateException};
 * large jobs are never silently run locally.</p>
 */
public final class ComputeRouter {

    private static final Logger log = LoggerFactory.getLogger(ComputeRouter.class);

    public enum Route {
        LOCAL,
        REMOTE
    }

    public static final long DEFAULT_LOCAL_STEP_THRESHOLD = 100_000L;

    private final ComputePreference preference;
    private final long localStepThreshold;
    private final RemoteJobClient remote;

    public ComputeRouter(ComputePreference preference, long localStepThreshold, RemoteJobClient remote) {
        this.preference = Objects.requireNonNull(preference, "preference");
        if (localStepThreshold < 1) throw new IllegalArgumentException("localStepThreshold must be >= 1");
        this.localStepThreshold = localStepThreshold;
        this.remote = remote;
    }

    /** AUTO at the default threshold with no remote client: small jobs run, large ones are refused. */
    public static ComputeRouter defaults() {
        return new ComputeRouter(ComputePreference.AUTO, DEFAULT_LOCAL_STEP_THRESHOLD, null);
    }

    public boolean exceedsLocalCapacity(long steps) {
        return steps >= localStepThreshold;
    }

    public Route route(long steps) {
        Route r;
        if (exceedsLocalCapacity(steps)) {
            r = Route.REMOTE;
        } else {
            r = preference == ComputePreference.REMOTE ? Route.REMOTE : Route.LOCAL;
        }
        if (r == Route.REMOTE && remote == null) {
            throw new IllegalStateException("Training request of " + steps + " steps must run on remote compute ("
                    + preference + ", threshold " + localStepThreshold + ") but no remote endpoint is configured");
        }
        log.debug("route(steps={}) -> {} (preference={}, threshold={})", steps, r, preference, localStepThreshold);
        return r;
    }

    public Optional<RemoteJobClient> remote() {
        return Optional.ofNullable(remote);
    }

    public ComputePreference preference() {
        return preference;
    }

    public long localStepThreshold() {
        return localStepThreshold;
    }
}
