package org.calista.specopt.ai.train;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.calista.specopt.ai.core.SpecOptException;
import org.calista.specopt.ai.encode.Observation;
import org.calista.specopt.ai.env.SpecEditEnvironment;
import org.calista.specopt.ai.env.StepResult;
import org.calista.specopt.ai.policy.Policy;
import org.calista.specopt.ai.policy.impl.ActorCriticPolicy;
import org.calista.specopt.ai.spec.DesignSpecification;
import org.calista.specopt.ai.spec.InvalidSpecException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * N environments stepped in parallel on an owned fixed pool.
 *
 * <p>During {@link #collect} the policy is only read. Each slot has its own environment and its
 * own RNG derived from (seed, update, slot), so the buffer does not depend on thread scheduling.</p>
 *
 * <p>Base-spec assignment: at update {@code u} slot {@code i} resets from base spec
 * {@code (i + u * N) mod n}; a spec rejected as invalid is skipped in favour of the next one.
 * When every base spec is invalid the rollout fails with {@link InvalidSpecException}.</p>
 */
final class VectorizedEnvironment implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(VectorizedEnvironment.class);

    private final List<SpecEditEnvironment> envs;
    private final List<DesignSpecification> baseSpecs;
    private final String prompt;
    private final ExecutorService pool;
    private final long shutdownTimeoutMs;
    private final Set<Integer> reportedInvalid = ConcurrentHashMap.newKeySet();

    VectorizedEnvironment(List<SpecEditEnvironment> envs,
                          List<DesignSpecification> baseSpecs,
                          String prompt,
                          int workerThreads,
                          String threadNamePrefix,
                          long shutdownTimeoutMs) {
        this.envs = List.copyOf(Objects.requireNonNull(envs, "envs"));
        this.baseSpecs = List.copyOf(Objects.requireNonNull(baseSpecs, "baseSpecs"));
        if (this.envs.isEmpty()) throw new IllegalArgumentException("envCount must be >= 1");
        if (this.baseSpecs.isEmpty()) throw new IllegalArgumentException("at least one base spec is required");
        this.prompt = prompt == null ? "" : prompt;
        this.shutdownTimeoutMs = Math.max(100L, shutdownTimeoutMs);
        this.pool = createPool(Math.max(1, Math.min(workerThreads, this.envs.size())), threadNamePrefix, this.envs.size());
    }

    int size() {
        return envs.size();
    }

    RolloutBuffer collect(ActorCriticPolicy policy, int update, int horizon, long seed) {
        Objects.requireNonNull(policy, "policy");
        final Map<String, String> mdc = ThreadContext.getImmutableContext();

        @SuppressWarnings("unchecked")
        final CompletableFuture<RolloutBuffer.EnvRollout>[] fut = new CompletableFuture[envs.size()];
        for (int i = 0; i < envs.size(); i++) {
            final int slot = i;
            fut[i] = CompletableFuture.supplyAsync(() -> rolloutOne(policy, slot, update, horizon, seed, mdc), pool);
        }

        ArrayList<RolloutBuffer.EnvRollout> out = new ArrayList<>(envs.size());
        for (int i = 0; i < envs.size(); i++) {
            try {
                out.add(fut[i].join());
            } catch (CompletionException e) {
                for (CompletableFuture<RolloutBuffer.EnvRollout> f : fut) f.cancel(true);
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof SpecOptException soe) throw soe;
                throw new IllegalStateException("rollout of env " + i + " failed at update " + update, cause);
            }
        }
        return new RolloutBuffer(out);
    }

    private RolloutBuffer.EnvRollout rolloutOne(ActorCriticPolicy policy, int slot, int update, int horizon,
                                                long seed, Map<String, String> mdc) {
        final Map<String, String> previous = ThreadContext.getImmutableContext();
        if (mdc != null && !mdc.isEmpty()) ThreadContext.putAll(mdc);
        try {
            SpecEditEnvironment env = envs.get(slot);
            SplittableRandom rnd = new SplittableRandom(Seeds.derive(seed, update, slot));

            int[] invalid = new int[1];
            int baseIndex = resetSlot(env, slot, update, invalid);
            Observation obs = env.reset(baseSpecs.get(baseIndex), prompt);

            double[][] observations = new double[horizon][];
            int[] actions = new int[horizon];
            double[] logProbs = new double[horizon];
            double[] values = new double[horizon];
            double[] rewards = new double[horizon];
            boolean[] dones = new boolean[horizon];
            int episodes = 0;

            for (int t = 0; t < horizon; t++) {
                double[] x = obs.values();
                ActorCriticPolicy.Forward f = policy.forward(x);
                int a = Policy.sampleIndex(f.probs(), rnd);

                observations[t] = x;
                actions[t] = a;
                logProbs[t] = Math.log(Math.max(f.probs()[a], 1e-300));
                values[t] = f.value();

                StepResult r = env.step(a);
                rewards[t] = r.reward();
                dones[t] = r.done();
                if (r.done()) {
                    episodes++;
                    obs = env.reset(baseSpecs.get(baseIndex), prompt);
                } else {
                    obs = r.observation();
                }
            }

            double lastValue = policy.forward(obs.values()).value();
            return new RolloutBuffer.EnvRollout(observations, actions, logProbs, values, rewards, dones,
                    lastValue, episodes, invalid[0]);
        } finally {
            ThreadContext.clearMap();
            if (!previous.isEmpty()) ThreadContext.putAll(previous);
        }
    }

    /** Index of the first base spec (in this slot's rotation) that resets cleanly. */
    private int resetSlot(SpecEditEnvironment env, int slot, int update, int[] invalidCount) {
        int n = baseSpecs.size();
        long start = (long) slot + (long) update * envs.size();
        for (int k = 0; k < n; k++) {
            int idx = (int) Math.floorMod(start + k, (long) n);
            try {
                env.reset(baseSpecs.get(idx), prompt);
                return idx;
            } catch (InvalidSpecException e) {
                invalidCount[0]++;
                if (reportedInvalid.add(idx)) {
                    log.warn("Base spec #{} rejected, env slot {} moves to the next one: {}", idx, slot, e.getMessage());
                }
            }
        }
        throw new InvalidSpecException("none of the " + n + " base specs is valid", null);
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
                if (!pool.awaitTermination(Math.max(250L, shutdownTimeoutMs / 2), TimeUnit.MILLISECONDS)) {
                    log.warn("Rollout pool did not terminate within {} ms", shutdownTimeoutMs);
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private static ExecutorService createPool(int threads, String prefix, int queueCapacity) {
        final AtomicLong tid = new AtomicLong(1);
        final String namePrefix = (prefix == null || prefix.isBlank()) ? "specopt-rollout-" : prefix;
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, namePrefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(
                threads,
                threads,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, queueCapacity)),
                tf,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }
}
