package org.calista.specopt.ai.train;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.calista.specopt.ai.action.ActionDecoder;
import org.calista.specopt.ai.encode.SpecEncoder;
import org.calista.specopt.ai.env.SpecEditEnvironment;
import org.calista.specopt.ai.events.EventStore;
import org.calista.specopt.ai.events.OptEvent;
import org.calista.specopt.ai.policy.PolicyCheckpoint;
import org.calista.specopt.ai.policy.PolicyCheckpointStore;
import org.calista.specopt.ai.policy.impl.ActorCriticPolicy;
import org.calista.specopt.ai.policy.impl.AdamOptimizer;
import org.calista.specopt.ai.reward.RewardModel;
import org.calista.specopt.ai.spec.DesignSpecification;
import org.calista.specopt.ai.spec.SpecCodec;
import org.calista.specopt.ai.train.remote.ComputeRouter;
import org.calista.specopt.ai.train.remote.JobHandle;
import org.calista.specopt.ai.train.remote.RemoteJobClient;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * PpoTrainer — trains the edit policy against a frozen reward model.
 *
 * <p>Flow of {@link #train}:</p>
 * <ol>
 *   <li>load the reward model (fails with ModelUnavailableException before any environment exists)</li>
 *   <li>route: large requests go to remote compute and return a job handle</li>
 *   <li>local loop, one update at a time: parallel rollout, GAE, clipped-surrogate epochs with Adam,
 *       periodic checkpoint, stats to the event log and the listener</li>
 * </ol>
 *
 * <p>The policy is written only by the calling thread, between rollouts. Cancellation is polled
 * before each update; the last checkpoint stays valid and the run can be resumed from it with the
 * same result as an uninterrupted run.</p>
 */
public final class PpoTrainer {
    private static final Logger log = LogManager.getLogger(PpoTrainer.class);

    public static final String REMOTE_JOB_KIND = "opt_ppo_train";

    // ----------------------------
    // Config
    // ----------------------------

    public static final class Config {
        public final int workerThreads;
        public final String threadNamePrefix;
        public final long shutdownTimeoutMs;
        public final String trainingPrompt;

        private Config(Builder b) {
            this.workerThreads = b.workerThreads;
            this.threadNamePrefix = b.threadNamePrefix;
            this.shutdownTimeoutMs = b.shutdownTimeoutMs;
            this.trainingPrompt = b.trainingPrompt;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private int workerThreads = Math.max(1, Runtime.getRuntime().availableProcessors());
            private String threadNamePrefix = "specopt-rollout-";
            private long shutdownTimeoutMs = 2000L;
            private String trainingPrompt = "";

            public Builder workerThreads(int v) {
                this.workerThreads = Math.max(1, v);
                return this;
            }

            public Builder threadNamePrefix(String v) {
                this.threadNamePrefix = Objects.requireNonNull(v, "threadNamePrefix");
                return this;
            }

            public Builder shutdownTimeoutMs(long v) {
                this.shutdownTimeoutMs = Math.max(100L, v);
                return this;
            }

            /** Prompt every training episode is conditioned on. */
            public Builder trainingPrompt(String v) {
                this.trainingPrompt = v == null ? "" : v;
                return this;
            }

            public Config build() {
                return new Config(this);
            }
        }
    }

    private final SpecEncoder encoder;
    private final ActionDecoder decoder;
    private final SpecEditEnvironment.Config envConfig;
    private final Supplier<RewardModel> rewardModels;
    private final PolicyCheckpointStore checkpoints;
    private final ComputeRouter router;
    private final EventStore events;
    private final SpecCodec codec;
    private final ObjectMapper mapper;
    private final Config cfg;

    private PpoTrainer(Builder b) {
        this.encoder = Objects.requireNonNull(b.encoder, "encoder");
        this.decoder = Objects.requireNonNull(b.decoder, "decoder");
        this.envConfig = Objects.requireNonNull(b.envConfig, "envConfig");
        this.rewardModels = Objects.requireNonNull(b.rewardModels, "rewardModels");
        this.checkpoints = Objects.requireNonNull(b.checkpoints, "checkpoints");
        this.router = b.router == null ? ComputeRouter.defaults() : b.router;
        this.events = b.events;
        this.mapper = Objects.requireNonNull(b.mapper, "mapper");
        this.codec = b.codec == null ? new SpecCodec(mapper) : b.codec;
        this.cfg = b.cfg == null ? Config.builder().build() : b.cfg;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ----------------------------
    // API
    // ----------------------------

    public TrainingOutcome train(List<DesignSpecification> baseSpecs, long steps, int envCount, Hyperparameters hp)
            throws IOException {
        return train(baseSpecs, steps, envCount, hp, CancellationToken.none(), TrainingListener.NONE);
    }

    public TrainingOutcome train(List<DesignSpecification> baseSpecs,
                                 long steps,
                                 int envCount,
                                 Hyperparameters hp,
                                 CancellationToken cancel,
                                 TrainingListener listener) throws IOException {
        checkArgs(baseSpecs, steps, envCount, hp);

        RewardModel rm = rewardModels.get();

        if (router.route(steps) == ComputeRouter.Route.REMOTE) {
            return submitRemote(baseSpecs, steps, envCount, hp, rm);
        }

        ActorCriticPolicy policy = ActorCriticPolicy.initialize(encoder.dim(), hp.hidden, decoder.space().size(), hp.seed);
        AdamOptimizer adam = new AdamOptimizer(policy.parameterCount(), hp.learningRate);
        return runLocal(rm, policy, adam, baseSpecs, steps, envCount, hp, 0, 0L, null, cancel, listener);
    }

    /**
     * Continues a local run from {@code checkpointPath} up to {@code steps} total env steps.
     * The checkpoint's seed and network width take precedence over {@code hp}. Resuming runs
     * in-process only, so a budget at or above the local step threshold is refused.
     */
    public TrainingOutcome resume(Path checkpointPath,
                                  List<DesignSpecification> baseSpecs,
                                  long steps,
                                  int envCount,
                                  Hyperparameters hp,
                                  CancellationToken cancel,
                                  TrainingListener listener) throws IOException {
        Objects.requireNonNull(checkpointPath, "checkpointPath");
        checkArgs(baseSpecs, steps, envCount, hp);
        if (router.exceedsLocalCapacity(steps)) {
            throw new IllegalStateException("Cannot resume " + steps + " steps in-process: at or above the local step"
                    + " threshold of " + router.localStepThreshold() + "; submit a new remote run instead");
        }

        RewardModel rm = rewardModels.get();
        PolicyCheckpoint cp = checkpoints.load(checkpointPath, encoder.dim(), decoder.space().size());

        Hyperparameters effective = hp;
        if (cp.seed != hp.seed || cp.hidden != hp.hidden) {
            log.warn("Resuming with checkpoint seed={} hidden={} (requested seed={} hidden={})",
                    cp.seed, cp.hidden, hp.seed, hp.hidden);
            effective = hp.toBuilder().seed(cp.seed).hidden(cp.hidden).build();
        }

        log.info("Resuming from {} at update {} ({} env steps)", checkpointPath, cp.update, cp.envSteps);
        return runLocal(rm, cp.toPolicy(), cp.toOptimizer(effective.learningRate), baseSpecs, steps, envCount,
                effective, cp.update, cp.envSteps, checkpointPath, cancel, listener);
    }

    public static int plannedUpdates(long steps, int envCount, Hyperparameters hp) {
        long per = hp.stepsPerUpdate(envCount);
        return Math.toIntExact(Math.max(1L, (steps + per - 1) / per));
    }

    // ----------------------------
    // Local loop
    // ----------------------------

    private TrainingOutcome runLocal(RewardModel rm,
                                     ActorCriticPolicy policy,
                                     AdamOptimizer adam,
                                     List<DesignSpecification> baseSpecs,
                                     long steps,
                                     int envCount,
                                     Hyperparameters hp,
                                     int startUpdate,
                                     long startEnvSteps,
                                     Path startCheckpoint,
                                     CancellationToken cancel,
                                     TrainingListener listener) throws IOException {
        final CancellationToken token = cancel == null ? CancellationToken.none() : cancel;
        final TrainingListener sink = listener == null ? TrainingListener.NONE : listener;

        final int totalUpdates = plannedUpdates(steps, envCount, hp);
        final String runId = UUID.randomUUID().toString().substring(0, 8);

        if (startUpdate >= totalUpdates) {
            log.info("Checkpoint already covers {} updates (requested {}); nothing to do", startUpdate, totalUpdates);
            return TrainingOutcome.local(startCheckpoint, startUpdate, startEnvSteps, Double.NaN);
        }

        ArrayList<SpecEditEnvironment> envs = new ArrayList<>(envCount);
        for (int i = 0; i < envCount; i++) envs.add(new SpecEditEnvironment(encoder, decoder, rm, envConfig));

        ThreadContext.put("runId", runId);
        Path lastCheckpoint = startCheckpoint;
        long envSteps = startEnvSteps;
        double lastMeanReward = Double.NaN;
        int done = startUpdate;

        try (VectorizedEnvironment venv = new VectorizedEnvironment(envs, baseSpecs, cfg.trainingPrompt,
                cfg.workerThreads, cfg.threadNamePrefix, cfg.shutdownTimeoutMs)) {

            log.info("PPO run {}: updates {}..{} of {}, envs={}, rm={}, {}",
                    runId, startUpdate + 1, totalUpdates, totalUpdates, envCount, rm.version(), hp);
            emit("TRAIN_START", runId, startUpdate, Map.of(
                    "steps", steps, "envCount", envCount, "totalUpdates", totalUpdates,
                    "rewardModel", rm.version(), "seed", hp.seed));

            for (int u = startUpdate; u < totalUpdates; u++) {
                if (token.isCancelled()) {
                    emit("TRAIN_INTERRUPTED", runId, done, lastCheckpoint == null
                            ? Map.of() : Map.of("checkpoint", lastCheckpoint.toString()));
                    log.info("PPO run {} cancelled after {} updates; last checkpoint {}", runId, done, lastCheckpoint);
                    throw new TrainingInterruptedException("training cancelled after " + done + " updates",
                            lastCheckpoint, done, null);
                }

                RolloutBuffer buf = venv.collect(policy, u, hp.rolloutLength, hp.seed);
                buf.computeAdvantages(hp.gamma, hp.gaeLambda);
                double[] losses = optimize(policy, adam, buf, hp, u);

                done = u + 1;
                envSteps += buf.size();
                lastMeanReward = buf.meanReward();

                Path written = null;
                if (done % hp.checkpointEvery == 0 || done == totalUpdates) {
                    written = checkpoints.save(PolicyCheckpoint.capture(policy, adam, done, envSteps, hp.seed, lastMeanReward));
                    lastCheckpoint = written;
                }

                UpdateStats stats = new UpdateStats(done, envSteps, lastMeanReward, buf.episodes(),
                        losses[0], losses[1], losses[2], losses[3], buf.invalidResets(), written);
                record(runId, stats);
                sink.onUpdate(stats);
            }

            emit("TRAIN_END", runId, done, Map.of(
                    "checkpoint", String.valueOf(lastCheckpoint), "envSteps", envSteps, "meanReward", lastMeanReward));
            log.info("PPO run {} finished: {} updates, {} env steps, meanReward={}, checkpoint={}",
                    runId, done, envSteps, lastMeanReward, lastCheckpoint);
            return TrainingOutcome.local(lastCheckpoint, done, envSteps, lastMeanReward);
        } finally {
            ThreadContext.remove("runId");
        }
    }

    /**
     * Clipped-surrogate epochs over the buffer. Returns mean {policyLoss, valueLoss, entropy, clipFraction}.
     */
    private double[] optimize(ActorCriticPolicy policy, AdamOptimizer adam, RolloutBuffer buf, Hyperparameters hp, int update) {
        final int n = buf.size();
        final int mb = Math.min(hp.minibatchSize, n);
        final int actions = policy.actionCount();
        final double[] params = policy.parameters();
        final double[] grad = new double[params.length];
        final double[] dLogits = new double[actions];

        int[] order = new int[n];
        for (int i = 0; i < n; i++) order[i] = i;
        SplittableRandom shuffle = new SplittableRandom(Seeds.derive(hp.seed, update, Seeds.SHUFFLE_STREAM));

        double sumPolicy = 0.0;
        double sumValue = 0.0;
        double sumEntropy = 0.0;
        long clipped = 0;
        long samples = 0;

        for (int epoch = 0; epoch < hp.epochs; epoch++) {
            shuffle(order, shuffle);
            for (int start = 0; start < n; start += mb) {
                int end = Math.min(n, start + mb);
                double inv = 1.0 / (end - start);
                Arrays.fill(grad, 0.0);

                for (int j = start; j < end; j++) {
                    int k = order[j];
                    double[] x = buf.observation(k);
                    int a = buf.action(k);
                    double adv = buf.advantage(k);
                    double ret = buf.returnAt(k);

                    ActorCriticPolicy.Forward f = policy.forward(x);
                    double[] p = f.probs();

                    double logp = Math.log(Math.max(p[a], 1e-300));
                    double ratio = Math.exp(logp - buf.logProb(k));
                    double clippedRatio = Math.max(1.0 - hp.clipRange, Math.min(1.0 + hp.clipRange, ratio));
                    double surr = Math.min(ratio * adv, clippedRatio * adv);

                    // gradient flows only through the unclipped branch
                    boolean isClipped = (adv >= 0.0 && ratio > 1.0 + hp.clipRange)
                            || (adv < 0.0 && ratio < 1.0 - hp.clipRange);
                    if (isClipped) clipped++;
                    double dLogp = isClipped ? 0.0 : -ratio * adv;

                    double entropy = 0.0;
                    for (int i = 0; i < actions; i++) if (p[i] > 0.0) entropy -= p[i] * Math.log(p[i]);

                    for (int i = 0; i < actions; i++) {
                        double logpi = p[i] > 0.0 ? Math.log(p[i]) : 0.0;
                        double g = dLogp * ((i == a ? 1.0 : 0.0) - p[i]);
                        g += hp.entropyCoef * p[i] * (logpi + entropy);
                        dLogits[i] = g * inv;
                    }

                    double vErr = f.value() - ret;
                    double dValue = hp.valueCoef * vErr * inv;

                    policy.backward(x, f, dLogits, dValue, grad);

                    sumPolicy += -surr;
                    sumValue += 0.5 * vErr * vErr;
                    sumEntropy += entropy;
                    samples++;
                }

                clipGradNorm(grad, hp.maxGradNorm);
                adam.step(params, grad);
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("update {}: policyLoss={} valueLoss={} entropy={} clipFrac={}",
                    update + 1, sumPolicy / samples, sumValue / samples, sumEntropy / samples, (double) clipped / samples);
        }
        return new double[]{sumPolicy / samples, sumValue / samples, sumEntropy / samples, (double) clipped / samples};
    }

    // ----------------------------
    // Remote
    // ----------------------------

    private TrainingOutcome submitRemote(List<DesignSpecification> baseSpecs, long steps, int envCount,
                                         Hyperparameters hp, RewardModel rm) throws IOException {
        RemoteJobClient client = router.remote().orElseThrow(
                () -> new IllegalStateException("remote route chosen but no remote client configured"));

        ObjectNode payload = mapper.createObjectNode();
        payload.put("steps", steps);
        payload.put("envCount", envCount);
        payload.put("rewardModelVersion", rm.version());
        payload.put("observationDim", encoder.dim());
        payload.put("actionCount", decoder.space().size());
        payload.put("trainingPrompt", cfg.trainingPrompt);
        payload.set("hyperparameters", mapper.valueToTree(hp));
        ArrayNode specs = payload.putArray("baseSpecs");
        for (DesignSpecification s : baseSpecs) specs.add(codec.toJson(s));

        JobHandle handle = client.submit(REMOTE_JOB_KIND, payload);
        emit("REMOTE_SUBMIT", null, null, Map.of("jobId", handle.id(), "steps", steps, "endpoint",
                String.valueOf(handle.endpoint())));
        log.info("Training request of {} steps submitted as remote job {}", steps, handle.id());
        return TrainingOutcome.remote(handle);
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static void checkArgs(List<DesignSpecification> baseSpecs, long steps, int envCount, Hyperparameters hp) {
        Objects.requireNonNull(baseSpecs, "baseSpecs");
        Objects.requireNonNull(hp, "hp");
        if (baseSpecs.isEmpty()) throw new IllegalArgumentException("at least one base spec is required");
        if (steps < 1) throw new IllegalArgumentException("steps must be >= 1");
        if (envCount < 1) throw new IllegalArgumentException("envCount must be >= 1");
    }

    private void record(String runId, UpdateStats s) throws IOException {
        if (log.isInfoEnabled()) {
            log.info("update {} | steps={} | reward={} | episodes={} | pLoss={} | vLoss={} | H={} | clip={}",
                    s.update(), s.envSteps(), fmt(s.meanReward()), s.episodes(), fmt(s.policyLoss()),
                    fmt(s.valueLoss()), fmt(s.entropy()), fmt(s.clipFraction()));
        }
        LinkedHashMap<String, Object> data = new LinkedHashMap<>();
        data.put("envSteps", s.envSteps());
        data.put("meanReward", s.meanReward());
        data.put("episodes", s.episodes());
        data.put("policyLoss", s.policyLoss());
        data.put("valueLoss", s.valueLoss());
        data.put("entropy", s.entropy());
        data.put("clipFraction", s.clipFraction());
        data.put("invalidResets", s.invalidResets());
        if (s.checkpoint() != null) data.put("checkpoint", s.checkpoint().toString());
        emit("TRAIN_UPDATE", runId, s.update(), data);
    }

    private void emit(String type, String runId, Integer update, Map<String, Object> data) throws IOException {
        if (events == null) return;
        events.append(OptEvent.of(type, runId, update, data));
    }

    private static void clipGradNorm(double[] grad, double maxNorm) {
        if (maxNorm <= 0.0) return;
        double sq = 0.0;
        for (double g : grad) sq += g * g;
        double norm = Math.sqrt(sq);
        if (norm <= maxNorm || norm == 0.0) return;
        double s = maxNorm / norm;
        for (int i = 0; i < grad.length; i++) grad[i] *= s;
    }

    private static void shuffle(int[] a, SplittableRandom rnd) {
        for (int i = a.length - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int t = a[i];
            a[i] = a[j];
            a[j] = t;
        }
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.4f", v);
    }

    // ----------------------------
    // Builder
    // ----------------------------

    public static final class Builder {
        private SpecEncoder encoder;
        private ActionDecoder decoder;
        private SpecEditEnvironment.Config envConfig = SpecEditEnvironment.Config.builder().build();
        private Supplier<RewardModel> rewardModels;
        private PolicyCheckpointStore checkpoints;
        private ComputeRouter router;
        private EventStore events;
        private SpecCodec codec;
        private ObjectMapper mapper;
        private Config cfg;

        public Builder encoder(SpecEncoder v) {
            this.encoder = v;
            return this;
        }

        public Builder decoder(ActionDecoder v) {
            this.decoder = v;
            return this;
        }

        public Builder environment(SpecEditEnvironment.Config v) {
            this.envConfig = v;
            return this;
        }

        /** Called once per run; may throw ModelUnavailableException. */
        public Builder rewardModels(Supplier<RewardModel> v) {
            this.rewardModels = v;
            return this;
        }

        public Builder checkpoints(PolicyCheckpointStore v) {
            this.checkpoints = v;
            return this;
        }

        public Builder router(ComputeRouter v) {
            this.router = v;
            return this;
        }

        public Builder events(EventStore v) {
            this.events = v;
            return this;
        }

        public Builder codec(SpecCodec v) {
            this.codec = v;
            return this;
        }

        public Builder mapper(ObjectMapper v) {
            this.mapper = v;
            return this;
        }

        public Builder config(Config v) {
            this.cfg = v;
            return this;
        }

        public PpoTrainer build() {
            return new PpoTrainer(this);
        }
    }
}
