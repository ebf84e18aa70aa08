package org.calista.specopt.ai.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.specopt.ai.action.ActionDecoder;
import org.calista.specopt.ai.action.ActionSpace;
import org.calista.specopt.ai.encode.SpecEncoder;
import org.calista.specopt.ai.encode.impl.HashingSpecEncoder;
import org.calista.specopt.ai.env.HardConstraints;
import org.calista.specopt.ai.env.SpecEditEnvironment;
import org.calista.specopt.ai.events.EventStore;
import org.calista.specopt.ai.policy.Policy;
import org.calista.specopt.ai.policy.PolicyCheckpointStore;
import org.calista.specopt.ai.reward.RewardModel;
import org.calista.specopt.ai.reward.RewardModelStore;
import org.calista.specopt.ai.reward.feedback.FeedbackLog;
import org.calista.specopt.ai.reward.train.PreferenceDataset;
import org.calista.specopt.ai.reward.train.RewardModelTrainer;
import org.calista.specopt.ai.spec.DesignSpecification;
import org.calista.specopt.ai.spec.SpecCodec;
import org.calista.specopt.ai.suggest.SuggestionService;
import org.calista.specopt.ai.train.CancellationToken;
import org.calista.specopt.ai.train.Hyperparameters;
import org.calista.specopt.ai.train.PpoTrainer;
import org.calista.specopt.ai.train.TrainingListener;
import org.calista.specopt.ai.train.TrainingOutcome;
import org.calista.specopt.ai.train.remote.ComputePreference;
import org.calista.specopt.ai.train.remote.ComputeRouter;
import org.calista.specopt.ai.train.remote.HttpRemoteJobClient;
import org.calista.specopt.ai.train.remote.RemoteJobClient;
import org.calista.specopt.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * OptKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config, wire encoder/actions/stores (no model is loaded)
 *   2) use               -> train(...), trainRewardModel(), suggestionService()
 *
 * Models are loaded per operation so a freshly written checkpoint is picked up
 * by the next suggestionService() or train() call. No static singletons.
 */
public final class OptKernel {

    private static final Logger log = LoggerFactory.getLogger(OptKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final OptConfig cfg;

    private final SpecEncoder encoder;
    private final ActionSpace actionSpace;
    private final ActionDecoder decoder;
    private final SpecCodec codec;

    private final EventStore events;
    private final FeedbackLog feedback;
    private final RewardModelStore rewardModels;
    private final PolicyCheckpointStore policies;
    private final ComputeRouter router;

    private OptKernel(FileIO io, ObjectMapper mapper, OptConfig cfg, RemoteJobClient remoteOverride) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");

        this.encoder = new HashingSpecEncoder(HashingSpecEncoder.Config.builder()
                .dim(cfg.encoder.dim)
                .promptWeight(cfg.encoder.promptWeight)
                .maxPromptTokens(cfg.encoder.maxPromptTokens)
                .maxSlots(cfg.encoder.maxSlots)
                .build());
        this.actionSpace = new ActionSpace(cfg.actions.maxSlots, cfg.actions.materials,
                cfg.actions.scaleFactors, cfg.actions.addableTypes);
        this.decoder = new ActionDecoder(actionSpace, cfg.actions.addedObjectSize);
        this.codec = new SpecCodec(mapper);

        this.events = new EventStore(io, mapper, io.resolve(cfg.events.logFile));
        this.feedback = new FeedbackLog(io, mapper, io.resolve(cfg.feedback.logFile));
        this.rewardModels = new RewardModelStore(io, mapper, io.resolve(cfg.rewardModel.checkpointFile));
        this.policies = new PolicyCheckpointStore(io, mapper, io.resolve(cfg.policy.dir));

        RemoteJobClient remote = remoteOverride;
        if (remote == null && !cfg.remote.url.isBlank()) {
            remote = new HttpRemoteJobClient(cfg.remote.url, cfg.remote.apiKey,
                    Duration.ofMillis(cfg.remote.timeoutMs), mapper);
        }
        this.router = new ComputeRouter(ComputePreference.parse(cfg.remote.preference),
                cfg.training.localStepThreshold, remote);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        /**
         * Root directory where config lives; a relative baseDir in the config is resolved against it.
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private RemoteJobClient remoteClient;

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** Replaces the HTTP client built from {@code remote.url}. */
        public Builder remoteClient(RemoteJobClient client) {
            this.remoteClient = client;
            return this;
        }

        public OptKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // config IO lives outside baseDir
            FileIO external = new FileIO(configRoot);
            Path cfgPath = configFile.isAbsolute() ? configFile : external.baseDir().resolve(configFile);

            OptConfig cfg = OptConfig.loadOrCreate(external, cfgPath, om);

            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = external.baseDir().resolve(base);
            FileIO io = new FileIO(base);

            OptKernel k = new OptKernel(io, om, cfg, remoteClient);
            k.logCreated(cfgPath);
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Derived configuration
    // ---------------------------------------------------------------------

    public HardConstraints constraints() {
        return new HardConstraints(cfg.environment.minDimension, cfg.environment.maxDimension,
                cfg.environment.maxObjects);
    }

    public SpecEditEnvironment.Config environmentConfig() {
        return SpecEditEnvironment.Config.builder()
                .horizon(cfg.environment.horizon)
                .violationPenalty(cfg.environment.violationPenalty)
                .constraints(constraints())
                .build();
    }

    public Hyperparameters hyperparameters() {
        OptConfig.Training t = cfg.training;
        return Hyperparameters.builder()
                .rolloutLength(t.rolloutLength)
                .epochs(t.epochs)
                .minibatchSize(t.minibatchSize)
                .learningRate(t.learningRate)
                .gamma(t.gamma)
                .gaeLambda(t.gaeLambda)
                .clipRange(t.clipRange)
                .valueCoef(t.valueCoef)
                .entropyCoef(t.entropyCoef)
                .maxGradNorm(t.maxGradNorm)
                .hidden(t.hidden)
                .checkpointEvery(t.checkpointEvery)
                .seed(t.seed)
                .build();
    }

    // ---------------------------------------------------------------------
    // Operations
    // ---------------------------------------------------------------------

    /** Reward model from the configured checkpoint; ModelUnavailableException when absent. */
    public RewardModel loadRewardModel() {
        return rewardModels.load(encoder);
    }

    public Availability<RewardModel> probeRewardModel() {
        return Availability.probe(this::loadRewardModel);
    }

    public Availability<Policy> probePolicy() {
        return Availability.probe(() -> policies.loadLatestPolicy(encoder.dim(), actionSpace.size()));
    }

    public PpoTrainer trainer() {
        OptConfig.Training t = cfg.training;
        return PpoTrainer.builder()
                .encoder(encoder)
                .decoder(decoder)
                .environment(environmentConfig())
                .rewardModels(this::loadRewardModel)
                .checkpoints(policies)
                .router(router)
                .events(events)
                .codec(codec)
                .mapper(mapper)
                .config(PpoTrainer.Config.builder()
                        .workerThreads(t.workerThreads > 0 ? t.workerThreads : Runtime.getRuntime().availableProcessors())
                        .threadNamePrefix(t.threadNamePrefix)
                        .shutdownTimeoutMs(t.shutdownTimeoutMs)
                        .trainingPrompt(t.trainingPrompt)
                        .build())
                .build();
    }

    public TrainingOutcome train(List<DesignSpecification> baseSpecs, long steps) throws IOException {
        return trainer().train(baseSpecs, steps, cfg.training.envCount, hyperparameters());
    }

    public TrainingOutcome train(List<DesignSpecification> baseSpecs,
                                 long steps,
                                 int envCount,
                                 Hyperparameters hp,
                                 CancellationToken cancel,
                                 TrainingListener listener) throws IOException {
        return trainer().train(baseSpecs, steps, envCount, hp, cancel, listener);
    }

    /**
     * Offline reward-model training on the feedback log; writes the configured checkpoint.
     *
     * @throws IllegalStateException when the log yields no preference pairs
     */
    public RewardModelTrainer.Result trainRewardModel() throws IOException {
        PreferenceDataset data = PreferenceDataset.fromFeedback(feedback.readAll(), codec, cfg.feedback.minRatingDelta);
        if (data.size() == 0) {
            throw new IllegalStateException("no preference pairs in " + feedback.file()
                    + " (" + data.skipped() + " records skipped)");
        }

        OptConfig.RewardModel r = cfg.rewardModel;
        RewardModelTrainer trainer = new RewardModelTrainer(encoder, RewardModelTrainer.Config.builder()
                .hidden(r.hidden)
                .epochs(r.epochs)
                .learningRate(r.learningRate)
                .margin(r.margin)
                .seed(r.seed)
                .build());

        RewardModelTrainer.Result res = trainer.train(data);
        String version = "rm-" + System.currentTimeMillis();
        rewardModels.save(res.parameters(), version, res.pairs());
        log.info("Reward model {} written to {} (pairs={}, acc={})", version, rewardModels.file(), res.pairs(), res.accuracy());
        return res;
    }

    /** A service bound to the models available right now. */
    public SuggestionService suggestionService() {
        return new SuggestionService(encoder, decoder, probeRewardModel(), probePolicy(),
                SuggestionService.Config.builder()
                        .neutralScore(cfg.rewardModel.neutralScore)
                        .environment(environmentConfig())
                        .build());
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public OptConfig config() { return cfg; }
    public SpecEncoder encoder() { return encoder; }
    public ActionSpace actionSpace() { return actionSpace; }
    public ActionDecoder decoder() { return decoder; }
    public SpecCodec codec() { return codec; }
    public EventStore eventStore() { return events; }
    public FeedbackLog feedbackLog() { return feedback; }
    public RewardModelStore rewardModelStore() { return rewardModels; }
    public PolicyCheckpointStore policyStore() { return policies; }
    public ComputeRouter router() { return router; }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("OptKernel created: config={}, baseDir={}, obsDim={}, actions={}, routing={}/{}",
                cfgPath, io.baseDir(), encoder.dim(), actionSpace.size(),
                router.preference(), router.remote().isPresent() ? "remote" : "local-only");
    }
}
