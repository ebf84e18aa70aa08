package org.calista.specopt.ai.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.specopt.ai.train.remote.ComputeRouter;
import org.calista.specopt.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * OptConfig — plain POJO configuration:
 * - defaults live in the fields
 * - loadOrCreate() writes the defaults when the file is missing or empty
 * - validate() normalizes and clamps values
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class OptConfig {

    private static final Logger log = LoggerFactory.getLogger(OptConfig.class);

    public String baseDir = "data";
    public Encoder encoder = new Encoder();
    public Actions actions = new Actions();
    public Environment environment = new Environment();
    public RewardModel rewardModel = new RewardModel();
    public Policy policy = new Policy();
    public Training training = new Training();
    public Remote remote = new Remote();
    public Feedback feedback = new Feedback();
    public Events events = new Events();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Encoder {
        /** Observation length; power of two. */
        public int dim = 512;
        public double promptWeight = 1.0;
        public int maxPromptTokens = 64;
        /** Objects beyond this many get no slot-qualified tokens. */
        public int maxSlots = 16;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Actions {
        public int maxSlots = 8;
        public List<String> materials = List.of(
                "marble_white", "leather_brown", "fabric_orange", "wood_walnut",
                "wood_teak", "metal_aluminum", "glass_triple_pane", "brick_premium");
        public List<Double> scaleFactors = List.of(0.8, 1.25);
        public List<String> addableTypes = List.of("cushion", "plant", "lamp", "rug", "shelf", "window");
        public double addedObjectSize = 1.0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Environment {
        public int horizon = 16;
        public double minDimension = 0.05;
        public double maxDimension = 50.0;
        public int maxObjects = 16;
        public double violationPenalty = 1.0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class RewardModel {
        public String checkpointFile = "models/reward-model.json";
        public int hidden = 32;
        public double neutralScore = 0.0;

        // offline training
        public int epochs = 20;
        public double learningRate = 0.05;
        public double margin = 0.5;
        public long seed = 42L;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Policy {
        public String dir = "models/policy";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Training {
        /** Requests of at least this many env steps leave the process (AUTO routing). */
        public long localStepThreshold = ComputeRouter.DEFAULT_LOCAL_STEP_THRESHOLD;
        public int envCount = 4;
        public String trainingPrompt = "";

        public int rolloutLength = 512;
        public int epochs = 10;
        public int minibatchSize = 2048;
        public double learningRate = 3e-4;
        public double gamma = 0.99;
        public double gaeLambda = 0.95;
        public double clipRange = 0.2;
        public double valueCoef = 0.5;
        public double entropyCoef = 0.01;
        public double maxGradNorm = 0.5;
        public int hidden = 64;
        public int checkpointEvery = 10;
        public long seed = 42L;

        // owned rollout pool
        /** 0 => availableProcessors. */
        public int workerThreads = 0;
        public String threadNamePrefix = "specopt-rollout-";
        public long shutdownTimeoutMs = 2500;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Remote {
        /** Empty => no remote compute. */
        public String url = "";
        public String apiKey = "";
        /** auto | local | remote */
        public String preference = "auto";
        public long timeoutMs = 30_000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Feedback {
        public String logFile = "feedback.jsonl";
        public double minRatingDelta = 0.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public String logFile = "events.jsonl";
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads the config. A missing or empty file is replaced by the defaults, written to disk.
     */
    public static OptConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            OptConfig created = new OptConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            OptConfig created = new OptConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        OptConfig cfg = mapper.readValue(json, OptConfig.class);
        if (cfg == null) cfg = new OptConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, OptConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, OptConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (encoder == null) encoder = new Encoder();
        if (encoder.dim < 16) encoder.dim = 16;
        if (Integer.bitCount(encoder.dim) != 1) encoder.dim = Integer.highestOneBit(encoder.dim) << 1;
        if (!(encoder.promptWeight >= 0.0)) encoder.promptWeight = 1.0;
        if (encoder.maxPromptTokens < 1) encoder.maxPromptTokens = 1;
        if (encoder.maxSlots < 1) encoder.maxSlots = 1;

        if (actions == null) actions = new Actions();
        if (actions.maxSlots < 1) actions.maxSlots = 1;
        actions.materials = nonBlank(actions.materials);
        actions.addableTypes = nonBlank(actions.addableTypes);
        if (actions.scaleFactors == null) actions.scaleFactors = List.of();
        ArrayList<Double> scales = new ArrayList<>();
        for (Double s : actions.scaleFactors) if (s != null && s > 0.0 && Double.isFinite(s) && s != 1.0) scales.add(s);
        actions.scaleFactors = List.copyOf(scales);
        if (!(actions.addedObjectSize > 0.0)) actions.addedObjectSize = 1.0;

        if (environment == null) environment = new Environment();
        if (environment.horizon < 1) environment.horizon = 1;
        if (!(environment.minDimension > 0.0)) environment.minDimension = 0.05;
        if (!(environment.maxDimension > environment.minDimension)) environment.maxDimension = 50.0;
        if (environment.maxObjects < actions.maxSlots) environment.maxObjects = actions.maxSlots;
        if (!(environment.violationPenalty >= 0.0)) environment.violationPenalty = 1.0;

        if (rewardModel == null) rewardModel = new RewardModel();
        if (rewardModel.checkpointFile == null || rewardModel.checkpointFile.isBlank())
            rewardModel.checkpointFile = "models/reward-model.json";
        if (rewardModel.hidden < 1) rewardModel.hidden = 32;
        if (!Double.isFinite(rewardModel.neutralScore)) rewardModel.neutralScore = 0.0;
        if (rewardModel.epochs < 1) rewardModel.epochs = 1;
        if (!(rewardModel.learningRate > 0.0)) rewardModel.learningRate = 0.05;
        if (!(rewardModel.margin >= 0.0)) rewardModel.margin = 0.5;

        if (policy == null) policy = new Policy();
        if (policy.dir == null || policy.dir.isBlank()) policy.dir = "models/policy";

        if (training == null) training = new Training();
        if (training.localStepThreshold < 1) training.localStepThreshold = 1;
        if (training.envCount < 1) training.envCount = 1;
        if (training.trainingPrompt == null) training.trainingPrompt = "";
        if (training.rolloutLength < 1) training.rolloutLength = 1;
        if (training.epochs < 1) training.epochs = 1;
        if (training.minibatchSize < 1) training.minibatchSize = 1;
        if (!(training.learningRate > 0.0)) training.learningRate = 3e-4;
        if (!(training.gamma >= 0.0 && training.gamma <= 1.0)) training.gamma = 0.99;
        if (!(training.gaeLambda >= 0.0 && training.gaeLambda <= 1.0)) training.gaeLambda = 0.95;
        if (!(training.clipRange > 0.0)) training.clipRange = 0.2;
        if (!(training.valueCoef >= 0.0)) training.valueCoef = 0.5;
        if (!(training.entropyCoef >= 0.0)) training.entropyCoef = 0.01;
        if (!(training.maxGradNorm >= 0.0)) training.maxGradNorm = 0.5;
        if (training.hidden < 1) training.hidden = 64;
        if (training.checkpointEvery < 1) training.checkpointEvery = 1;
        if (training.workerThreads < 0) training.workerThreads = 0;
        if (training.threadNamePrefix == null || training.threadNamePrefix.isBlank())
            training.threadNamePrefix = "specopt-rollout-";
        if (training.shutdownTimeoutMs < 250) training.shutdownTimeoutMs = 250;

        if (remote == null) remote = new Remote();
        if (remote.url == null) remote.url = "";
        if (remote.apiKey == null) remote.apiKey = "";
        if (remote.preference == null || remote.preference.isBlank()) remote.preference = "auto";
        if (remote.timeoutMs < 1000) remote.timeoutMs = 1000;

        if (feedback == null) feedback = new Feedback();
        if (feedback.logFile == null || feedback.logFile.isBlank()) feedback.logFile = "feedback.jsonl";
        if (!(feedback.minRatingDelta >= 0.0)) feedback.minRatingDelta = 0.5;

        if (events == null) events = new Events();
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "events.jsonl";
    }

    private static List<String> nonBlank(List<String> in) {
        if (in == null) return List.of();
        ArrayList<String> out = new ArrayList<>(in.size());
        for (String s : in) if (s != null && !s.isBlank() && !out.contains(s.trim())) out.add(s.trim());
        return List.copyOf(out);
    }
}
