package org.calista.specopt.ai.reward;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.specopt.ai.encode.SpecEncoder;
import org.calista.specopt.ai.reward.impl.MlpRewardModel;
import org.calista.specopt.ai.reward.impl.RewardMlpParameters;
import org.calista.specopt.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes reward-model checkpoints (a single JSON document, schema {@value #SCHEMA}).
 *
 * <p>{@link #load} fails with {@link ModelUnavailableException} when the file is missing,
 * unreadable, of another schema, or shaped for a different encoder dimension.</p>
 */
public final class RewardModelStore {
    private static final Logger log = LogManager.getLogger(RewardModelStore.class);

    public static final String SCHEMA = "reward-mlp-v1";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Checkpoint {
        public String schema = SCHEMA;
        public String version;
        public long createdAtEpochMs;
        public int trainedPairs;
        public int inputDim;
        public int hidden;
        public double[] w1;
        public double[] b1;
        public double[] w2;
        public double b2;
    }

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public RewardModelStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        return io.exists(file);
    }

    public MlpRewardModel load(SpecEncoder encoder) {
        Objects.requireNonNull(encoder, "encoder");
        String where = file.toString();
        if (!io.exists(file)) throw new ModelUnavailableException("reward model checkpoint not found", where);

        Checkpoint cp;
        try {
            cp = mapper.readValue(io.readString(file), Checkpoint.class);
        } catch (IOException e) {
            throw new ModelUnavailableException("reward model checkpoint unreadable: " + e.getMessage(), where, e);
        }
        if (cp == null || !SCHEMA.equals(cp.schema)) {
            throw new ModelUnavailableException("unsupported reward model schema: " + (cp == null ? null : cp.schema), where);
        }
        if (cp.inputDim != encoder.dim()) {
            throw new ModelUnavailableException("reward model inputDim " + cp.inputDim
                    + " does not match encoder dim " + encoder.dim(), where);
        }

        RewardMlpParameters p;
        try {
            p = new RewardMlpParameters(cp.inputDim, cp.hidden, cp.w1, cp.b1, cp.w2, cp.b2);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ModelUnavailableException("reward model weights malformed: " + e.getMessage(), where, e);
        }
        log.info("Reward model loaded: {} (version={}, hidden={}, pairs={})", where, cp.version, cp.hidden, cp.trainedPairs);
        return new MlpRewardModel(p, encoder, cp.version);
    }

    public void save(RewardMlpParameters params, String version, int trainedPairs) throws IOException {
        Objects.requireNonNull(params, "params");
        Checkpoint cp = new Checkpoint();
        cp.version = version;
        cp.createdAtEpochMs = System.currentTimeMillis();
        cp.trainedPairs = trainedPairs;
        cp.inputDim = params.inputDim;
        cp.hidden = params.hidden;
        cp.w1 = params.w1;
        cp.b1 = params.b1;
        cp.w2 = params.w2;
        cp.b2 = params.b2;
        io.writeString(file, mapper.writeValueAsString(cp));
        log.info("Reward model saved: {} (version={}, pairs={})", file, version, trainedPairs);
    }
}
