package org.calista.specopt.ai.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.specopt.ai.policy.impl.ActorCriticPolicy;
import org.calista.specopt.ai.reward.ModelUnavailableException;
import org.calista.specopt.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Policy checkpoints in one directory: {@code policy-u000012.json} files plus a {@code LATEST}
 * file naming the newest one. Both are written with atomic commits, the checkpoint first,
 * so {@code LATEST} never points at a partial file.
 */
public final class PolicyCheckpointStore {
    private static final Logger log = LogManager.getLogger(PolicyCheckpointStore.class);

    public static final String LATEST = "LATEST";

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path dir;

    public PolicyCheckpointStore(FileIO io, ObjectMapper mapper, Path dir) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.dir = Objects.requireNonNull(dir, "dir");
    }

    public Path dir() {
        return dir;
    }

    public static String fileName(int update) {
        return String.format(Locale.ROOT, "policy-u%06d.json", update);
    }

    public Path save(PolicyCheckpoint cp) throws IOException {
        Objects.requireNonNull(cp, "cp");
        Path file = dir.resolve(fileName(cp.update));
        io.writeString(file, mapper.writeValueAsString(cp));
        io.writeString(dir.resolve(LATEST), file.getFileName().toString());
        log.debug("Policy checkpoint written: {} (update={}, meanReward={})", file, cp.update, cp.meanReward);
        return file;
    }

    /**
     * Path named by {@code LATEST}, if present and pointing at an existing file.
     * A name that is not a usable path inside the store raises {@link ModelUnavailableException}.
     */
    public Optional<Path> latest() throws IOException {
        Optional<String> name = io.readStringIfExists(dir.resolve(LATEST));
        if (name.isEmpty() || name.get().isBlank()) return Optional.empty();
        Path p;
        boolean present;
        try {
            p = dir.resolve(name.get().trim());
            present = io.exists(p);
        } catch (IllegalArgumentException e) {
            throw new ModelUnavailableException(LATEST + " names an invalid checkpoint path: " + e.getMessage(),
                    dir.toString(), e);
        }
        if (!present) {
            log.warn("LATEST points at missing checkpoint {}", p);
            return Optional.empty();
        }
        return Optional.of(p);
    }

    public PolicyCheckpoint load(Path file) {
        Objects.requireNonNull(file, "file");
        String where = file.toString();
        if (!io.exists(file)) throw new ModelUnavailableException("policy checkpoint not found", where);

        PolicyCheckpoint cp;
        try {
            cp = mapper.readValue(io.readString(file), PolicyCheckpoint.class);
        } catch (IOException e) {
            throw new ModelUnavailableException("policy checkpoint unreadable: " + e.getMessage(), where, e);
        }
        if (cp == null || !PolicyCheckpoint.SCHEMA.equals(cp.schema)) {
            throw new ModelUnavailableException("unsupported policy schema: " + (cp == null ? null : cp.schema), where);
        }
        if (cp.observationDim < 1 || cp.hidden < 1 || cp.actionCount < 1) {
            throw new ModelUnavailableException("policy shape must be >= 1 (obsDim=" + cp.observationDim
                    + ", hidden=" + cp.hidden + ", actions=" + cp.actionCount + ")", where);
        }
        if (cp.params == null || cp.params.length
                != ActorCriticPolicy.parameterCount(cp.observationDim, cp.hidden, cp.actionCount)) {
            throw new ModelUnavailableException("policy parameter vector has the wrong length", where);
        }
        for (double v : cp.params) {
            if (!Double.isFinite(v)) throw new ModelUnavailableException("policy parameters are not finite", where);
        }
        if ((cp.adamM != null && cp.adamM.length != cp.params.length)
                || (cp.adamV != null && cp.adamV.length != cp.params.length)) {
            throw new ModelUnavailableException("optimizer moments do not match the parameter vector", where);
        }
        return cp;
    }

    /** Loads and checks the shape against the current encoder and action space. */
    public PolicyCheckpoint load(Path file, int observationDim, int actionCount) {
        PolicyCheckpoint cp = load(file);
        if (cp.observationDim != observationDim || cp.actionCount != actionCount) {
            throw new ModelUnavailableException("policy shape (" + cp.observationDim + "x" + cp.actionCount
                    + ") does not match encoder/action space (" + observationDim + "x" + actionCount + ")",
                    file.toString());
        }
        return cp;
    }

    /** Newest checkpoint; {@link ModelUnavailableException} when there is none. */
    public PolicyCheckpoint loadLatest(int observationDim, int actionCount) {
        Optional<Path> p;
        try {
            p = latest();
        } catch (IOException e) {
            throw new ModelUnavailableException("cannot read " + LATEST + ": " + e.getMessage(), dir.toString(), e);
        }
        if (p.isEmpty()) throw new ModelUnavailableException("no policy checkpoint", dir.toString());
        return load(p.get(), observationDim, actionCount);
    }

    /** Newest checkpoint as a ready policy; any shape it cannot be built with is unavailable too. */
    public ActorCriticPolicy loadLatestPolicy(int observationDim, int actionCount) {
        PolicyCheckpoint cp = loadLatest(observationDim, actionCount);
        try {
            return cp.toPolicy();
        } catch (IllegalArgumentException e) {
            throw new ModelUnavailableException("policy checkpoint unusable: " + e.getMessage(), dir.toString(), e);
        }
    }
}
