package org.calista.specopt.ai.encode.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.specopt.ai.encode.Observation;
import org.calista.specopt.ai.encode.SpecEncoder;
import org.calista.specopt.ai.encode.SpecTokenizer;
import org.calista.specopt.ai.spec.DesignSpecification;

import java.util.List;
import java.util.Objects;

/**
 * HashingSpecEncoder — signed feature hashing of prompt/spec tokens into {@code dim} buckets.
 *
 * <ul>
 *   <li>FNV-1a 64 over the token chars, then a 64-bit finaliser; bucket = low bits, sign = top bit</li>
 *   <li>prompt tokens are scaled by {@code promptWeight}; 0 ignores the prompt</li>
 *   <li>the accumulated vector is L2-normalised, so every component lies in [-1, 1]</li>
 * </ul>
 * Collisions are accepted. No randomness and no hash-map iteration: the same pair always
 * yields the same vector, in any JVM.
 */
public final class HashingSpecEncoder implements SpecEncoder {
    private static final Logger log = LogManager.getLogger(HashingSpecEncoder.class);

    private final int dim;
    private final int mask;
    private final double promptWeight;
    private final SpecTokenizer tokenizer;

    public HashingSpecEncoder() {
        this(Config.builder().build());
    }

    public HashingSpecEncoder(Config cfg) {
        Objects.requireNonNull(cfg, "cfg");
        this.dim = requirePow2(cfg.dim);
        this.mask = dim - 1;
        this.promptWeight = cfg.promptWeight >= 0.0 && Double.isFinite(cfg.promptWeight) ? cfg.promptWeight : 1.0;
        this.tokenizer = new SpecTokenizer(cfg.maxPromptTokens, cfg.maxSlots);
        log.debug("HashingSpecEncoder: dim={}, promptWeight={}, maxPromptTokens={}, maxSlots={}",
                dim, promptWeight, cfg.maxPromptTokens, cfg.maxSlots);
    }

    @Override
    public int dim() {
        return dim;
    }

    @Override
    public Observation encode(String prompt, DesignSpecification spec) {
        Objects.requireNonNull(spec, "spec");
        double[] v = new double[dim];

        if (promptWeight > 0.0) accumulate(v, tokenizer.promptTokens(prompt), promptWeight);
        accumulate(v, tokenizer.specTokens(spec), 1.0);

        double norm = 0.0;
        for (double x : v) norm += x * x;
        if (norm > 0.0) {
            double inv = 1.0 / Math.sqrt(norm);
            for (int i = 0; i < v.length; i++) v[i] *= inv;
        }
        return new Observation(v);
    }

    private void accumulate(double[] v, List<String> tokens, double weight) {
        for (String t : tokens) {
            long h = hash64(t);
            int idx = (int) h & mask;
            double sign = ((h >>> 63) == 0) ? 1.0 : -1.0;
            v[idx] += sign * weight;
        }
    }

    static long hash64(String t) {
        long h = 0xcbf29ce484222325L;
        for (int i = 0; i < t.length(); i++) {
            h ^= (t.charAt(i) & 0xFFFF);
            h *= 0x100000001b3L;
        }
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }

    private static int requirePow2(int v) {
        if (v < 16) throw new IllegalArgumentException("dim too small: " + v);
        if ((v & (v - 1)) != 0) throw new IllegalArgumentException("dim must be power-of-two: " + v);
        return v;
    }

    // ---------------------------------------------------------------------
    // Config
    // ---------------------------------------------------------------------

    public static final class Config {
        final int dim;
        final double promptWeight;
        final int maxPromptTokens;
        final int maxSlots;

        private Config(Builder b) {
            this.dim = b.dim;
            this.promptWeight = b.promptWeight;
            this.maxPromptTokens = b.maxPromptTokens;
            this.maxSlots = b.maxSlots;
        }

        public static Builder builder() {
            Builder b = new Builder();
            b.dim = 512;
            b.promptWeight = 1.0;
            b.maxPromptTokens = 64;
            b.maxSlots = 16;
            return b;
        }

        public static final class Builder {
            int dim;
            double promptWeight;
            int maxPromptTokens;
            int maxSlots;

            public Builder dim(int v) { this.dim = v; return this; }
            public Builder promptWeight(double v) { this.promptWeight = v; return this; }
            public Builder maxPromptTokens(int v) { this.maxPromptTokens = v; return this; }
            public Builder maxSlots(int v) { this.maxSlots = v; return this; }

            public Config build() { return new Config(this); }
        }
    }
}
