package org.calista.specopt.ai.reward.train;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.specopt.ai.encode.SpecEncoder;
import org.calista.specopt.ai.reward.impl.RewardMlpParameters;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Offline trainer for the reward MLP on preference pairs.
 *
 * <p>Loss per pair: {@code max(0, margin - (r(preferred) - r(other)))}, plain SGD,
 * pair order reshuffled every epoch from a fixed seed. Same data and config give the same weights.</p>
 */
public final class RewardModelTrainer {
    private static final Logger log = LogManager.getLogger(RewardModelTrainer.class);

    public static final class Config {
        public final int hidden;
        public final int epochs;
        public final double learningRate;
        public final double margin;
        public final long seed;

        private Config(Builder b) {
            this.hidden = b.hidden;
            this.epochs = b.epochs;
            this.learningRate = b.learningRate;
            this.margin = b.margin;
            this.seed = b.seed;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private int hidden = 32;
            private int epochs = 20;
            private double learningRate = 0.05;
            private double margin = 0.5;
            private long seed = 42L;

            public Builder hidden(int v) {
                this.hidden = Math.max(1, v);
                return this;
            }

            public Builder epochs(int v) {
                this.epochs = Math.max(1, v);
                return this;
            }

            public Builder learningRate(double v) {
                if (!(v > 0.0)) throw new IllegalArgumentException("learningRate must be > 0");
                this.learningRate = v;
                return this;
            }

            public Builder margin(double v) {
                if (!(v >= 0.0)) throw new IllegalArgumentException("margin must be >= 0");
                this.margin = v;
                return this;
            }

            public Builder seed(long v) {
                this.seed = v;
                return this;
            }

            public Config build() {
                return new Config(this);
            }
        }
    }

    /** Trained weights plus the last epoch's mean loss and pair accuracy. */
    public record Result(RewardMlpParameters parameters, int pairs, double finalLoss, double accuracy) {
    }

    private final SpecEncoder encoder;
    private final Config cfg;

    public RewardModelTrainer(SpecEncoder encoder, Config cfg) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    public Result train(PreferenceDataset data) {
        return train(data, RewardMlpParameters.initial(encoder.dim(), cfg.hidden, cfg.seed));
    }

    /** Continues from {@code start} (copied; the argument is not modified). */
    public Result train(PreferenceDataset data, RewardMlpParameters start) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(start, "start");
        if (data.size() == 0) throw new IllegalArgumentException("no preference pairs to train on");
        if (start.inputDim != encoder.dim()) {
            throw new IllegalArgumentException("start params inputDim " + start.inputDim + " != encoder dim " + encoder.dim());
        }

        RewardMlpParameters p = start.copy();
        int n = data.size();
        double[][] xp = new double[n][];
        double[][] xo = new double[n][];
        for (int i = 0; i < n; i++) {
            PreferencePair pair = data.pairs().get(i);
            xp[i] = encoder.encode(pair.prompt(), pair.preferred()).values();
            xo[i] = encoder.encode(pair.prompt(), pair.other()).values();
        }

        double[] hp = new double[p.hidden];
        double[] ho = new double[p.hidden];
        int[] order = new int[n];
        for (int i = 0; i < n; i++) order[i] = i;
        SplittableRandom rnd = new SplittableRandom(cfg.seed ^ 0x5DEECE66DL);

        double lossSum = 0.0;
        int correct = 0;
        for (int epoch = 0; epoch < cfg.epochs; epoch++) {
            shuffle(order, rnd);
            lossSum = 0.0;
            correct = 0;
            for (int k : order) {
                double rp = p.forward(xp[k], hp);
                double ro = p.forward(xo[k], ho);
                double gap = rp - ro;
                if (gap > 0) correct++;
                double loss = cfg.margin - gap;
                if (loss <= 0.0) continue;
                lossSum += loss;
                // d loss / d rp = -1, d loss / d ro = +1, applied as two consecutive SGD steps
                p.step(xp[k], hp, -1.0, cfg.learningRate);
                p.forward(xo[k], ho);
                p.step(xo[k], ho, +1.0, cfg.learningRate);
            }
            if (log.isDebugEnabled()) {
                log.debug("reward epoch {}/{}: loss={} acc={}", epoch + 1, cfg.epochs, lossSum / n, (double) correct / n);
            }
        }

        double finalLoss = lossSum / n;
        double acc = (double) correct / n;
        log.info("Reward model trained: pairs={}, epochs={}, loss={}, acc={}", n, cfg.epochs, finalLoss, acc);
        return new Result(p, n, finalLoss, acc);
    }

    private static void shuffle(int[] a, SplittableRandom rnd) {
        for (int i = a.length - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int t = a[i];
            a[i] = a[j];
            a[j] = t;
        }
    }
}
