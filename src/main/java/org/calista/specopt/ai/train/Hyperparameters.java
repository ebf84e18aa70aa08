package org.calista.specopt.ai.train;

/**
 * PPO hyperparameters. Immutable; use {@link #builder()} or {@link #toBuilder()}.
 */
public final class Hyperparameters {

    public final int rolloutLength;
    public final int epochs;
    public final int minibatchSize;
    public final double learningRate;
    public final double gamma;
    public final double gaeLambda;
    public final double clipRange;
    public final double valueCoef;
    public final double entropyCoef;
    public final double maxGradNorm;
    public final int hidden;
    public final int checkpointEvery;
    public final long seed;

    private Hyperparameters(Builder b) {
        this.rolloutLength = b.rolloutLength;
        this.epochs = b.epochs;
        this.minibatchSize = b.minibatchSize;
        this.learningRate = b.learningRate;
        this.gamma = b.gamma;
        this.gaeLambda = b.gaeLambda;
        this.clipRange = b.clipRange;
        this.valueCoef = b.valueCoef;
        this.entropyCoef = b.entropyCoef;
        this.maxGradNorm = b.maxGradNorm;
        this.hidden = b.hidden;
        this.checkpointEvery = b.checkpointEvery;
        this.seed = b.seed;
    }

    public static Hyperparameters defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .rolloutLength(rolloutLength)
                .epochs(epochs)
                .minibatchSize(minibatchSize)
                .learningRate(learningRate)
                .gamma(gamma)
                .gaeLambda(gaeLambda)
                .clipRange(clipRange)
                .valueCoef(valueCoef)
                .entropyCoef(entropyCoef)
                .maxGradNorm(maxGradNorm)
                .hidden(hidden)
                .checkpointEvery(checkpointEvery)
                .seed(seed);
    }

    /** Env steps consumed by one update. */
    public int stepsPerUpdate(int envCount) {
        return rolloutLength * envCount;
    }

    @Override
    public String toString() {
        return "Hyperparameters{T=" + rolloutLength + ", epochs=" + epochs + ", minibatch=" + minibatchSize
                + ", lr=" + learningRate + ", gamma=" + gamma + ", lambda=" + gaeLambda + ", clip=" + clipRange
                + ", vf=" + valueCoef + ", ent=" + entropyCoef + ", hidden=" + hidden
                + ", ckptEvery=" + checkpointEvery + ", seed=" + seed + "}";
    }

    public static final class Builder {
        private int rolloutLength = 512;
        private int epochs = 10;
        private int minibatchSize = 2048;
        private double learningRate = 3e-4;
        private double gamma = 0.99;
        private double gaeLambda = 0.95;
        private double clipRange = 0.2;
        private double valueCoef = 0.5;
        private double entropyCoef = 0.01;
        private double maxGradNorm = 0.5;
        private int hidden = 64;
        private int checkpointEvery = 10;
        private long seed = 42L;

        public Builder rolloutLength(int v) {
            if (v < 1) throw new IllegalArgumentException("rolloutLength must be >= 1");
            this.rolloutLength = v;
            return this;
        }

        public Builder epochs(int v) {
            if (v < 1) throw new IllegalArgumentException("epochs must be >= 1");
            this.epochs = v;
            return this;
        }

        public Builder minibatchSize(int v) {
            if (v < 1) throw new IllegalArgumentException("minibatchSize must be >= 1");
            this.minibatchSize = v;
            return this;
        }

        public Builder learningRate(double v) {
            if (!(v > 0.0)) throw new IllegalArgumentException("learningRate must be > 0");
            this.learningRate = v;
            return this;
        }

        public Builder gamma(double v) {
            if (!(v >= 0.0 && v <= 1.0)) throw new IllegalArgumentException("gamma must be in [0,1]");
            this.gamma = v;
            return this;
        }

        public Builder gaeLambda(double v) {
            if (!(v >= 0.0 && v <= 1.0)) throw new IllegalArgumentException("gaeLambda must be in [0,1]");
            this.gaeLambda = v;
            return this;
        }

        public Builder clipRange(double v) {
            if (!(v > 0.0)) throw new IllegalArgumentException("clipRange must be > 0");
            this.clipRange = v;
            return this;
        }

        public Builder valueCoef(double v) {
            this.valueCoef = Math.max(0.0, v);
            return this;
        }

        public Builder entropyCoef(double v) {
            this.entropyCoef = Math.max(0.0, v);
            return this;
        }

        /** Global gradient-norm clip; 0 disables. */
        public Builder maxGradNorm(double v) {
            this.maxGradNorm = Math.max(0.0, v);
            return this;
        }

        public Builder hidden(int v) {
            if (v < 1) throw new IllegalArgumentException("hidden must be >= 1");
            this.hidden = v;
            return this;
        }

        public Builder checkpointEvery(int v) {
            this.checkpointEvery = Math.max(1, v);
            return this;
        }

        public Builder seed(long v) {
            this.seed = v;
            return this;
        }

        public Hyperparameters build() {
            return new Hyperparameters(this);
        }
    }
}
