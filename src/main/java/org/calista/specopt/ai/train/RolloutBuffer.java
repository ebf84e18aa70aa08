package org.calista.specopt.ai.train;

import java.util.List;
import java.util.Objects;

/**
 * Transitions of one update, env-major: flat index {@code k = env * T + t}.
 */
final class RolloutBuffer {

    /** What one environment produced during a rollout of T steps. */
    record EnvRollout(double[][] observations,
                      int[] actions,
                      double[] logProbs,
                      double[] values,
                      double[] rewards,
                      boolean[] dones,
                      double lastValue,
                      int episodes,
                      int invalidResets) {
    }

    private final List<EnvRollout> envs;
    private final int envCount;
    private final int horizon;

    private double[] advantages;
    private double[] returns;

    RolloutBuffer(List<EnvRollout> envs) {
        this.envs = List.copyOf(Objects.requireNonNull(envs, "envs"));
        if (this.envs.isEmpty()) throw new IllegalArgumentException("empty rollout");
        this.envCount = this.envs.size();
        this.horizon = this.envs.get(0).actions().length;
        for (EnvRollout r : this.envs) {
            if (r.actions().length != horizon) throw new IllegalArgumentException("ragged rollout");
        }
    }

    int size() {
        return envCount * horizon;
    }

    double[] observation(int k) {
        return envs.get(k / horizon).observations()[k % horizon];
    }

    int action(int k) {
        return envs.get(k / horizon).actions()[k % horizon];
    }

    double logProb(int k) {
        return envs.get(k / horizon).logProbs()[k % horizon];
    }

    double advantage(int k) {
        return advantages[k];
    }

    double returnAt(int k) {
        return returns[k];
    }

    /**
     * GAE(gamma, lambda) per environment, bootstrapped from the value of the observation after
     * the last step unless that step ended an episode; advantages are then standardized buffer-wide.
     */
    void computeAdvantages(double gamma, double lambda) {
        int n = size();
        advantages = new double[n];
        returns = new double[n];

        for (int e = 0; e < envCount; e++) {
            EnvRollout r = envs.get(e);
            double gae = 0.0;
            for (int t = horizon - 1; t >= 0; t--) {
                double nextValue = (t == horizon - 1) ? r.lastValue() : r.values()[t + 1];
                double notDone = r.dones()[t] ? 0.0 : 1.0;
                double delta = r.rewards()[t] + gamma * nextValue * notDone - r.values()[t];
                gae = delta + gamma * lambda * notDone * gae;
                int k = e * horizon + t;
                advantages[k] = gae;
                returns[k] = gae + r.values()[t];
            }
        }

        double mean = 0.0;
        for (double a : advantages) mean += a;
        mean /= n;
        double var = 0.0;
        for (double a : advantages) var += (a - mean) * (a - mean);
        double std = Math.sqrt(var / n);
        double inv = 1.0 / (std + 1e-8);
        for (int k = 0; k < n; k++) advantages[k] = (advantages[k] - mean) * inv;
    }

    double meanReward() {
        double s = 0.0;
        for (EnvRollout r : envs) for (double x : r.rewards()) s += x;
        return s / size();
    }

    int episodes() {
        int s = 0;
        for (EnvRollout r : envs) s += r.episodes();
        return s;
    }

    int invalidResets() {
        int s = 0;
        for (EnvRollout r : envs) s += r.invalidResets();
        return s;
    }
}
