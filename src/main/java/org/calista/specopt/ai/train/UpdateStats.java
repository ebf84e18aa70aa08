package org.calista.specopt.ai.train;

import java.nio.file.Path;

/**
 * Per-update summary.
 *
 * @param update         1-based index of the completed update
 * @param meanReward     mean per-step reward over the rollout buffer
 * @param episodes       episodes finished during the rollout
 * @param checkpoint     checkpoint written after this update, or null
 */
public record UpdateStats(int update,
                          long envSteps,
                          double meanReward,
                          int episodes,
                          double policyLoss,
                          double valueLoss,
                          double entropy,
                          double clipFraction,
                          int invalidResets,
                          Path checkpoint) {
}
