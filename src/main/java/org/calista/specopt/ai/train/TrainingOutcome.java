package org.calista.specopt.ai.train;

import org.calista.specopt.ai.train.remote.JobHandle;

import java.nio.file.Path;

/**
 * Either a local run's final checkpoint or the handle of a job submitted to remote compute.
 */
public record TrainingOutcome(Path checkpointPath, JobHandle jobHandle, int updates, long envSteps, double lastMeanReward) {

    public TrainingOutcome {
        if ((checkpointPath == null) == (jobHandle == null)) {
            throw new IllegalArgumentException("exactly one of checkpointPath/jobHandle must be set");
        }
    }

    public static TrainingOutcome local(Path checkpointPath, int updates, long envSteps, double lastMeanReward) {
        return new TrainingOutcome(checkpointPath, null, updates, envSteps, lastMeanReward);
    }

    public static TrainingOutcome remote(JobHandle handle) {
        return new TrainingOutcome(null, handle, 0, 0L, Double.NaN);
    }

    public boolean isRemote() {
        return jobHandle != null;
    }
}
