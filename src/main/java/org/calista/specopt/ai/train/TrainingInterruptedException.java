package org.calista.specopt.ai.train;

import org.calista.specopt.ai.core.ErrorKind;
import org.calista.specopt.ai.core.SpecOptException;

import java.nio.file.Path;

/**
 * Raised between updates when a run is cancelled or cannot continue.
 * The last written checkpoint (nullable if none was written yet) stays intact.
 */
public final class TrainingInterruptedException extends SpecOptException {

    private final transient Path lastCheckpoint;
    private final int completedUpdates;

    public TrainingInterruptedException(String message, Path lastCheckpoint, int completedUpdates, Throwable cause) {
        super(ErrorKind.TRAINING_INTERRUPTED, message,
                lastCheckpoint == null ? null : lastCheckpoint.toString(), cause);
        this.lastCheckpoint = lastCheckpoint;
        this.completedUpdates = completedUpdates;
    }

    public Path lastCheckpoint() {
        return lastCheckpoint;
    }

    public int completedUpdates() {
        return completedUpdates;
    }
}
