package org.calista.specopt.ai.train;

/** Called on the trainer thread after every completed update. */
@FunctionalInterface
public interface TrainingListener {

    TrainingListener NONE = stats -> { };

    void onUpdate(UpdateStats stats);
}
