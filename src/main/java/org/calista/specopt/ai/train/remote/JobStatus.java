package org.calista.specopt.ai.train.remote;

/**
 * Last known state of a remote job, as reported by the compute service
 * ("queued", "running", "succeeded", "failed", ...).
 */
public record JobStatus(String id, String state, String message) {

    public static final String SUCCEEDED = "succeeded";
    public static final String FAILED = "failed";

    public boolean isTerminal() {
        return SUCCEEDED.equalsIgnoreCase(state) || FAILED.equalsIgnoreCase(state);
    }

    public boolean succeeded() {
        return SUCCEEDED.equalsIgnoreCase(state);
    }
}
