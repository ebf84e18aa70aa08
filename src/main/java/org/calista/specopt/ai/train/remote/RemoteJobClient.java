package org.calista.specopt.ai.train.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.time.Duration;

/**
 * Submits work to remote compute and polls it.
 */
public interface RemoteJobClient {

    JobHandle submit(String kind, JsonNode payload) throws IOException;

    JobStatus status(JobHandle handle) throws IOException;

    /**
     * Polls until the job reaches a terminal state or {@code timeout} elapses; returns the last status seen.
     */
    default JobStatus await(JobHandle handle, Duration pollInterval, Duration timeout) throws IOException {
        long deadline = System.nanoTime() + timeout.toNanos();
        JobStatus st = status(handle);
        while (!st.isTerminal() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(Math.max(1L, pollInterval.toMillis()));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for job " + handle.id(), ie);
            }
            st = status(handle);
        }
        return st;
    }
}
