package org.calista.specopt.ai.train.remote;

import java.util.Objects;

/** Reference to a job accepted by remote compute. */
public record JobHandle(String id, String kind, String endpoint, long submittedAtEpochMs) {

    public JobHandle {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("job id is blank");
    }
}
