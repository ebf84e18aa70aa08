package org.calista.specopt.ai.encode;

import org.calista.specopt.ai.spec.DesignSpecification;

/**
 * Maps (prompt, spec) to a fixed-length {@link Observation}.
 * Implementations must be pure and deterministic across process restarts.
 */
public interface SpecEncoder {

    Observation encode(String prompt, DesignSpecification spec);

    /** Length of every observation this encoder produces. */
    int dim();
}
