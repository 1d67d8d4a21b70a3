package com.phillippitts.axiom.service.response;

import com.phillippitts.axiom.domain.SessionContext;

/**
 * External text-generation service (rule engine, local model, remote API).
 *
 * <p>Calls may block on I/O; the orchestrator bounds them with the turn timeout.
 */
public interface GenerationBackend {

    /**
     * @throws com.phillippitts.axiom.exception.BackendUnavailableException when no completion
     *         can be produced
     */
    String complete(String prompt, SessionContext context);

    String name();
}
