package com.phillippitts.axiom.service.response;

import com.phillippitts.axiom.domain.SessionContext;
import com.phillippitts.axiom.exception.BackendUnavailableException;

/**
 * Placeholder used when no generation backend is configured. Every call fails with
 * {@link BackendUnavailableException}.
 */
public class UnavailableGenerationBackend implements GenerationBackend {

    @Override
    public String complete(String prompt, SessionContext context) {
        throw new BackendUnavailableException(name(), "No generation backend configured");
    }

    @Override
    public String name() {
        return "none";
    }
}
