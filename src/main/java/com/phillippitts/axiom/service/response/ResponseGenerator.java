package com.phillippitts.axiom.service.response;

import com.phillippitts.axiom.domain.Intent;
import com.phillippitts.axiom.domain.SessionContext;

/**
 * Maps an intent plus session context to response text. Side-effect free: recording the
 * chosen variant in the context is the orchestrator's job.
 */
public interface ResponseGenerator {

    GeneratedResponse generate(Intent intent, SessionContext context);
}
