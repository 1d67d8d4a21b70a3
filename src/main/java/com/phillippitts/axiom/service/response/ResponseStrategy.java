package com.phillippitts.axiom.service.response;

import com.phillippitts.axiom.domain.Intent;
import com.phillippitts.axiom.domain.SessionContext;

/**
 * Produces response text for one intent. Implementations read the context but never modify
 * it.
 */
@FunctionalInterface
public interface ResponseStrategy {

    GeneratedResponse respond(Intent intent, SessionContext context);
}
