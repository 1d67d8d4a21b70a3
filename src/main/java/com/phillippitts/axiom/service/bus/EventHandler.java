package com.phillippitts.axiom.service.bus;

import com.phillippitts.axiom.domain.Event;

/**
 * Receives events for one subscribed topic. Exceptions are logged by the bus and do not
 * affect delivery to other subscribers; a handler that needs retries does them itself.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(Event event) throws Exception;
}
