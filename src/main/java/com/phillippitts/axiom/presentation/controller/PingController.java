package com.phillippitts.axiom.presentation.controller;

import com.phillippitts.axiom.service.bus.DefaultEventBus;
import com.phillippitts.axiom.service.context.ContextStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cheap liveness probe for load balancers. Actuator health covers the store and bus in depth;
 * this only answers whether turns can be accepted right now.
 */
@RestController
class PingController {

    private static final Logger LOG = LogManager.getLogger(PingController.class);

    private final DefaultEventBus eventBus;
    private final ContextStore contextStore;

    PingController(DefaultEventBus eventBus, ContextStore contextStore) {
        this.eventBus = eventBus;
        this.contextStore = contextStore;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        boolean accepting = eventBus.isRunning();
        LOG.debug("Ping received (accepting turns: {})", accepting);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", accepting ? "ok" : "stopping");
        body.put("service", "axiom");
        body.put("activeSessions", contextStore.activeSessionCount());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(accepting ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
