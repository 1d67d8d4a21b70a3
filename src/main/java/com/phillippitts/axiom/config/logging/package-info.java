/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>{@link com.phillippitts.axiom.config.logging.MdcFilter} puts {@code requestId},
 * {@code method} and {@code uri} into the Log4j2 {@code ThreadContext} for every HTTP request.
 * The turn pipeline adds {@code sessionId} and {@code turnId}; the thread pools and the event
 * bus copy the context onto their worker threads.
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17T15:42:32,529 INFO  [turn-pool-1] c.p.a.s.o.DefaultTurnOrchestrator [req=... session=s1 turn=...] - message
 * </pre>
 *
 * @see com.phillippitts.axiom.config.ThreadPoolConfig#mdcPropagating()
 */
package com.phillippitts.axiom.config.logging;
