/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.axiom.config.ThreadPoolConfig} - turn and generation executors
 *       with MDC propagation</li>
 *   <li>{@link com.phillippitts.axiom.config.ThreadPoolMetricsConfig} - executor gauges and
 *       periodic saturation logging</li>
 *   <li>{@link com.phillippitts.axiom.config.ClockConfig} - the shared {@code Clock}</li>
 * </ul>
 *
 * <p>Sub-packages wire one service each ({@code bus}, {@code policy}, {@code intent},
 * {@code response}, {@code store}, {@code orchestration}); {@code config.properties} holds the
 * typed {@code axiom.*} and {@code threadpool.*} properties.
 *
 * @see com.phillippitts.axiom.config.properties
 */
package com.phillippitts.axiom.config;
