/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.lineconsensus.config.ThreadPoolConfig} - Bounded executor for
 *       parallel subject reduction</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.cluster} - Wiring of the clustering pipeline strategies</li>
 *   <li>{@code config.properties} - Typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.lineconsensus.config;
