/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID unless supplied)</li>
 *   <li>{@code projectId} - Crowd project id, when the caller sends {@code X-Project-ID}</li>
 *   <li>{@code subjectId} / {@code frame} - added while a subject is reduced</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [reduce-pool-1] [requestId] [projectId] [subjectId] [frame] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.lineconsensus.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.lineconsensus.config.logging;
