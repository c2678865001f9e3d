/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.lineconsensus.exception.LineConsensusException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.lineconsensus.exception.MalformedRecordException} - A line record
 *       lacks {@code x}, {@code y} or {@code text} when it is read</li>
 *   <li>{@link com.phillippitts.lineconsensus.exception.InvalidClassificationException} - A raw
 *       classification payload cannot be extracted</li>
 *   <li>{@link com.phillippitts.lineconsensus.exception.ReductionException} - The reduction of one
 *       subject aborted; carries subject id and frame</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining, and map to HTTP status codes via
 * {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.lineconsensus.exception;
