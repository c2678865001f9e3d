/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.lineconsensus.exception.InvalidClassificationException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.lineconsensus.exception.MalformedRecordException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.lineconsensus.exception.ReductionException} → 422 Unprocessable Entity</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "ReductionException",
 *   "message": "Subject could not be reduced",
 *   "details": "Subject reduction aborted [field=text, reason=missing transcription] (subject: s1, frame: frame0)",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>500 responses never carry record text or stack traces; details are logged server-side.
 *
 * @see com.phillippitts.lineconsensus.exception
 * @since 1.0
 */
package com.phillippitts.lineconsensus.presentation.exception;
