/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP/REST boundary of the application, following a
 * 3-tier architecture where presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for the extract and reduce routes</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; extraction and clustering live in the service layer.
 *
 * @see com.phillippitts.lineconsensus.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.lineconsensus.presentation;
