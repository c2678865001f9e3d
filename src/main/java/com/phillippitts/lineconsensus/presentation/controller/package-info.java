/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /extractors/line-text} - classification payload to per-frame line records</li>
 *   <li>{@code POST /reducers/line-text} - one subject's extracts to consensus lines</li>
 *   <li>{@code POST /reducers/line-text/batch} - parallel reduction of many subjects</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.lineconsensus.presentation.controller;
