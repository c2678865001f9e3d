/**
 * Service layer containing extraction and consensus logic.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.extract} - Classification payload to line records</li>
 *   <li>{@code service.text} - Text normalization and edit distance</li>
 *   <li>{@code service.distance} - Pairwise dissimilarity between observations</li>
 *   <li>{@code service.cluster} - Clustering collaborator, density threshold, one-line-per-user rule</li>
 *   <li>{@code service.consensus} - Cluster aggregation and singleton synthesis</li>
 *   <li>{@code service.reduce} - Frame, subject and batch reduction</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are stateless Spring beans ({@code @Component}, {@code @Service})</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.lineconsensus.service;
