/**
 * Runner type domain model package.
 *
 * <p>This package defines the immutable values that describe execution backends
 * and their persisted form.</p>
 *
 * <h2>Catalog Side</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runnertype.core.model.RunnerTypeDefinition} - Canonical definition (catalog unit)</li>
 *   <li>{@link com.ryuqq.runnertype.core.model.ParameterSpec} - One named runner parameter</li>
 *   <li>{@link com.ryuqq.runnertype.core.model.ParameterType} - Parameter value type</li>
 * </ul>
 *
 * <h2>Store Side</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runnertype.core.model.RunnerTypeRecord} - Persisted counterpart of a definition</li>
 *   <li>{@link com.ryuqq.runnertype.core.model.RunnerTypeId} - Store-assigned identity</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Records with unmodifiable parameter maps</li>
 *   <li><strong>Late Validation:</strong> Shape rules are checked per definition at registration time</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Runner Type Registry Team
 */
package com.ryuqq.runnertype.core.model;
