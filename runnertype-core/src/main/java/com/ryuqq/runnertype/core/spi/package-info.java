/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that infrastructure adapters implement
 * to plug a concrete store and audit channel into the reconciler.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runnertype.core.spi.RunnerTypeStore} - Lookup by name and upsert of runner type records</li>
 *   <li>{@link com.ryuqq.runnertype.core.spi.AuditSink} - Receives one event per created/updated record</li>
 * </ul>
 *
 * <h2>Failure Signals</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runnertype.core.spi.RunnerTypeNotFoundException} - No record for the name (expected answer)</li>
 *   <li>{@link com.ryuqq.runnertype.core.spi.StoreException} - Store-level failure</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., runnertype-adapter-inmemory) provide concrete implementations.
 * The {@code runnertype-testkit} module ships contract test bases every store adapter
 * should extend.</p>
 *
 * @since 1.0.0
 * @author Runner Type Registry Team
 */
package com.ryuqq.runnertype.core.spi;
