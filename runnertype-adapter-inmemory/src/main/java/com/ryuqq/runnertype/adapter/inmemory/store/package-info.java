/**
 * In-memory Store adapter implementation package.
 *
 * <p>This package provides a reference implementation of the
 * {@link com.ryuqq.runnertype.core.spi.RunnerTypeStore} SPI for tests and embedded use.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.runnertype.adapter.inmemory.store.InMemoryRunnerTypeStore}:
 *       Thread-safe store enforcing one record per name and stable ids</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.runnertype.core.spi.RunnerTypeStore
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
package com.ryuqq.runnertype.adapter.inmemory.store;
