/**
 * Contract test bases for runner type store adapters.
 *
 * <p>Adapter modules extend these classes in their own test sources to prove they honour
 * the {@link com.ryuqq.runnertype.core.spi.RunnerTypeStore} contract and behave correctly
 * under reconciliation.</p>
 *
 * <h2>Bases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runnertype.testkit.contract.AbstractRunnerTypeStoreContractTest} - Store SPI semantics</li>
 *   <li>{@link com.ryuqq.runnertype.testkit.contract.AbstractReconciliationContractTest} - Reconciliation properties</li>
 * </ul>
 *
 * <h2>Helpers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runnertype.testkit.contract.FaultInjectingRunnerTypeStore} - Injects lookup/upsert failures</li>
 *   <li>{@link com.ryuqq.runnertype.testkit.contract.RunnerTypeFixtures} - Valid and invalid definitions</li>
 * </ul>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
package com.ryuqq.runnertype.testkit.contract;
