/**
 * Reconciliation outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for the per-definition
 * result of a reconciliation pass.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runnertype.core.outcome.Outcome} - Sealed interface (permits Created, Updated, Skipped, Failed)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runnertype.core.outcome.Created} - New record created with a fresh id</li>
 *   <li>{@link com.ryuqq.runnertype.core.outcome.Updated} - Existing record updated, id carried forward</li>
 *   <li>{@link com.ryuqq.runnertype.core.outcome.Skipped} - Excluded by the experimental filter</li>
 *   <li>{@link com.ryuqq.runnertype.core.outcome.Failed} - Validation, lookup or persistence failure
 *       ({@link com.ryuqq.runnertype.core.outcome.FailureKind})</li>
 * </ul>
 *
 * <h2>Error Propagation</h2>
 * <p>No failure escapes a reconciliation pass as an exception. Every failure is captured
 * as a {@code Failed} outcome so the caller decides what the startup step means.</p>
 *
 * @since 1.0.0
 * @author Runner Type Registry Team
 */
package com.ryuqq.runnertype.core.outcome;
