/**
 * Reconciliation use-case contracts.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runnertype.application.reconciler.Reconciler} - Brings the store into agreement with a catalog</li>
 *   <li>{@link com.ryuqq.runnertype.application.reconciler.ReconciliationReport} - Ordered outcomes and summary views</li>
 * </ul>
 *
 * <h2>Architecture Position</h2>
 * <pre>
 * adapter-bootstrap (DefaultReconciler)
 *   ↓ implements
 * application (Reconciler interface)
 *   ↓ depends on
 * core (catalog, model, outcome, spi, validation)
 * </pre>
 *
 * @since 1.0.0
 * @author Runner Type Registry Team
 */
package com.ryuqq.runnertype.application.reconciler;
