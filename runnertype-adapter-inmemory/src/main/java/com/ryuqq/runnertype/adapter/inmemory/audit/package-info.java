/**
 * In-memory AuditSink adapter.
 *
 * <p>{@link com.ryuqq.runnertype.adapter.inmemory.audit.InMemoryAuditSink} collects audit
 * events so embedded callers and tests can inspect what a registration pass changed.</p>
 *
 * @since 1.0.0
 * @author Runner Type Registry Team
 */
package com.ryuqq.runnertype.adapter.inmemory.audit;
