package com.ryuqq.runnertype.core.spi;

/**
 * Optional audit capability receiving one event per created or updated record.
 *
 * <p>The sink is passed to the reconciler explicitly, never looked up globally, so the
 * reconciler is testable without a live logging or database subsystem. Failures are
 * reported through the outcome sequence, not through this sink.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AuditSink {

    /**
     * Receives an audit event.
     *
     * @param event the event (never null)
     */
    void record(AuditEvent event);

    /**
     * Returns a sink that discards every event.
     *
     * @return no-op sink
     */
    static AuditSink noop() {
        return event -> { };
    }
}
