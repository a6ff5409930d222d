package com.ryuqq.runnertype.core.spi;

import com.ryuqq.runnertype.core.model.RunnerTypeRecord;

import java.time.Instant;

/**
 * Audit event emitted once per successfully created or updated record.
 *
 * @param name the runner type name
 * @param action created or updated
 * @param snapshot the record as returned by the store
 * @param occurredAt when the upsert completed
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public record AuditEvent(
    String name,
    AuditAction action,
    RunnerTypeRecord snapshot,
    Instant occurredAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if any component is null
     */
    public AuditEvent {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
    }
}
