package com.ryuqq.runnertype.core.spi;

/**
 * Kind of change an {@link AuditEvent} reports.
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public enum AuditAction {

    /**
     * A record was created.
     */
    CREATED,

    /**
     * An existing record was updated in place.
     */
    UPDATED
}
