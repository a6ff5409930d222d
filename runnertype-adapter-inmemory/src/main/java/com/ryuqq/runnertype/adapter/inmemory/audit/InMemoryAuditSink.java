package com.ryuqq.runnertype.adapter.inmemory.audit;

import com.ryuqq.runnertype.core.spi.AuditAction;
import com.ryuqq.runnertype.core.spi.AuditEvent;
import com.ryuqq.runnertype.core.spi.AuditSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link AuditSink} that keeps every received event.
 *
 * <p>Events are kept in arrival order using {@link CopyOnWriteArrayList}, which suits
 * the low write volume of a startup registration pass.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public class InMemoryAuditSink implements AuditSink {

    private final CopyOnWriteArrayList<AuditEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void record(AuditEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
    }

    /**
     * Returns all received events in arrival order.
     *
     * @return immutable snapshot
     */
    public List<AuditEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Returns the events of one action kind in arrival order.
     *
     * @param action the action kind
     * @return immutable snapshot
     */
    public List<AuditEvent> events(AuditAction action) {
        return events.stream()
            .filter(event -> event.action() == action)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Clears all received events.
     */
    public void clear() {
        events.clear();
    }
}
