package com.ryuqq.runnertype.core.spi;

import com.ryuqq.runnertype.core.model.RunnerTypeRecord;

/**
 * Persistent Storage SPI for runner type records.
 *
 * <p>This is the only capability boundary the reconciler depends on. The store owns the
 * durable lifetime of every {@link RunnerTypeRecord}; the reconciler only reads and writes
 * records transiently during a reconciliation pass.</p>
 *
 * <p><strong>Invariants the implementation must hold:</strong></p>
 * <ul>
 *   <li>At most one record per distinct {@code name}</li>
 *   <li>An id is assigned on first creation and never regenerated on update</li>
 * </ul>
 *
 * <p><strong>Upsert Semantics:</strong></p>
 * <pre>
 * record.id() == null → create, assign a fresh id
 * record.id() != null → update in place, keep the id
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Each call is atomic with respect to the single record it touches</li>
 *   <li>Each call has its own bounded latency (the reconciler applies no timeout)</li>
 * </ul>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public interface RunnerTypeStore {

    /**
     * Retrieves the record with the given natural key.
     *
     * @param name the runner type name
     * @return the stored record (never null)
     * @throws RunnerTypeNotFoundException if no record matches
     * @throws StoreException if the store could not be queried
     */
    RunnerTypeRecord findByName(String name);

    /**
     * Creates or updates a record.
     *
     * <p>A record without id is created and receives a store-assigned id. A record carrying
     * an id replaces the stored record with that id; the id must already be bound to the
     * same name.</p>
     *
     * @param record the record to persist
     * @return the record as stored, always carrying its id
     * @throws IllegalArgumentException if record is null
     * @throws StoreException on constraint violation (duplicate name, unknown id),
     *         store-side validation or connectivity failure
     */
    RunnerTypeRecord upsert(RunnerTypeRecord record);
}
