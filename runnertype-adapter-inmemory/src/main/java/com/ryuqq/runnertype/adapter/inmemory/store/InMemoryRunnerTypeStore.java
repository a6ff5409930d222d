package com.ryuqq.runnertype.adapter.inmemory.store;

import com.ryuqq.runnertype.core.model.RunnerTypeId;
import com.ryuqq.runnertype.core.model.RunnerTypeRecord;
import com.ryuqq.runnertype.core.spi.RunnerTypeNotFoundException;
import com.ryuqq.runnertype.core.spi.RunnerTypeStore;
import com.ryuqq.runnertype.core.spi.StoreException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link RunnerTypeStore} SPI for testing and reference purposes.
 *
 * <p>This implementation keeps records in {@link ConcurrentHashMap}s and serializes writes,
 * so the one-record-per-name invariant holds even if several threads upsert concurrently.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>recordsByName:</strong> ConcurrentHashMap&lt;String, RunnerTypeRecord&gt; - Natural key lookup (O(1))</li>
 *   <li><strong>namesById:</strong> ConcurrentHashMap&lt;RunnerTypeId, String&gt; - Identity binding check on update (O(1))</li>
 * </ul>
 *
 * <p><strong>Upsert Rules:</strong></p>
 * <ul>
 *   <li>No id, unknown name → create with a generated id</li>
 *   <li>No id, known name → {@link StoreException} (duplicate name)</li>
 *   <li>Id bound to the same name → replace in place, id unchanged</li>
 *   <li>Unknown id, or id bound to another name → {@link StoreException}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RunnerTypeStore store = new InMemoryRunnerTypeStore();
 *
 * RunnerTypeRecord created = store.upsert(RunnerTypeRecord.fromDefinition(definition));
 * RunnerTypeRecord found = store.findByName("run-local");
 * </pre>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public class InMemoryRunnerTypeStore implements RunnerTypeStore {

    private final ConcurrentHashMap<String, RunnerTypeRecord> recordsByName;
    private final ConcurrentHashMap<RunnerTypeId, String> namesById;
    private final Supplier<RunnerTypeId> idGenerator;

    /**
     * Creates a new store generating UUID based ids.
     */
    public InMemoryRunnerTypeStore() {
        this(() -> RunnerTypeId.of(UUID.randomUUID().toString()));
    }

    /**
     * Creates a new store with a custom id generator.
     *
     * @param idGenerator supplies a fresh id for every created record
     * @throws IllegalArgumentException if idGenerator is null
     */
    public InMemoryRunnerTypeStore(Supplier<RunnerTypeId> idGenerator) {
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        this.recordsByName = new ConcurrentHashMap<>();
        this.namesById = new ConcurrentHashMap<>();
        this.idGenerator = idGenerator;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if name is null
     */
    @Override
    public RunnerTypeRecord findByName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }

        RunnerTypeRecord record = recordsByName.get(name);
        if (record == null) {
            throw new RunnerTypeNotFoundException(name);
        }
        return record;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Synchronized so the name and id indexes change together</li>
     *   <li>Generated ids are checked for collisions</li>
     * </ul>
     */
    @Override
    public synchronized RunnerTypeRecord upsert(RunnerTypeRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }

        if (!record.hasId()) {
            return create(record);
        }
        return update(record);
    }

    private RunnerTypeRecord create(RunnerTypeRecord record) {
        if (recordsByName.containsKey(record.name())) {
            throw new StoreException("Runner type already exists: " + record.name());
        }

        RunnerTypeId id = idGenerator.get();
        if (id == null || namesById.containsKey(id)) {
            throw new StoreException("Could not assign a unique id to runner type: " + record.name());
        }

        RunnerTypeRecord stored = record.withId(id);
        namesById.put(id, stored.name());
        recordsByName.put(stored.name(), stored);
        return stored;
    }

    private RunnerTypeRecord update(RunnerTypeRecord record) {
        String boundName = namesById.get(record.id());
        if (boundName == null) {
            throw new StoreException("No runner type with id " + record.id().getValue());
        }
        if (!boundName.equals(record.name())) {
            throw new StoreException(String.format(
                "Id %s belongs to runner type %s, not %s", record.id().getValue(), boundName, record.name()));
        }

        recordsByName.put(record.name(), record);
        return record;
    }

    /**
     * Returns a snapshot of all stored records.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @return records in no particular order
     */
    public List<RunnerTypeRecord> findAll() {
        return new ArrayList<>(recordsByName.values());
    }

    /**
     * Returns the number of stored records.
     *
     * @return record count
     */
    public int size() {
        return recordsByName.size();
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public synchronized void clear() {
        recordsByName.clear();
        namesById.clear();
    }
}
