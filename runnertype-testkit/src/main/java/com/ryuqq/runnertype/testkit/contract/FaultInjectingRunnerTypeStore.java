package com.ryuqq.runnertype.testkit.contract;

import com.ryuqq.runnertype.core.model.RunnerTypeRecord;
import com.ryuqq.runnertype.core.spi.RunnerTypeStore;
import com.ryuqq.runnertype.core.spi.StoreException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link RunnerTypeStore} decorator that fails lookups or upserts for selected names.
 *
 * <p>All other calls are delegated unchanged. Every call is recorded so tests can
 * assert the order in which the reconciler touched the store.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * FaultInjectingRunnerTypeStore store = new FaultInjectingRunnerTypeStore(createStore());
 * store.failLookupFor("run-remote");
 * store.failUpsertFor("http-runner");
 * </pre>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public class FaultInjectingRunnerTypeStore implements RunnerTypeStore {

    private final RunnerTypeStore delegate;
    private final Set<String> failingLookups = new HashSet<>();
    private final Set<String> failingUpserts = new HashSet<>();
    private final List<String> calls = new ArrayList<>();

    public FaultInjectingRunnerTypeStore(RunnerTypeStore delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    public FaultInjectingRunnerTypeStore failLookupFor(String name) {
        failingLookups.add(name);
        return this;
    }

    public FaultInjectingRunnerTypeStore failUpsertFor(String name) {
        failingUpserts.add(name);
        return this;
    }

    @Override
    public RunnerTypeRecord findByName(String name) {
        calls.add("findByName:" + name);
        if (failingLookups.contains(name)) {
            throw new StoreException("Injected lookup failure for " + name);
        }
        return delegate.findByName(name);
    }

    @Override
    public RunnerTypeRecord upsert(RunnerTypeRecord record) {
        calls.add("upsert:" + (record == null ? null : record.name()));
        if (record != null && failingUpserts.contains(record.name())) {
            throw new StoreException("Injected upsert failure for " + record.name());
        }
        return delegate.upsert(record);
    }

    /**
     * Returns the recorded calls, e.g. {@code "findByName:run-local"}, {@code "upsert:run-local"}.
     *
     * @return calls in order
     */
    public List<String> calls() {
        return Collections.unmodifiableList(calls);
    }
}
