package com.ryuqq.runnertype.adapter.inmemory.store;

import com.ryuqq.runnertype.core.model.RunnerTypeId;
import com.ryuqq.runnertype.core.model.RunnerTypeRecord;
import com.ryuqq.runnertype.core.spi.RunnerTypeNotFoundException;
import com.ryuqq.runnertype.core.spi.StoreException;
import com.ryuqq.runnertype.testkit.contract.RunnerTypeFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryRunnerTypeStore 유닛 테스트.
 *
 * <p>SPI 계약 외의 구현 세부 동작을 검증합니다:</p>
 * <ul>
 *   <li>사용자 정의 id 생성기</li>
 *   <li>id 충돌 감지</li>
 *   <li>동시 생성 시 이름당 하나의 레코드</li>
 *   <li>clear, findAll, size</li>
 * </ul>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
class InMemoryRunnerTypeStoreTest {

    private InMemoryRunnerTypeStore store;

    @BeforeEach
    void setUp() {
        AtomicInteger sequence = new AtomicInteger();
        store = new InMemoryRunnerTypeStore(() -> RunnerTypeId.of("rt-" + sequence.incrementAndGet()));
    }

    @Test
    void upsert_사용자_정의_id_생성기로_id_부여() {
        // when
        RunnerTypeRecord first = store.upsert(record("run-local"));
        RunnerTypeRecord second = store.upsert(record("run-remote"));

        // then
        assertThat(first.id()).isEqualTo(RunnerTypeId.of("rt-1"));
        assertThat(second.id()).isEqualTo(RunnerTypeId.of("rt-2"));
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void upsert_id_생성기가_중복_id를_반환하면_StoreException() {
        // given
        InMemoryRunnerTypeStore constantIdStore = new InMemoryRunnerTypeStore(() -> RunnerTypeId.of("same"));
        constantIdStore.upsert(record("run-local"));

        // when & then
        assertThatThrownBy(() -> constantIdStore.upsert(record("run-remote")))
            .isInstanceOf(StoreException.class)
            .hasMessageContaining("run-remote");
        assertThat(constantIdStore.size()).isEqualTo(1);
    }

    @Test
    void findByName_null이면_IllegalArgumentException() {
        assertThatThrownBy(() -> store.findByName(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name cannot be null");
    }

    @Test
    void clear_모든_레코드와_id_바인딩_제거() {
        // given
        RunnerTypeRecord created = store.upsert(record("run-local"));

        // when
        store.clear();

        // then
        assertThat(store.size()).isZero();
        assertThat(store.findAll()).isEmpty();
        assertThatThrownBy(() -> store.findByName("run-local"))
            .isInstanceOf(RunnerTypeNotFoundException.class);
        assertThatThrownBy(() -> store.upsert(created))
            .isInstanceOf(StoreException.class);
    }

    @Test
    void findAll_저장된_레코드_스냅샷_반환() {
        // given
        store.upsert(record("run-local"));
        store.upsert(record("run-remote"));

        // when
        List<RunnerTypeRecord> all = store.findAll();

        // then
        assertThat(all).extracting(RunnerTypeRecord::name)
            .containsExactlyInAnyOrder("run-local", "run-remote");
    }

    @Test
    void upsert_동시에_같은_이름을_생성해도_레코드는_하나() throws Exception {
        // given
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    store.upsert(record("run-local"));
                    return true;
                } catch (StoreException e) {
                    return false;
                }
            }));
        }

        // when
        start.countDown();
        int succeeded = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(5, TimeUnit.SECONDS)) {
                succeeded++;
            }
        }
        executor.shutdown();

        // then
        assertThat(succeeded).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
    }

    private static RunnerTypeRecord record(String name) {
        return RunnerTypeRecord.fromDefinition(RunnerTypeFixtures.validDefinition(name));
    }
}
