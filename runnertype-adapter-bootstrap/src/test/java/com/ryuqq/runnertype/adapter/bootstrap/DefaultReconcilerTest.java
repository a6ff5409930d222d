package com.ryuqq.runnertype.adapter.bootstrap;

import com.ryuqq.runnertype.core.catalog.StaticRunnerTypeCatalog;
import com.ryuqq.runnertype.core.model.ParameterSpec;
import com.ryuqq.runnertype.core.model.ParameterType;
import com.ryuqq.runnertype.core.model.RunnerTypeDefinition;
import com.ryuqq.runnertype.core.model.RunnerTypeId;
import com.ryuqq.runnertype.core.model.RunnerTypeRecord;
import com.ryuqq.runnertype.core.outcome.Created;
import com.ryuqq.runnertype.core.outcome.Failed;
import com.ryuqq.runnertype.core.outcome.FailureKind;
import com.ryuqq.runnertype.core.outcome.Outcome;
import com.ryuqq.runnertype.core.outcome.Skipped;
import com.ryuqq.runnertype.core.outcome.Updated;
import com.ryuqq.runnertype.core.spi.AuditAction;
import com.ryuqq.runnertype.core.spi.AuditEvent;
import com.ryuqq.runnertype.core.spi.AuditSink;
import com.ryuqq.runnertype.core.spi.RunnerTypeNotFoundException;
import com.ryuqq.runnertype.core.spi.RunnerTypeStore;
import com.ryuqq.runnertype.core.spi.StoreException;
import com.ryuqq.runnertype.core.validation.RunnerTypeDefinitionValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * DefaultReconciler 유닛 테스트.
 *
 * <p>정의 하나당 처리 순서를 검증합니다:</p>
 * <ul>
 *   <li>실험적 정의 필터링 → 저장소 미접근</li>
 *   <li>조회 → 검증 → 레코드 생성 → upsert 순서</li>
 *   <li>기존 id 유지</li>
 *   <li>조회/검증/저장 실패 격리</li>
 *   <li>감사 이벤트 발행 및 감사 실패 무시</li>
 * </ul>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultReconcilerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    @Mock
    private RunnerTypeStore store;

    @Mock
    private AuditSink auditSink;

    private DefaultReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new DefaultReconciler(new RunnerTypeDefinitionValidator(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RunnerTypeDefinition definition(String name, int timeout) {
        return RunnerTypeDefinition.builder(name)
            .description("A runner to execute local actions as a fixed user.")
            .runnerModule("st2actions.runners.localrunner")
            .parameter(ParameterSpec.of("timeout", ParameterType.INTEGER, "Action timeout in seconds.")
                .withDefault(timeout))
            .build();
    }

    private void storeAssignsId(String id) {
        when(store.upsert(any(RunnerTypeRecord.class)))
            .thenAnswer(invocation -> {
                RunnerTypeRecord record = invocation.getArgument(0);
                return record.hasId() ? record : record.withId(RunnerTypeId.of(id));
            });
    }

    // ============================================================
    // 1. 신규 생성
    // ============================================================

    @Test
    void reconcile_저장소에_없으면_Created_및_CREATED_감사_이벤트() {
        // given
        when(store.findByName("run-local")).thenThrow(new RunnerTypeNotFoundException("run-local"));
        storeAssignsId("rt-1");

        // when
        List<Outcome> outcomes = reconciler.reconcile(
            StaticRunnerTypeCatalog.of(definition("run-local", 1800)), store, auditSink, false);

        // then
        assertThat(outcomes).hasSize(1);
        Created created = (Created) outcomes.get(0);
        assertThat(created.record().id()).isEqualTo(RunnerTypeId.of("rt-1"));
        assertThat(created.record().parameters().get("timeout").defaultValue()).isEqualTo(1800);

        ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditSink).record(event.capture());
        assertThat(event.getValue().action()).isEqualTo(AuditAction.CREATED);
        assertThat(event.getValue().snapshot()).isSameAs(created.record());
        assertThat(event.getValue().occurredAt()).isEqualTo(NOW);
    }

    // ============================================================
    // 2. 기존 레코드 갱신: id 유지
    // ============================================================

    @Test
    void reconcile_기존_레코드가_있으면_id를_유지한_채_Updated() {
        // given
        RunnerTypeRecord existing = RunnerTypeRecord.fromDefinition(definition("run-local", 60))
            .withId(RunnerTypeId.of("rt-42"));
        when(store.findByName("run-local")).thenReturn(existing);
        storeAssignsId("never-used");

        // when
        List<Outcome> outcomes = reconciler.reconcile(
            StaticRunnerTypeCatalog.of(definition("run-local", 1800)), store, auditSink, false);

        // then
        Updated updated = (Updated) outcomes.get(0);
        assertThat(updated.previous()).isSameAs(existing);
        assertThat(updated.record().id()).isEqualTo(RunnerTypeId.of("rt-42"));
        assertThat(updated.contentChanged()).isTrue();

        ArgumentCaptor<RunnerTypeRecord> upserted = ArgumentCaptor.forClass(RunnerTypeRecord.class);
        verify(store).upsert(upserted.capture());
        assertThat(upserted.getValue().id()).isEqualTo(RunnerTypeId.of("rt-42"));
        verify(auditSink).record(any(AuditEvent.class));
    }

    @Test
    void reconcile_조회가_upsert보다_먼저_수행됨() {
        // given
        when(store.findByName("run-local")).thenThrow(new RunnerTypeNotFoundException("run-local"));
        storeAssignsId("rt-1");

        // when
        reconciler.reconcile(StaticRunnerTypeCatalog.of(definition("run-local", 60)), store, auditSink, false);

        // then
        InOrder inOrder = inOrder(store, auditSink);
        inOrder.verify(store).findByName("run-local");
        inOrder.verify(store).upsert(any(RunnerTypeRecord.class));
        inOrder.verify(auditSink).record(any(AuditEvent.class));
    }

    // ============================================================
    // 3. 실험적 정의 필터
    // ============================================================

    @Test
    void reconcile_실험적_정의는_제외되면_저장소에_접근하지_않음() {
        // given
        RunnerTypeDefinition experimental = RunnerTypeDefinition.builder("run-windows-cmd")
            .description("Windows runner")
            .experimental(true)
            .runnerModule("st2actions.runners.windows_command_runner")
            .build();

        // when
        List<Outcome> outcomes = reconciler.reconcile(
            StaticRunnerTypeCatalog.of(experimental), store, auditSink, false);

        // then
        assertThat(outcomes).containsExactly(Skipped.experimental("run-windows-cmd"));
        verifyNoInteractions(store, auditSink);
    }

    @Test
    void reconcile_실험적_정의가_포함되면_실험적_표시_없이_저장() {
        // given
        RunnerTypeDefinition experimental = RunnerTypeDefinition.builder("run-windows-cmd")
            .description("Windows runner")
            .experimental(true)
            .runnerModule("st2actions.runners.windows_command_runner")
            .build();
        when(store.findByName("run-windows-cmd")).thenThrow(new RunnerTypeNotFoundException("run-windows-cmd"));
        storeAssignsId("rt-7");

        // when
        List<Outcome> outcomes = reconciler.reconcile(
            StaticRunnerTypeCatalog.of(experimental), store, auditSink, true);

        // then
        assertThat(outcomes.get(0).isCreated()).isTrue();
        assertThat(experimental.experimental()).isTrue();
    }

    // ============================================================
    // 4. 실패 격리
    // ============================================================

    @Test
    void reconcile_조회_실패는_LOOKUP_Failed_후_다음_정의_계속() {
        // given
        when(store.findByName("run-remote")).thenThrow(new StoreException("connection refused"));
        when(store.findByName("run-local")).thenThrow(new RunnerTypeNotFoundException("run-local"));
        storeAssignsId("rt-1");

        // when
        List<Outcome> outcomes = reconciler.reconcile(
            StaticRunnerTypeCatalog.of(definition("run-remote", 60), definition("run-local", 60)),
            store, auditSink, false);

        // then
        Failed failed = (Failed) outcomes.get(0);
        assertThat(failed.kind()).isEqualTo(FailureKind.LOOKUP);
        assertThat(failed.message()).isEqualTo("connection refused");
        assertThat(failed.cause()).isInstanceOf(StoreException.class);
        assertThat(outcomes.get(1).isCreated()).isTrue();
        verify(store, times(1)).upsert(any(RunnerTypeRecord.class));
    }

    @Test
    void reconcile_검증_실패는_upsert_없이_VALIDATION_Failed() {
        // given
        RunnerTypeDefinition invalid = RunnerTypeDefinition.builder("run-windows-cmd")
            .description("Windows runner")
            .runnerModule("st2actions.runners.windows_command_runner")
            .parameter(ParameterSpec.of("username", ParameterType.STRING, "User")
                .withDefault("Administrator")
                .asRequired())
            .build();
        when(store.findByName("run-windows-cmd")).thenThrow(new RunnerTypeNotFoundException("run-windows-cmd"));

        // when
        List<Outcome> outcomes = reconciler.reconcile(StaticRunnerTypeCatalog.of(invalid), store, auditSink, false);

        // then
        Failed failed = (Failed) outcomes.get(0);
        assertThat(failed.kind()).isEqualTo(FailureKind.VALIDATION);
        assertThat(failed.message()).contains("a required parameter cannot declare a default value");
        verify(store, never()).upsert(any());
        verifyNoInteractions(auditSink);
    }

    @Test
    void reconcile_저장_실패는_PERSISTENCE_Failed_감사_없음() {
        // given
        when(store.findByName("run-local")).thenThrow(new RunnerTypeNotFoundException("run-local"));
        when(store.upsert(any(RunnerTypeRecord.class))).thenThrow(new StoreException("disk full"));

        // when
        List<Outcome> outcomes = reconciler.reconcile(
            StaticRunnerTypeCatalog.of(definition("run-local", 60)), store, auditSink, false);

        // then
        Failed failed = (Failed) outcomes.get(0);
        assertThat(failed.kind()).isEqualTo(FailureKind.PERSISTENCE);
        assertThat(failed.errorCode()).isEqualTo("RT-PERSISTENCE");
        verifyNoInteractions(auditSink);
    }

    @Test
    void reconcile_저장소가_null을_반환하면_PERSISTENCE_Failed() {
        // given
        when(store.findByName("run-local")).thenThrow(new RunnerTypeNotFoundException("run-local"));
        when(store.upsert(any(RunnerTypeRecord.class))).thenReturn(null);

        // when
        List<Outcome> outcomes = reconciler.reconcile(
            StaticRunnerTypeCatalog.of(definition("run-local", 60)), store, auditSink, false);

        // then
        assertThat(outcomes.get(0)).isEqualTo(
            Failed.of("run-local", FailureKind.PERSISTENCE, "store returned no record"));
    }

    @Test
    void reconcile_이름_없는_정의는_저장소_조회_없이_VALIDATION_Failed() {
        // given
        RunnerTypeDefinition unnamed = RunnerTypeDefinition.builder(null)
            .description("Unnamed runner")
            .runnerModule("st2actions.runners.localrunner")
            .build();

        // when
        List<Outcome> outcomes = reconciler.reconcile(StaticRunnerTypeCatalog.of(unnamed), store, auditSink, false);

        // then
        Failed failed = (Failed) outcomes.get(0);
        assertThat(failed.kind()).isEqualTo(FailureKind.VALIDATION);
        assertThat(failed.message()).contains("name is required");
        verifyNoInteractions(store, auditSink);
    }

    @Test
    void reconcile_빈_이름의_정의는_저장소_조회_없이_VALIDATION_Failed() {
        // given
        RunnerTypeDefinition blank = RunnerTypeDefinition.builder("  ")
            .description("Blank runner")
            .runnerModule("st2actions.runners.localrunner")
            .build();
        when(store.findByName("run-local")).thenThrow(new RunnerTypeNotFoundException("run-local"));
        storeAssignsId("rt-1");

        // when
        List<Outcome> outcomes = reconciler.reconcile(
            StaticRunnerTypeCatalog.of(blank, definition("run-local", 60)), store, auditSink, false);

        // then
        assertThat(((Failed) outcomes.get(0)).kind()).isEqualTo(FailureKind.VALIDATION);
        assertThat(outcomes.get(1).isCreated()).isTrue();
        verify(store, never()).findByName("  ");
        verify(store, times(1)).upsert(any(RunnerTypeRecord.class));
    }

    @Test
    void reconcile_카탈로그의_null_정의는_VALIDATION_Failed() {
        // given
        RunnerTypeDefinition missing = null;

        // when
        List<Outcome> outcomes = reconciler.reconcile(
            () -> Arrays.asList(missing), store, auditSink, false);

        // then
        assertThat(outcomes).hasSize(1);
        assertThat(((Failed) outcomes.get(0)).kind()).isEqualTo(FailureKind.VALIDATION);
        verifyNoInteractions(store, auditSink);
    }

    // ============================================================
    // 5. 감사 싱크 실패
    // ============================================================

    @Test
    void reconcile_감사_싱크_예외는_결과를_바꾸지_않음() {
        // given
        when(store.findByName("run-local")).thenThrow(new RunnerTypeNotFoundException("run-local"));
        storeAssignsId("rt-1");
        doThrow(new IllegalStateException("audit backend down")).when(auditSink).record(any(AuditEvent.class));

        // when
        List<Outcome> outcomes = reconciler.reconcile(
            StaticRunnerTypeCatalog.of(definition("run-local", 60)), store, auditSink, false);

        // then
        assertThat(outcomes.get(0).isCreated()).isTrue();
    }

    @Test
    void reconcile_감사_싱크_생략시_no_op_사용() {
        // given
        when(store.findByName("run-local")).thenThrow(new RunnerTypeNotFoundException("run-local"));
        storeAssignsId("rt-1");

        // when
        List<Outcome> outcomes = reconciler.reconcile(
            StaticRunnerTypeCatalog.of(definition("run-local", 60)), store, false);

        // then
        assertThat(outcomes.get(0).isCreated()).isTrue();
    }

    // ============================================================
    // 6. 인자 검증
    // ============================================================

    @Test
    void reconcile_null_협력자는_IllegalArgumentException() {
        StaticRunnerTypeCatalog catalog = StaticRunnerTypeCatalog.of(definition("run-local", 60));

        assertThatThrownBy(() -> reconciler.reconcile(null, store, auditSink, false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> reconciler.reconcile(catalog, null, auditSink, false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> reconciler.reconcile(catalog, store, null, false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefaultReconciler(null, Clock.systemUTC()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reconcile_결과_리스트는_수정_불가() {
        // when
        List<Outcome> outcomes = reconciler.reconcile(StaticRunnerTypeCatalog.of(List.of()), store, auditSink, false);

        // then
        assertThat(outcomes).isEmpty();
        assertThatThrownBy(() -> outcomes.add(Skipped.experimental("x")))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
