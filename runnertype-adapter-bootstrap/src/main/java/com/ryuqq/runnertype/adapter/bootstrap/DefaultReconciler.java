package com.ryuqq.runnertype.adapter.bootstrap;

import com.ryuqq.runnertype.application.reconciler.Reconciler;
import com.ryuqq.runnertype.core.catalog.RunnerTypeCatalog;
import com.ryuqq.runnertype.core.model.RunnerTypeDefinition;
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
import com.ryuqq.runnertype.core.validation.RunnerTypeDefinitionValidator;
import com.ryuqq.runnertype.core.validation.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 기본 Reconciler 구현체.
 *
 * <p>정의를 카탈로그 순서대로 하나씩 끝까지 처리한 뒤 다음 정의로 넘어가는
 * 단일 스레드 동기 패스입니다. 저장소 호출 외에는 대기 지점이 없으며
 * 레코드를 캐시하거나 락을 잡지 않습니다.</p>
 *
 * <p><strong>실패 격리:</strong></p>
 * <ul>
 *   <li>조회, 검증, 저장 단계의 예외는 해당 정의의 {@link Failed}로 변환</li>
 *   <li>실패해도 다음 정의 처리를 계속 진행</li>
 *   <li>이전에 성공한 upsert는 롤백하지 않음</li>
 * </ul>
 *
 * <p><strong>감사 이벤트:</strong> 생성/갱신 성공 시 한 번씩 발행합니다.
 * 감사 채널의 예외는 이미 저장된 결과를 바꾸지 않으며 WARN 로그로 남깁니다.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public final class DefaultReconciler implements Reconciler {

    private static final Logger log = LoggerFactory.getLogger(DefaultReconciler.class);

    private final RunnerTypeDefinitionValidator validator;
    private final Clock clock;

    /**
     * 기본 생성자 (UTC 시스템 시계).
     */
    public DefaultReconciler() {
        this(new RunnerTypeDefinitionValidator(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param validator 정의 검증기
     * @param clock 감사 이벤트 시각용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultReconciler(RunnerTypeDefinitionValidator validator, Clock clock) {
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.validator = validator;
        this.clock = clock;
    }

    @Override
    public List<Outcome> reconcile(
        RunnerTypeCatalog catalog,
        RunnerTypeStore store,
        AuditSink auditSink,
        boolean includeExperimental
    ) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (auditSink == null) {
            throw new IllegalArgumentException("auditSink cannot be null");
        }

        List<RunnerTypeDefinition> definitions = catalog.definitions();
        log.debug("Reconciliation started: {} definitions, includeExperimental={}",
            definitions.size(), includeExperimental);

        List<Outcome> outcomes = new ArrayList<>(definitions.size());
        for (RunnerTypeDefinition definition : definitions) {
            outcomes.add(reconcileOne(definition, store, auditSink, includeExperimental));
        }

        log.debug("Reconciliation completed: {} outcomes", outcomes.size());
        return Collections.unmodifiableList(outcomes);
    }

    /**
     * 정의 하나를 재조정.
     *
     * <p>예외를 던지지 않고 항상 Outcome을 반환합니다.</p>
     */
    private Outcome reconcileOne(
        RunnerTypeDefinition definition,
        RunnerTypeStore store,
        AuditSink auditSink,
        boolean includeExperimental
    ) {
        if (definition == null) {
            log.error("Catalog contains a missing runner type definition");
            return Failed.of(null, FailureKind.VALIDATION, "definition is missing");
        }
        String name = definition.name();

        // 1. Filter
        if (definition.experimental() && !includeExperimental) {
            log.debug("Skipping experimental runner type \"{}\"", name);
            return Skipped.experimental(name);
        }

        // 이름이 없으면 저장소를 조회하지 않고 검증 실패로 처리
        if (name == null || name.isBlank()) {
            return validate(definition);
        }

        // 2. Lookup
        RunnerTypeRecord existing;
        try {
            existing = store.findByName(name);
        } catch (RunnerTypeNotFoundException e) {
            existing = null;
        } catch (RuntimeException e) {
            log.error("Unable to look up runner type {}", name, e);
            return Failed.of(name, FailureKind.LOOKUP, e);
        }

        // 3. Validate
        Failed invalid = validate(definition);
        if (invalid != null) {
            return invalid;
        }

        // 4. Build (experimental 플래그는 레코드로 옮겨지지 않음)
        RunnerTypeRecord candidate = RunnerTypeRecord.fromDefinition(definition);
        if (existing != null) {
            candidate = candidate.withId(existing.id());
        }

        // 5. Persist
        RunnerTypeRecord stored;
        try {
            stored = store.upsert(candidate);
        } catch (RuntimeException e) {
            log.error("Unable to register runner type {}", name, e);
            return Failed.of(name, FailureKind.PERSISTENCE, e);
        }
        if (stored == null) {
            log.error("Store returned no record for runner type {}", name);
            return Failed.of(name, FailureKind.PERSISTENCE, "store returned no record");
        }

        Outcome outcome;
        AuditAction action;
        if (existing == null) {
            outcome = new Created(name, stored);
            action = AuditAction.CREATED;
        } else {
            outcome = new Updated(name, existing, stored);
            action = AuditAction.UPDATED;
        }
        emit(auditSink, new AuditEvent(name, action, stored, clock.instant()));
        return outcome;
    }

    /**
     * 정의 검증.
     *
     * @return 위반 사항이 있으면 VALIDATION Failed, 없으면 null
     */
    private Failed validate(RunnerTypeDefinition definition) {
        try {
            validator.validate(definition);
            return null;
        } catch (ValidationException e) {
            log.error("Unable to register runner type {}: {}", definition.name(), e.getMessage());
            return Failed.of(definition.name(), FailureKind.VALIDATION, e);
        }
    }

    private void emit(AuditSink auditSink, AuditEvent event) {
        try {
            auditSink.record(event);
        } catch (RuntimeException e) {
            log.warn("Audit sink rejected {} event for runner type {}", event.action(), event.name(), e);
        }
    }
}
