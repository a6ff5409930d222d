package com.ryuqq.runnertype.application.reconciler;

import com.ryuqq.runnertype.core.catalog.RunnerTypeCatalog;
import com.ryuqq.runnertype.core.outcome.Outcome;
import com.ryuqq.runnertype.core.spi.AuditSink;
import com.ryuqq.runnertype.core.spi.RunnerTypeStore;

import java.util.List;

/**
 * 카탈로그와 저장소의 Runner Type 레코드를 일치시키는 재조정자.
 *
 * <p><strong>정의별 처리 흐름 (카탈로그 순서):</strong></p>
 * <pre>
 * 1. Filter   : experimental &amp;&amp; !includeExperimental → Skipped
 * 2. Lookup   : store.findByName(name)
 *               - NotFound → 신규
 *               - 레코드   → 갱신 (기존 id 보관)
 *               - 그 외 예외 → Failed(LOOKUP)
 * 3. Validate : 형식 오류 → Failed(VALIDATION)
 * 4. Build    : RunnerTypeRecord 생성, 갱신이면 기존 id 복사
 * 5. Persist  : store.upsert(record)
 *               - 성공 → Created / Updated + 감사 이벤트
 *               - 실패 → Failed(PERSISTENCE), 이전 upsert는 롤백하지 않음
 * </pre>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>범위 내 모든 정의를 시도하며 중간에 중단하지 않음</li>
 *   <li>정의별 실패는 예외로 전파되지 않고 Outcome으로 반환</li>
 *   <li>카탈로그를 변경하지 않음 (반복 호출해도 부수 효과 없음)</li>
 *   <li>변경 없는 카탈로그로 두 번 실행하면 두 번째는 모두 Updated이며 내용 변화 없음</li>
 * </ul>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public interface Reconciler {

    /**
     * 카탈로그를 저장소에 재조정.
     *
     * @param catalog 정의 카탈로그
     * @param store 레코드 저장소
     * @param auditSink 생성/갱신 감사 이벤트 수신자
     * @param includeExperimental true이면 experimental 정의도 등록
     * @return 카탈로그 순서를 유지하는 정의별 Outcome 목록
     * @throws IllegalArgumentException catalog, store 또는 auditSink가 null인 경우
     */
    List<Outcome> reconcile(
        RunnerTypeCatalog catalog,
        RunnerTypeStore store,
        AuditSink auditSink,
        boolean includeExperimental
    );

    /**
     * 감사 이벤트 없이 재조정.
     *
     * @param catalog 정의 카탈로그
     * @param store 레코드 저장소
     * @param includeExperimental true이면 experimental 정의도 등록
     * @return 정의별 Outcome 목록
     */
    default List<Outcome> reconcile(RunnerTypeCatalog catalog, RunnerTypeStore store, boolean includeExperimental) {
        return reconcile(catalog, store, AuditSink.noop(), includeExperimental);
    }
}
