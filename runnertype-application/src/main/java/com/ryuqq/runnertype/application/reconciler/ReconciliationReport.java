package com.ryuqq.runnertype.application.reconciler;

import com.ryuqq.runnertype.core.outcome.Created;
import com.ryuqq.runnertype.core.outcome.Failed;
import com.ryuqq.runnertype.core.outcome.Outcome;
import com.ryuqq.runnertype.core.outcome.Skipped;
import com.ryuqq.runnertype.core.outcome.Updated;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 재조정 패스 한 번의 결과 요약.
 *
 * <p>시작 단계의 호출자가 전체 성공/실패를 판단할 수 있도록
 * 정의별 Outcome을 순서대로 보관하고 유형별 조회를 제공합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ReconciliationReport report = registrar.registerRunnerTypes(false);
 *
 * if (report.hasFailures()) {
 *     report.failed().forEach(f -&gt; log.error("{}: {}", f.definitionName(), f.message()));
 * }
 * </pre>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public final class ReconciliationReport {

    private final List<Outcome> outcomes;

    /**
     * 생성자.
     *
     * @param outcomes 정의별 Outcome 목록 (카탈로그 순서)
     * @throws IllegalArgumentException outcomes가 null이거나 null 원소를 포함한 경우
     */
    public ReconciliationReport(List<Outcome> outcomes) {
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }
        for (Outcome outcome : outcomes) {
            if (outcome == null) {
                throw new IllegalArgumentException("outcomes cannot contain null");
            }
        }
        this.outcomes = List.copyOf(outcomes);
    }

    /**
     * 전체 Outcome 조회.
     *
     * @return 카탈로그 순서를 유지하는 수정 불가능한 목록
     */
    public List<Outcome> outcomes() {
        return outcomes;
    }

    public List<Created> created() {
        return ofType(Created.class);
    }

    public List<Updated> updated() {
        return ofType(Updated.class);
    }

    public List<Skipped> skipped() {
        return ofType(Skipped.class);
    }

    public List<Failed> failed() {
        return ofType(Failed.class);
    }

    /**
     * 실패 존재 여부.
     *
     * @return Failed가 하나라도 있으면 true
     */
    public boolean hasFailures() {
        return outcomes.stream().anyMatch(Outcome::isFailed);
    }

    /**
     * 이름으로 Outcome 조회.
     *
     * @param definitionName 정의 이름
     * @return 해당 정의의 Outcome (없으면 empty)
     */
    public Optional<Outcome> outcomeFor(String definitionName) {
        if (definitionName == null) {
            return Optional.empty();
        }
        return outcomes.stream()
            .filter(outcome -> definitionName.equals(outcome.definitionName()))
            .findFirst();
    }

    public int size() {
        return outcomes.size();
    }

    private <T extends Outcome> List<T> ofType(Class<T> type) {
        return outcomes.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 로그용 요약 문자열.
     *
     * @return "created=1, updated=2, skipped=0, failed=0" 형식
     */
    public String summary() {
        return "created=" + created().size()
            + ", updated=" + updated().size()
            + ", skipped=" + skipped().size()
            + ", failed=" + failed().size();
    }

    @Override
    public String toString() {
        return "ReconciliationReport{" + summary() + '}';
    }
}
