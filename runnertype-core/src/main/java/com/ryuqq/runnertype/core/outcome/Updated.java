package com.ryuqq.runnertype.core.outcome;

import com.ryuqq.runnertype.core.model.RunnerTypeRecord;

/**
 * 갱신 결과.
 *
 * <p>같은 이름의 기존 레코드가 있어 동일한 id로 갱신되었음을 나타냅니다.
 * 갱신 전 레코드를 함께 보관하여 실제 내용 변경 여부를 확인할 수 있습니다.</p>
 *
 * @param definitionName 정의 이름
 * @param previous 갱신 전 레코드
 * @param record 저장소가 반환한 갱신 후 레코드
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public record Updated(
    String definitionName,
    RunnerTypeRecord previous,
    RunnerTypeRecord record
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 인자 중 하나라도 null인 경우
     */
    public Updated {
        if (definitionName == null) {
            throw new IllegalArgumentException("definitionName cannot be null");
        }
        if (previous == null) {
            throw new IllegalArgumentException("previous cannot be null");
        }
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
    }

    /**
     * id를 제외한 내용이 바뀌었는지 확인.
     *
     * @return 내용이 달라졌으면 true
     */
    public boolean contentChanged() {
        return !previous.hasSameContentAs(record);
    }
}
