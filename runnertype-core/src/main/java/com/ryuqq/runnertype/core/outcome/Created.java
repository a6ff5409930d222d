package com.ryuqq.runnertype.core.outcome;

import com.ryuqq.runnertype.core.model.RunnerTypeRecord;

/**
 * 생성 결과.
 *
 * <p>저장소에 같은 이름의 레코드가 없어 새 레코드가 생성되었음을 나타냅니다.</p>
 *
 * @param definitionName 정의 이름
 * @param record 저장소가 반환한 레코드 (새로 부여된 id 포함)
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public record Created(
    String definitionName,
    RunnerTypeRecord record
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException definitionName 또는 record가 null인 경우
     */
    public Created {
        if (definitionName == null) {
            throw new IllegalArgumentException("definitionName cannot be null");
        }
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
    }
}
