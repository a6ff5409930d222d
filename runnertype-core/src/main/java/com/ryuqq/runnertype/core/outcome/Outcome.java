package com.ryuqq.runnertype.core.outcome;

/**
 * 정의 하나에 대한 재조정(reconciliation) 결과.
 *
 * <p>Outcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Created}: 저장소에 새 레코드 생성</li>
 *   <li>{@link Updated}: 기존 레코드를 같은 id로 갱신</li>
 *   <li>{@link Skipped}: 등록 대상에서 의도적으로 제외 (오류 아님)</li>
 *   <li>{@link Failed}: 검증, 조회 또는 저장 실패</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 새로운 결과 유형이 추가되면 컴파일 타임에 드러납니다.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Created, Updated, Skipped, Failed {

    /**
     * 결과가 속한 Runner Type 정의 이름.
     *
     * @return 정의 이름
     */
    String definitionName();

    /**
     * 새로 생성되었는지 확인.
     *
     * @return 생성 여부
     */
    default boolean isCreated() {
        return this instanceof Created;
    }

    /**
     * 갱신되었는지 확인.
     *
     * @return 갱신 여부
     */
    default boolean isUpdated() {
        return this instanceof Updated;
    }

    /**
     * 제외되었는지 확인.
     *
     * @return 제외 여부
     */
    default boolean isSkipped() {
        return this instanceof Skipped;
    }

    /**
     * 실패했는지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailed() {
        return this instanceof Failed;
    }

    /**
     * 저장소에 반영되었는지 확인 (Created 또는 Updated).
     *
     * @return 반영 여부
     */
    default boolean isPersisted() {
        return isCreated() || isUpdated();
    }
}
