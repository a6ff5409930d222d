package com.ryuqq.runnertype.core.outcome;

/**
 * 제외 결과 (오류 아님).
 *
 * <p>실험 단계 정의가 포함 대상이 아니어서 조회, 검증, 저장 없이 건너뛰었음을 나타냅니다.</p>
 *
 * @param definitionName 정의 이름
 * @param reason 제외 사유
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public record Skipped(
    String definitionName,
    String reason
) implements Outcome {

    /**
     * 실험 단계 정의 제외 사유.
     */
    public static final String EXPERIMENTAL_EXCLUDED = "experimental runner types are not included";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason이 null이거나 빈 문자열인 경우
     */
    public Skipped {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        // definitionName은 null 허용 (이름 없는 정의도 제외될 수 있음)
    }

    /**
     * 실험 단계 정의 제외 결과 생성.
     *
     * @param definitionName 정의 이름
     * @return Skipped 인스턴스
     */
    public static Skipped experimental(String definitionName) {
        return new Skipped(definitionName, EXPERIMENTAL_EXCLUDED);
    }
}
