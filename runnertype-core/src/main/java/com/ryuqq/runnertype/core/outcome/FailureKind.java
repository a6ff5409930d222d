package com.ryuqq.runnertype.core.outcome;

/**
 * 실패 유형.
 *
 * <p>모든 유형은 {@link Failed} 결과로 변환되며 재조정 전체를 중단시키지 않습니다.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public enum FailureKind {

    /**
     * 정의 형식 오류 (카탈로그 작성자 책임).
     */
    VALIDATION("RT-VALIDATION"),

    /**
     * 저장소 조회 실패.
     */
    LOOKUP("RT-LOOKUP"),

    /**
     * 저장소 생성/갱신 실패.
     */
    PERSISTENCE("RT-PERSISTENCE");

    private final String errorCode;

    FailureKind(String errorCode) {
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: RT-VALIDATION)
     */
    public String errorCode() {
        return errorCode;
    }
}
