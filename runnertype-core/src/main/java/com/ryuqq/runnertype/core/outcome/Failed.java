package com.ryuqq.runnertype.core.outcome;

/**
 * 실패 결과.
 *
 * <p>검증, 조회 또는 저장 단계에서 실패했음을 나타냅니다.
 * 이 정의에만 영향을 주며 다음 정의의 처리는 계속됩니다.</p>
 *
 * @param definitionName 정의 이름 (이름이 비어 있는 정의는 null 가능)
 * @param kind 실패 유형
 * @param message 오류 메시지
 * @param cause 원인 예외 (선택, null 가능)
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public record Failed(
    String definitionName,
    FailureKind kind,
    String message,
    Throwable cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 message가 null 또는 빈 문자열인 경우
     */
    public Failed {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * cause 없이 Failed 생성.
     *
     * @param definitionName 정의 이름
     * @param kind 실패 유형
     * @param message 오류 메시지
     * @return Failed 인스턴스
     */
    public static Failed of(String definitionName, FailureKind kind, String message) {
        return new Failed(definitionName, kind, message, null);
    }

    /**
     * 원인 예외로부터 Failed 생성.
     *
     * <p>예외 메시지가 비어 있으면 예외 클래스 이름을 메시지로 사용합니다.</p>
     *
     * @param definitionName 정의 이름
     * @param kind 실패 유형
     * @param cause 원인 예외
     * @return Failed 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static Failed of(String definitionName, FailureKind kind, Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = cause.getClass().getName();
        }
        return new Failed(definitionName, kind, message, cause);
    }

    /**
     * 오류 코드 조회.
     *
     * @return 실패 유형의 오류 코드
     */
    public String errorCode() {
        return kind.errorCode();
    }
}
