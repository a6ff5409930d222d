package com.ryuqq.runnertype.core.validation;

import java.util.List;

/**
 * Runner Type 정의 형식 오류.
 *
 * <p>하나의 정의에서 발견된 모든 위반 사항을 함께 보고합니다.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public class ValidationException extends RuntimeException {

    private final String definitionName;
    private final List<String> violations;

    /**
     * 생성자.
     *
     * @param definitionName 정의 이름 (null 가능)
     * @param violations 위반 사항 목록 (1개 이상)
     * @throws IllegalArgumentException violations가 null이거나 비어 있는 경우
     */
    public ValidationException(String definitionName, List<String> violations) {
        super(buildMessage(definitionName, violations));
        this.definitionName = definitionName;
        this.violations = List.copyOf(violations);
    }

    private static String buildMessage(String definitionName, List<String> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations cannot be null or empty");
        }
        return "Invalid runner type '" + definitionName + "': " + String.join("; ", violations);
    }

    public String getDefinitionName() {
        return definitionName;
    }

    /**
     * 위반 사항 조회.
     *
     * @return 수정 불가능한 위반 사항 목록
     */
    public List<String> getViolations() {
        return violations;
    }
}
