package com.ryuqq.runnertype.adapter.bootstrap;

/**
 * StartupRegistrar 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>includeExperimental: experimental Runner Type 등록 여부 (기본 false)</li>
 *   <li>failOnError: 패스 완료 후 실패가 있으면 예외를 던질지 여부 (기본 false)</li>
 * </ul>
 *
 * <p>failOnError가 true여도 모든 정의를 시도한 뒤에만 예외를 던집니다.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 * @param includeExperimental experimental Runner Type 등록 여부
 * @param failOnError 실패 시 RunnerTypeRegistrationException 발생 여부
 */
public record RegistrarConfig(boolean includeExperimental, boolean failOnError) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: includeExperimental=false, failOnError=false</p>
     */
    public RegistrarConfig() {
        this(false, false);
    }

    /**
     * includeExperimental만 변경한 새 인스턴스 생성.
     *
     * @param includeExperimental experimental 등록 여부
     * @return 새 RegistrarConfig 인스턴스
     */
    public RegistrarConfig withIncludeExperimental(boolean includeExperimental) {
        return new RegistrarConfig(includeExperimental, this.failOnError);
    }

    /**
     * failOnError만 변경한 새 인스턴스 생성.
     *
     * @param failOnError 실패 시 예외 발생 여부
     * @return 새 RegistrarConfig 인스턴스
     */
    public RegistrarConfig withFailOnError(boolean failOnError) {
        return new RegistrarConfig(this.includeExperimental, failOnError);
    }
}
