package com.ryuqq.runnertype.application.registrar;

import com.ryuqq.runnertype.application.reconciler.ReconciliationReport;

/**
 * 시스템 시작 시 Runner Type을 등록하는 진입점.
 *
 * <p>프로세스 시작 과정에서 한 번 호출됩니다. 카탈로그, 저장소, 감사 채널은
 * 구현체가 생성 시점에 주입받습니다.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public interface RunnerTypeRegistrar {

    /**
     * Runner Type 등록.
     *
     * @param includeExperimental true이면 experimental Runner Type도 등록
     * @return 재조정 결과
     */
    ReconciliationReport registerRunnerTypes(boolean includeExperimental);

    /**
     * experimental Runner Type을 제외하고 등록.
     *
     * @return 재조정 결과
     */
    default ReconciliationReport registerRunnerTypes() {
        return registerRunnerTypes(false);
    }
}
