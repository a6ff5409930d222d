package com.ryuqq.runnertype.application.registrar;

import com.ryuqq.runnertype.application.reconciler.ReconciliationReport;

/**
 * 등록 패스가 끝난 뒤 실패한 정의가 있음을 호출자에게 알리는 예외.
 *
 * <p>모든 정의를 시도한 이후에만 던져지며, 전체 결과를 함께 전달합니다.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public class RunnerTypeRegistrationException extends RuntimeException {

    private final ReconciliationReport report;

    public RunnerTypeRegistrationException(ReconciliationReport report) {
        super("Runner type registration completed with failures: " + report.summary());
        this.report = report;
    }

    public ReconciliationReport getReport() {
        return report;
    }
}
