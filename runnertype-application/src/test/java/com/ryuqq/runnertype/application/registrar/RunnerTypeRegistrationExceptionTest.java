package com.ryuqq.runnertype.application.registrar;

import com.ryuqq.runnertype.application.reconciler.ReconciliationReport;
import com.ryuqq.runnertype.core.outcome.Failed;
import com.ryuqq.runnertype.core.outcome.FailureKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * RunnerTypeRegistrationException 및 RunnerTypeRegistrar 기본 메서드 테스트.
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
class RunnerTypeRegistrationExceptionTest {

    @Test
    void constructor_리포트와_요약_메시지_보관() {
        // given
        ReconciliationReport report = new ReconciliationReport(List.of(
            Failed.of("run-local", FailureKind.VALIDATION, "runner_module is required")));

        // when
        RunnerTypeRegistrationException exception = new RunnerTypeRegistrationException(report);

        // then
        assertThat(exception.getReport()).isSameAs(report);
        assertThat(exception).hasMessage(
            "Runner type registration completed with failures: created=0, updated=0, skipped=0, failed=1");
    }

    @Test
    void registerRunnerTypes_기본값은_실험적_제외() {
        // given
        boolean[] received = new boolean[] {true};
        RunnerTypeRegistrar registrar = includeExperimental -> {
            received[0] = includeExperimental;
            return new ReconciliationReport(List.of());
        };

        // when
        registrar.registerRunnerTypes();

        // then
        assertThat(received[0]).isFalse();
    }
}
