package com.ryuqq.runnertype.adapter.bootstrap;

import com.ryuqq.runnertype.application.reconciler.ReconciliationReport;
import com.ryuqq.runnertype.application.reconciler.Reconciler;
import com.ryuqq.runnertype.application.registrar.RunnerTypeRegistrar;
import com.ryuqq.runnertype.application.registrar.RunnerTypeRegistrationException;
import com.ryuqq.runnertype.core.catalog.RunnerTypeCatalog;
import com.ryuqq.runnertype.core.outcome.Failed;
import com.ryuqq.runnertype.core.spi.AuditSink;
import com.ryuqq.runnertype.core.spi.RunnerTypeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 시작 시점 Runner Type 등록 컴포넌트.
 *
 * <p>카탈로그, 저장소, 감사 채널, Reconciler를 묶어 한 번의 등록 패스를 실행하고
 * 결과를 로그로 남깁니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. reconciler.reconcile(catalog, store, auditSink, includeExperimental)
 * 2. 실패한 정의마다 ERROR 로그
 * 3. created/updated/skipped/failed 요약 INFO 로그
 * 4. register()이고 failOnError=true이며 실패가 있으면 RunnerTypeRegistrationException
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StartupRegistrar registrar = new StartupRegistrar(
 *     new BuiltinRunnerTypeCatalog(), store, new Slf4jAuditSink(),
 *     new DefaultReconciler(), new RegistrarConfig());
 *
 * ReconciliationReport report = registrar.register();
 * </pre>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public final class StartupRegistrar implements RunnerTypeRegistrar {

    private static final Logger log = LoggerFactory.getLogger(StartupRegistrar.class);

    private final RunnerTypeCatalog catalog;
    private final RunnerTypeStore store;
    private final AuditSink auditSink;
    private final Reconciler reconciler;
    private final RegistrarConfig config;

    /**
     * 기본 Reconciler와 기본 설정으로 생성.
     *
     * @param catalog 정의 카탈로그
     * @param store 레코드 저장소
     * @param auditSink 감사 채널
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StartupRegistrar(RunnerTypeCatalog catalog, RunnerTypeStore store, AuditSink auditSink) {
        this(catalog, store, auditSink, new DefaultReconciler(), new RegistrarConfig());
    }

    /**
     * 생성자.
     *
     * @param catalog 정의 카탈로그
     * @param store 레코드 저장소
     * @param auditSink 감사 채널
     * @param reconciler 재조정자
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StartupRegistrar(
        RunnerTypeCatalog catalog,
        RunnerTypeStore store,
        AuditSink auditSink,
        Reconciler reconciler,
        RegistrarConfig config
    ) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (auditSink == null) {
            throw new IllegalArgumentException("auditSink cannot be null");
        }
        if (reconciler == null) {
            throw new IllegalArgumentException("reconciler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.catalog = catalog;
        this.store = store;
        this.auditSink = auditSink;
        this.reconciler = reconciler;
        this.config = config;
    }

    /**
     * 설정에 따라 등록.
     *
     * @return 재조정 결과
     * @throws RunnerTypeRegistrationException failOnError=true이고 실패한 정의가 있는 경우
     */
    public ReconciliationReport register() {
        ReconciliationReport report = registerRunnerTypes(config.includeExperimental());
        if (config.failOnError() && report.hasFailures()) {
            throw new RunnerTypeRegistrationException(report);
        }
        return report;
    }

    /**
     * {@inheritDoc}
     *
     * <p>failOnError 설정과 무관하게 항상 결과를 반환합니다.</p>
     */
    @Override
    public ReconciliationReport registerRunnerTypes(boolean includeExperimental) {
        log.debug("Start : register default RunnerTypes.");

        ReconciliationReport report = new ReconciliationReport(
            reconciler.reconcile(catalog, store, auditSink, includeExperimental)
        );

        for (Failed failed : report.failed()) {
            log.error("RunnerType {} not registered [{}]: {}",
                failed.definitionName(), failed.errorCode(), failed.message());
        }
        log.info("RunnerType registration finished: {}", report.summary());

        log.debug("End : register default RunnerTypes.");
        return report;
    }
}
