/**
 * Bootstrap Adapter Layer - 시작 시점 등록 구현체.
 *
 * <p>이 패키지는 application 계층 인터페이스의 구체적인 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runnertype.adapter.bootstrap.DefaultReconciler} - 정의별 실패 격리 재조정 패스</li>
 *   <li>{@link com.ryuqq.runnertype.adapter.bootstrap.StartupRegistrar} - register_runner_types 진입점</li>
 *   <li>{@link com.ryuqq.runnertype.adapter.bootstrap.Slf4jAuditSink} - SLF4J 감사 로그</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-bootstrap (DefaultReconciler, StartupRegistrar)
 *   ↓ implements
 * application (Reconciler, RunnerTypeRegistrar)
 *   ↓ depends on
 * core (catalog, model, outcome, spi, validation)
 * </pre>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
package com.ryuqq.runnertype.adapter.bootstrap;
