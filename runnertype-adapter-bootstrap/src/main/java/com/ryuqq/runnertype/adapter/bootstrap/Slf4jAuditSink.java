package com.ryuqq.runnertype.adapter.bootstrap;

import com.ryuqq.runnertype.core.spi.AuditEvent;
import com.ryuqq.runnertype.core.spi.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J 로거로 감사 이벤트를 기록하는 AuditSink.
 *
 * <p>기본 로거 이름은 {@value #DEFAULT_LOGGER_NAME}이며 로깅 설정에서 감사 로그만
 * 별도 appender로 분리할 수 있습니다.</p>
 *
 * <p><strong>로그 형식:</strong></p>
 * <pre>
 * RunnerType created. RunnerType run-local (id=..., enabled=true, runner_module=..., parameters=6) at 2024-01-01T00:00:00Z
 * RunnerType updated. RunnerType run-local (id=..., ...) at ...
 * </pre>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public final class Slf4jAuditSink implements AuditSink {

    /**
     * 기본 감사 로거 이름.
     */
    public static final String DEFAULT_LOGGER_NAME = "AUDIT";

    private final Logger logger;

    public Slf4jAuditSink() {
        this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
    }

    /**
     * 생성자.
     *
     * @param logger 감사 로거
     * @throws IllegalArgumentException logger가 null인 경우
     */
    public Slf4jAuditSink(Logger logger) {
        if (logger == null) {
            throw new IllegalArgumentException("logger cannot be null");
        }
        this.logger = logger;
    }

    @Override
    public void record(AuditEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        String verb;
        switch (event.action()) {
            case CREATED:
                verb = "created";
                break;
            case UPDATED:
                verb = "updated";
                break;
            default:
                throw new IllegalStateException("Unexpected audit action: " + event.action());
        }
        logger.info("RunnerType {}. RunnerType {} (id={}, enabled={}, runner_module={}, parameters={}) at {}",
            verb,
            event.name(),
            event.snapshot().hasId() ? event.snapshot().id().getValue() : null,
            event.snapshot().enabled(),
            event.snapshot().runnerModule(),
            event.snapshot().parameters().size(),
            event.occurredAt());
    }
}
