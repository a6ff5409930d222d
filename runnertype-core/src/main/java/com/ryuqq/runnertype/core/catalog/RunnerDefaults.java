package com.ryuqq.runnertype.core.catalog;

/**
 * 내장 Runner Type의 기본값 상수.
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public final class RunnerDefaults {

    /**
     * 로컬 액션 기본 타임아웃 (초).
     */
    public static final int LOCAL_RUNNER_DEFAULT_ACTION_TIMEOUT = 60;

    /**
     * 원격 액션 기본 타임아웃 (초).
     */
    public static final int REMOTE_RUNNER_DEFAULT_ACTION_TIMEOUT = 60;

    /**
     * 원격 호스트의 스크립트 복사 디렉터리.
     */
    public static final String REMOTE_RUNNER_DEFAULT_REMOTE_DIR = "/tmp";

    /**
     * Python 액션 기본 타임아웃 (초).
     */
    public static final int PYTHON_RUNNER_DEFAULT_ACTION_TIMEOUT = 10 * 60;

    public static final String WINDOWS_RUNNER_DEFAULT_USERNAME = "Administrator";

    public static final String WINDOWS_RUNNER_DEFAULT_SHARE = "C$";

    /**
     * 키워드 인자 앞에 붙는 기본 연산자.
     */
    public static final String DEFAULT_KWARG_OP = "--";

    private RunnerDefaults() {
    }
}
