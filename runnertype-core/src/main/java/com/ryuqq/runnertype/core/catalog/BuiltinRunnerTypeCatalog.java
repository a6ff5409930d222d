package com.ryuqq.runnertype.core.catalog;

import com.ryuqq.runnertype.core.model.ParameterSpec;
import com.ryuqq.runnertype.core.model.ParameterType;
import com.ryuqq.runnertype.core.model.RunnerTypeDefinition;

import java.util.List;
import java.util.Map;

import static com.ryuqq.runnertype.core.catalog.RunnerDefaults.*;

/**
 * 시스템에 기본 등록되는 Runner Type 카탈로그.
 *
 * <p><strong>정의 순서:</strong></p>
 * <ol>
 *   <li>run-local, run-local-script: 로컬 명령/스크립트</li>
 *   <li>run-remote, run-remote-script: SSH 원격 명령/스크립트</li>
 *   <li>http-runner: HTTP 호출</li>
 *   <li>mistral-v1, mistral-v2: 워크플로 엔진 (v2는 비동기 상태 조회 모듈 보유)</li>
 *   <li>action-chain: 선형 액션 체인</li>
 *   <li>run-python: Python 액션</li>
 *   <li>run-windows-cmd, run-windows-script: Windows 원격 실행 (experimental)</li>
 * </ol>
 *
 * <p>정의 목록은 클래스 로딩 시 한 번 생성되며 모든 호출에서 같은 불변 목록을 반환합니다.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public final class BuiltinRunnerTypeCatalog implements RunnerTypeCatalog {

    public static final String RUN_LOCAL = "run-local";
    public static final String RUN_LOCAL_SCRIPT = "run-local-script";
    public static final String RUN_REMOTE = "run-remote";
    public static final String RUN_REMOTE_SCRIPT = "run-remote-script";
    public static final String HTTP_RUNNER = "http-runner";
    public static final String MISTRAL_V1 = "mistral-v1";
    public static final String MISTRAL_V2 = "mistral-v2";
    public static final String ACTION_CHAIN = "action-chain";
    public static final String RUN_PYTHON = "run-python";
    public static final String RUN_WINDOWS_CMD = "run-windows-cmd";
    public static final String RUN_WINDOWS_SCRIPT = "run-windows-script";

    private static final List<RunnerTypeDefinition> DEFINITIONS = List.of(
        runLocal(),
        runLocalScript(),
        runRemote(),
        runRemoteScript(),
        httpRunner(),
        mistralV1(),
        mistralV2(),
        actionChain(),
        runPython(),
        runWindowsCmd(),
        runWindowsScript()
    );

    @Override
    public List<RunnerTypeDefinition> definitions() {
        return DEFINITIONS;
    }

    private static RunnerTypeDefinition runLocal() {
        return RunnerTypeDefinition.builder(RUN_LOCAL)
            .description("A runner to execute local actions as a fixed user.")
            .runnerModule("st2actions.runners.localrunner")
            .parameter(ParameterSpec.of("cmd", ParameterType.STRING,
                "Arbitrary Linux command to be executed on the host."))
            .parameter(ParameterSpec.of("cwd", ParameterType.STRING,
                "Working directory where the command will be executed in"))
            .parameter(env("command"))
            .parameter(sudo("The command will be executed with sudo."))
            .parameter(kwargOp())
            .parameter(timeout(LOCAL_RUNNER_DEFAULT_ACTION_TIMEOUT))
            .build();
    }

    private static RunnerTypeDefinition runLocalScript() {
        return RunnerTypeDefinition.builder(RUN_LOCAL_SCRIPT)
            .description("A runner to execute local actions as a fixed user.")
            .runnerModule("st2actions.runners.localrunner")
            .parameter(ParameterSpec.of("cwd", ParameterType.STRING,
                "Working directory where the script will be executed in"))
            .parameter(env("script"))
            .parameter(sudo("The command will be executed with sudo."))
            .parameter(kwargOp())
            .parameter(timeout(LOCAL_RUNNER_DEFAULT_ACTION_TIMEOUT))
            .build();
    }

    private static RunnerTypeDefinition runRemote() {
        return remoteBase(RUN_REMOTE)
            .parameter(ParameterSpec.of("cmd", ParameterType.STRING,
                "Arbitrary Linux command to be executed on the remote host(s)."))
            .parameter(ParameterSpec.of("cwd", ParameterType.STRING,
                "Working directory where the script will be executed in"))
            .parameter(env("command"))
            .parameter(parallel())
            .parameter(sudo("The remote command will be executed with sudo."))
            .parameter(remoteDir().asImmutable())
            .parameter(kwargOp())
            .parameter(timeout(REMOTE_RUNNER_DEFAULT_ACTION_TIMEOUT))
            .build();
    }

    private static RunnerTypeDefinition runRemoteScript() {
        return remoteBase(RUN_REMOTE_SCRIPT)
            .parameter(parallel())
            .parameter(ParameterSpec.of("cwd", ParameterType.STRING,
                    "Working directory where the script will be executed in.")
                .withDefault(REMOTE_RUNNER_DEFAULT_REMOTE_DIR))
            .parameter(env("script"))
            .parameter(sudo("The remote command will be executed with sudo."))
            .parameter(remoteDir())
            .parameter(kwargOp())
            .parameter(timeout(REMOTE_RUNNER_DEFAULT_ACTION_TIMEOUT))
            .build();
    }

    private static RunnerTypeDefinition httpRunner() {
        return RunnerTypeDefinition.builder(HTTP_RUNNER)
            .description("A HTTP client for running HTTP actions.")
            .runnerModule("st2actions.runners.httprunner")
            .parameter(ParameterSpec.of("url", ParameterType.STRING,
                "URL to the HTTP endpoint.").asRequired())
            .parameter(ParameterSpec.of("headers", ParameterType.STRING,
                "HTTP headers for the request."))
            .parameter(ParameterSpec.of("cookies", ParameterType.OBJECT,
                "Optional cookies to send with the request."))
            .parameter(ParameterSpec.of("http_proxy", ParameterType.STRING,
                "A URL of a HTTP proxy to use (e.g. http://10.10.1.10:3128)."))
            .parameter(ParameterSpec.of("https_proxy", ParameterType.STRING,
                "A URL of a HTTPs proxy to use (e.g. http://10.10.1.10:3128)."))
            .parameter(ParameterSpec.of("allow_redirects", ParameterType.BOOLEAN,
                "Set to True if POST/PUT/DELETE redirect following is allowed.").withDefault(false))
            .build();
    }

    private static RunnerTypeDefinition mistralV1() {
        return RunnerTypeDefinition.builder(MISTRAL_V1)
            .description("A runner for executing mistral v1 workflow.")
            .runnerModule("st2actions.runners.mistral.v1")
            .parameter(ParameterSpec.of("workbook", ParameterType.STRING,
                "The name of the workbook.").asRequired())
            .parameter(ParameterSpec.of("task", ParameterType.STRING,
                "The startup task in the workbook to execute.").asRequired())
            .parameter(ParameterSpec.of("context", ParameterType.OBJECT,
                "Context for the startup task.").withDefault(Map.of()))
            .build();
    }

    private static RunnerTypeDefinition mistralV2() {
        return RunnerTypeDefinition.builder(MISTRAL_V2)
            .description("A runner for executing mistral v2 workflow.")
            .runnerModule("st2actions.runners.mistral.v2")
            .queryModule("st2actions.query.mistral.v2")
            .parameter(ParameterSpec.of("workflow", ParameterType.STRING,
                "The name of the workflow to run if the entry_point is a workbook of many workflows. "
                    + "The name should be in the format \"<pack_name>.<action_name>.<workflow_name>\". "
                    + "If entry point is a workflow or a workbook with a single workflow, "
                    + "the runner will identify the workflow automatically."))
            .parameter(ParameterSpec.of("task", ParameterType.STRING,
                "The name of the task to run for reverse workflow."))
            .parameter(ParameterSpec.of("context", ParameterType.OBJECT,
                "Additional workflow inputs.").withDefault(Map.of()))
            .build();
    }

    private static RunnerTypeDefinition actionChain() {
        return RunnerTypeDefinition.builder(ACTION_CHAIN)
            .description("A runner for launching linear action chains.")
            .runnerModule("st2actions.runners.actionchainrunner")
            .build();
    }

    private static RunnerTypeDefinition runPython() {
        return RunnerTypeDefinition.builder(RUN_PYTHON)
            .description("A runner for launching python actions.")
            .runnerModule("st2actions.runners.pythonrunner")
            .parameter(env("script"))
            .parameter(timeout(PYTHON_RUNNER_DEFAULT_ACTION_TIMEOUT))
            .build();
    }

    private static RunnerTypeDefinition runWindowsCmd() {
        return windowsBase(RUN_WINDOWS_CMD,
                "A remote execution runner that executes commands on Windows hosts.")
            .runnerModule("st2actions.runners.windows_command_runner")
            .parameter(ParameterSpec.of("cmd", ParameterType.STRING,
                "Arbitrary command to be executed on the remote host."))
            .parameter(timeout(REMOTE_RUNNER_DEFAULT_ACTION_TIMEOUT))
            .build();
    }

    private static RunnerTypeDefinition runWindowsScript() {
        return windowsBase(RUN_WINDOWS_SCRIPT,
                "A remote execution runner that executes power shell scripts on Windows hosts.")
            .runnerModule("st2actions.runners.windows_script_runner")
            // 기본값이 있으므로 required 아님
            .parameter(ParameterSpec.of("share", ParameterType.STRING,
                "Name of the Windows share where script files are uploaded")
                .withDefault(WINDOWS_RUNNER_DEFAULT_SHARE))
            .parameter(timeout(REMOTE_RUNNER_DEFAULT_ACTION_TIMEOUT))
            .build();
    }

    // ============================================================
    // 공통 파라미터
    // ============================================================

    private static RunnerTypeDefinition.Builder remoteBase(String name) {
        return RunnerTypeDefinition.builder(name)
            .description("A remote execution runner that executes actions as a fixed system user.")
            .runnerModule("st2actions.runners.fabricrunner")
            .parameter(ParameterSpec.of("hosts", ParameterType.STRING,
                "A comma delimited string of a list of hosts where the remote command will be executed.")
                .asRequired())
            .parameter(ParameterSpec.of("username", ParameterType.STRING,
                "Username used to log-in. If not provided, default username from config is used."))
            .parameter(ParameterSpec.of("password", ParameterType.STRING,
                "Password used to log in. If not provided, private key from the config file is used."))
            .parameter(ParameterSpec.of("private_key", ParameterType.STRING,
                "Private key used to log in. If not provided, private key from the config file is used."));
    }

    /**
     * Windows 러너 공통 파라미터.
     *
     * <p>username(과 run-windows-script의 share)은 기본값을 가지므로 required로 표시하지 않습니다.
     * required 파라미터는 기본값을 선언할 수 없습니다.</p>
     */
    private static RunnerTypeDefinition.Builder windowsBase(String name, String description) {
        return RunnerTypeDefinition.builder(name)
            .description(description)
            .experimental(true)
            .parameter(ParameterSpec.of("host", ParameterType.STRING,
                "Host to execute the command on").asRequired())
            .parameter(ParameterSpec.of("username", ParameterType.STRING,
                "Username used to log-in.").withDefault(WINDOWS_RUNNER_DEFAULT_USERNAME))
            .parameter(ParameterSpec.of("password", ParameterType.STRING,
                "Password used to log in.").asRequired());
    }

    private static ParameterSpec env(String subject) {
        return ParameterSpec.of("env", ParameterType.OBJECT,
            "Environment variables which will be available to the " + subject
                + " (e.g. key1=val1,key2=val2)");
    }

    private static ParameterSpec sudo(String description) {
        return ParameterSpec.of("sudo", ParameterType.BOOLEAN, description).withDefault(false);
    }

    private static ParameterSpec kwargOp() {
        return ParameterSpec.of("kwarg_op", ParameterType.STRING,
            "Operator to use in front of keyword args i.e. \"--\" or \"-\".").withDefault(DEFAULT_KWARG_OP);
    }

    private static ParameterSpec timeout(int seconds) {
        return ParameterSpec.of("timeout", ParameterType.INTEGER,
            "Action timeout in seconds. Action will get killed if it doesn't finish in timeout seconds.")
            .withDefault(seconds);
    }

    private static ParameterSpec parallel() {
        return ParameterSpec.of("parallel", ParameterType.BOOLEAN, "Default to parallel execution.")
            .withDefault(true)
            .asImmutable();
    }

    private static ParameterSpec remoteDir() {
        return ParameterSpec.of("dir", ParameterType.STRING,
            "The working directory where the script will be copied to on the remote host.")
            .withDefault(REMOTE_RUNNER_DEFAULT_REMOTE_DIR);
    }
}
