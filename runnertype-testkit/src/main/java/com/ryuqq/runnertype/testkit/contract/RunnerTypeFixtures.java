package com.ryuqq.runnertype.testkit.contract;

import com.ryuqq.runnertype.core.model.ParameterSpec;
import com.ryuqq.runnertype.core.model.ParameterType;
import com.ryuqq.runnertype.core.model.RunnerTypeDefinition;

/**
 * Reusable runner type definitions for contract tests.
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public final class RunnerTypeFixtures {

    private RunnerTypeFixtures() {
    }

    /**
     * A valid, non-experimental definition with a single integer parameter.
     *
     * @param name the runner type name
     * @param timeoutDefault default of the {@code timeout} parameter
     * @return a valid definition
     */
    public static RunnerTypeDefinition validDefinition(String name, int timeoutDefault) {
        return RunnerTypeDefinition.builder(name)
            .description("Runner " + name)
            .runnerModule("runners." + name.replace('-', '_'))
            .parameter(ParameterSpec.of("timeout", ParameterType.INTEGER, "Action timeout in seconds.")
                .withDefault(timeoutDefault))
            .build();
    }

    /**
     * A valid, non-experimental definition.
     *
     * @param name the runner type name
     * @return a valid definition
     */
    public static RunnerTypeDefinition validDefinition(String name) {
        return validDefinition(name, 60);
    }

    /**
     * A valid definition marked experimental.
     *
     * @param name the runner type name
     * @return an experimental definition
     */
    public static RunnerTypeDefinition experimentalDefinition(String name) {
        return RunnerTypeDefinition.builder(name)
            .description("Experimental runner " + name)
            .experimental(true)
            .runnerModule("runners." + name.replace('-', '_'))
            .parameter(ParameterSpec.of("host", ParameterType.STRING, "Target host.").asRequired())
            .build();
    }

    /**
     * A definition whose parameter is both required and defaulted.
     *
     * @param name the runner type name
     * @return a definition that fails validation
     */
    public static RunnerTypeDefinition requiredWithDefaultDefinition(String name) {
        return RunnerTypeDefinition.builder(name)
            .description("Broken runner " + name)
            .runnerModule("runners." + name.replace('-', '_'))
            .parameter(ParameterSpec.of("username", ParameterType.STRING, "Username.")
                .withDefault("Administrator")
                .asRequired())
            .build();
    }

    /**
     * A definition without a runner module.
     *
     * @param name the runner type name
     * @return a definition that fails validation
     */
    public static RunnerTypeDefinition missingRunnerModuleDefinition(String name) {
        return RunnerTypeDefinition.builder(name)
            .description("Runner without module " + name)
            .build();
    }
}
