package com.ryuqq.runnertype.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 카탈로그의 단위인 Runner Type 정의.
 *
 * <p>실행 백엔드 하나의 식별자, 활성/실험 상태, 파라미터 목록,
 * 구현 모듈 참조를 기술합니다. 프로세스 시작 시 정적으로 한 번 생성되며
 * 실행 중에는 변경되지 않습니다. 직접 저장되지 않고 {@link RunnerTypeRecord}로 변환되어 저장됩니다.</p>
 *
 * <p><strong>불변성:</strong> parameters는 삽입 순서를 유지하는 수정 불가능한 Map입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RunnerTypeDefinition runLocal = RunnerTypeDefinition.builder("run-local")
 *     .description("A runner to execute local actions as a fixed user.")
 *     .runnerModule("st2actions.runners.localrunner")
 *     .parameter(ParameterSpec.of("timeout", ParameterType.INTEGER, "Action timeout.").withDefault(60))
 *     .build();
 * </pre>
 *
 * @param name 이름 (전역 고유, 자연키)
 * @param description 설명
 * @param enabled 활성 여부
 * @param experimental 실험 단계 여부 (선택 플래그, 저장되지 않음)
 * @param runnerModule 백엔드 구현 모듈 참조
 * @param queryModule 비동기 상태 조회 모듈 참조 (선택, null 가능)
 * @param parameters 파라미터 이름 → ParameterSpec
 * @param duplicateParameterNames Builder에 두 번 이상 추가된 파라미터 이름 (검증기가 위반으로 보고)
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public record RunnerTypeDefinition(
    String name,
    String description,
    boolean enabled,
    boolean experimental,
    String runnerModule,
    String queryModule,
    Map<String, ParameterSpec> parameters,
    List<String> duplicateParameterNames
) {

    /**
     * Compact Constructor.
     *
     * <p>parameters, duplicateParameterNames가 null이면 비어 있는 컬렉션으로 대체합니다.</p>
     */
    public RunnerTypeDefinition {
        parameters = parameters == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        duplicateParameterNames = duplicateParameterNames == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(duplicateParameterNames));
    }

    /**
     * 중복 파라미터 없이 생성.
     */
    public RunnerTypeDefinition(
        String name,
        String description,
        boolean enabled,
        boolean experimental,
        String runnerModule,
        String queryModule,
        Map<String, ParameterSpec> parameters
    ) {
        this(name, description, enabled, experimental, runnerModule, queryModule, parameters, null);
    }

    /**
     * Builder 생성.
     *
     * @param name Runner Type 이름
     * @return Builder 인스턴스 (enabled=true, experimental=false)
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * 비동기 조회 모듈 보유 여부.
     *
     * @return queryModule이 있으면 true
     */
    public boolean hasQueryModule() {
        return queryModule != null;
    }

    /**
     * RunnerTypeDefinition Builder.
     */
    public static final class Builder {

        private final String name;
        private String description = "";
        private boolean enabled = true;
        private boolean experimental;
        private String runnerModule;
        private String queryModule;
        private final Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        private final List<String> duplicateParameterNames = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder experimental(boolean experimental) {
            this.experimental = experimental;
            return this;
        }

        public Builder runnerModule(String runnerModule) {
            this.runnerModule = runnerModule;
            return this;
        }

        public Builder queryModule(String queryModule) {
            this.queryModule = queryModule;
            return this;
        }

        /**
         * 파라미터 추가. 같은 이름이 이미 있으면 교체되고, 그 이름은 중복으로 기록됩니다.
         *
         * @param spec 파라미터 정의
         * @return this
         * @throws IllegalArgumentException spec이 null인 경우
         */
        public Builder parameter(ParameterSpec spec) {
            if (spec == null) {
                throw new IllegalArgumentException("spec cannot be null");
            }
            if (parameters.put(spec.name(), spec) != null) {
                duplicateParameterNames.add(spec.name());
            }
            return this;
        }

        public RunnerTypeDefinition build() {
            return new RunnerTypeDefinition(
                name, description, enabled, experimental, runnerModule, queryModule, parameters,
                duplicateParameterNames
            );
        }
    }
}
