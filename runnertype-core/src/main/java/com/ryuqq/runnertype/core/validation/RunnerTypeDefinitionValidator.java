package com.ryuqq.runnertype.core.validation;

import com.ryuqq.runnertype.core.model.ParameterSpec;
import com.ryuqq.runnertype.core.model.RunnerTypeDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runner Type 정의 형식 검증기.
 *
 * <p>정의 하나를 검사하여 발견된 위반 사항을 모두 모은 뒤 한 번에
 * {@link ValidationException}으로 보고합니다.</p>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>name, runnerModule: null 또는 빈 문자열 불가</li>
 *   <li>description: null 불가 (빈 문자열 허용)</li>
 *   <li>queryModule: 지정된 경우 빈 문자열 불가</li>
 *   <li>파라미터 Map의 키와 {@link ParameterSpec#name()} 일치</li>
 *   <li>같은 이름의 파라미터 중복 선언 불가</li>
 *   <li>파라미터 name, type, description 필수</li>
 *   <li>required=true이면 기본값 불가</li>
 *   <li>기본값은 선언된 타입과 일치</li>
 * </ul>
 *
 * <p>상태가 없으므로 스레드 안전합니다.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public final class RunnerTypeDefinitionValidator {

    /**
     * 정의 검증.
     *
     * @param definition 검증할 정의
     * @throws IllegalArgumentException definition이 null인 경우
     * @throws ValidationException 위반 사항이 하나 이상 있는 경우
     */
    public void validate(RunnerTypeDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }

        List<String> violations = new ArrayList<>();

        if (isBlank(definition.name())) {
            violations.add("name is required");
        }
        if (definition.description() == null) {
            violations.add("description is required");
        }
        if (isBlank(definition.runnerModule())) {
            violations.add("runner_module is required");
        }
        if (definition.queryModule() != null && definition.queryModule().isBlank()) {
            violations.add("query_module must not be blank when present");
        }

        for (Map.Entry<String, ParameterSpec> entry : definition.parameters().entrySet()) {
            validateParameter(entry.getKey(), entry.getValue(), violations);
        }
        for (String duplicate : definition.duplicateParameterNames()) {
            violations.add("parameter '" + duplicate + "': declared more than once");
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(definition.name(), violations);
        }
    }

    private void validateParameter(String key, ParameterSpec spec, List<String> violations) {
        String prefix = "parameter '" + key + "': ";

        if (spec == null) {
            violations.add(prefix + "parameter definition is missing");
            return;
        }
        if (isBlank(spec.name())) {
            violations.add(prefix + "name is required");
        } else if (!spec.name().equals(key)) {
            violations.add(prefix + "declared name '" + spec.name() + "' does not match its key");
        }
        if (spec.description() == null) {
            violations.add(prefix + "description is required");
        }
        if (spec.type() == null) {
            violations.add(prefix + "type is required");
        }
        if (spec.required() && spec.hasDefault()) {
            violations.add(prefix + "a required parameter cannot declare a default value");
        }
        if (spec.type() != null && spec.hasDefault() && !spec.type().accepts(spec.defaultValue())) {
            violations.add(prefix + "default value " + spec.defaultValue()
                + " is not of type " + spec.type().wireName());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
