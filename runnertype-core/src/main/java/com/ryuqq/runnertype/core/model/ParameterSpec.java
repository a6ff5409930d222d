package com.ryuqq.runnertype.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runner Type이 받는 단일 파라미터 정의.
 *
 * <p>ParameterSpec은 값만 담는 불변 record입니다. {@code required}와 {@code defaultValue}의
 * 상호 배제 같은 정합성 규칙은 등록 시점에
 * {@link com.ryuqq.runnertype.core.validation.RunnerTypeDefinitionValidator}가 검증하여
 * 카탈로그 작성자가 어떤 정의가 잘못되었는지 정확히 알 수 있도록 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ParameterSpec timeout = ParameterSpec.of("timeout", ParameterType.INTEGER, "Action timeout in seconds.")
 *     .withDefault(60);
 *
 * ParameterSpec hosts = ParameterSpec.of("hosts", ParameterType.STRING, "Target hosts.")
 *     .asRequired();
 * </pre>
 *
 * @param name 파라미터 이름 (정의 내 고유)
 * @param description 설명
 * @param type 값 타입
 * @param required 필수 여부
 * @param defaultValue 기본값 (선택, null이면 없음)
 * @param immutable true이면 하위 호출자가 값을 덮어쓸 수 없음
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public record ParameterSpec(
    String name,
    String description,
    ParameterType type,
    boolean required,
    Object defaultValue,
    boolean immutable
) {

    /**
     * Compact Constructor.
     *
     * <p>Map/List 기본값은 중첩된 컨테이너까지 수정 불가능한 복사본으로 보관합니다.
     * 호출자가 원본을 수정해도 정의와 저장된 레코드는 바뀌지 않습니다.</p>
     */
    public ParameterSpec {
        defaultValue = deepCopy(defaultValue);
    }

    /**
     * 선택 파라미터 생성 (기본값 없음, 변경 가능).
     *
     * @param name 파라미터 이름
     * @param type 값 타입
     * @param description 설명
     * @return ParameterSpec 인스턴스
     */
    public static ParameterSpec of(String name, ParameterType type, String description) {
        return new ParameterSpec(name, description, type, false, null, false);
    }

    /**
     * 기본값을 지정한 새 인스턴스 생성.
     *
     * @param value 기본값
     * @return 새 ParameterSpec 인스턴스
     */
    public ParameterSpec withDefault(Object value) {
        return new ParameterSpec(name, description, type, required, value, immutable);
    }

    /**
     * 필수 파라미터로 표시한 새 인스턴스 생성.
     *
     * @return 새 ParameterSpec 인스턴스
     */
    public ParameterSpec asRequired() {
        return new ParameterSpec(name, description, type, true, defaultValue, immutable);
    }

    /**
     * 불변 파라미터로 표시한 새 인스턴스 생성.
     *
     * @return 새 ParameterSpec 인스턴스
     */
    public ParameterSpec asImmutable() {
        return new ParameterSpec(name, description, type, required, defaultValue, true);
    }

    /**
     * 기본값 존재 여부.
     *
     * @return 기본값이 있으면 true
     */
    public boolean hasDefault() {
        return defaultValue != null;
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(entry.getKey(), deepCopy(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(deepCopy(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
