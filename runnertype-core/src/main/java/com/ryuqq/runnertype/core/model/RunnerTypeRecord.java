package com.ryuqq.runnertype.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 저장소에 영속화되는 Runner Type 레코드.
 *
 * <p>{@link RunnerTypeDefinition}의 필드 중 {@code experimental}을 제외한 모든 필드와
 * 저장소가 부여한 식별자 {@code id}를 가집니다. experimental은 등록 대상 선택에만 쓰이는
 * 플래그이므로 레코드에 포함되지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>저장소에는 이름당 정확히 하나의 레코드만 존재</li>
 *   <li>id는 최초 생성 시 부여되며 이후 갱신에서 재생성되지 않음</li>
 * </ul>
 *
 * @param id 저장소 식별자 (저장 전에는 null)
 * @param name 이름 (자연키)
 * @param description 설명
 * @param enabled 활성 여부
 * @param runnerModule 백엔드 구현 모듈 참조
 * @param queryModule 비동기 상태 조회 모듈 참조 (null 가능)
 * @param parameters 파라미터 이름 → ParameterSpec
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public record RunnerTypeRecord(
    RunnerTypeId id,
    String name,
    String description,
    boolean enabled,
    String runnerModule,
    String queryModule,
    Map<String, ParameterSpec> parameters
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public RunnerTypeRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        parameters = parameters == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        // id는 null 허용 (저장 전)
    }

    /**
     * 정의로부터 식별자 없는 레코드 생성.
     *
     * <p>experimental 플래그는 복사되지 않습니다.</p>
     *
     * @param definition Runner Type 정의
     * @return id가 없는 RunnerTypeRecord
     * @throws IllegalArgumentException definition이 null인 경우
     */
    public static RunnerTypeRecord fromDefinition(RunnerTypeDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        return new RunnerTypeRecord(
            null,
            definition.name(),
            definition.description(),
            definition.enabled(),
            definition.runnerModule(),
            definition.queryModule(),
            definition.parameters()
        );
    }

    /**
     * id만 변경한 새 인스턴스 생성.
     *
     * @param id 저장소 식별자
     * @return 새 RunnerTypeRecord 인스턴스
     */
    public RunnerTypeRecord withId(RunnerTypeId id) {
        return new RunnerTypeRecord(id, name, description, enabled, runnerModule, queryModule, parameters);
    }

    /**
     * 식별자 보유 여부.
     *
     * @return id가 있으면 true
     */
    public boolean hasId() {
        return id != null;
    }

    /**
     * id를 제외한 내용 비교.
     *
     * @param other 비교 대상
     * @return id 외 모든 필드가 같으면 true
     */
    public boolean hasSameContentAs(RunnerTypeRecord other) {
        if (other == null) {
            return false;
        }
        return enabled == other.enabled
            && name.equals(other.name)
            && Objects.equals(description, other.description)
            && Objects.equals(runnerModule, other.runnerModule)
            && Objects.equals(queryModule, other.queryModule)
            && parameters.equals(other.parameters);
    }
}
