package com.ryuqq.runnertype.core.model;

import java.util.Locale;
import java.util.Map;

/**
 * Runner 파라미터의 값 타입.
 *
 * <p>각 타입은 직렬화 시 사용되는 wire name과 기본값 타입 검사 규칙을 가집니다.</p>
 *
 * <ul>
 *   <li>STRING ("string"): {@link CharSequence}</li>
 *   <li>INTEGER ("integer"): {@link Integer}, {@link Long}, {@link Short}, {@link Byte}</li>
 *   <li>BOOLEAN ("boolean"): {@link Boolean}</li>
 *   <li>OBJECT ("object"): {@link Map}</li>
 * </ul>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public enum ParameterType {

    /**
     * 문자열.
     */
    STRING("string"),

    /**
     * 정수.
     */
    INTEGER("integer"),

    /**
     * 불리언.
     */
    BOOLEAN("boolean"),

    /**
     * 키-값 객체.
     */
    OBJECT("object");

    private final String wireName;

    ParameterType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 직렬화 이름 조회.
     *
     * @return wire name (예: "integer")
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 값이 이 타입에 부합하는지 확인.
     *
     * @param value 검사할 값 (null이면 false)
     * @return 타입이 일치하면 true
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return false;
        }
        switch (this) {
            case STRING:
                return value instanceof CharSequence;
            case INTEGER:
                return value instanceof Integer
                    || value instanceof Long
                    || value instanceof Short
                    || value instanceof Byte;
            case BOOLEAN:
                return value instanceof Boolean;
            case OBJECT:
                return value instanceof Map;
            default:
                return false;
        }
    }

    /**
     * wire name으로 ParameterType 조회 (대소문자 무시).
     *
     * @param wireName wire name (예: "string")
     * @return ParameterType
     * @throws IllegalArgumentException null이거나 알 수 없는 이름인 경우
     */
    public static ParameterType fromWireName(String wireName) {
        if (wireName == null || wireName.isBlank()) {
            throw new IllegalArgumentException("wireName cannot be null or blank");
        }
        String normalized = wireName.trim().toLowerCase(Locale.ROOT);
        for (ParameterType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown parameter type: " + wireName);
    }
}
