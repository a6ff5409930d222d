package com.ryuqq.runnertype.core.model;

/**
 * 저장소가 부여하는 RunnerTypeRecord 식별자.
 *
 * <p>값의 형식은 저장소 구현에 따라 다르며(UUID, ObjectId 등) 코어는 이를 해석하지 않습니다.
 * 최초 생성 시 한 번 부여되고, 같은 이름의 레코드가 갱신될 때마다 그대로 유지되어야 합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public final class RunnerTypeId {

    private final String value;

    private RunnerTypeId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RunnerTypeId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("RunnerTypeId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * RunnerTypeId 생성.
     *
     * @param value 식별자 값
     * @return RunnerTypeId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RunnerTypeId of(String value) {
        return new RunnerTypeId(value);
    }

    /**
     * 식별자 값 조회.
     *
     * @return 식별자 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunnerTypeId that = (RunnerTypeId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RunnerTypeId{" + value + '}';
    }
}
