package com.ryuqq.runnertype.core.catalog;

import com.ryuqq.runnertype.core.model.RunnerTypeDefinition;

import java.util.List;

/**
 * Runner Type 정의의 정규 목록 공급자.
 *
 * <p>순서가 있는 불변 목록을 반환하며 부수 효과가 없어야 합니다.
 * 형식 검증은 수행하지 않습니다. 검증은 재조정 시 정의별로 수행됩니다.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RunnerTypeCatalog {

    /**
     * 정의 목록 조회.
     *
     * @return 카탈로그 순서를 유지하는 수정 불가능한 목록
     */
    List<RunnerTypeDefinition> definitions();
}
