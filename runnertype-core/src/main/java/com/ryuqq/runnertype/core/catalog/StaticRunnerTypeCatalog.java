package com.ryuqq.runnertype.core.catalog;

import com.ryuqq.runnertype.core.model.RunnerTypeDefinition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 호출자가 제공한 정의 목록을 그대로 노출하는 카탈로그.
 *
 * <p>생성 시 목록을 복사하므로 이후 원본 목록을 변경해도 영향을 받지 않습니다.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public final class StaticRunnerTypeCatalog implements RunnerTypeCatalog {

    private final List<RunnerTypeDefinition> definitions;

    private StaticRunnerTypeCatalog(List<RunnerTypeDefinition> definitions) {
        if (definitions == null) {
            throw new IllegalArgumentException("definitions cannot be null");
        }
        List<RunnerTypeDefinition> copy = new ArrayList<>(definitions.size());
        for (RunnerTypeDefinition definition : definitions) {
            if (definition == null) {
                throw new IllegalArgumentException("definitions cannot contain null");
            }
            copy.add(definition);
        }
        this.definitions = Collections.unmodifiableList(copy);
    }

    /**
     * 목록으로부터 카탈로그 생성.
     *
     * @param definitions 정의 목록
     * @return StaticRunnerTypeCatalog 인스턴스
     * @throws IllegalArgumentException 목록이 null이거나 null 원소를 포함한 경우
     */
    public static StaticRunnerTypeCatalog of(List<RunnerTypeDefinition> definitions) {
        return new StaticRunnerTypeCatalog(definitions);
    }

    /**
     * 가변 인자로부터 카탈로그 생성.
     *
     * @param definitions 정의들
     * @return StaticRunnerTypeCatalog 인스턴스
     */
    public static StaticRunnerTypeCatalog of(RunnerTypeDefinition... definitions) {
        return new StaticRunnerTypeCatalog(Arrays.asList(definitions));
    }

    @Override
    public List<RunnerTypeDefinition> definitions() {
        return definitions;
    }
}
