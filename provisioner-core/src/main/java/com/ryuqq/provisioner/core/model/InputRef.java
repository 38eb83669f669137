package com.ryuqq.provisioner.core.model;

import java.util.List;

/**
 * 선행 단계의 출력(식별자)을 파라미터로 요구하는 선언.
 *
 * <p>단일 값 입력은 식별자 문자열 하나로, 목록 입력은 선언 순서대로 식별자 목록으로 해석됩니다.</p>
 *
 * @param parameter 해석된 값을 받을 파라미터 이름
 * @param sources 식별자를 제공하는 논리 이름들 (1개 이상)
 * @param listValued 목록으로 해석할지 여부
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record InputRef(
    String parameter,
    List<LogicalName> sources,
    boolean listValued
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 이름이 비었거나 sources가 유효하지 않은 경우
     */
    public InputRef {
        if (parameter == null || parameter.isBlank()) {
            throw new IllegalArgumentException("parameter cannot be null or blank");
        }
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("sources cannot be null or empty");
        }
        if (!listValued && sources.size() != 1) {
            throw new IllegalArgumentException(
                "single-valued input '" + parameter + "' must have exactly one source (current: " + sources.size() + ")");
        }
        sources = List.copyOf(sources);
    }

    /**
     * 단일 값 입력 생성.
     */
    public static InputRef single(String parameter, LogicalName source) {
        return new InputRef(parameter, List.of(source), false);
    }

    /**
     * 목록 입력 생성.
     */
    public static InputRef list(String parameter, List<LogicalName> sources) {
        return new InputRef(parameter, sources, true);
    }
}
