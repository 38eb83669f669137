package com.ryuqq.provisioner.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 생성할 리소스 하나에 대한 불변 명세.
 *
 * <p>종류, 논리 이름, 고정 파라미터, 그리고 선행 단계로부터 받아야 하는 입력 목록으로 구성됩니다.
 * 예: Subnet은 VirtualNetwork의 식별자를 {@code vpcId} 입력으로 요구합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ResourceSpec subnet = ResourceSpec.builder(ResourceKind.SUBNET, LogicalName.of("demo-pub-eu-central-1a"))
 *     .parameter(ParameterKeys.CIDR_BLOCK, "10.201.1.0/24")
 *     .parameter(ParameterKeys.AVAILABILITY_ZONE, "eu-central-1a")
 *     .input(ParameterKeys.VPC_ID, LogicalName.of("demo-vpc"))
 *     .build();
 * </pre>
 *
 * @param kind 리소스 종류
 * @param name 논리 이름
 * @param parameters 고정 파라미터
 * @param inputs 선행 단계 출력 입력 목록
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ResourceSpec(
    ResourceKind kind,
    LogicalName name,
    ResourceParameters parameters,
    List<InputRef> inputs
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 입력 파라미터 이름이 중복/충돌하는 경우
     */
    public ResourceSpec {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters cannot be null");
        }
        if (inputs == null) {
            throw new IllegalArgumentException("inputs cannot be null");
        }
        Set<String> seen = new LinkedHashSet<>();
        for (InputRef input : inputs) {
            if (!seen.add(input.parameter())) {
                throw new IllegalArgumentException(
                    "duplicate input parameter '" + input.parameter() + "' in " + name);
            }
            if (parameters.contains(input.parameter())) {
                throw new IllegalArgumentException(
                    "input parameter '" + input.parameter() + "' shadows a fixed parameter in " + name);
            }
            if (input.sources().contains(name)) {
                throw new IllegalArgumentException(name + " cannot depend on itself");
            }
        }
        inputs = List.copyOf(inputs);
    }

    /**
     * 이 명세가 요구하는 모든 논리 이름 (선언 순서, 중복 제거).
     *
     * @return 의존 논리 이름 집합
     */
    public Set<LogicalName> dependencies() {
        Set<LogicalName> names = new LinkedHashSet<>();
        for (InputRef input : inputs) {
            names.addAll(input.sources());
        }
        return names;
    }

    /**
     * 특정 파라미터로 선언된 입력 조회.
     *
     * @param parameter 파라미터 이름
     * @return 입력 선언, 없으면 null
     */
    public InputRef inputOrNull(String parameter) {
        for (InputRef input : inputs) {
            if (input.parameter().equals(parameter)) {
                return input;
            }
        }
        return null;
    }

    public static Builder builder(ResourceKind kind, LogicalName name) {
        return new Builder(kind, name);
    }

    /**
     * ResourceSpec 빌더.
     */
    public static final class Builder {

        private final ResourceKind kind;
        private final LogicalName name;
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final List<InputRef> inputs = new ArrayList<>();

        private Builder(ResourceKind kind, LogicalName name) {
            this.kind = kind;
            this.name = name;
        }

        public Builder parameter(String key, Object value) {
            parameters.put(key, value);
            return this;
        }

        public Builder input(String parameter, LogicalName source) {
            inputs.add(InputRef.single(parameter, source));
            return this;
        }

        public Builder inputs(String parameter, List<LogicalName> sources) {
            inputs.add(InputRef.list(parameter, sources));
            return this;
        }

        public ResourceSpec build() {
            return new ResourceSpec(kind, name, ResourceParameters.of(parameters), inputs);
        }
    }
}
