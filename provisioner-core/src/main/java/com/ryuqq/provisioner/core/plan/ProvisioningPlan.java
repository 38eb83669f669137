package com.ryuqq.provisioner.core.plan;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.ResourceSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 위상 정렬된 리소스 명세 시퀀스.
 *
 * <p><strong>불변식:</strong> 모든 명세의 입력은 시퀀스상 앞선 명세가 생산하거나,
 * 계획의 외부 입력({@link #externalInputs()})으로 선언되어 있어야 합니다.
 * 위반은 런타임 장애가 아니라 프로그래밍 오류이므로 생성 시점에
 * {@link IllegalArgumentException}으로 거부합니다.</p>
 *
 * <p>외부 입력은 다른 계획이 생산할 이름입니다 (예: 플릿 계획은 네트워크 계획의 VPC와 서브넷을 소비).
 * {@link #then(ProvisioningPlan)}으로 두 계획을 이으면 앞 계획이 생산하는 외부 입력은 해소됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ProvisioningPlan implements Iterable<ResourceSpec> {

    private final List<ResourceSpec> specs;
    private final Set<LogicalName> externalInputs;

    private ProvisioningPlan(List<ResourceSpec> specs, Set<LogicalName> externalInputs) {
        if (specs == null) {
            throw new IllegalArgumentException("specs cannot be null");
        }
        if (externalInputs == null) {
            throw new IllegalArgumentException("externalInputs cannot be null");
        }
        this.specs = List.copyOf(specs);
        this.externalInputs = Collections.unmodifiableSet(new LinkedHashSet<>(externalInputs));
        validate();
    }

    /**
     * 외부 입력이 없는 자기 완결 계획 생성.
     *
     * @param specs 위상 정렬된 명세
     * @return ProvisioningPlan
     * @throws IllegalArgumentException 순서 불변식 위반 또는 이름 중복 시
     */
    public static ProvisioningPlan of(List<ResourceSpec> specs) {
        return new ProvisioningPlan(specs, Set.of());
    }

    /**
     * 외부 입력을 선언한 계획 생성.
     *
     * @param externalInputs 다른 계획이 생산할 논리 이름
     * @param specs 위상 정렬된 명세
     * @return ProvisioningPlan
     * @throws IllegalArgumentException 순서 불변식 위반 또는 이름 중복 시
     */
    public static ProvisioningPlan withExternalInputs(Set<LogicalName> externalInputs, List<ResourceSpec> specs) {
        return new ProvisioningPlan(specs, externalInputs);
    }

    /**
     * 이 계획 뒤에 다른 계획을 이어 붙임.
     *
     * @param next 뒤에 실행할 계획
     * @return 결합된 계획 (next의 외부 입력 중 이 계획이 생산하는 이름은 해소됨)
     * @throws IllegalArgumentException 결합 결과가 불변식을 위반하는 경우
     */
    public ProvisioningPlan then(ProvisioningPlan next) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        List<ResourceSpec> combined = new ArrayList<>(specs);
        combined.addAll(next.specs);

        Set<LogicalName> produced = producedNames();
        Set<LogicalName> remaining = new LinkedHashSet<>(externalInputs);
        for (LogicalName name : next.externalInputs) {
            if (!produced.contains(name)) {
                remaining.add(name);
            }
        }
        return new ProvisioningPlan(combined, remaining);
    }

    private void validate() {
        Set<LogicalName> available = new LinkedHashSet<>(externalInputs);
        Set<LogicalName> produced = new LinkedHashSet<>();
        for (ResourceSpec spec : specs) {
            if (spec == null) {
                throw new IllegalArgumentException("plan cannot contain null specs");
            }
            for (LogicalName dependency : spec.dependencies()) {
                if (!available.contains(dependency)) {
                    throw new IllegalArgumentException(
                        "plan is not topologically ordered: " + spec.name() + " requires " + dependency
                            + ", which is neither produced earlier nor declared as an external input");
                }
            }
            if (externalInputs.contains(spec.name())) {
                throw new IllegalArgumentException(spec.name() + " is both produced and declared as an external input");
            }
            if (!produced.add(spec.name())) {
                throw new IllegalArgumentException("duplicate logical name in plan: " + spec.name());
            }
            available.add(spec.name());
        }
    }

    public List<ResourceSpec> specs() {
        return specs;
    }

    public Set<LogicalName> externalInputs() {
        return externalInputs;
    }

    /**
     * 이 계획이 생산하는 논리 이름 (실행 순서).
     */
    public Set<LogicalName> producedNames() {
        return specs.stream()
            .map(ResourceSpec::name)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public List<ResourceSpec> specsOf(ResourceKind kind) {
        return specs.stream()
            .filter(spec -> spec.kind() == kind)
            .collect(Collectors.toList());
    }

    public long countOf(ResourceKind kind) {
        return specs.stream().filter(spec -> spec.kind() == kind).count();
    }

    /**
     * 논리 이름으로 명세 조회.
     *
     * @param name 논리 이름
     * @return 명세, 없으면 null
     */
    public ResourceSpec specOrNull(LogicalName name) {
        for (ResourceSpec spec : specs) {
            if (spec.name().equals(name)) {
                return spec;
            }
        }
        return null;
    }

    public int indexOf(LogicalName name) {
        for (int i = 0; i < specs.size(); i++) {
            if (specs.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public int size() {
        return specs.size();
    }

    public boolean isEmpty() {
        return specs.isEmpty();
    }

    @Override
    public Iterator<ResourceSpec> iterator() {
        return specs.iterator();
    }

    @Override
    public String toString() {
        return "ProvisioningPlan{" + specs.size() + " steps, externalInputs=" + externalInputs + '}';
    }
}
