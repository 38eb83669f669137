package com.ryuqq.provisioner.core.topology;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.plan.ProvisioningPlan;

import java.util.List;

/**
 * 네트워크 계획과 플릿 계획이 소비할 출력 이름.
 *
 * @param plan 네트워크 계획
 * @param zones 선택된 가용 영역
 * @param virtualNetwork VPC 논리 이름
 * @param publicSubnets 퍼블릭 서브넷 논리 이름 (영역 순서)
 * @param privateSubnets 프라이빗 서브넷 논리 이름 (영역 순서)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record NetworkLayout(
    ProvisioningPlan plan,
    List<String> zones,
    LogicalName virtualNetwork,
    List<LogicalName> publicSubnets,
    List<LogicalName> privateSubnets
) {

    public NetworkLayout {
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }
        if (zones == null || zones.isEmpty()) {
            throw new IllegalArgumentException("zones cannot be null or empty");
        }
        if (virtualNetwork == null) {
            throw new IllegalArgumentException("virtualNetwork cannot be null");
        }
        if (publicSubnets == null || publicSubnets.size() != zones.size()) {
            throw new IllegalArgumentException("publicSubnets must have one entry per zone");
        }
        if (privateSubnets == null || privateSubnets.size() != zones.size()) {
            throw new IllegalArgumentException("privateSubnets must have one entry per zone");
        }
        zones = List.copyOf(zones);
        publicSubnets = List.copyOf(publicSubnets);
        privateSubnets = List.copyOf(privateSubnets);
    }
}
