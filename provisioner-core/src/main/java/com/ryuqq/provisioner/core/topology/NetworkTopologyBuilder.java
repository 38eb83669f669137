package com.ryuqq.provisioner.core.topology;

import com.ryuqq.provisioner.core.config.ProvisioningConfig;
import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ParameterKeys;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.ResourceSpec;
import com.ryuqq.provisioner.core.plan.ProvisioningPlan;

import java.util.ArrayList;
import java.util.List;

/**
 * 네트워크 리소스 계획 빌더.
 *
 * <p><strong>생성 순서:</strong></p>
 * <ol>
 *   <li>VirtualNetwork</li>
 *   <li>Gateway (VPC에 연결)</li>
 *   <li>PublicRouteTable (0.0.0.0/0 → Gateway)</li>
 *   <li>영역별: PublicSubnet, PrivateSubnet, PublicSubnet ↔ PublicRouteTable 연결</li>
 *   <li>AddressTranslator (첫 번째 퍼블릭 서브넷)</li>
 *   <li>PrivateRouteTable (0.0.0.0/0 → AddressTranslator)</li>
 *   <li>영역별: PrivateSubnet ↔ PrivateRouteTable 연결</li>
 * </ol>
 *
 * <p>CIDR은 영역 순서대로 위치 기준 할당됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class NetworkTopologyBuilder {

    static final String ANY_DESTINATION = "0.0.0.0/0";

    private final ProvisioningConfig config;
    private final ResourceNames names;

    public NetworkTopologyBuilder(ProvisioningConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.names = new ResourceNames(config.project());
    }

    /**
     * 선택된 영역으로 네트워크 계획 생성.
     *
     * @param zones 선택된 가용 영역 (1개 이상)
     * @return NetworkLayout
     * @throws IllegalArgumentException 영역 수보다 CIDR이 적은 경우
     */
    public NetworkLayout build(List<String> zones) {
        if (zones == null || zones.isEmpty()) {
            throw new IllegalArgumentException("zones cannot be null or empty");
        }
        requireCidrs("publicSubnetCidrs", config.publicSubnetCidrs(), zones.size());
        requireCidrs("privateSubnetCidrs", config.privateSubnetCidrs(), zones.size());

        LogicalName vpc = names.virtualNetwork();
        LogicalName gateway = names.gateway();
        LogicalName publicRouteTable = names.publicRouteTable();

        List<ResourceSpec> specs = new ArrayList<>();
        specs.add(ResourceSpec.builder(ResourceKind.VIRTUAL_NETWORK, vpc)
            .parameter(ParameterKeys.CIDR_BLOCK, config.vpcCidr())
            .build());
        specs.add(ResourceSpec.builder(ResourceKind.GATEWAY, gateway)
            .input(ParameterKeys.VPC_ID, vpc)
            .build());
        specs.add(ResourceSpec.builder(ResourceKind.ROUTE_TABLE, publicRouteTable)
            .parameter(ParameterKeys.DESTINATION_CIDR, ANY_DESTINATION)
            .input(ParameterKeys.VPC_ID, vpc)
            .input(ParameterKeys.GATEWAY_ID, gateway)
            .build());

        List<LogicalName> publicSubnets = new ArrayList<>();
        List<LogicalName> privateSubnets = new ArrayList<>();
        for (int i = 0; i < zones.size(); i++) {
            String zone = zones.get(i);
            LogicalName publicSubnet = names.publicSubnet(zone);
            LogicalName privateSubnet = names.privateSubnet(zone);

            specs.add(ResourceSpec.builder(ResourceKind.SUBNET, publicSubnet)
                .parameter(ParameterKeys.CIDR_BLOCK, config.publicSubnetCidrs().get(i))
                .parameter(ParameterKeys.AVAILABILITY_ZONE, zone)
                .parameter(ParameterKeys.MAP_PUBLIC_IP_ON_LAUNCH, true)
                .input(ParameterKeys.VPC_ID, vpc)
                .build());
            specs.add(ResourceSpec.builder(ResourceKind.SUBNET, privateSubnet)
                .parameter(ParameterKeys.CIDR_BLOCK, config.privateSubnetCidrs().get(i))
                .parameter(ParameterKeys.AVAILABILITY_ZONE, zone)
                .input(ParameterKeys.VPC_ID, vpc)
                .build());
            specs.add(association(names.publicRouteAssociation(zone), publicSubnet, publicRouteTable));

            publicSubnets.add(publicSubnet);
            privateSubnets.add(privateSubnet);
        }

        LogicalName translator = names.addressTranslator();
        LogicalName privateRouteTable = names.privateRouteTable();
        specs.add(ResourceSpec.builder(ResourceKind.ADDRESS_TRANSLATOR, translator)
            .input(ParameterKeys.SUBNET_ID, publicSubnets.get(0))
            .build());
        specs.add(ResourceSpec.builder(ResourceKind.ROUTE_TABLE, privateRouteTable)
            .parameter(ParameterKeys.DESTINATION_CIDR, ANY_DESTINATION)
            .input(ParameterKeys.VPC_ID, vpc)
            .input(ParameterKeys.ADDRESS_TRANSLATOR_ID, translator)
            .build());
        for (int i = 0; i < zones.size(); i++) {
            specs.add(association(names.privateRouteAssociation(zones.get(i)), privateSubnets.get(i), privateRouteTable));
        }

        return new NetworkLayout(ProvisioningPlan.of(specs), zones, vpc, publicSubnets, privateSubnets);
    }

    private static ResourceSpec association(LogicalName name, LogicalName subnet, LogicalName routeTable) {
        return ResourceSpec.builder(ResourceKind.ROUTE_ASSOCIATION, name)
            .input(ParameterKeys.SUBNET_ID, subnet)
            .input(ParameterKeys.ROUTE_TABLE_ID, routeTable)
            .build();
    }

    private static void requireCidrs(String field, List<String> cidrs, int zoneCount) {
        if (cidrs.size() < zoneCount) {
            throw new IllegalArgumentException(
                field + " has " + cidrs.size() + " entries but " + zoneCount + " zones were selected");
        }
    }
}
