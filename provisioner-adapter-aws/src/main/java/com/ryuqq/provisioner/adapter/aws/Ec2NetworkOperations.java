package com.ryuqq.provisioner.adapter.aws;

import com.amazonaws.AmazonClientException;
import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.AllocateAddressRequest;
import com.amazonaws.services.ec2.model.AssociateRouteTableRequest;
import com.amazonaws.services.ec2.model.AttachInternetGatewayRequest;
import com.amazonaws.services.ec2.model.AuthorizeSecurityGroupIngressRequest;
import com.amazonaws.services.ec2.model.AvailabilityZone;
import com.amazonaws.services.ec2.model.CreateInternetGatewayRequest;
import com.amazonaws.services.ec2.model.CreateKeyPairRequest;
import com.amazonaws.services.ec2.model.CreateLaunchTemplateRequest;
import com.amazonaws.services.ec2.model.CreateNatGatewayRequest;
import com.amazonaws.services.ec2.model.CreateRouteRequest;
import com.amazonaws.services.ec2.model.CreateRouteTableRequest;
import com.amazonaws.services.ec2.model.CreateSecurityGroupRequest;
import com.amazonaws.services.ec2.model.CreateSubnetRequest;
import com.amazonaws.services.ec2.model.CreateVpcRequest;
import com.amazonaws.services.ec2.model.DescribeAvailabilityZonesRequest;
import com.amazonaws.services.ec2.model.DescribeInternetGatewaysRequest;
import com.amazonaws.services.ec2.model.DescribeKeyPairsRequest;
import com.amazonaws.services.ec2.model.DescribeLaunchTemplatesRequest;
import com.amazonaws.services.ec2.model.DescribeNatGatewaysRequest;
import com.amazonaws.services.ec2.model.DescribeRouteTablesRequest;
import com.amazonaws.services.ec2.model.DescribeSecurityGroupsRequest;
import com.amazonaws.services.ec2.model.DescribeSubnetsRequest;
import com.amazonaws.services.ec2.model.DescribeVpcsRequest;
import com.amazonaws.services.ec2.model.DomainType;
import com.amazonaws.services.ec2.model.Filter;
import com.amazonaws.services.ec2.model.InternetGateway;
import com.amazonaws.services.ec2.model.IpPermission;
import com.amazonaws.services.ec2.model.IpRange;
import com.amazonaws.services.ec2.model.KeyPair;
import com.amazonaws.services.ec2.model.ModifySubnetAttributeRequest;
import com.amazonaws.services.ec2.model.NatGateway;
import com.amazonaws.services.ec2.model.ReleaseAddressRequest;
import com.amazonaws.services.ec2.model.RequestLaunchTemplateData;
import com.amazonaws.services.ec2.model.ResourceType;
import com.amazonaws.services.ec2.model.RouteTable;
import com.amazonaws.services.ec2.model.RouteTableAssociation;
import com.amazonaws.services.ec2.model.Subnet;
import com.amazonaws.services.ec2.model.Tag;
import com.amazonaws.services.ec2.model.TagSpecification;
import com.amazonaws.services.ec2.model.UserIdGroupPair;
import com.amazonaws.services.ec2.model.Vpc;
import com.ryuqq.provisioner.core.model.IngressRule;
import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ParameterKeys;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.ResourceParameters;
import com.ryuqq.provisioner.core.model.ResourceState;
import com.ryuqq.provisioner.core.spi.CreatedResource;
import com.ryuqq.provisioner.core.spi.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * EC2 호출 묶음: VPC, 인터넷 게이트웨이, 서브넷, 라우트 테이블, NAT 게이트웨이,
 * 보안 그룹, 키페어, 시작 템플릿.
 *
 * <p>EC2는 대부분의 네트워크 리소스 이름 중복을 거부하지 않으므로, Name 태그가 있는 종류는
 * 생성 전에 태그로 조회해 {@link AwsErrors#DUPLICATE_NAME}을 직접 던집니다.
 * Name 태그는 생성 요청의 TagSpecification으로 함께 붙이므로, 부가 설정(연결, 라우트, 속성,
 * 인바운드 규칙)이 실패해도 재실행 시 같은 리소스를 찾습니다.</p>
 *
 * <p>이미 있는 리소스를 중복으로 거부하기 전에 빠진 부가 설정을 채웁니다.
 * 재사용되는 리소스는 새로 만든 리소스와 같은 설정을 갖습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
final class Ec2NetworkOperations {

    private static final Logger log = LoggerFactory.getLogger(Ec2NetworkOperations.class);

    private static final String NAME_TAG = "Name";

    private final AmazonEC2 ec2;

    Ec2NetworkOperations(AmazonEC2 ec2) {
        if (ec2 == null) {
            throw new IllegalArgumentException("ec2 cannot be null");
        }
        this.ec2 = ec2;
    }

    List<String> listAvailabilityZones(String region) {
        return ec2.describeAvailabilityZones(new DescribeAvailabilityZonesRequest()
                .withFilters(filter("region-name", region), filter("state", "available")))
            .getAvailabilityZones().stream()
            .map(AvailabilityZone::getZoneName)
            .collect(Collectors.toList());
    }

    // ===== Create =====

    String createVpc(LogicalName name, ResourceParameters parameters) {
        rejectDuplicateName(ResourceKind.VIRTUAL_NETWORK, name, parameters);
        return ec2.createVpc(new CreateVpcRequest()
                .withCidrBlock(parameters.getString(ParameterKeys.CIDR_BLOCK))
                .withTagSpecifications(nameTagSpecification(ResourceType.Vpc, name)))
            .getVpc().getVpcId();
    }

    /**
     * 인터넷 게이트웨이 생성 후 VPC에 연결.
     *
     * <p>같은 이름의 게이트웨이가 있으면 VPC 연결을 확인해 빠져 있으면 연결한 뒤
     * {@link AwsErrors#DUPLICATE_NAME}을 던집니다.</p>
     */
    String createInternetGateway(LogicalName name, ResourceParameters parameters) {
        String vpcId = parameters.getString(ParameterKeys.VPC_ID);
        Optional<InternetGateway> existing = findInternetGateway(name.getValue());
        if (existing.isPresent()) {
            InternetGateway gateway = existing.get();
            boolean attached = gateway.getAttachments().stream()
                .anyMatch(attachment -> vpcId.equals(attachment.getVpcId()));
            if (!attached) {
                attachInternetGateway(gateway.getInternetGatewayId(), vpcId);
            }
            throw duplicateName(ResourceKind.GATEWAY, name, gateway.getInternetGatewayId());
        }
        String gatewayId = ec2.createInternetGateway(new CreateInternetGatewayRequest()
                .withTagSpecifications(nameTagSpecification(ResourceType.InternetGateway, name)))
            .getInternetGateway().getInternetGatewayId();
        attachInternetGateway(gatewayId, vpcId);
        return gatewayId;
    }

    /**
     * 서브넷 생성. 퍼블릭 서브넷은 퍼블릭 IP 자동 할당을 켭니다.
     *
     * <p>같은 이름의 서브넷이 있으면 자동 할당 속성을 확인해 맞춘 뒤 중복으로 거부합니다.</p>
     */
    String createSubnet(LogicalName name, ResourceParameters parameters) {
        boolean mapPublicIp = parameters.getBooleanOrDefault(ParameterKeys.MAP_PUBLIC_IP_ON_LAUNCH, false);
        Optional<Subnet> existing = findSubnet(name.getValue());
        if (existing.isPresent()) {
            Subnet subnet = existing.get();
            if (mapPublicIp && !Boolean.TRUE.equals(subnet.getMapPublicIpOnLaunch())) {
                enablePublicIpOnLaunch(subnet.getSubnetId());
            }
            throw duplicateName(ResourceKind.SUBNET, name, subnet.getSubnetId());
        }
        String subnetId = ec2.createSubnet(new CreateSubnetRequest()
                .withVpcId(parameters.getString(ParameterKeys.VPC_ID))
                .withCidrBlock(parameters.getString(ParameterKeys.CIDR_BLOCK))
                .withAvailabilityZone(parameters.getString(ParameterKeys.AVAILABILITY_ZONE))
                .withTagSpecifications(nameTagSpecification(ResourceType.Subnet, name)))
            .getSubnet().getSubnetId();
        if (mapPublicIp) {
            enablePublicIpOnLaunch(subnetId);
        }
        return subnetId;
    }

    /**
     * 라우트 테이블 생성 후 기본 경로 추가 (인터넷 게이트웨이 또는 NAT 게이트웨이).
     *
     * <p>같은 이름의 테이블에 목적지 경로가 없으면 추가한 뒤 중복으로 거부합니다.</p>
     */
    String createRouteTable(LogicalName name, ResourceParameters parameters) {
        String destination = parameters.getString(ParameterKeys.DESTINATION_CIDR);
        Optional<RouteTable> existing = findRouteTable(name.getValue());
        if (existing.isPresent()) {
            RouteTable table = existing.get();
            boolean routed = table.getRoutes().stream()
                .anyMatch(route -> destination.equals(route.getDestinationCidrBlock()));
            if (!routed) {
                createRoute(table.getRouteTableId(), destination, parameters);
            }
            throw duplicateName(ResourceKind.ROUTE_TABLE, name, table.getRouteTableId());
        }
        String routeTableId = ec2.createRouteTable(new CreateRouteTableRequest()
                .withVpcId(parameters.getString(ParameterKeys.VPC_ID))
                .withTagSpecifications(nameTagSpecification(ResourceType.RouteTable, name)))
            .getRouteTable().getRouteTableId();
        createRoute(routeTableId, destination, parameters);
        return routeTableId;
    }

    String associateRouteTable(LogicalName name, ResourceParameters parameters) {
        rejectDuplicateName(ResourceKind.ROUTE_ASSOCIATION, name, parameters);
        return ec2.associateRouteTable(new AssociateRouteTableRequest()
                .withRouteTableId(parameters.getString(ParameterKeys.ROUTE_TABLE_ID))
                .withSubnetId(parameters.getString(ParameterKeys.SUBNET_ID)))
            .getAssociationId();
    }

    /**
     * 탄력적 IP를 할당해 NAT 게이트웨이 생성.
     *
     * <p>NAT 게이트웨이 생성이 실패하면 방금 할당한 탄력적 IP를 해제합니다.</p>
     */
    String createNatGateway(LogicalName name, ResourceParameters parameters) {
        rejectDuplicateName(ResourceKind.ADDRESS_TRANSLATOR, name, parameters);
        String allocationId = ec2.allocateAddress(new AllocateAddressRequest().withDomain(DomainType.Vpc))
            .getAllocationId();
        log.info("Allocated elastic IP {} for {}", allocationId, name);
        try {
            return ec2.createNatGateway(new CreateNatGatewayRequest()
                    .withSubnetId(parameters.getString(ParameterKeys.SUBNET_ID))
                    .withAllocationId(allocationId)
                    .withTagSpecifications(nameTagSpecification(ResourceType.Natgateway, name)))
                .getNatGateway().getNatGatewayId();
        } catch (RuntimeException e) {
            releaseAddress(allocationId, e);
            throw e;
        }
    }

    /**
     * 보안 그룹 생성 후 인바운드 규칙 추가.
     *
     * <p>같은 이름의 그룹이 이미 있으면({@link AwsErrors#SECURITY_GROUP_DUPLICATE}) 빠진 인바운드 규칙을
     * 추가한 뒤 원래 오류를 그대로 던집니다.</p>
     */
    String createSecurityGroup(LogicalName name, ResourceParameters parameters) {
        List<IpPermission> permissions = parameters.getIngressRules(ParameterKeys.INGRESS_RULES).stream()
            .map(rule -> toPermission(rule, parameters))
            .collect(Collectors.toList());
        String groupId;
        try {
            groupId = ec2.createSecurityGroup(new CreateSecurityGroupRequest()
                    .withGroupName(name.getValue())
                    .withDescription(parameters.getString(ParameterKeys.DESCRIPTION))
                    .withVpcId(parameters.getString(ParameterKeys.VPC_ID))
                    .withTagSpecifications(nameTagSpecification(ResourceType.SecurityGroup, name)))
                .getGroupId();
        } catch (AmazonServiceException e) {
            if (AwsErrors.SECURITY_GROUP_DUPLICATE.equals(e.getErrorCode()) && !permissions.isEmpty()) {
                findByName(ResourceKind.SECURITY_GROUP, name, parameters)
                    .ifPresent(existingId -> authorizeMissing(existingId, permissions));
            }
            throw e;
        }
        if (!permissions.isEmpty()) {
            ec2.authorizeSecurityGroupIngress(new AuthorizeSecurityGroupIngressRequest()
                .withGroupId(groupId)
                .withIpPermissions(permissions));
        }
        return groupId;
    }

    CreatedResource createKeyPair(LogicalName name) {
        KeyPair keyPair = ec2.createKeyPair(new CreateKeyPairRequest().withKeyName(name.getValue())).getKeyPair();
        return CreatedResource.withKeyMaterial(keyPair.getKeyName(), keyPair.getKeyMaterial());
    }

    String createLaunchTemplate(LogicalName name, ResourceParameters parameters) {
        RequestLaunchTemplateData data = new RequestLaunchTemplateData()
            .withImageId(parameters.getString(ParameterKeys.IMAGE_ID))
            .withInstanceType(parameters.getString(ParameterKeys.INSTANCE_TYPE))
            .withKeyName(parameters.getString(ParameterKeys.KEY_NAME))
            .withSecurityGroupIds(parameters.getStringList(ParameterKeys.SECURITY_GROUP_IDS))
            .withUserData(parameters.getString(ParameterKeys.USER_DATA));
        return ec2.createLaunchTemplate(new CreateLaunchTemplateRequest()
                .withLaunchTemplateName(name.getValue())
                .withVersionDescription(parameters.getStringOrNull(ParameterKeys.VERSION_DESCRIPTION))
                .withLaunchTemplateData(data))
            .getLaunchTemplate().getLaunchTemplateId();
    }

    // ===== Lookup =====

    Optional<String> findByName(ResourceKind kind, LogicalName name, ResourceParameters parameters) {
        String value = name.getValue();
        switch (kind) {
            case VIRTUAL_NETWORK:
                return ec2.describeVpcs(new DescribeVpcsRequest().withFilters(nameTag(value)))
                    .getVpcs().stream().map(Vpc::getVpcId).findFirst();
            case GATEWAY:
                return findInternetGateway(value).map(InternetGateway::getInternetGatewayId);
            case SUBNET:
                return findSubnet(value).map(Subnet::getSubnetId);
            case ROUTE_TABLE:
                return findRouteTable(value).map(RouteTable::getRouteTableId);
            case ROUTE_ASSOCIATION:
                return findAssociation(parameters);
            case ADDRESS_TRANSLATOR:
                return ec2.describeNatGateways(new DescribeNatGatewaysRequest()
                        .withFilter(nameTag(value), filter("state", "pending", "available")))
                    .getNatGateways().stream().map(NatGateway::getNatGatewayId).findFirst();
            case SECURITY_GROUP:
                DescribeSecurityGroupsRequest groups = new DescribeSecurityGroupsRequest()
                    .withFilters(filter("group-name", value));
                if (parameters.contains(ParameterKeys.VPC_ID)) {
                    groups.withFilters(filter("vpc-id", parameters.getString(ParameterKeys.VPC_ID)));
                }
                return ec2.describeSecurityGroups(groups)
                    .getSecurityGroups().stream().map(g -> g.getGroupId()).findFirst();
            case KEY_PAIR:
                return ec2.describeKeyPairs(new DescribeKeyPairsRequest().withFilters(filter("key-name", value)))
                    .getKeyPairs().stream().map(k -> k.getKeyName()).findFirst();
            case LAUNCH_TEMPLATE:
                return ec2.describeLaunchTemplates(new DescribeLaunchTemplatesRequest()
                        .withFilters(filter("launch-template-name", value)))
                    .getLaunchTemplates().stream().map(t -> t.getLaunchTemplateId()).findFirst();
            default:
                throw new IllegalArgumentException("not an EC2 kind: " + kind);
        }
    }

    /**
     * 기본 VPC가 아닌 첫 VPC 조회.
     */
    Optional<String> findNonDefaultVpc() {
        return ec2.describeVpcs(new DescribeVpcsRequest().withFilters(filter("is-default", "false")))
            .getVpcs().stream()
            .filter(vpc -> !Boolean.TRUE.equals(vpc.getIsDefault()))
            .map(Vpc::getVpcId)
            .findFirst();
    }

    private Optional<InternetGateway> findInternetGateway(String name) {
        return ec2.describeInternetGateways(new DescribeInternetGatewaysRequest().withFilters(nameTag(name)))
            .getInternetGateways().stream().findFirst();
    }

    private Optional<Subnet> findSubnet(String name) {
        return ec2.describeSubnets(new DescribeSubnetsRequest().withFilters(nameTag(name)))
            .getSubnets().stream().findFirst();
    }

    private Optional<RouteTable> findRouteTable(String name) {
        return ec2.describeRouteTables(new DescribeRouteTablesRequest().withFilters(nameTag(name)))
            .getRouteTables().stream().findFirst();
    }

    private Optional<String> findAssociation(ResourceParameters parameters) {
        String subnetId = parameters.getString(ParameterKeys.SUBNET_ID);
        String routeTableId = parameters.getString(ParameterKeys.ROUTE_TABLE_ID);
        return ec2.describeRouteTables(new DescribeRouteTablesRequest()
                .withFilters(filter("route-table-id", routeTableId), filter("association.subnet-id", subnetId)))
            .getRouteTables().stream()
            .flatMap(table -> table.getAssociations().stream())
            .filter(association -> subnetId.equals(association.getSubnetId()))
            .map(RouteTableAssociation::getRouteTableAssociationId)
            .findFirst();
    }

    // ===== Readiness =====

    ResourceState describeVpc(String vpcId) {
        try {
            return ec2.describeVpcs(new DescribeVpcsRequest().withVpcIds(vpcId)).getVpcs().stream()
                .findFirst()
                .map(vpc -> "available".equals(vpc.getState()) ? ResourceState.AVAILABLE : ResourceState.PENDING)
                .orElse(ResourceState.PENDING);
        } catch (AmazonServiceException e) {
            if (AwsErrors.isNotFound(e)) {
                return ResourceState.PENDING;
            }
            throw e;
        }
    }

    ResourceState describeNatGateway(String natGatewayId) {
        try {
            return ec2.describeNatGateways(new DescribeNatGatewaysRequest().withNatGatewayIds(natGatewayId))
                .getNatGateways().stream()
                .findFirst()
                .map(nat -> toState(nat.getState()))
                .orElse(ResourceState.PENDING);
        } catch (AmazonServiceException e) {
            if (AwsErrors.isNotFound(e)) {
                return ResourceState.PENDING;
            }
            throw e;
        }
    }

    private static ResourceState toState(String natState) {
        if ("available".equals(natState)) {
            return ResourceState.AVAILABLE;
        }
        if ("failed".equals(natState) || "deleting".equals(natState) || "deleted".equals(natState)) {
            return ResourceState.FAILED;
        }
        return ResourceState.PENDING;
    }

    // ===== Helpers =====

    private void rejectDuplicateName(ResourceKind kind, LogicalName name, ResourceParameters parameters) {
        Optional<String> existing = findByName(kind, name, parameters);
        if (existing.isPresent()) {
            throw duplicateName(kind, name, existing.get());
        }
    }

    private static ProviderException duplicateName(ResourceKind kind, LogicalName name, String existingId) {
        return new ProviderException(AwsErrors.DUPLICATE_NAME, kind + " " + name + " already exists as " + existingId);
    }

    private void attachInternetGateway(String gatewayId, String vpcId) {
        ec2.attachInternetGateway(new AttachInternetGatewayRequest()
            .withInternetGatewayId(gatewayId)
            .withVpcId(vpcId));
        log.info("Attached internet gateway {} to {}", gatewayId, vpcId);
    }

    private void enablePublicIpOnLaunch(String subnetId) {
        ec2.modifySubnetAttribute(new ModifySubnetAttributeRequest()
            .withSubnetId(subnetId)
            .withMapPublicIpOnLaunch(true));
    }

    private void createRoute(String routeTableId, String destination, ResourceParameters parameters) {
        CreateRouteRequest route = new CreateRouteRequest()
            .withRouteTableId(routeTableId)
            .withDestinationCidrBlock(destination);
        if (parameters.contains(ParameterKeys.GATEWAY_ID)) {
            route.setGatewayId(parameters.getString(ParameterKeys.GATEWAY_ID));
        } else {
            route.setNatGatewayId(parameters.getString(ParameterKeys.ADDRESS_TRANSLATOR_ID));
        }
        ec2.createRoute(route);
    }

    private void releaseAddress(String allocationId, RuntimeException cause) {
        try {
            ec2.releaseAddress(new ReleaseAddressRequest().withAllocationId(allocationId));
            log.info("Released elastic IP {} after failed NAT gateway creation", allocationId);
        } catch (AmazonClientException e) {
            log.warn("Elastic IP {} could not be released and must be released manually", allocationId, e);
            cause.addSuppressed(e);
        }
    }

    /**
     * 기존 보안 그룹에 규칙을 하나씩 추가. 이미 있는 규칙은 건너뜁니다.
     */
    private void authorizeMissing(String groupId, List<IpPermission> permissions) {
        for (IpPermission permission : permissions) {
            try {
                ec2.authorizeSecurityGroupIngress(new AuthorizeSecurityGroupIngressRequest()
                    .withGroupId(groupId)
                    .withIpPermissions(permission));
                log.info("Added missing ingress {}/{} to existing security group {}",
                    permission.getIpProtocol(), permission.getFromPort(), groupId);
            } catch (AmazonServiceException e) {
                if (!AwsErrors.PERMISSION_DUPLICATE.equals(e.getErrorCode())) {
                    throw e;
                }
            }
        }
    }

    private static TagSpecification nameTagSpecification(ResourceType resourceType, LogicalName name) {
        return new TagSpecification()
            .withResourceType(resourceType)
            .withTags(new Tag(NAME_TAG, name.getValue()));
    }

    private static IpPermission toPermission(IngressRule rule, ResourceParameters parameters) {
        IpPermission permission = new IpPermission()
            .withIpProtocol(rule.protocol())
            .withFromPort(rule.fromPort())
            .withToPort(rule.toPort());
        if (rule.isGroupReference()) {
            return permission.withUserIdGroupPairs(new UserIdGroupPair()
                .withGroupId(parameters.getString(rule.sourceGroupParameter())));
        }
        return permission.withIpv4Ranges(new IpRange().withCidrIp(rule.cidr()));
    }

    private static Filter nameTag(String value) {
        return filter("tag:" + NAME_TAG, value);
    }

    private static Filter filter(String name, String... values) {
        return new Filter(name).withValues(values);
    }
}
