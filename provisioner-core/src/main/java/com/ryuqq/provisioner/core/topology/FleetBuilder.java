package com.ryuqq.provisioner.core.topology;

import com.ryuqq.provisioner.core.config.FleetPlacement;
import com.ryuqq.provisioner.core.config.ProvisioningConfig;
import com.ryuqq.provisioner.core.model.IngressRule;
import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ParameterKeys;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.ResourceSpec;
import com.ryuqq.provisioner.core.plan.ProvisioningPlan;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 컴퓨트 리소스 계획 빌더.
 *
 * <p><strong>생성 순서:</strong> LoadBalancerSecurityGroup → ComputeSecurityGroup → KeyPair →
 * LaunchTemplate → LoadBalancer → TargetGroup → Listener → ScalingGroup</p>
 *
 * <p>컴퓨트 보안 그룹의 HTTP 인바운드는 항상 로드 밸런서 보안 그룹을 참조합니다.
 * 열린 CIDR은 로드 밸런서 그룹과 (설정된 경우) SSH 규칙에만 사용됩니다.</p>
 *
 * <p>소비하는 네트워크 이름(VPC, 서브넷)은 계획의 외부 입력으로 선언되므로,
 * {@code network.plan().then(fleet)}으로 결합해 실행합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class FleetBuilder {

    static final String OPEN_CIDR = "0.0.0.0/0";
    static final String TEMPLATE_VERSION_LABEL = "v1";
    static final String LATEST_TEMPLATE_VERSION = "$Latest";
    static final int HEALTH_CHECK_INTERVAL_SECONDS = 15;
    static final String HEALTH_CHECK_MATCHER = "200";
    static final int SSH_PORT = 22;

    private final ProvisioningConfig config;
    private final ResourceNames names;

    public FleetBuilder(ProvisioningConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.names = new ResourceNames(config.project());
    }

    /**
     * 네트워크 레이아웃을 소비하는 플릿 계획 생성.
     *
     * @param network 네트워크 계획 출력 이름
     * @return 외부 입력을 선언한 플릿 계획
     */
    public ProvisioningPlan build(NetworkLayout network) {
        if (network == null) {
            throw new IllegalArgumentException("network cannot be null");
        }
        LogicalName vpc = network.virtualNetwork();
        List<LogicalName> fleetSubnets = config.fleetPlacement() == FleetPlacement.PRIVATE
            ? network.privateSubnets()
            : network.publicSubnets();

        Set<LogicalName> external = new LinkedHashSet<>();
        external.add(vpc);
        external.addAll(network.publicSubnets());
        external.addAll(fleetSubnets);

        LogicalName albSg = names.loadBalancerSecurityGroup();
        LogicalName computeSg = names.computeSecurityGroup();
        LogicalName keyPair = names.keyPair();
        LogicalName launchTemplate = names.launchTemplate();
        LogicalName loadBalancer = names.loadBalancer();
        LogicalName targetGroup = names.targetGroup();

        List<ResourceSpec> specs = new ArrayList<>();
        specs.add(ResourceSpec.builder(ResourceKind.SECURITY_GROUP, albSg)
            .parameter(ParameterKeys.DESCRIPTION, "ALB security group")
            .parameter(ParameterKeys.INGRESS_RULES, List.of(IngressRule.fromCidr("tcp", config.httpPort(), OPEN_CIDR)))
            .input(ParameterKeys.VPC_ID, vpc)
            .build());

        List<IngressRule> computeRules = new ArrayList<>();
        computeRules.add(IngressRule.fromGroup("tcp", config.httpPort(), ParameterKeys.SOURCE_SECURITY_GROUP_ID));
        if (config.hasSshIngress()) {
            computeRules.add(IngressRule.fromCidr("tcp", SSH_PORT, config.sshIngressCidr()));
        }
        specs.add(ResourceSpec.builder(ResourceKind.SECURITY_GROUP, computeSg)
            .parameter(ParameterKeys.DESCRIPTION, "EC2 security group")
            .parameter(ParameterKeys.INGRESS_RULES, computeRules)
            .input(ParameterKeys.VPC_ID, vpc)
            .input(ParameterKeys.SOURCE_SECURITY_GROUP_ID, albSg)
            .build());

        specs.add(ResourceSpec.builder(ResourceKind.KEY_PAIR, keyPair).build());

        specs.add(ResourceSpec.builder(ResourceKind.LAUNCH_TEMPLATE, launchTemplate)
            .parameter(ParameterKeys.IMAGE_ID, config.imageId())
            .parameter(ParameterKeys.INSTANCE_TYPE, config.instanceType())
            .parameter(ParameterKeys.USER_DATA, encodeUserData(config.bootScript()))
            .parameter(ParameterKeys.VERSION_DESCRIPTION, TEMPLATE_VERSION_LABEL)
            .inputs(ParameterKeys.SECURITY_GROUP_IDS, List.of(computeSg))
            .input(ParameterKeys.KEY_NAME, keyPair)
            .build());

        specs.add(ResourceSpec.builder(ResourceKind.LOAD_BALANCER, loadBalancer)
            .parameter(ParameterKeys.SCHEME, "internet-facing")
            .parameter(ParameterKeys.LOAD_BALANCER_TYPE, "application")
            .parameter(ParameterKeys.IP_ADDRESS_TYPE, "ipv4")
            .inputs(ParameterKeys.SUBNET_IDS, network.publicSubnets())
            .inputs(ParameterKeys.SECURITY_GROUP_IDS, List.of(albSg))
            .build());

        specs.add(ResourceSpec.builder(ResourceKind.TARGET_GROUP, targetGroup)
            .parameter(ParameterKeys.PROTOCOL, "HTTP")
            .parameter(ParameterKeys.PORT, config.httpPort())
            .parameter(ParameterKeys.TARGET_TYPE, "instance")
            .parameter(ParameterKeys.HEALTH_CHECK_PATH, config.healthCheckPath())
            .parameter(ParameterKeys.HEALTH_CHECK_INTERVAL_SECONDS, HEALTH_CHECK_INTERVAL_SECONDS)
            .parameter(ParameterKeys.HEALTH_CHECK_MATCHER, HEALTH_CHECK_MATCHER)
            .input(ParameterKeys.VPC_ID, vpc)
            .build());

        specs.add(ResourceSpec.builder(ResourceKind.LISTENER, names.listener())
            .parameter(ParameterKeys.PROTOCOL, "HTTP")
            .parameter(ParameterKeys.PORT, config.httpPort())
            .input(ParameterKeys.LOAD_BALANCER_ID, loadBalancer)
            .input(ParameterKeys.TARGET_GROUP_ID, targetGroup)
            .build());

        specs.add(ResourceSpec.builder(ResourceKind.SCALING_GROUP, names.scalingGroup())
            .parameter(ParameterKeys.LAUNCH_TEMPLATE_VERSION, LATEST_TEMPLATE_VERSION)
            .parameter(ParameterKeys.MIN_SIZE, config.minSize())
            .parameter(ParameterKeys.MAX_SIZE, config.maxSize())
            .parameter(ParameterKeys.DESIRED_CAPACITY, config.desiredCapacity())
            .parameter(ParameterKeys.INSTANCE_NAME_TAG, names.instanceNameTag())
            .parameter(ParameterKeys.PROPAGATE_TAG_AT_LAUNCH, true)
            .input(ParameterKeys.LAUNCH_TEMPLATE_ID, launchTemplate)
            .inputs(ParameterKeys.SUBNET_IDS, fleetSubnets)
            .inputs(ParameterKeys.TARGET_GROUP_IDS, List.of(targetGroup))
            .build());

        return ProvisioningPlan.withExternalInputs(external, specs);
    }

    static String encodeUserData(String script) {
        return Base64.getEncoder().encodeToString(script.getBytes(StandardCharsets.UTF_8));
    }
}
