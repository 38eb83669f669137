package com.ryuqq.provisioner.core.model;

/**
 * 빌더와 프로바이더 어댑터가 공유하는 파라미터 이름.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ParameterKeys {

    // network
    public static final String CIDR_BLOCK = "cidrBlock";
    public static final String VPC_ID = "vpcId";
    public static final String AVAILABILITY_ZONE = "availabilityZone";
    public static final String MAP_PUBLIC_IP_ON_LAUNCH = "mapPublicIpOnLaunch";
    public static final String DESTINATION_CIDR = "destinationCidr";
    public static final String GATEWAY_ID = "gatewayId";
    public static final String ADDRESS_TRANSLATOR_ID = "addressTranslatorId";
    public static final String SUBNET_ID = "subnetId";
    public static final String ROUTE_TABLE_ID = "routeTableId";

    // access control
    public static final String DESCRIPTION = "description";
    public static final String INGRESS_RULES = "ingressRules";
    public static final String SOURCE_SECURITY_GROUP_ID = "sourceSecurityGroupId";

    // compute template
    public static final String IMAGE_ID = "imageId";
    public static final String INSTANCE_TYPE = "instanceType";
    public static final String KEY_NAME = "keyName";
    public static final String SECURITY_GROUP_IDS = "securityGroupIds";
    public static final String USER_DATA = "userData";
    public static final String VERSION_DESCRIPTION = "versionDescription";

    // load balancing
    public static final String SUBNET_IDS = "subnetIds";
    public static final String SCHEME = "scheme";
    public static final String LOAD_BALANCER_TYPE = "loadBalancerType";
    public static final String IP_ADDRESS_TYPE = "ipAddressType";
    public static final String PROTOCOL = "protocol";
    public static final String PORT = "port";
    public static final String TARGET_TYPE = "targetType";
    public static final String HEALTH_CHECK_PATH = "healthCheckPath";
    public static final String HEALTH_CHECK_INTERVAL_SECONDS = "healthCheckIntervalSeconds";
    public static final String HEALTH_CHECK_MATCHER = "healthCheckMatcher";
    public static final String LOAD_BALANCER_ID = "loadBalancerId";
    public static final String TARGET_GROUP_ID = "targetGroupId";

    // scaling
    public static final String LAUNCH_TEMPLATE_ID = "launchTemplateId";
    public static final String LAUNCH_TEMPLATE_VERSION = "launchTemplateVersion";
    public static final String TARGET_GROUP_IDS = "targetGroupIds";
    public static final String MIN_SIZE = "minSize";
    public static final String MAX_SIZE = "maxSize";
    public static final String DESIRED_CAPACITY = "desiredCapacity";
    public static final String INSTANCE_NAME_TAG = "instanceNameTag";
    public static final String PROPAGATE_TAG_AT_LAUNCH = "propagateTagAtLaunch";

    private ParameterKeys() {
    }
}
