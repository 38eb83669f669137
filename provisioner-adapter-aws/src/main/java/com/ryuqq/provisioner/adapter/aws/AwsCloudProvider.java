package com.ryuqq.provisioner.adapter.aws;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.autoscaling.AmazonAutoScaling;
import com.amazonaws.services.autoscaling.AmazonAutoScalingClientBuilder;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.AmazonEC2ClientBuilder;
import com.amazonaws.services.elasticloadbalancingv2.AmazonElasticLoadBalancing;
import com.amazonaws.services.elasticloadbalancingv2.AmazonElasticLoadBalancingClientBuilder;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.ResourceState;
import com.ryuqq.provisioner.core.spi.CloudProvider;
import com.ryuqq.provisioner.core.spi.CreateRequest;
import com.ryuqq.provisioner.core.spi.CreatedResource;
import com.ryuqq.provisioner.core.spi.ExistingResource;
import com.ryuqq.provisioner.core.spi.LookupMode;
import com.ryuqq.provisioner.core.spi.LookupRequest;
import com.ryuqq.provisioner.core.spi.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * AWS SDK 기반 {@link CloudProvider} 구현.
 *
 * <p>리소스 종류별 호출은 EC2 / ELBv2 / Auto Scaling 작업 클래스에 위임하고,
 * SDK 예외({@link AmazonClientException})는 모두 {@link AwsErrors#translate}로
 * {@link ProviderException}으로 변환합니다.</p>
 *
 * <h3>준비 상태</h3>
 * <ul>
 *   <li>VPC: {@code available} 상태이면 AVAILABLE</li>
 *   <li>NAT 게이트웨이: {@code available}이면 AVAILABLE, {@code failed/deleting/deleted}이면 FAILED</li>
 *   <li>방금 생성되어 아직 조회되지 않는 경우(NotFound)는 PENDING</li>
 *   <li>그 외 종류는 생성 응답 시점에 사용 가능한 것으로 간주</li>
 * </ul>
 *
 * <p>기본 재사용 규칙은 {@link AwsReusePolicy#defaults()}를 사용합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class AwsCloudProvider implements CloudProvider {

    private static final Logger log = LoggerFactory.getLogger(AwsCloudProvider.class);

    private final Ec2NetworkOperations ec2;
    private final LoadBalancingOperations loadBalancing;
    private final ScalingOperations scaling;

    public AwsCloudProvider(AmazonEC2 ec2, AmazonElasticLoadBalancing elb, AmazonAutoScaling autoScaling) {
        this.ec2 = new Ec2NetworkOperations(ec2);
        this.loadBalancing = new LoadBalancingOperations(elb);
        this.scaling = new ScalingOperations(autoScaling);
    }

    /**
     * 기본 자격 증명 체인으로 리전 클라이언트를 구성합니다.
     *
     * @param region AWS 리전 (예: ap-northeast-2)
     * @return AwsCloudProvider 인스턴스
     */
    public static AwsCloudProvider forRegion(String region) {
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("region cannot be null or blank");
        }
        return new AwsCloudProvider(
            AmazonEC2ClientBuilder.standard().withRegion(region).build(),
            AmazonElasticLoadBalancingClientBuilder.standard().withRegion(region).build(),
            AmazonAutoScalingClientBuilder.standard().withRegion(region).build()
        );
    }

    @Override
    public List<String> listAvailabilityZones(String region) {
        return call(() -> ec2.listAvailabilityZones(region));
    }

    @Override
    public CreatedResource create(CreateRequest request) {
        log.debug("Creating {} {}", request.kind(), request.name());
        return call(() -> dispatchCreate(request));
    }

    @Override
    public Optional<ExistingResource> findExisting(LookupRequest request) {
        Optional<String> id = call(() -> dispatchLookup(request));
        return id.map(found -> new ExistingResource(request.kind(), found));
    }

    @Override
    public ResourceState describe(ResourceHandle handle) {
        switch (handle.kind()) {
            case VIRTUAL_NETWORK:
                return call(() -> ec2.describeVpc(handle.id()));
            case ADDRESS_TRANSLATOR:
                return call(() -> ec2.describeNatGateway(handle.id()));
            default:
                return ResourceState.AVAILABLE;
        }
    }

    private CreatedResource dispatchCreate(CreateRequest request) {
        switch (request.kind()) {
            case VIRTUAL_NETWORK:
                return CreatedResource.of(ec2.createVpc(request.name(), request.parameters()));
            case GATEWAY:
                return CreatedResource.of(ec2.createInternetGateway(request.name(), request.parameters()));
            case SUBNET:
                return CreatedResource.of(ec2.createSubnet(request.name(), request.parameters()));
            case ROUTE_TABLE:
                return CreatedResource.of(ec2.createRouteTable(request.name(), request.parameters()));
            case ROUTE_ASSOCIATION:
                return CreatedResource.of(ec2.associateRouteTable(request.name(), request.parameters()));
            case ADDRESS_TRANSLATOR:
                return CreatedResource.of(ec2.createNatGateway(request.name(), request.parameters()));
            case SECURITY_GROUP:
                return CreatedResource.of(ec2.createSecurityGroup(request.name(), request.parameters()));
            case KEY_PAIR:
                return ec2.createKeyPair(request.name());
            case LAUNCH_TEMPLATE:
                return CreatedResource.of(ec2.createLaunchTemplate(request.name(), request.parameters()));
            case LOAD_BALANCER:
                return CreatedResource.of(loadBalancing.createLoadBalancer(request.name(), request.parameters()));
            case TARGET_GROUP:
                return CreatedResource.of(loadBalancing.createTargetGroup(request.name(), request.parameters()));
            case LISTENER:
                return CreatedResource.of(loadBalancing.createListener(request.parameters()));
            case SCALING_GROUP:
                return CreatedResource.of(scaling.createScalingGroup(request.name(), request.parameters()));
            default:
                throw new IllegalArgumentException("unsupported kind: " + request.kind());
        }
    }

    private Optional<String> dispatchLookup(LookupRequest request) {
        if (request.mode() == LookupMode.ANY_NON_DEFAULT) {
            if (request.kind() != ResourceKind.VIRTUAL_NETWORK) {
                throw new IllegalArgumentException("ANY_NON_DEFAULT lookup is only supported for VIRTUAL_NETWORK");
            }
            return ec2.findNonDefaultVpc();
        }
        switch (request.kind()) {
            case LOAD_BALANCER:
                return loadBalancing.findLoadBalancer(request.name());
            case TARGET_GROUP:
                return loadBalancing.findTargetGroup(request.name());
            case LISTENER:
                return loadBalancing.findListener(request.parameters());
            case SCALING_GROUP:
                return scaling.findScalingGroup(request.name());
            default:
                return ec2.findByName(request.kind(), request.name(), request.parameters());
        }
    }

    private static <T> T call(Supplier<T> action) {
        try {
            return action.get();
        } catch (AmazonClientException e) {
            ProviderException translated = AwsErrors.translate(e);
            log.debug("AWS call failed (code: {}): {}", translated.getErrorCode(), translated.getMessage());
            throw translated;
        }
    }
}
