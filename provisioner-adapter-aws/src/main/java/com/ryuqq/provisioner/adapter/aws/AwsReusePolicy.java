package com.ryuqq.provisioner.adapter.aws;

import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.policy.ReusePolicy;
import com.ryuqq.provisioner.core.spi.LookupMode;

import java.util.EnumSet;
import java.util.Set;

/**
 * AWS 오류 코드 기준 기본 재사용 규칙.
 *
 * <p>VPC 한도 초과는 기본 VPC가 아닌 아무 VPC를 재사용하고, 나머지 중복 오류는 모두
 * 논리 이름으로 기존 리소스를 조회합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class AwsReusePolicy {

    /**
     * 어댑터가 Name 태그로 중복을 감지하는 종류.
     */
    static final Set<ResourceKind> NAME_TAGGED_KINDS = EnumSet.of(
        ResourceKind.VIRTUAL_NETWORK,
        ResourceKind.GATEWAY,
        ResourceKind.SUBNET,
        ResourceKind.ROUTE_TABLE,
        ResourceKind.ROUTE_ASSOCIATION,
        ResourceKind.ADDRESS_TRANSLATOR
    );

    private static final ReusePolicy DEFAULTS = build();

    private AwsReusePolicy() {
    }

    public static ReusePolicy defaults() {
        return DEFAULTS;
    }

    private static ReusePolicy build() {
        ReusePolicy.Builder builder = ReusePolicy.builder()
            .reuse(ResourceKind.VIRTUAL_NETWORK, AwsErrors.VPC_LIMIT_EXCEEDED, LookupMode.ANY_NON_DEFAULT);
        for (ResourceKind kind : NAME_TAGGED_KINDS) {
            builder.reuseByName(kind, AwsErrors.DUPLICATE_NAME);
        }
        return builder
            .reuseByName(ResourceKind.ROUTE_ASSOCIATION, AwsErrors.ROUTE_ALREADY_ASSOCIATED)
            .reuseByName(ResourceKind.SECURITY_GROUP, AwsErrors.SECURITY_GROUP_DUPLICATE)
            .reuseByName(ResourceKind.KEY_PAIR, AwsErrors.KEY_PAIR_DUPLICATE)
            .reuseByName(ResourceKind.LAUNCH_TEMPLATE, AwsErrors.LAUNCH_TEMPLATE_DUPLICATE)
            .reuseByName(ResourceKind.LOAD_BALANCER, AwsErrors.LOAD_BALANCER_DUPLICATE)
            .reuseByName(ResourceKind.TARGET_GROUP, AwsErrors.TARGET_GROUP_DUPLICATE)
            .reuseByName(ResourceKind.LISTENER, AwsErrors.LISTENER_DUPLICATE)
            .reuseByName(ResourceKind.SCALING_GROUP, AwsErrors.SCALING_GROUP_DUPLICATE)
            .build();
    }
}
