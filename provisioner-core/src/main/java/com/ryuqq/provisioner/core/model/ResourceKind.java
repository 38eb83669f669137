package com.ryuqq.provisioner.core.model;

/**
 * 프로비저닝 가능한 리소스 종류.
 *
 * <p>각 종류는 프로바이더 측 생명주기에 "준비 중" 단계가 있는지 여부를 알고 있습니다.
 * {@link #requiresReadiness()}가 true인 종류는 생성 직후 바로 사용할 수 없으며,
 * 의존 리소스가 생성되기 전에 AVAILABLE 상태까지 대기해야 합니다.</p>
 *
 * <p><strong>비동기 프로비저닝 종류:</strong></p>
 * <ul>
 *   <li>{@link #VIRTUAL_NETWORK}: pending → available</li>
 *   <li>{@link #ADDRESS_TRANSLATOR}: pending → available (수십 초 ~ 수 분)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ResourceKind {

    VIRTUAL_NETWORK(true),
    GATEWAY(false),
    SUBNET(false),
    ROUTE_TABLE(false),
    ROUTE_ASSOCIATION(false),
    ADDRESS_TRANSLATOR(true),
    SECURITY_GROUP(false),
    KEY_PAIR(false),
    LAUNCH_TEMPLATE(false),
    LOAD_BALANCER(false),
    TARGET_GROUP(false),
    LISTENER(false),
    SCALING_GROUP(false);

    private final boolean requiresReadiness;

    ResourceKind(boolean requiresReadiness) {
        this.requiresReadiness = requiresReadiness;
    }

    /**
     * 생성 후 준비 완료 대기가 필요한지 확인.
     *
     * @return 비동기 프로비저닝 종류인 경우 true
     */
    public boolean requiresReadiness() {
        return requiresReadiness;
    }
}
