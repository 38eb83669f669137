package com.ryuqq.provisioner.core.config;

/**
 * 스케일링 그룹 인스턴스를 배치할 서브넷 계층.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum FleetPlacement {

    /**
     * 프라이빗 서브넷 (주소 변환기를 통해서만 외부로 나감).
     */
    PRIVATE,

    /**
     * 퍼블릭 서브넷 (시작 시 공인 IP 할당).
     */
    PUBLIC
}
