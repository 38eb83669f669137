package com.ryuqq.provisioner.core.spi;

/**
 * 재사용 조회 방식.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum LookupMode {

    /**
     * 같은 논리 이름을 가진 리소스 조회.
     */
    BY_NAME,

    /**
     * 이름과 무관하게 기본(default)이 아닌 임의의 기존 리소스 조회.
     *
     * <p>가상 네트워크 한도 초과 시의 대체 경로에서만 사용합니다.</p>
     */
    ANY_NON_DEFAULT
}
