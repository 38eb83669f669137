package com.ryuqq.provisioner.core.model;

/**
 * 프로바이더가 보고하는 리소스 상태.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ResourceState {

    /**
     * 생성 요청은 수락되었으나 아직 사용할 수 없음.
     */
    PENDING,

    /**
     * 사용 가능.
     */
    AVAILABLE,

    /**
     * 프로바이더 측에서 프로비저닝 실패 (종료 상태).
     */
    FAILED
}
