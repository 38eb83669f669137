package com.ryuqq.provisioner.core.exception;

/**
 * 프로비저닝 실행을 중단시키는 오류 분류.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 계획 순서 오류. 빌더가 올바르면 런타임에 발생하지 않아야 합니다.
     */
    UNRESOLVED_DEPENDENCY,

    /**
     * 재사용 대상이 아닌 프로바이더 오류.
     */
    PROVIDER_REJECTED,

    /**
     * 비동기 리소스가 대기 예산 내에 준비되지 않음.
     */
    READINESS_TIMEOUT,

    /**
     * 리전에서 사용 가능한 가용 영역 부족 (사전 조건 위반).
     */
    INSUFFICIENT_ZONES,

    /**
     * 같은 논리 이름으로 찾은 기존 리소스의 종류가 다름 (이름 충돌).
     */
    REUSE_CONFLICT,

    /**
     * 운영자 취소 또는 실행 시간 예산 소진.
     */
    RUN_CANCELLED,

    /**
     * 프로바이더 거부 외의 단계 실행 오류 (키 자료 저장 실패, 잘못된 파라미터, 비정상 응답).
     */
    STEP_FAILED
}
