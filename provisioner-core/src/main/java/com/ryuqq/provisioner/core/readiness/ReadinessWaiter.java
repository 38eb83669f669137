package com.ryuqq.provisioner.core.readiness;

import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.run.Cancellation;

import java.time.Duration;

/**
 * 비동기로 프로비저닝되는 리소스가 사용 가능해질 때까지 대기.
 *
 * <p>정상 반환은 리소스가 AVAILABLE 상태임을 의미합니다. 구현체는 예산을
 * 한 번의 상태 조회 이상 초과해서는 안 됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface ReadinessWaiter {

    /**
     * 리소스가 준비될 때까지 대기.
     *
     * @param handle 대기할 리소스
     * @param timeout 대기 예산
     * @param cancellation 실행 취소 신호
     * @throws com.ryuqq.provisioner.core.exception.ReadinessTimeoutException 예산 내에 준비되지 않은 경우
     * @throws com.ryuqq.provisioner.core.exception.ProviderRejectedException 프로바이더가 실패 상태를 보고한 경우
     * @throws com.ryuqq.provisioner.core.exception.RunCancelledException 취소 또는 인터럽트된 경우
     */
    void waitUntilReady(ResourceHandle handle, Duration timeout, Cancellation cancellation);
}
