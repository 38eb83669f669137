package com.ryuqq.provisioner.adapter.runner;

import com.ryuqq.provisioner.core.exception.ProviderRejectedException;
import com.ryuqq.provisioner.core.exception.ReadinessTimeoutException;
import com.ryuqq.provisioner.core.exception.RunCancelledException;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceState;
import com.ryuqq.provisioner.core.readiness.ReadinessWaiter;
import com.ryuqq.provisioner.core.run.Cancellation;
import com.ryuqq.provisioner.core.spi.CloudProvider;
import com.ryuqq.provisioner.core.spi.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 상태 조회 폴링 기반 Readiness Waiter.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>{@link CloudProvider#describe(ResourceHandle)} 호출</li>
 *   <li>AVAILABLE → 반환, FAILED → {@link ProviderRejectedException} (코드 {@value #RESOURCE_FAILED})</li>
 *   <li>PENDING → 남은 예산이 없으면 {@link ReadinessTimeoutException}</li>
 *   <li>backoff 간격만큼 대기 (남은 예산으로 잘라냄) 후 1로 돌아감</li>
 * </ol>
 *
 * <p>마지막 대기를 남은 예산으로 자르므로 예산을 넘기는 시간은 상태 조회 한 번 이하입니다.</p>
 *
 * <p>대기는 {@link Cancellation#await(long)}로 수행되어 취소 즉시 깨어납니다.
 * 스레드 인터럽트도 취소로 취급하며, 인터럽트 플래그는 복원됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class PollingReadinessWaiter implements ReadinessWaiter {

    static final String RESOURCE_FAILED = "ResourceFailed";

    private static final Logger log = LoggerFactory.getLogger(PollingReadinessWaiter.class);

    private final CloudProvider provider;
    private final BackoffCalculator backoff;

    /**
     * 생성자.
     *
     * @param provider 상태를 조회할 프로바이더
     * @param backoff 폴링 간격 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PollingReadinessWaiter(CloudProvider provider, BackoffCalculator backoff) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        this.provider = provider;
        this.backoff = backoff;
    }

    @Override
    public void waitUntilReady(ResourceHandle handle, Duration timeout, Cancellation cancellation) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }

        long startNanos = System.nanoTime();
        long budgetNanos = timeout.toNanos();
        int attempt = 0;

        while (true) {
            cancellation.throwIfCancelled();

            ResourceState state = describe(handle);
            if (state == ResourceState.AVAILABLE) {
                log.info("{} {} ({}) is available after {} poll(s)", handle.kind(), handle.name(), handle.id(), attempt + 1);
                return;
            }
            if (state == ResourceState.FAILED) {
                throw new ProviderRejectedException(handle.name(), handle.kind(), RESOURCE_FAILED,
                    handle.kind() + " " + handle.id() + " entered a failed state while becoming ready", null);
            }

            long elapsedNanos = System.nanoTime() - startNanos;
            long remainingMs = (budgetNanos - elapsedNanos) / 1_000_000;
            if (remainingMs <= 0) {
                throw new ReadinessTimeoutException(handle, Duration.ofNanos(elapsedNanos));
            }

            attempt++;
            long delayMs = Math.min(backoff.calculate(attempt), remainingMs);
            log.debug("{} {} is still pending, polling again in {}ms", handle.kind(), handle.name(), delayMs);
            pause(handle, delayMs, cancellation);
        }
    }

    private ResourceState describe(ResourceHandle handle) {
        try {
            ResourceState state = provider.describe(handle);
            if (state == null) {
                throw new IllegalStateException("provider returned no state for " + handle.id());
            }
            return state;
        } catch (ProviderException e) {
            throw ProviderRejectedException.of(handle.name(), handle.kind(), e);
        }
    }

    /**
     * 취소 가능한 대기.
     *
     * @throws RunCancelledException 대기 중 취소되거나 인터럽트된 경우
     */
    private void pause(ResourceHandle handle, long millis, Cancellation cancellation) {
        try {
            if (cancellation.await(millis)) {
                throw new RunCancelledException(cancellation.getReasonOrNull());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("interrupted while waiting for " + handle.name(), e);
        }
    }
}
