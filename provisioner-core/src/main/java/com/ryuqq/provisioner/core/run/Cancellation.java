package com.ryuqq.provisioner.core.run;

import com.ryuqq.provisioner.core.exception.RunCancelledException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 실행 단위 취소 신호.
 *
 * <p>운영자가 멈춘 실행을 중단할 수 있도록, 준비 대기 중인 스레드를 즉시 깨웁니다.
 * 폴링 간격 대기에 {@link #await(long)}를 사용하면 취소 즉시 반환됩니다.</p>
 *
 * <p><strong>Thread Safety:</strong> {@link #cancel(String)}은 어느 스레드에서든 호출할 수 있으며 멱등합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class Cancellation {

    private final CountDownLatch signal = new CountDownLatch(1);
    private volatile String reason;

    /**
     * 아직 취소되지 않은 새 신호 생성.
     *
     * @return Cancellation
     */
    public static Cancellation create() {
        return new Cancellation();
    }

    /**
     * 실행 취소 (첫 호출의 사유만 유지).
     *
     * @param reason 취소 사유
     */
    public void cancel(String reason) {
        synchronized (signal) {
            if (this.reason == null) {
                this.reason = reason == null || reason.isBlank() ? "cancelled by operator" : reason;
            }
        }
        signal.countDown();
    }

    public boolean isCancelled() {
        return signal.getCount() == 0;
    }

    /**
     * 취소 사유 조회.
     *
     * @return 사유, 취소되지 않았으면 null
     */
    public String getReasonOrNull() {
        return reason;
    }

    /**
     * 최대 millis 동안 취소를 기다림.
     *
     * @param millis 최대 대기 시간 (밀리초)
     * @return 대기 중 취소된 경우 true, 시간이 지난 경우 false
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean await(long millis) throws InterruptedException {
        if (millis <= 0) {
            return isCancelled();
        }
        return signal.await(millis, TimeUnit.MILLISECONDS);
    }

    /**
     * 취소된 경우 예외 발생.
     *
     * @throws RunCancelledException 취소된 경우
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new RunCancelledException(reason);
        }
    }
}
