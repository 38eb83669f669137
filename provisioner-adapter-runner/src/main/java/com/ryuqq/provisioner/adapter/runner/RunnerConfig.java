package com.ryuqq.provisioner.adapter.runner;

/**
 * 실행기 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>readinessTimeoutMs: 리소스 하나의 준비 대기 예산 (기본 600000ms = 10분)</li>
 *   <li>pollBaseIntervalMs: 첫 폴링 간격 (기본 5000ms)</li>
 *   <li>pollMaxIntervalMs: 최대 폴링 간격 (기본 15000ms)</li>
 *   <li>jitterFactor: 폴링 간격 Jitter 비율 (기본 0.1)</li>
 *   <li>runTimeoutMs: 실행 전체 예산 (기본 0 = 제한 없음)</li>
 * </ul>
 *
 * <p>NAT 게이트웨이는 보통 1-3분 안에 준비되며, 10분 예산은 AWS 기본 waiter(15초 × 40회)와 비슷한 수준입니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param readinessTimeoutMs 준비 대기 예산 (밀리초, 0 이상)
 * @param pollBaseIntervalMs 첫 폴링 간격 (밀리초, 양수)
 * @param pollMaxIntervalMs 최대 폴링 간격 (밀리초, pollBaseIntervalMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param runTimeoutMs 실행 전체 예산 (밀리초, 0이면 제한 없음)
 */
public record RunnerConfig(
    long readinessTimeoutMs,
    long pollBaseIntervalMs,
    long pollMaxIntervalMs,
    double jitterFactor,
    long runTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     */
    public RunnerConfig() {
        this(600000, 5000, 15000, 0.1, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RunnerConfig {
        if (readinessTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "readinessTimeoutMs must be non-negative (current: " + readinessTimeoutMs + ")"
            );
        }
        if (pollBaseIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollBaseIntervalMs must be positive (current: " + pollBaseIntervalMs + ")"
            );
        }
        if (pollMaxIntervalMs < pollBaseIntervalMs) {
            throw new IllegalArgumentException(
                "pollMaxIntervalMs must be >= pollBaseIntervalMs (base: " + pollBaseIntervalMs
                    + ", max: " + pollMaxIntervalMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (runTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "runTimeoutMs must be non-negative (current: " + runTimeoutMs + ")"
            );
        }
    }

    public boolean hasRunTimeout() {
        return runTimeoutMs > 0;
    }

    /**
     * readinessTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withReadinessTimeoutMs(long readinessTimeoutMs) {
        return new RunnerConfig(readinessTimeoutMs, pollBaseIntervalMs, pollMaxIntervalMs, jitterFactor, runTimeoutMs);
    }

    /**
     * 폴링 간격만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withPollIntervals(long pollBaseIntervalMs, long pollMaxIntervalMs) {
        return new RunnerConfig(readinessTimeoutMs, pollBaseIntervalMs, pollMaxIntervalMs, jitterFactor, runTimeoutMs);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withJitterFactor(double jitterFactor) {
        return new RunnerConfig(readinessTimeoutMs, pollBaseIntervalMs, pollMaxIntervalMs, jitterFactor, runTimeoutMs);
    }

    /**
     * runTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withRunTimeoutMs(long runTimeoutMs) {
        return new RunnerConfig(readinessTimeoutMs, pollBaseIntervalMs, pollMaxIntervalMs, jitterFactor, runTimeoutMs);
    }
}
