package com.ryuqq.provisioner.adapter.runner;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>준비 상태 폴링 간격을 지수적으로 늘리되, Jitter를 더해
 * 여러 실행이 같은 시점에 상태 조회 API를 두드리지 않도록 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attemptCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=5000ms, maxDelay=15000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attemptCount=1: 5000-5500ms</li>
 *   <li>attemptCount=2: 10000-11000ms</li>
 *   <li>attemptCount=3 이후: 15000ms (maxDelay)</li>
 * </ul>
 *
 * <p>대기 예산이 길면 시도 횟수가 수백 회가 될 수 있으므로 지수 부분은 2^30에서 멈춥니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=5000ms, maxDelay=15000ms, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(5000, 15000, 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * RunnerConfig의 폴링 설정으로 생성.
     *
     * @param config 실행기 설정 (폴링 기본 간격, 최대 간격, 지터 비율)
     * @return 폴링용 BackoffCalculator
     */
    public static BackoffCalculator forPolling(RunnerConfig config) {
        return new BackoffCalculator(config.pollBaseIntervalMs(), config.pollMaxIntervalMs(), config.jitterFactor());
    }

    /**
     * 다음 폴링까지의 지연 시간 계산.
     *
     * @param attemptCount 현재 폴링 횟수 (1부터 시작)
     * @return 대기 시간 (밀리초, maxDelayMs 이하)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        int shift = Math.min(attemptCount - 1, MAX_SHIFT);
        long exponential = baseDelayMs > (maxDelayMs >> shift)
            ? maxDelayMs
            : Math.min(baseDelayMs << shift, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * Math.random());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
