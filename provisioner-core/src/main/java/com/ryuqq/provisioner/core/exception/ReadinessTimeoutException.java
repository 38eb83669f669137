package com.ryuqq.provisioner.core.exception;

import com.ryuqq.provisioner.core.model.ResourceHandle;

import java.time.Duration;

/**
 * 비동기 리소스가 대기 예산 내에 AVAILABLE 상태가 되지 않음.
 *
 * <p>준비되지 않은 리소스에 안전하게 의존할 수 없으므로 실행 전체에 치명적입니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ReadinessTimeoutException extends ProvisioningException {

    private static final long serialVersionUID = 1L;

    private final ResourceHandle handle;
    private final Duration elapsed;

    public ReadinessTimeoutException(ResourceHandle handle, Duration elapsed) {
        super(ErrorKind.READINESS_TIMEOUT,
            handle.kind() + " " + handle.name() + " (" + handle.id() + ") was not ready after " + elapsed.toMillis() + "ms");
        this.handle = handle;
        this.elapsed = elapsed;
    }

    public ResourceHandle getHandle() {
        return handle;
    }

    public Duration getElapsed() {
        return elapsed;
    }
}
