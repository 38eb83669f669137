package com.ryuqq.provisioner.core.exception;

/**
 * 운영자 취소, 스레드 인터럽트 또는 실행 시간 예산 소진으로 실행이 중단됨.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class RunCancelledException extends ProvisioningException {

    private static final long serialVersionUID = 1L;

    public RunCancelledException(String reason) {
        super(ErrorKind.RUN_CANCELLED, "Provisioning run cancelled: " + reason);
    }

    public RunCancelledException(String reason, Throwable cause) {
        super(ErrorKind.RUN_CANCELLED, "Provisioning run cancelled: " + reason, cause);
    }
}
