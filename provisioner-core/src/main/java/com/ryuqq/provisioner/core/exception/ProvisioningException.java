package com.ryuqq.provisioner.core.exception;

/**
 * 프로비저닝 실행 전체를 중단시키는 오류의 기반 클래스.
 *
 * <p>재사용 가능한 프로바이더 오류는 생성 단계 내부에서 복구되며 이 계층으로 올라오지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public abstract class ProvisioningException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind errorKind;

    protected ProvisioningException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    protected ProvisioningException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
