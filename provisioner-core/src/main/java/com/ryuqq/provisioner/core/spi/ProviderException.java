package com.ryuqq.provisioner.core.spi;

/**
 * 프로바이더 호출 실패.
 *
 * <p>프로바이더 고유의 오류 코드 (예: {@code InvalidKeyPair.Duplicate})를 보존합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ProviderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    public ProviderException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    public ProviderException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
