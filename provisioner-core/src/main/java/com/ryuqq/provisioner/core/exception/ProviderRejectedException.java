package com.ryuqq.provisioner.core.exception;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.spi.ProviderException;

/**
 * 프로바이더가 재사용 대상이 아닌 오류를 반환함.
 *
 * <p>프로바이더 오류 코드와 메시지를 그대로 보존하여 실행 리포트에 노출합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ProviderRejectedException extends ProvisioningException {

    private static final long serialVersionUID = 1L;

    private final LogicalName resource;
    private final ResourceKind resourceKind;
    private final String providerErrorCode;
    private final String providerMessage;

    /**
     * 생성자.
     *
     * @param resource 실패한 리소스의 논리 이름 (리소스와 무관한 호출이면 null)
     * @param resourceKind 리소스 종류 (null 가능)
     * @param providerErrorCode 프로바이더 오류 코드
     * @param providerMessage 프로바이더 메시지
     * @param cause 원인 (null 가능)
     */
    public ProviderRejectedException(LogicalName resource, ResourceKind resourceKind,
                                     String providerErrorCode, String providerMessage, Throwable cause) {
        super(ErrorKind.PROVIDER_REJECTED, describe(resource, resourceKind, providerErrorCode, providerMessage), cause);
        this.resource = resource;
        this.resourceKind = resourceKind;
        this.providerErrorCode = providerErrorCode;
        this.providerMessage = providerMessage;
    }

    /**
     * 프로바이더 예외로부터 생성.
     */
    public static ProviderRejectedException of(LogicalName resource, ResourceKind kind, ProviderException cause) {
        return new ProviderRejectedException(resource, kind, cause.getErrorCode(), cause.getMessage(), cause);
    }

    private static String describe(LogicalName resource, ResourceKind kind, String code, String message) {
        String target = resource == null ? "provider call" : kind + " " + resource;
        return "Provider rejected " + target + ": [" + code + "] " + message;
    }

    public LogicalName getResourceOrNull() {
        return resource;
    }

    public ResourceKind getResourceKindOrNull() {
        return resourceKind;
    }

    public String getProviderErrorCode() {
        return providerErrorCode;
    }

    public String getProviderMessage() {
        return providerMessage;
    }
}
