package com.ryuqq.provisioner.core.exception;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKind;

/**
 * 프로바이더 거부가 아닌 이유로 단계가 실패함.
 *
 * <p>예: 키 자료 저장 실패, 계획 파라미터 타입 오류, 프로바이더의 비정상 응답.
 * 리소스가 이미 생성된 뒤 실패했다면 그 핸들을 보존하여 실행 보고서에 남깁니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class StepFailedException extends ProvisioningException {

    private static final long serialVersionUID = 1L;

    private final LogicalName resource;
    private final ResourceKind resourceKind;
    private final ResourceHandle createdHandle;

    /**
     * 생성자.
     *
     * @param resource 실패한 단계의 논리 이름
     * @param resourceKind 리소스 종류
     * @param createdHandle 실패 전에 생성된 리소스 핸들 (없으면 null)
     * @param message 오류 메시지
     * @param cause 원인
     */
    public StepFailedException(LogicalName resource, ResourceKind resourceKind, ResourceHandle createdHandle,
                               String message, Throwable cause) {
        super(ErrorKind.STEP_FAILED, message, cause);
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        if (resourceKind == null) {
            throw new IllegalArgumentException("resourceKind cannot be null");
        }
        this.resource = resource;
        this.resourceKind = resourceKind;
        this.createdHandle = createdHandle;
    }

    public LogicalName getResource() {
        return resource;
    }

    public ResourceKind getResourceKind() {
        return resourceKind;
    }

    public ResourceHandle getCreatedHandleOrNull() {
        return createdHandle;
    }
}
