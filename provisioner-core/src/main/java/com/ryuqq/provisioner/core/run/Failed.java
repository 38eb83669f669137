package com.ryuqq.provisioner.core.run;

import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKind;

/**
 * 실행을 중단시킨 실패.
 *
 * <p>리소스가 생성되었지만 준비 대기 중 실패한 경우 {@code createdHandle}에 그 핸들이 남습니다.
 * 이 핸들은 컨텍스트에 바인딩되지 않지만, 운영자가 정리할 수 있도록 실행 보고서에는 포함됩니다.</p>
 *
 * @param logicalName 실패한 단계의 논리 이름
 * @param kind 실패한 단계의 리소스 종류
 * @param error 실행을 중단시킨 오류
 * @param createdHandle 생성은 되었으나 바인딩되지 않은 핸들 (없으면 null)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record Failed(
    LogicalName logicalName,
    ResourceKind kind,
    ProvisioningException error,
    ResourceHandle createdHandle
) implements StepResult {

    public Failed {
        if (logicalName == null) {
            throw new IllegalArgumentException("logicalName cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    public static Failed of(LogicalName logicalName, ResourceKind kind, ProvisioningException error) {
        return new Failed(logicalName, kind, error, null);
    }

    public boolean hasCreatedHandle() {
        return createdHandle != null;
    }
}
