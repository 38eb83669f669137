package com.ryuqq.provisioner.core.run;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceHandle;

/**
 * 기존 리소스 재사용.
 *
 * <p>생성 시도가 재사용 가능 오류(이름 중복, VPC 한도 초과 등)로 거부된 뒤
 * 조회로 찾은 리소스를 채택한 경우입니다.</p>
 *
 * @param handle 채택된 리소스 핸들 (논리 이름은 이번 실행의 이름)
 * @param triggeringErrorCode 재사용을 유발한 프로바이더 오류 코드
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record Reused(
    ResourceHandle handle,
    String triggeringErrorCode
) implements StepResult {

    public Reused {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (triggeringErrorCode == null || triggeringErrorCode.isBlank()) {
            throw new IllegalArgumentException("triggeringErrorCode cannot be null or blank");
        }
    }

    @Override
    public LogicalName logicalName() {
        return handle.name();
    }
}
