package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.ResourceParameters;

/**
 * 리소스 생성 요청.
 *
 * @param kind 리소스 종류
 * @param name 논리 이름 (프로바이더 측 이름 또는 Name 태그로 사용)
 * @param parameters 고정 파라미터와 해석된 입력이 병합된 파라미터
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record CreateRequest(
    ResourceKind kind,
    LogicalName name,
    ResourceParameters parameters
) {

    public CreateRequest {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters cannot be null");
        }
    }
}
