package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.ResourceKind;

/**
 * 조회로 찾은 기존 리소스.
 *
 * @param kind 프로바이더가 보고한 실제 종류
 * @param id 프로바이더 식별자
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ExistingResource(
    ResourceKind kind,
    String id
) {

    public ExistingResource {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
    }
}
