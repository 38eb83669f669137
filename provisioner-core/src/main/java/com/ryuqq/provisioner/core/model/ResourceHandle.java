package com.ryuqq.provisioner.core.model;

/**
 * 완료된 단계가 만들어낸 프로바이더 식별자.
 *
 * <p>단계 사이에 전달되는 유일한 값입니다. 다른 부수 채널은 없습니다.</p>
 *
 * @param kind 리소스 종류
 * @param name 논리 이름
 * @param id 프로바이더가 부여한 식별자 (ID, ARN 또는 키 이름)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ResourceHandle(
    ResourceKind kind,
    LogicalName name,
    String id
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 id가 빈 문자열인 경우
     */
    public ResourceHandle {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
    }
}
