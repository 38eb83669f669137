package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.ResourceParameters;

/**
 * 기존 리소스 조회 요청.
 *
 * <p>라우트 연결이나 리스너처럼 프로바이더 측 이름이 없는 종류는
 * 해석된 파라미터(서브넷 ID, 로드 밸런서 ID 등)로 조회합니다.</p>
 *
 * @param kind 기대하는 리소스 종류
 * @param name 논리 이름
 * @param mode 조회 방식
 * @param parameters 생성 시도에 사용한 해석된 파라미터
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record LookupRequest(
    ResourceKind kind,
    LogicalName name,
    LookupMode mode,
    ResourceParameters parameters
) {

    public LookupRequest {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters cannot be null");
        }
    }
}
