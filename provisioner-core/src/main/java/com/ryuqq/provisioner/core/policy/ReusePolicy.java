package com.ryuqq.provisioner.core.policy;

import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.spi.LookupMode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 리소스 종류별 "재사용 가능" 오류 코드 테이블.
 *
 * <p>생성 호출이 실패했을 때 해당 (종류, 오류 코드) 조합이 테이블에 있으면
 * 오류가 아니라 기존 리소스 재사용으로 처리합니다. 테이블에 없는 오류는 모두 치명적입니다.</p>
 *
 * <p>호출 지점마다 오류 코드를 하드코딩하지 않고 데이터로 관리하여,
 * 관련 없는 프로바이더 오류를 조용히 삼키는 일을 막습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ReusePolicy policy = ReusePolicy.builder()
 *     .reuse(ResourceKind.VIRTUAL_NETWORK, "VpcLimitExceeded", LookupMode.ANY_NON_DEFAULT)
 *     .reuseByName(ResourceKind.KEY_PAIR, "InvalidKeyPair.Duplicate")
 *     .build();
 *
 * policy.lookupFor(ResourceKind.KEY_PAIR, "InvalidKeyPair.Duplicate"); // Optional[BY_NAME]
 * policy.lookupFor(ResourceKind.KEY_PAIR, "UnauthorizedOperation");    // Optional.empty
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ReusePolicy {

    private static final ReusePolicy NONE = new ReusePolicy(new EnumMap<>(ResourceKind.class));

    private final Map<ResourceKind, Map<String, LookupMode>> rules;

    private ReusePolicy(Map<ResourceKind, Map<String, LookupMode>> rules) {
        EnumMap<ResourceKind, Map<String, LookupMode>> copy = new EnumMap<>(ResourceKind.class);
        rules.forEach((kind, codes) -> copy.put(kind, Collections.unmodifiableMap(new LinkedHashMap<>(codes))));
        this.rules = Collections.unmodifiableMap(copy);
    }

    /**
     * 재사용 규칙이 없는 정책 (모든 프로바이더 오류가 치명적).
     *
     * @return 빈 정책
     */
    public static ReusePolicy none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 오류 코드에 대응하는 재사용 조회 방식.
     *
     * @param kind 리소스 종류
     * @param errorCode 프로바이더 오류 코드
     * @return 재사용 대상이면 조회 방식, 아니면 empty
     */
    public Optional<LookupMode> lookupFor(ResourceKind kind, String errorCode) {
        if (kind == null || errorCode == null) {
            return Optional.empty();
        }
        Map<String, LookupMode> codes = rules.get(kind);
        return codes == null ? Optional.empty() : Optional.ofNullable(codes.get(errorCode));
    }

    public boolean isReuseEligible(ResourceKind kind, String errorCode) {
        return lookupFor(kind, errorCode).isPresent();
    }

    /**
     * 종류별 규칙 조회 (읽기 전용).
     *
     * @param kind 리소스 종류
     * @return 오류 코드 → 조회 방식 매핑
     */
    public Map<String, LookupMode> rulesFor(ResourceKind kind) {
        return rules.getOrDefault(kind, Map.of());
    }

    /**
     * 다른 정책의 규칙을 덧붙인 새 정책 생성 (충돌 시 other 우선).
     */
    public ReusePolicy merge(ReusePolicy other) {
        Builder builder = new Builder();
        rules.forEach((kind, codes) -> codes.forEach((code, mode) -> builder.reuse(kind, code, mode)));
        other.rules.forEach((kind, codes) -> codes.forEach((code, mode) -> builder.reuse(kind, code, mode)));
        return builder.build();
    }

    @Override
    public String toString() {
        return "ReusePolicy" + rules;
    }

    /**
     * ReusePolicy 빌더.
     */
    public static final class Builder {

        private final Map<ResourceKind, Map<String, LookupMode>> rules = new EnumMap<>(ResourceKind.class);

        private Builder() {
        }

        public Builder reuse(ResourceKind kind, String errorCode, LookupMode mode) {
            if (kind == null) {
                throw new IllegalArgumentException("kind cannot be null");
            }
            if (errorCode == null || errorCode.isBlank()) {
                throw new IllegalArgumentException("errorCode cannot be null or blank");
            }
            if (mode == null) {
                throw new IllegalArgumentException("mode cannot be null");
            }
            rules.computeIfAbsent(kind, k -> new LinkedHashMap<>()).put(errorCode, mode);
            return this;
        }

        public Builder reuseByName(ResourceKind kind, String errorCode) {
            return reuse(kind, errorCode, LookupMode.BY_NAME);
        }

        public ReusePolicy build() {
            return new ReusePolicy(rules);
        }
    }
}
