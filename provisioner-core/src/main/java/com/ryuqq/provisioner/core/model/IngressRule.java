package com.ryuqq.provisioner.core.model;

/**
 * 보안 그룹 인바운드 규칙.
 *
 * <p>허용 출처는 정확히 하나입니다:</p>
 * <ul>
 *   <li>열린 CIDR 블록 (예: {@code 0.0.0.0/0})</li>
 *   <li>다른 보안 그룹 참조: 참조 대상 그룹의 식별자를 담고 있는 입력 파라미터 이름</li>
 * </ul>
 *
 * <p>그룹 참조 형태는 로드 밸런서를 거친 트래픽만 컴퓨트 플릿에 도달하도록 강제할 때 사용합니다.
 * 참조 대상 식별자는 실행 시점에 입력 해석을 통해 채워지므로, 규칙 자체에는 파라미터 이름만 기록됩니다.</p>
 *
 * @param protocol 프로토콜 (예: tcp)
 * @param fromPort 시작 포트
 * @param toPort 끝 포트
 * @param cidr 허용 CIDR (그룹 참조인 경우 null)
 * @param sourceGroupParameter 참조 그룹 식별자를 담은 파라미터 이름 (CIDR 규칙인 경우 null)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record IngressRule(
    String protocol,
    int fromPort,
    int toPort,
    String cidr,
    String sourceGroupParameter
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 포트 범위가 잘못되었거나 출처가 정확히 하나가 아닌 경우
     */
    public IngressRule {
        if (protocol == null || protocol.isBlank()) {
            throw new IllegalArgumentException("protocol cannot be null or blank");
        }
        if (fromPort < 0 || toPort > 65535 || fromPort > toPort) {
            throw new IllegalArgumentException(
                "invalid port range (from: " + fromPort + ", to: " + toPort + ")");
        }
        boolean hasCidr = cidr != null && !cidr.isBlank();
        boolean hasGroup = sourceGroupParameter != null && !sourceGroupParameter.isBlank();
        if (hasCidr == hasGroup) {
            throw new IllegalArgumentException("exactly one of cidr or sourceGroupParameter must be set");
        }
    }

    /**
     * CIDR 출처 규칙 생성 (단일 포트).
     */
    public static IngressRule fromCidr(String protocol, int port, String cidr) {
        return new IngressRule(protocol, port, port, cidr, null);
    }

    /**
     * 보안 그룹 참조 규칙 생성 (단일 포트).
     *
     * @param protocol 프로토콜
     * @param port 포트
     * @param sourceGroupParameter 참조 그룹 식별자를 담은 입력 파라미터 이름
     * @return IngressRule 인스턴스
     */
    public static IngressRule fromGroup(String protocol, int port, String sourceGroupParameter) {
        return new IngressRule(protocol, port, port, null, sourceGroupParameter);
    }

    /**
     * 그룹 참조 규칙인지 확인.
     *
     * @return 그룹 참조인 경우 true
     */
    public boolean isGroupReference() {
        return sourceGroupParameter != null;
    }
}
