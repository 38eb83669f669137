package com.ryuqq.provisioner.core.config;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 프로비저닝 실행 설정 (불변 record).
 *
 * <p>한 번의 실행이 만들 환경 전체를 기술합니다. 모든 리소스 이름은 {@code project}에서 파생됩니다.</p>
 *
 * <p><strong>설정 항목 (기본값):</strong></p>
 * <ul>
 *   <li>project: 리소스 이름 접두사 ("provisioner")</li>
 *   <li>region: 리전 ("eu-central-1")</li>
 *   <li>zoneCount: 사용할 가용 영역 수 (2)</li>
 *   <li>vpcCidr: VPC CIDR ("10.201.0.0/16")</li>
 *   <li>publicSubnetCidrs / privateSubnetCidrs: 영역별 서브넷 CIDR (위치 기준 할당)</li>
 *   <li>imageId / instanceType: 인스턴스 이미지와 크기 ("ami-04e601abe3e1a910f", "t3.medium")</li>
 *   <li>bootScript: 인스턴스 부트 스크립트 (평문, 시작 템플릿에서 base64 인코딩)</li>
 *   <li>minSize / desiredCapacity / maxSize: 스케일링 그룹 크기 (3 / 5 / 5)</li>
 *   <li>sshIngressCidr: SSH 허용 CIDR (null이면 SSH 규칙 없음)</li>
 *   <li>fleetPlacement: 인스턴스 배치 계층 (PRIVATE)</li>
 *   <li>httpPort / healthCheckPath: 서비스 포트와 헬스 체크 경로 (80, "/")</li>
 * </ul>
 *
 * @param project 프로젝트 이름
 * @param region 리전
 * @param zoneCount 가용 영역 수 (1 이상)
 * @param vpcCidr VPC CIDR
 * @param publicSubnetCidrs 퍼블릭 서브넷 CIDR 목록
 * @param privateSubnetCidrs 프라이빗 서브넷 CIDR 목록
 * @param imageId 머신 이미지 ID
 * @param instanceType 인스턴스 타입
 * @param bootScript 부트 스크립트
 * @param minSize 최소 인스턴스 수
 * @param maxSize 최대 인스턴스 수
 * @param desiredCapacity 희망 인스턴스 수
 * @param sshIngressCidr SSH 허용 CIDR (nullable)
 * @param fleetPlacement 인스턴스 배치 계층
 * @param httpPort HTTP 포트
 * @param healthCheckPath 헬스 체크 경로
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ProvisioningConfig(
    String project,
    String region,
    int zoneCount,
    String vpcCidr,
    List<String> publicSubnetCidrs,
    List<String> privateSubnetCidrs,
    String imageId,
    String instanceType,
    String bootScript,
    int minSize,
    int maxSize,
    int desiredCapacity,
    String sshIngressCidr,
    FleetPlacement fleetPlacement,
    int httpPort,
    String healthCheckPath
) {

    public static final String DEFAULT_BOOT_SCRIPT = "#!/bin/bash\n"
        + "yum update -y\n"
        + "yum install -y httpd\n"
        + "systemctl enable httpd\n"
        + "systemctl start httpd\n"
        + "echo \"<h1>Healthy from $(hostname)</h1>\" > /var/www/html/index.html\n";

    private static final Pattern PROJECT_PATTERN = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9\\-]{0,27}$");

    /**
     * 기본 설정 생성자.
     */
    public ProvisioningConfig() {
        this("provisioner", "eu-central-1", 2, "10.201.0.0/16",
            List.of("10.201.1.0/24", "10.201.2.0/24"),
            List.of("10.201.101.0/24", "10.201.102.0/24"),
            "ami-04e601abe3e1a910f", "t3.medium", DEFAULT_BOOT_SCRIPT,
            3, 5, 5, null, FleetPlacement.PRIVATE, 80, "/");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ProvisioningConfig {
        if (project == null || !PROJECT_PATTERN.matcher(project).matches()) {
            throw new IllegalArgumentException(
                "project must be 1-28 alphanumerics or hyphens, starting with an alphanumeric (current: " + project + ")");
        }
        requireText(region, "region");
        if (zoneCount < 1) {
            throw new IllegalArgumentException("zoneCount must be positive (current: " + zoneCount + ")");
        }
        requireText(vpcCidr, "vpcCidr");
        if (publicSubnetCidrs == null) {
            throw new IllegalArgumentException("publicSubnetCidrs cannot be null");
        }
        if (privateSubnetCidrs == null) {
            throw new IllegalArgumentException("privateSubnetCidrs cannot be null");
        }
        requireText(imageId, "imageId");
        requireText(instanceType, "instanceType");
        requireText(bootScript, "bootScript");
        if (minSize < 0) {
            throw new IllegalArgumentException("minSize must be non-negative (current: " + minSize + ")");
        }
        if (maxSize < 1 || maxSize < minSize) {
            throw new IllegalArgumentException(
                "maxSize must be positive and >= minSize (current: " + maxSize + ", minSize: " + minSize + ")");
        }
        if (desiredCapacity < minSize || desiredCapacity > maxSize) {
            throw new IllegalArgumentException(
                "desiredCapacity must be between minSize and maxSize (current: " + desiredCapacity + ")");
        }
        if (sshIngressCidr != null && sshIngressCidr.isBlank()) {
            sshIngressCidr = null;
        }
        if (fleetPlacement == null) {
            throw new IllegalArgumentException("fleetPlacement cannot be null");
        }
        if (httpPort < 1 || httpPort > 65535) {
            throw new IllegalArgumentException("httpPort must be between 1 and 65535 (current: " + httpPort + ")");
        }
        if (healthCheckPath == null || !healthCheckPath.startsWith("/")) {
            throw new IllegalArgumentException("healthCheckPath must start with '/' (current: " + healthCheckPath + ")");
        }
        publicSubnetCidrs = List.copyOf(publicSubnetCidrs);
        privateSubnetCidrs = List.copyOf(privateSubnetCidrs);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be null or blank");
        }
    }

    public boolean hasSshIngress() {
        return sshIngressCidr != null;
    }

    public ProvisioningConfig withProject(String project) {
        return new ProvisioningConfig(project, region, zoneCount, vpcCidr, publicSubnetCidrs, privateSubnetCidrs,
            imageId, instanceType, bootScript, minSize, maxSize, desiredCapacity, sshIngressCidr, fleetPlacement,
            httpPort, healthCheckPath);
    }

    public ProvisioningConfig withRegion(String region) {
        return new ProvisioningConfig(project, region, zoneCount, vpcCidr, publicSubnetCidrs, privateSubnetCidrs,
            imageId, instanceType, bootScript, minSize, maxSize, desiredCapacity, sshIngressCidr, fleetPlacement,
            httpPort, healthCheckPath);
    }

    public ProvisioningConfig withZoneCount(int zoneCount) {
        return new ProvisioningConfig(project, region, zoneCount, vpcCidr, publicSubnetCidrs, privateSubnetCidrs,
            imageId, instanceType, bootScript, minSize, maxSize, desiredCapacity, sshIngressCidr, fleetPlacement,
            httpPort, healthCheckPath);
    }

    public ProvisioningConfig withVpcCidr(String vpcCidr) {
        return new ProvisioningConfig(project, region, zoneCount, vpcCidr, publicSubnetCidrs, privateSubnetCidrs,
            imageId, instanceType, bootScript, minSize, maxSize, desiredCapacity, sshIngressCidr, fleetPlacement,
            httpPort, healthCheckPath);
    }

    /**
     * 서브넷 CIDR 목록만 변경한 새 인스턴스 생성.
     */
    public ProvisioningConfig withSubnetCidrs(List<String> publicSubnetCidrs, List<String> privateSubnetCidrs) {
        return new ProvisioningConfig(project, region, zoneCount, vpcCidr, publicSubnetCidrs, privateSubnetCidrs,
            imageId, instanceType, bootScript, minSize, maxSize, desiredCapacity, sshIngressCidr, fleetPlacement,
            httpPort, healthCheckPath);
    }

    public ProvisioningConfig withImageId(String imageId) {
        return new ProvisioningConfig(project, region, zoneCount, vpcCidr, publicSubnetCidrs, privateSubnetCidrs,
            imageId, instanceType, bootScript, minSize, maxSize, desiredCapacity, sshIngressCidr, fleetPlacement,
            httpPort, healthCheckPath);
    }

    public ProvisioningConfig withInstanceType(String instanceType) {
        return new ProvisioningConfig(project, region, zoneCount, vpcCidr, publicSubnetCidrs, privateSubnetCidrs,
            imageId, instanceType, bootScript, minSize, maxSize, desiredCapacity, sshIngressCidr, fleetPlacement,
            httpPort, healthCheckPath);
    }

    public ProvisioningConfig withBootScript(String bootScript) {
        return new ProvisioningConfig(project, region, zoneCount, vpcCidr, publicSubnetCidrs, privateSubnetCidrs,
            imageId, instanceType, bootScript, minSize, maxSize, desiredCapacity, sshIngressCidr, fleetPlacement,
            httpPort, healthCheckPath);
    }

    /**
     * 스케일링 그룹 크기만 변경한 새 인스턴스 생성.
     */
    public ProvisioningConfig withCapacity(int minSize, int desiredCapacity, int maxSize) {
        return new ProvisioningConfig(project, region, zoneCount, vpcCidr, publicSubnetCidrs, privateSubnetCidrs,
            imageId, instanceType, bootScript, minSize, maxSize, desiredCapacity, sshIngressCidr, fleetPlacement,
            httpPort, healthCheckPath);
    }

    public ProvisioningConfig withSshIngressCidr(String sshIngressCidr) {
        return new ProvisioningConfig(project, region, zoneCount, vpcCidr, publicSubnetCidrs, privateSubnetCidrs,
            imageId, instanceType, bootScript, minSize, maxSize, desiredCapacity, sshIngressCidr, fleetPlacement,
            httpPort, healthCheckPath);
    }

    public ProvisioningConfig withFleetPlacement(FleetPlacement fleetPlacement) {
        return new ProvisioningConfig(project, region, zoneCount, vpcCidr, publicSubnetCidrs, privateSubnetCidrs,
            imageId, instanceType, bootScript, minSize, maxSize, desiredCapacity, sshIngressCidr, fleetPlacement,
            httpPort, healthCheckPath);
    }

    public ProvisioningConfig withHttpPort(int httpPort) {
        return new ProvisioningConfig(project, region, zoneCount, vpcCidr, publicSubnetCidrs, privateSubnetCidrs,
            imageId, instanceType, bootScript, minSize, maxSize, desiredCapacity, sshIngressCidr, fleetPlacement,
            httpPort, healthCheckPath);
    }

    public ProvisioningConfig withHealthCheckPath(String healthCheckPath) {
        return new ProvisioningConfig(project, region, zoneCount, vpcCidr, publicSubnetCidrs, privateSubnetCidrs,
            imageId, instanceType, bootScript, minSize, maxSize, desiredCapacity, sshIngressCidr, fleetPlacement,
            httpPort, healthCheckPath);
    }
}
