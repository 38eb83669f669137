package com.ryuqq.provisioner.core.topology;

import com.ryuqq.provisioner.core.model.LogicalName;

/**
 * 프로젝트 이름에서 파생되는 논리 이름 규칙.
 *
 * <p>같은 프로젝트로 다시 실행하면 같은 이름이 만들어지므로, 재실행 시 이름 기반 재사용이 동작합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ResourceNames {

    private final String project;

    public ResourceNames(String project) {
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("project cannot be null or blank");
        }
        this.project = project;
    }

    public String project() {
        return project;
    }

    public LogicalName virtualNetwork() {
        return name("vpc");
    }

    public LogicalName gateway() {
        return name("igw");
    }

    public LogicalName publicRouteTable() {
        return name("public-rt");
    }

    public LogicalName privateRouteTable() {
        return name("private-rt");
    }

    public LogicalName publicSubnet(String zone) {
        return name("pub-" + zone);
    }

    public LogicalName privateSubnet(String zone) {
        return name("priv-" + zone);
    }

    public LogicalName publicRouteAssociation(String zone) {
        return name("pub-" + zone + "-rta");
    }

    public LogicalName privateRouteAssociation(String zone) {
        return name("priv-" + zone + "-rta");
    }

    public LogicalName addressTranslator() {
        return name("nat");
    }

    public LogicalName loadBalancerSecurityGroup() {
        return name("alb-sg");
    }

    public LogicalName computeSecurityGroup() {
        return name("ec2-sg");
    }

    public LogicalName keyPair() {
        return name("key");
    }

    public LogicalName launchTemplate() {
        return name("lt");
    }

    public LogicalName loadBalancer() {
        return name("alb");
    }

    public LogicalName targetGroup() {
        return name("tg");
    }

    public LogicalName listener() {
        return name("listener");
    }

    public LogicalName scalingGroup() {
        return name("asg");
    }

    /**
     * 스케일링 그룹이 시작하는 인스턴스의 Name 태그 값.
     */
    public String instanceNameTag() {
        return project + "-instance";
    }

    private LogicalName name(String suffix) {
        return LogicalName.of(project + "-" + suffix);
    }
}
