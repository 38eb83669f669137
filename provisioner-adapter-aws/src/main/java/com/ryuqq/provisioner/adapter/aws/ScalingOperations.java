package com.ryuqq.provisioner.adapter.aws;

import com.amazonaws.services.autoscaling.AmazonAutoScaling;
import com.amazonaws.services.autoscaling.model.AutoScalingGroup;
import com.amazonaws.services.autoscaling.model.CreateAutoScalingGroupRequest;
import com.amazonaws.services.autoscaling.model.DescribeAutoScalingGroupsRequest;
import com.amazonaws.services.autoscaling.model.LaunchTemplateSpecification;
import com.amazonaws.services.autoscaling.model.Tag;
import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ParameterKeys;
import com.ryuqq.provisioner.core.model.ResourceParameters;

import java.util.Optional;

/**
 * Auto Scaling 그룹 생성/조회.
 *
 * <p>Auto Scaling 그룹은 별도 ID가 없으므로 그룹 이름을 식별자로 사용합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
final class ScalingOperations {

    private final AmazonAutoScaling autoScaling;

    ScalingOperations(AmazonAutoScaling autoScaling) {
        if (autoScaling == null) {
            throw new IllegalArgumentException("autoScaling cannot be null");
        }
        this.autoScaling = autoScaling;
    }

    String createScalingGroup(LogicalName name, ResourceParameters parameters) {
        autoScaling.createAutoScalingGroup(new CreateAutoScalingGroupRequest()
            .withAutoScalingGroupName(name.getValue())
            .withLaunchTemplate(new LaunchTemplateSpecification()
                .withLaunchTemplateId(parameters.getString(ParameterKeys.LAUNCH_TEMPLATE_ID))
                .withVersion(parameters.getString(ParameterKeys.LAUNCH_TEMPLATE_VERSION)))
            .withMinSize(parameters.getInt(ParameterKeys.MIN_SIZE))
            .withMaxSize(parameters.getInt(ParameterKeys.MAX_SIZE))
            .withDesiredCapacity(parameters.getInt(ParameterKeys.DESIRED_CAPACITY))
            .withVPCZoneIdentifier(String.join(",", parameters.getStringList(ParameterKeys.SUBNET_IDS)))
            .withTargetGroupARNs(parameters.getStringList(ParameterKeys.TARGET_GROUP_IDS))
            .withTags(new Tag()
                .withKey("Name")
                .withValue(parameters.getString(ParameterKeys.INSTANCE_NAME_TAG))
                .withPropagateAtLaunch(parameters.getBooleanOrDefault(ParameterKeys.PROPAGATE_TAG_AT_LAUNCH, true))));
        return name.getValue();
    }

    Optional<String> findScalingGroup(LogicalName name) {
        return autoScaling.describeAutoScalingGroups(new DescribeAutoScalingGroupsRequest()
                .withAutoScalingGroupNames(name.getValue()))
            .getAutoScalingGroups().stream()
            .map(AutoScalingGroup::getAutoScalingGroupName)
            .findFirst();
    }
}
