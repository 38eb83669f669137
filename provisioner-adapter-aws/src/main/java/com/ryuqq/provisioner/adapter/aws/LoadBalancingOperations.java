package com.ryuqq.provisioner.adapter.aws;

import com.amazonaws.services.elasticloadbalancingv2.AmazonElasticLoadBalancing;
import com.amazonaws.services.elasticloadbalancingv2.model.Action;
import com.amazonaws.services.elasticloadbalancingv2.model.CreateListenerRequest;
import com.amazonaws.services.elasticloadbalancingv2.model.CreateLoadBalancerRequest;
import com.amazonaws.services.elasticloadbalancingv2.model.CreateTargetGroupRequest;
import com.amazonaws.services.elasticloadbalancingv2.model.DescribeListenersRequest;
import com.amazonaws.services.elasticloadbalancingv2.model.DescribeLoadBalancersRequest;
import com.amazonaws.services.elasticloadbalancingv2.model.DescribeTargetGroupsRequest;
import com.amazonaws.services.elasticloadbalancingv2.model.Listener;
import com.amazonaws.services.elasticloadbalancingv2.model.LoadBalancer;
import com.amazonaws.services.elasticloadbalancingv2.model.LoadBalancerNotFoundException;
import com.amazonaws.services.elasticloadbalancingv2.model.Matcher;
import com.amazonaws.services.elasticloadbalancingv2.model.Tag;
import com.amazonaws.services.elasticloadbalancingv2.model.TargetGroup;
import com.amazonaws.services.elasticloadbalancingv2.model.TargetGroupNotFoundException;
import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ParameterKeys;
import com.ryuqq.provisioner.core.model.ResourceParameters;

import java.util.List;
import java.util.Optional;

/**
 * ELBv2 호출 묶음: 로드밸런서, 타깃 그룹, 리스너.
 *
 * <p>식별자는 모두 ARN입니다. 로드밸런서와 타깃 그룹은 이름이 계정/리전 내에서 고유하므로
 * AWS가 중복을 직접 거부하고, 리스너는 (로드밸런서, 포트) 쌍으로 조회합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
final class LoadBalancingOperations {

    private static final String FORWARD = "forward";

    private final AmazonElasticLoadBalancing elb;

    LoadBalancingOperations(AmazonElasticLoadBalancing elb) {
        if (elb == null) {
            throw new IllegalArgumentException("elb cannot be null");
        }
        this.elb = elb;
    }

    String createLoadBalancer(LogicalName name, ResourceParameters parameters) {
        return elb.createLoadBalancer(new CreateLoadBalancerRequest()
                .withName(name.getValue())
                .withSubnets(parameters.getStringList(ParameterKeys.SUBNET_IDS))
                .withSecurityGroups(parameters.getStringList(ParameterKeys.SECURITY_GROUP_IDS))
                .withScheme(parameters.getString(ParameterKeys.SCHEME))
                .withType(parameters.getString(ParameterKeys.LOAD_BALANCER_TYPE))
                .withIpAddressType(parameters.getString(ParameterKeys.IP_ADDRESS_TYPE))
                .withTags(new Tag().withKey("Name").withValue(name.getValue())))
            .getLoadBalancers().get(0).getLoadBalancerArn();
    }

    String createTargetGroup(LogicalName name, ResourceParameters parameters) {
        return elb.createTargetGroup(new CreateTargetGroupRequest()
                .withName(name.getValue())
                .withProtocol(parameters.getString(ParameterKeys.PROTOCOL))
                .withPort(parameters.getInt(ParameterKeys.PORT))
                .withVpcId(parameters.getString(ParameterKeys.VPC_ID))
                .withTargetType(parameters.getString(ParameterKeys.TARGET_TYPE))
                .withHealthCheckPath(parameters.getString(ParameterKeys.HEALTH_CHECK_PATH))
                .withHealthCheckIntervalSeconds(parameters.getInt(ParameterKeys.HEALTH_CHECK_INTERVAL_SECONDS))
                .withMatcher(new Matcher().withHttpCode(parameters.getString(ParameterKeys.HEALTH_CHECK_MATCHER))))
            .getTargetGroups().get(0).getTargetGroupArn();
    }

    String createListener(ResourceParameters parameters) {
        return elb.createListener(new CreateListenerRequest()
                .withLoadBalancerArn(parameters.getString(ParameterKeys.LOAD_BALANCER_ID))
                .withProtocol(parameters.getString(ParameterKeys.PROTOCOL))
                .withPort(parameters.getInt(ParameterKeys.PORT))
                .withDefaultActions(new Action()
                    .withType(FORWARD)
                    .withTargetGroupArn(parameters.getString(ParameterKeys.TARGET_GROUP_ID))))
            .getListeners().get(0).getListenerArn();
    }

    Optional<String> findLoadBalancer(LogicalName name) {
        try {
            return orEmpty(elb.describeLoadBalancers(new DescribeLoadBalancersRequest().withNames(name.getValue()))
                .getLoadBalancers()).stream()
                .map(LoadBalancer::getLoadBalancerArn)
                .findFirst();
        } catch (LoadBalancerNotFoundException e) {
            return Optional.empty();
        }
    }

    Optional<String> findTargetGroup(LogicalName name) {
        try {
            return orEmpty(elb.describeTargetGroups(new DescribeTargetGroupsRequest().withNames(name.getValue()))
                .getTargetGroups()).stream()
                .map(TargetGroup::getTargetGroupArn)
                .findFirst();
        } catch (TargetGroupNotFoundException e) {
            return Optional.empty();
        }
    }

    Optional<String> findListener(ResourceParameters parameters) {
        int port = parameters.getInt(ParameterKeys.PORT);
        return orEmpty(elb.describeListeners(new DescribeListenersRequest()
                .withLoadBalancerArn(parameters.getString(ParameterKeys.LOAD_BALANCER_ID)))
            .getListeners()).stream()
            .filter(listener -> listener.getPort() != null && listener.getPort() == port)
            .map(Listener::getListenerArn)
            .findFirst();
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
