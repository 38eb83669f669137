package com.ryuqq.provisioner.adapter.aws;

import com.amazonaws.AmazonClientException;
import com.amazonaws.AmazonServiceException;
import com.ryuqq.provisioner.core.spi.ProviderException;

import java.util.Set;

/**
 * AWS 오류 코드 상수 및 SDK 예외 변환.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class AwsErrors {

    /**
     * 같은 Name 태그의 네트워크 리소스가 이미 있음 (어댑터가 생성 전에 감지).
     */
    public static final String DUPLICATE_NAME = "DuplicateName";

    public static final String VPC_LIMIT_EXCEEDED = "VpcLimitExceeded";
    public static final String ROUTE_ALREADY_ASSOCIATED = "Resource.AlreadyAssociated";
    public static final String SECURITY_GROUP_DUPLICATE = "InvalidGroup.Duplicate";
    public static final String PERMISSION_DUPLICATE = "InvalidPermission.Duplicate";
    public static final String KEY_PAIR_DUPLICATE = "InvalidKeyPair.Duplicate";
    public static final String LAUNCH_TEMPLATE_DUPLICATE = "InvalidLaunchTemplateName.AlreadyExistsException";
    public static final String LOAD_BALANCER_DUPLICATE = "DuplicateLoadBalancerName";
    public static final String TARGET_GROUP_DUPLICATE = "DuplicateTargetGroupName";
    public static final String LISTENER_DUPLICATE = "DuplicateListener";
    public static final String SCALING_GROUP_DUPLICATE = "AlreadyExists";

    /**
     * SDK 클라이언트 측 오류 (네트워크, 자격 증명 등).
     */
    public static final String CLIENT_ERROR = "ClientError";

    /**
     * 리소스가 없거나 방금 생성되어 아직 조회되지 않는 경우의 코드.
     */
    static final Set<String> NOT_FOUND_CODES = Set.of(
        "InvalidVpcID.NotFound",
        "NatGatewayNotFound",
        "InvalidKeyPair.NotFound",
        "InvalidLaunchTemplateName.NotFoundException",
        "LoadBalancerNotFound",
        "TargetGroupNotFound"
    );

    private AwsErrors() {
    }

    /**
     * SDK 예외를 {@link ProviderException}으로 변환.
     *
     * @param e SDK 예외
     * @return 오류 코드와 메시지를 담은 ProviderException
     */
    public static ProviderException translate(AmazonClientException e) {
        if (e instanceof AmazonServiceException service) {
            String code = service.getErrorCode();
            String message = service.getErrorMessage();
            return new ProviderException(
                code == null || code.isBlank() ? "HTTP" + service.getStatusCode() : code,
                message != null ? message : service.getMessage(),
                e);
        }
        return new ProviderException(CLIENT_ERROR, e.getMessage(), e);
    }

    static boolean isNotFound(AmazonServiceException e) {
        return e.getErrorCode() != null && NOT_FOUND_CODES.contains(e.getErrorCode());
    }
}
