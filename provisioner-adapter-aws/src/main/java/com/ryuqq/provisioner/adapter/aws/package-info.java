/**
 * AWS SDK 어댑터.
 *
 * <p>{@link com.ryuqq.provisioner.core.spi.CloudProvider}를 EC2, ELBv2, Auto Scaling
 * 클라이언트로 구현합니다.</p>
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.adapter.aws.AwsCloudProvider}: 종류별 호출 위임, SDK 예외 변환</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.aws.AwsReusePolicy}: 오류 코드별 기본 재사용 규칙</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.aws.AwsErrors}: 오류 코드 상수</li>
 * </ul>
 *
 * <h2>사용 예</h2>
 * <pre>{@code
 * Provisioner provisioner = StandardProvisioner.create(
 *     AwsCloudProvider.forRegion("ap-northeast-2"),
 *     AwsReusePolicy.defaults(),
 *     keySink,
 *     new RunnerConfig());
 * }</pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.adapter.aws;
