package com.ryuqq.provisioner.application.provisioner;

import com.ryuqq.provisioner.core.config.ProvisioningConfig;
import com.ryuqq.provisioner.core.plan.ProvisioningPlan;
import com.ryuqq.provisioner.core.run.Cancellation;

/**
 * 프로비저닝 실행 진입점.
 *
 * <p>가용 영역 조회와 선택, 네트워크/플릿 계획 생성, 계획 실행을 한 번에 수행하고
 * 결과를 {@link ProvisioningRun} 보고서로 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ProvisioningConfig config = ProvisioningConfigLoader.fromClasspath("provisioner.properties");
 * ProvisioningRun run = provisioner.provision(config);
 *
 * if (run.isCompleted()) {
 *     String asgId = run.idOf(LogicalName.of(config.project() + "-asg"));
 * } else {
 *     ErrorKind kind = run.getErrorKindOrNull();
 *     Map&lt;LogicalName, String&gt; leftovers = run.resourceIds();
 * }
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface Provisioner {

    /**
     * 환경 프로비저닝.
     *
     * @param config 실행 설정
     * @return 실행 보고서 (실패해도 예외 대신 보고서로 반환)
     * @throws IllegalArgumentException config가 null이거나 계획이 유효하지 않은 경우
     */
    default ProvisioningRun provision(ProvisioningConfig config) {
        return provision(config, Cancellation.create());
    }

    /**
     * 취소 가능한 환경 프로비저닝.
     *
     * <p>다른 스레드에서 {@link Cancellation#cancel(String)}을 호출하면
     * 진행 중인 준비 대기가 즉시 깨어나고 실행은 RUN_CANCELLED로 종료됩니다.</p>
     *
     * @param config 실행 설정
     * @param cancellation 취소 신호
     * @return 실행 보고서
     */
    ProvisioningRun provision(ProvisioningConfig config, Cancellation cancellation);

    /**
     * 리소스를 만들지 않고 실행될 계획만 생성 (dry run).
     *
     * <p>가용 영역 조회는 수행합니다.</p>
     *
     * @param config 실행 설정
     * @return 네트워크와 플릿이 결합된 계획
     * @throws com.ryuqq.provisioner.core.exception.InsufficientZonesException 영역이 부족한 경우
     */
    ProvisioningPlan plan(ProvisioningConfig config);
}
