package com.ryuqq.provisioner.core.executor;

import com.ryuqq.provisioner.core.context.ProvisioningContext;
import com.ryuqq.provisioner.core.plan.ProvisioningPlan;
import com.ryuqq.provisioner.core.run.Cancellation;
import com.ryuqq.provisioner.core.run.RunResult;

/**
 * 프로비저닝 계획 실행기.
 *
 * <p>계획 순서대로 각 명세를 생성하고, 필요한 경우 준비 상태를 기다린 뒤 핸들을 컨텍스트에 바인딩합니다.
 * 치명적 오류가 발생하면 즉시 중단하며 이미 생성된 리소스를 되돌리지 않습니다.</p>
 *
 * <p>실행 중 발생한 {@link com.ryuqq.provisioner.core.exception.ProvisioningException}은
 * 던지지 않고 {@link RunResult}의 실패로 보고합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface PlanExecutor {

    /**
     * 계획 실행.
     *
     * @param plan 실행할 계획
     * @param context 이번 실행의 컨텍스트 (외부 입력이 미리 바인딩되어 있을 수 있음)
     * @param cancellation 취소 신호
     * @return 실행 결과
     */
    RunResult run(ProvisioningPlan plan, ProvisioningContext context, Cancellation cancellation);

    /**
     * 취소 없이 계획 실행.
     */
    default RunResult run(ProvisioningPlan plan, ProvisioningContext context) {
        return run(plan, context, Cancellation.create());
    }
}
