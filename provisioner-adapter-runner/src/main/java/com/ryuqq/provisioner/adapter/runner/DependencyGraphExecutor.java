package com.ryuqq.provisioner.adapter.runner;

import com.ryuqq.provisioner.core.context.ProvisioningContext;
import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.exception.RunCancelledException;
import com.ryuqq.provisioner.core.exception.StepFailedException;
import com.ryuqq.provisioner.core.exception.UnresolvedDependencyException;
import com.ryuqq.provisioner.core.executor.PlanExecutor;
import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceSpec;
import com.ryuqq.provisioner.core.plan.ProvisioningPlan;
import com.ryuqq.provisioner.core.readiness.ReadinessWaiter;
import com.ryuqq.provisioner.core.run.Cancellation;
import com.ryuqq.provisioner.core.run.Created;
import com.ryuqq.provisioner.core.run.Failed;
import com.ryuqq.provisioner.core.run.Reused;
import com.ryuqq.provisioner.core.run.RunResult;
import com.ryuqq.provisioner.core.run.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 순차 Dependency Graph Executor.
 *
 * <p>계획을 순서대로 실행합니다. 단계마다:</p>
 * <ol>
 *   <li>취소 여부와 실행 예산 확인 ({@link RunCancelledException})</li>
 *   <li>모든 입력이 바인딩되었는지 확인 ({@link UnresolvedDependencyException})</li>
 *   <li>{@link IdempotentCreateStep} 실행</li>
 *   <li>준비 대기가 필요한 종류면 {@link ReadinessWaiter} 호출
 *       (예산 = min(readinessTimeoutMs, 남은 실행 예산))</li>
 *   <li>핸들 바인딩</li>
 * </ol>
 *
 * <p>바인딩은 준비 대기가 끝난 뒤에만 일어나므로, 준비되지 않은 핸들은 후속 단계에 보이지 않습니다.
 * 첫 치명적 오류에서 중단하며 되돌리지 않습니다. 준비 대기 중 실패한 리소스의 핸들은
 * {@link Failed#createdHandle()}로 보고됩니다.</p>
 *
 * <p>{@link ProvisioningException}이 아닌 런타임 오류(키 자료 저장 실패, 파라미터 오류 등)도
 * 단계 실패로 기록하여 {@link StepFailedException}으로 보고합니다. 실행 보고서는 항상 반환됩니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 인스턴스는 상태가 없어 여러 실행이 공유할 수 있습니다.
 * 한 실행 안의 단계는 호출 스레드에서 순차 실행됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class DependencyGraphExecutor implements PlanExecutor {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphExecutor.class);

    private final IdempotentCreateStep createStep;
    private final ReadinessWaiter readinessWaiter;
    private final RunnerConfig config;

    /**
     * 생성자.
     *
     * @param createStep 생성 단계
     * @param readinessWaiter 준비 대기
     * @param config 실행기 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DependencyGraphExecutor(IdempotentCreateStep createStep, ReadinessWaiter readinessWaiter, RunnerConfig config) {
        if (createStep == null) {
            throw new IllegalArgumentException("createStep cannot be null");
        }
        if (readinessWaiter == null) {
            throw new IllegalArgumentException("readinessWaiter cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.createStep = createStep;
        this.readinessWaiter = readinessWaiter;
        this.config = config;
    }

    @Override
    public RunResult run(ProvisioningPlan plan, ProvisioningContext context, Cancellation cancellation) {
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }

        long startNanos = System.nanoTime();
        List<StepResult> results = new ArrayList<>();

        for (ResourceSpec spec : plan) {
            ResourceHandle unbound = null;
            try {
                cancellation.throwIfCancelled();
                checkDeadline(startNanos, spec);
                for (LogicalName dependency : spec.dependencies()) {
                    if (!context.isBound(dependency)) {
                        throw new UnresolvedDependencyException(spec.name(), dependency);
                    }
                }

                StepResult result = createStep.execute(spec, context);
                ResourceHandle handle = handleOf(result);
                if (spec.kind().requiresReadiness()) {
                    unbound = handle;
                    readinessWaiter.waitUntilReady(handle, readinessBudget(startNanos), cancellation);
                }
                context.bind(handle);
                results.add(result);
            } catch (ProvisioningException e) {
                if (e instanceof StepFailedException stepFailed && stepFailed.getCreatedHandleOrNull() != null) {
                    unbound = stepFailed.getCreatedHandleOrNull();
                }
                return fail(spec, e, unbound, results, context);
            } catch (RuntimeException e) {
                StepFailedException wrapped = new StepFailedException(spec.name(), spec.kind(), unbound,
                    "Step " + spec.name() + " failed unexpectedly: " + e, e);
                return fail(spec, wrapped, unbound, results, context);
            }
        }

        log.info("Plan completed: {} step(s) in {}ms", results.size(), (System.nanoTime() - startNanos) / 1_000_000);
        return RunResult.completed(results, context.snapshot());
    }

    private static RunResult fail(ResourceSpec spec, ProvisioningException error, ResourceHandle unbound,
                                  List<StepResult> results, ProvisioningContext context) {
        Failed failed = new Failed(spec.name(), spec.kind(), error, unbound);
        results.add(failed);
        log.error("Step {} ({}) failed after {} completed step(s): {}",
            spec.name(), spec.kind(), results.size() - 1, error.getMessage(),
            error instanceof StepFailedException ? error.getCause() : null);
        return RunResult.failed(results, context.snapshot(), failed);
    }

    private static ResourceHandle handleOf(StepResult result) {
        if (result instanceof Created created) {
            return created.handle();
        }
        if (result instanceof Reused reused) {
            return reused.handle();
        }
        throw new IllegalStateException("create step returned " + result);
    }

    private void checkDeadline(long startNanos, ResourceSpec spec) {
        if (config.hasRunTimeout() && remainingRunMs(startNanos) <= 0) {
            throw new RunCancelledException(
                "run timeout of " + config.runTimeoutMs() + "ms exceeded before " + spec.name());
        }
    }

    private Duration readinessBudget(long startNanos) {
        long budgetMs = config.readinessTimeoutMs();
        if (config.hasRunTimeout()) {
            budgetMs = Math.min(budgetMs, Math.max(0, remainingRunMs(startNanos)));
        }
        return Duration.ofMillis(budgetMs);
    }

    private long remainingRunMs(long startNanos) {
        return config.runTimeoutMs() - (System.nanoTime() - startNanos) / 1_000_000;
    }
}
