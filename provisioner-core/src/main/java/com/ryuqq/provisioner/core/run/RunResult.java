package com.ryuqq.provisioner.core.run;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceHandle;

import java.util.List;
import java.util.Map;

/**
 * 계획 실행 결과.
 *
 * <p>단계 결과는 실행 순서대로 기록되며, 실패한 경우 마지막 결과가 {@link Failed}입니다.
 * 바인딩은 실행 종료 시점 컨텍스트의 스냅샷입니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class RunResult {

    private final List<StepResult> stepResults;
    private final Map<LogicalName, ResourceHandle> bindings;
    private final Failed failure;

    private RunResult(List<StepResult> stepResults, Map<LogicalName, ResourceHandle> bindings, Failed failure) {
        if (stepResults == null) {
            throw new IllegalArgumentException("stepResults cannot be null");
        }
        if (bindings == null) {
            throw new IllegalArgumentException("bindings cannot be null");
        }
        this.stepResults = List.copyOf(stepResults);
        this.bindings = bindings;
        this.failure = failure;
    }

    /**
     * 모든 단계가 완료된 결과.
     */
    public static RunResult completed(List<StepResult> stepResults, Map<LogicalName, ResourceHandle> bindings) {
        return new RunResult(stepResults, bindings, null);
    }

    /**
     * 실패로 중단된 결과.
     *
     * @param stepResults 실패 단계를 포함한 단계 결과 (마지막이 failure)
     * @param bindings 중단 시점 바인딩 스냅샷
     * @param failure 실패 결과
     * @return RunResult
     */
    public static RunResult failed(List<StepResult> stepResults, Map<LogicalName, ResourceHandle> bindings, Failed failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        return new RunResult(stepResults, bindings, failure);
    }

    public boolean isCompleted() {
        return failure == null;
    }

    public List<StepResult> stepResults() {
        return stepResults;
    }

    public Map<LogicalName, ResourceHandle> bindings() {
        return bindings;
    }

    public Failed getFailureOrNull() {
        return failure;
    }

    /**
     * 논리 이름에 바인딩된 핸들 조회.
     *
     * @param name 논리 이름
     * @return 핸들, 바인딩되지 않았으면 null
     */
    public ResourceHandle handleOrNull(LogicalName name) {
        return bindings.get(name);
    }

    public long createdCount() {
        return stepResults.stream().filter(StepResult::isCreated).count();
    }

    public long reusedCount() {
        return stepResults.stream().filter(StepResult::isReused).count();
    }

    @Override
    public String toString() {
        return "RunResult{completed=" + isCompleted()
            + ", steps=" + stepResults.size()
            + ", created=" + createdCount()
            + ", reused=" + reusedCount()
            + (failure != null ? ", failed=" + failure.logicalName() : "")
            + '}';
    }
}
