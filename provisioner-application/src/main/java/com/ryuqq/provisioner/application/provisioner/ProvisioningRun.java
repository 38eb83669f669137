package com.ryuqq.provisioner.application.provisioner;

import com.ryuqq.provisioner.core.exception.ErrorKind;
import com.ryuqq.provisioner.core.exception.ProviderRejectedException;
import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.run.Created;
import com.ryuqq.provisioner.core.run.Failed;
import com.ryuqq.provisioner.core.run.Reused;
import com.ryuqq.provisioner.core.run.RunResult;
import com.ryuqq.provisioner.core.run.StepResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 프로비저닝 실행 보고서.
 *
 * <p>두 가지 경로로 만들어집니다:</p>
 * <ul>
 *   <li>{@link #from(String, List, RunResult)}: 계획이 실행된 경우 (완료 또는 중간 실패)</li>
 *   <li>{@link #rejected(String, ProvisioningException)}: 계획 실행 전에 거부된 경우
 *       (가용 영역 부족, 영역 조회 실패). 생성된 리소스가 없습니다.</li>
 * </ul>
 *
 * <p>실패한 경우에도 {@link #resourceIds()}는 그때까지 생성 또는 재사용된 모든 리소스 ID를 담고 있어,
 * 운영자가 수동으로 정리하거나 같은 설정으로 재실행할 수 있습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ProvisioningRun {

    private final String project;
    private final List<String> zones;
    private final RunResult resultOrNull;
    private final ProvisioningException rejectionOrNull;

    private ProvisioningRun(String project, List<String> zones, RunResult resultOrNull,
                            ProvisioningException rejectionOrNull) {
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("project cannot be null or blank");
        }
        if (zones == null) {
            throw new IllegalArgumentException("zones cannot be null");
        }
        this.project = project;
        this.zones = List.copyOf(zones);
        this.resultOrNull = resultOrNull;
        this.rejectionOrNull = rejectionOrNull;
    }

    /**
     * 실행된 계획의 보고서 생성.
     *
     * @param project 프로젝트 이름
     * @param zones 선택된 가용 영역
     * @param result 실행 결과
     * @return ProvisioningRun
     */
    public static ProvisioningRun from(String project, List<String> zones, RunResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return new ProvisioningRun(project, zones, result, null);
    }

    /**
     * 실행 전 거부된 보고서 생성.
     *
     * @param project 프로젝트 이름
     * @param rejection 거부 사유
     * @return ProvisioningRun
     */
    public static ProvisioningRun rejected(String project, ProvisioningException rejection) {
        if (rejection == null) {
            throw new IllegalArgumentException("rejection cannot be null");
        }
        return new ProvisioningRun(project, List.of(), null, rejection);
    }

    public String getProject() {
        return project;
    }

    public List<String> getZones() {
        return zones;
    }

    public boolean isCompleted() {
        return resultOrNull != null && resultOrNull.isCompleted();
    }

    /**
     * 계획 실행 결과 조회.
     *
     * @return 실행 결과, 실행 전 거부된 경우 null
     */
    public RunResult getResultOrNull() {
        return resultOrNull;
    }

    /**
     * 실행을 중단시킨 오류 조회.
     *
     * @return 오류, 완료된 경우 null
     */
    public ProvisioningException getFailureOrNull() {
        if (rejectionOrNull != null) {
            return rejectionOrNull;
        }
        Failed failed = resultOrNull.getFailureOrNull();
        return failed != null ? failed.error() : null;
    }

    public ErrorKind getErrorKindOrNull() {
        ProvisioningException failure = getFailureOrNull();
        return failure != null ? failure.getErrorKind() : null;
    }

    /**
     * 실패한 단계의 논리 이름 조회.
     *
     * @return 논리 이름, 완료되었거나 실행 전 거부된 경우 null
     */
    public LogicalName getFailedStepOrNull() {
        if (resultOrNull == null || resultOrNull.getFailureOrNull() == null) {
            return null;
        }
        return resultOrNull.getFailureOrNull().logicalName();
    }

    public String getProviderErrorCodeOrNull() {
        ProvisioningException failure = getFailureOrNull();
        return failure instanceof ProviderRejectedException rejected ? rejected.getProviderErrorCode() : null;
    }

    public String getProviderMessageOrNull() {
        ProvisioningException failure = getFailureOrNull();
        return failure instanceof ProviderRejectedException rejected ? rejected.getProviderMessage() : null;
    }

    /**
     * 이번 실행에서 생성 또는 재사용된 리소스 ID (실행 순서).
     *
     * <p>준비 대기 중 실패한 리소스처럼 생성은 되었지만 바인딩되지 않은 리소스도 포함합니다.</p>
     *
     * @return 논리 이름 → 프로바이더 ID
     */
    public Map<LogicalName, String> resourceIds() {
        Map<LogicalName, String> ids = new LinkedHashMap<>();
        if (resultOrNull == null) {
            return Collections.unmodifiableMap(ids);
        }
        for (Map.Entry<LogicalName, ResourceHandle> entry : resultOrNull.bindings().entrySet()) {
            ids.put(entry.getKey(), entry.getValue().id());
        }
        Failed failed = resultOrNull.getFailureOrNull();
        if (failed != null && failed.hasCreatedHandle()) {
            ids.putIfAbsent(failed.logicalName(), failed.createdHandle().id());
        }
        return Collections.unmodifiableMap(ids);
    }

    /**
     * 논리 이름의 리소스 ID 조회.
     *
     * @param name 논리 이름
     * @return ID, 없으면 null
     */
    public String idOf(LogicalName name) {
        return resourceIds().get(name);
    }

    public long createdCount() {
        return resultOrNull != null ? resultOrNull.createdCount() : 0;
    }

    public long reusedCount() {
        return resultOrNull != null ? resultOrNull.reusedCount() : 0;
    }

    /**
     * 사람이 읽을 수 있는 여러 줄 보고서.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("project=").append(project)
            .append(" zones=").append(zones)
            .append(" completed=").append(isCompleted())
            .append(" created=").append(createdCount())
            .append(" reused=").append(reusedCount());
        if (resultOrNull != null) {
            for (StepResult step : resultOrNull.stepResults()) {
                sb.append(System.lineSeparator()).append("  ").append(describe(step));
            }
        }
        ProvisioningException failure = getFailureOrNull();
        if (failure != null) {
            sb.append(System.lineSeparator())
                .append("  error[").append(failure.getErrorKind()).append("]: ").append(failure.getMessage());
        }
        return sb.toString();
    }

    private static String describe(StepResult step) {
        if (step instanceof Failed failed) {
            String leftover = failed.hasCreatedHandle() ? " (created " + failed.createdHandle().id() + ", not bound)" : "";
            return "FAILED   " + failed.logicalName() + leftover;
        }
        if (step instanceof Reused reused) {
            return "REUSED   " + reused.logicalName() + " -> " + reused.handle().id() + " (" + reused.triggeringErrorCode() + ")";
        }
        Created created = (Created) step;
        return "CREATED  " + created.logicalName() + " -> " + created.handle().id();
    }

    @Override
    public String toString() {
        return "ProvisioningRun{project=" + project
            + ", completed=" + isCompleted()
            + ", created=" + createdCount()
            + ", reused=" + reusedCount()
            + (getErrorKindOrNull() != null ? ", error=" + getErrorKindOrNull() : "")
            + '}';
    }
}
