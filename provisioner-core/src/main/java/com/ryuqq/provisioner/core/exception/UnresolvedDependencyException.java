package com.ryuqq.provisioner.core.exception;

import com.ryuqq.provisioner.core.model.LogicalName;

/**
 * 단계가 요구하는 입력이 컨텍스트에 바인딩되어 있지 않음.
 *
 * <p>계획의 위상 정렬이 깨졌다는 뜻이므로 프로그래밍 오류로 취급합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class UnresolvedDependencyException extends ProvisioningException {

    private static final long serialVersionUID = 1L;

    private final LogicalName step;
    private final LogicalName missing;

    public UnresolvedDependencyException(LogicalName step, LogicalName missing) {
        super(ErrorKind.UNRESOLVED_DEPENDENCY,
            "Step " + step + " requires " + missing + ", which is not bound in the provisioning context");
        this.step = step;
        this.missing = missing;
    }

    public LogicalName getStep() {
        return step;
    }

    public LogicalName getMissing() {
        return missing;
    }
}
