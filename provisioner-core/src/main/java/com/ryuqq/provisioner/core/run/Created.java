package com.ryuqq.provisioner.core.run;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceHandle;

/**
 * 새로 생성된 리소스.
 *
 * @param handle 생성된 리소스 핸들
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record Created(ResourceHandle handle) implements StepResult {

    public Created {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
    }

    @Override
    public LogicalName logicalName() {
        return handle.name();
    }
}
