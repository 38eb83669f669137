package com.ryuqq.provisioner.core.exception;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceKind;

/**
 * 재사용 조회로 찾은 기존 리소스의 종류가 기대한 종류와 다름.
 *
 * <p>논리 이름 충돌을 의미합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ReuseConflictException extends ProvisioningException {

    private static final long serialVersionUID = 1L;

    private final LogicalName name;
    private final ResourceKind expected;
    private final ResourceKind found;
    private final String foundId;

    public ReuseConflictException(LogicalName name, ResourceKind expected, ResourceKind found, String foundId) {
        super(ErrorKind.REUSE_CONFLICT,
            "Existing resource " + foundId + " named " + name + " is a " + found + ", expected " + expected);
        this.name = name;
        this.expected = expected;
        this.found = found;
        this.foundId = foundId;
    }

    public LogicalName getName() {
        return name;
    }

    public ResourceKind getExpected() {
        return expected;
    }

    public ResourceKind getFound() {
        return found;
    }

    public String getFoundId() {
        return foundId;
    }
}
