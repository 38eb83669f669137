package com.ryuqq.provisioner.core.exception;

import java.util.List;

/**
 * 리전에서 사용 가능한 가용 영역이 요구 수보다 적음.
 *
 * <p>재시도로 해결되지 않는 사전 조건 위반입니다. 리소스가 하나도 생성되기 전에 발생합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class InsufficientZonesException extends ProvisioningException {

    private static final long serialVersionUID = 1L;

    private final String region;
    private final int required;
    private final List<String> available;

    public InsufficientZonesException(String region, int required, List<String> available) {
        super(ErrorKind.INSUFFICIENT_ZONES,
            "Region " + region + " offers " + available.size() + " distinct availability zone(s) " + available
                + ", " + required + " required");
        this.region = region;
        this.required = required;
        this.available = List.copyOf(available);
    }

    public String getRegion() {
        return region;
    }

    public int getRequired() {
        return required;
    }

    public List<String> getAvailable() {
        return available;
    }
}
