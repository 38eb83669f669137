package com.ryuqq.provisioner.core.topology;

import com.ryuqq.provisioner.core.exception.InsufficientZonesException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 프로바이더가 보고한 가용 영역에서 사용할 영역 선택.
 *
 * <p>프로바이더 순서를 유지하며 중복을 제외한 처음 N개를 고릅니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ZoneSelector {

    private final int required;

    private ZoneSelector(int required) {
        if (required < 1) {
            throw new IllegalArgumentException("required must be positive (current: " + required + ")");
        }
        this.required = required;
    }

    public static ZoneSelector firstDistinct(int required) {
        return new ZoneSelector(required);
    }

    /**
     * 영역 선택.
     *
     * @param region 리전 (오류 보고용)
     * @param available 프로바이더가 보고한 영역 (순서 유지)
     * @return 선택된 영역 N개
     * @throws InsufficientZonesException 중복 제외 영역이 N개 미만인 경우
     */
    public List<String> select(String region, List<String> available) {
        if (available == null) {
            throw new IllegalArgumentException("available cannot be null");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String zone : available) {
            if (zone != null && !zone.isBlank()) {
                distinct.add(zone);
            }
        }
        if (distinct.size() < required) {
            throw new InsufficientZonesException(region, required, new ArrayList<>(distinct));
        }
        return List.copyOf(new ArrayList<>(distinct).subList(0, required));
    }

    public int required() {
        return required;
    }
}
