package com.ryuqq.provisioner.core.context;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceHandle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 한 번의 실행 동안 누적되는 논리 이름 → 핸들 매핑.
 *
 * <p>실행의 유일한 가변 공유 상태입니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <ul>
 *   <li>실행 시작 시 빈 상태로 생성</li>
 *   <li>단조 증가: 한 번 바인딩된 이름은 다시 바인딩할 수 없음 (write-once)</li>
 *   <li>실행 종료 시 폐기. 실행 간 영속화 없음 (이름 기반 재사용은 프로바이더 상태에만 의존)</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>{@link ConcurrentHashMap#putIfAbsent}로 이름당 writer 하나만 성공</li>
 *   <li>병렬 실행기가 추가되더라도 동기화 없이 안전하게 바인딩 가능</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ProvisioningContext implements ContextView {

    private final ConcurrentHashMap<LogicalName, ResourceHandle> bindings = new ConcurrentHashMap<>();
    private final List<LogicalName> bindingOrder = new CopyOnWriteArrayList<>();

    /**
     * 핸들 바인딩 (write-once).
     *
     * @param handle 바인딩할 핸들 (핸들의 논리 이름으로 바인딩)
     * @throws IllegalArgumentException handle이 null인 경우
     * @throws IllegalStateException 이름이 이미 바인딩된 경우
     */
    public void bind(ResourceHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        ResourceHandle previous = bindings.putIfAbsent(handle.name(), handle);
        if (previous != null) {
            throw new IllegalStateException(
                handle.name() + " is already bound to " + previous.id() + ", cannot rebind to " + handle.id());
        }
        bindingOrder.add(handle.name());
    }

    @Override
    public Optional<ResourceHandle> find(LogicalName name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        return Optional.ofNullable(bindings.get(name));
    }

    @Override
    public boolean isBound(LogicalName name) {
        return find(name).isPresent();
    }

    @Override
    public Map<LogicalName, ResourceHandle> snapshot() {
        Map<LogicalName, ResourceHandle> ordered = new LinkedHashMap<>();
        for (LogicalName name : bindingOrder) {
            ordered.put(name, bindings.get(name));
        }
        return Collections.unmodifiableMap(ordered);
    }

    public int size() {
        return bindings.size();
    }
}
