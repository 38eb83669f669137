package com.ryuqq.provisioner.core.context;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceHandle;

import java.util.Map;
import java.util.Optional;

/**
 * 프로비저닝 컨텍스트의 읽기 전용 뷰.
 *
 * <p>개별 단계는 이 뷰로 입력을 해석할 수만 있고, 이름을 바인딩할 수는 없습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface ContextView {

    Optional<ResourceHandle> find(LogicalName name);

    boolean isBound(LogicalName name);

    /**
     * 바인딩 순서를 보존한 스냅샷.
     *
     * @return 논리 이름 → 핸들 (불변)
     */
    Map<LogicalName, ResourceHandle> snapshot();
}
