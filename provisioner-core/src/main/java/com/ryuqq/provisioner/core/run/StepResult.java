package com.ryuqq.provisioner.core.run;

import com.ryuqq.provisioner.core.model.LogicalName;

/**
 * 단일 생성 단계의 결과.
 *
 * <p>StepResult는 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Created}: 새 리소스가 생성되고 준비됨</li>
 *   <li>{@link Reused}: 재사용 가능한 프로바이더 오류 후 기존 리소스를 채택함</li>
 *   <li>{@link Failed}: 치명적 오류로 실행이 중단됨</li>
 * </ul>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (result instanceof Reused reused) {
 *     log.info("reused {} after {}", reused.handle().id(), reused.triggeringErrorCode());
 * }
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public sealed interface StepResult permits Created, Reused, Failed {

    /**
     * 결과가 속한 단계의 논리 이름.
     *
     * @return 논리 이름
     */
    LogicalName logicalName();

    default boolean isCreated() {
        return this instanceof Created;
    }

    default boolean isReused() {
        return this instanceof Reused;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }
}
