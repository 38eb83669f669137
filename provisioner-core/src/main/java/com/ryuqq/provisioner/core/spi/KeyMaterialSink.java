package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.LogicalName;

/**
 * 새로 생성된 키 페어의 개인 키 자료를 받는 SPI.
 *
 * <p>프로바이더는 키 자료를 생성 시점에 단 한 번만 반환하므로,
 * 호출자가 이 콜백에서 영속화해야 합니다. 재사용된 키 페어에 대해서는 호출되지 않습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface KeyMaterialSink {

    /**
     * 아무것도 하지 않는 싱크.
     */
    KeyMaterialSink DISCARD = (keyName, material) -> { };

    /**
     * 키 자료 수신.
     *
     * @param keyName 키 페어 논리 이름
     * @param material 개인 키 자료 (PEM)
     */
    void accept(LogicalName keyName, String material);
}
