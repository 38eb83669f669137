package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceState;

import java.util.List;
import java.util.Optional;

/**
 * 클라우드 프로바이더 리소스 API SPI (Service Provider Interface).
 *
 * <p>오케스트레이터가 호출하는 유일한 외부 협력자입니다.
 * 종류별 생성/조회/상태 확인 호출을 단일 인터페이스 뒤로 숨깁니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>{@link CreateRequest}의 종류에 맞는 프로바이더 호출로 변환</li>
 *   <li>프로바이더 오류를 {@link ProviderException}(오류 코드 + 메시지)으로 변환</li>
 *   <li>논리 이름으로 기존 리소스 조회 (태그, 네이티브 이름 등 프로바이더 방식)</li>
 *   <li>비동기 프로비저닝 리소스의 상태 보고</li>
 * </ul>
 *
 * <p><strong>오류 계약:</strong></p>
 * <p>어떤 오류 코드가 "재사용" 의미인지는 구현체가 아니라
 * {@link com.ryuqq.provisioner.core.policy.ReusePolicy} 테이블이 결정합니다.
 * 구현체는 오류 코드를 가공하지 않고 그대로 전달해야 합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface CloudProvider {

    /**
     * 리전의 가용 영역 목록 조회 (프로바이더 순서 유지).
     *
     * @param region 리전 이름
     * @return 가용 영역 이름 목록
     * @throws ProviderException 프로바이더 호출 실패 시
     */
    List<String> listAvailabilityZones(String region);

    /**
     * 리소스 생성.
     *
     * <p>호출당 정확히 한 번의 생성 시도만 수행해야 합니다.</p>
     *
     * @param request 생성 요청 (입력이 해석된 파라미터 포함)
     * @return 생성된 리소스의 식별자
     * @throws ProviderException 프로바이더가 요청을 거부한 경우
     */
    CreatedResource create(CreateRequest request);

    /**
     * 기존 리소스 조회.
     *
     * @param request 조회 요청
     * @return 찾은 리소스, 없으면 empty
     * @throws ProviderException 조회 호출 자체가 실패한 경우
     */
    Optional<ExistingResource> findExisting(LookupRequest request);

    /**
     * 리소스 상태 조회.
     *
     * <p>동기적으로 준비되는 종류는 항상 {@link ResourceState#AVAILABLE}을 반환해도 됩니다.</p>
     *
     * @param handle 리소스 핸들
     * @return 현재 상태
     * @throws ProviderException 조회 실패 시
     */
    ResourceState describe(ResourceHandle handle);
}
