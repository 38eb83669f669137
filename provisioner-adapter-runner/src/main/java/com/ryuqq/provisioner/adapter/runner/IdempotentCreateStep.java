package com.ryuqq.provisioner.adapter.runner;

import com.ryuqq.provisioner.core.context.ContextView;
import com.ryuqq.provisioner.core.exception.ProviderRejectedException;
import com.ryuqq.provisioner.core.exception.ReuseConflictException;
import com.ryuqq.provisioner.core.exception.StepFailedException;
import com.ryuqq.provisioner.core.exception.UnresolvedDependencyException;
import com.ryuqq.provisioner.core.model.InputRef;
import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.ResourceParameters;
import com.ryuqq.provisioner.core.model.ResourceSpec;
import com.ryuqq.provisioner.core.policy.ReusePolicy;
import com.ryuqq.provisioner.core.run.Created;
import com.ryuqq.provisioner.core.run.Reused;
import com.ryuqq.provisioner.core.run.StepResult;
import com.ryuqq.provisioner.core.spi.CloudProvider;
import com.ryuqq.provisioner.core.spi.CreateRequest;
import com.ryuqq.provisioner.core.spi.CreatedResource;
import com.ryuqq.provisioner.core.spi.ExistingResource;
import com.ryuqq.provisioner.core.spi.KeyMaterialSink;
import com.ryuqq.provisioner.core.spi.LookupMode;
import com.ryuqq.provisioner.core.spi.LookupRequest;
import com.ryuqq.provisioner.core.spi.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 멱등 생성 단계.
 *
 * <p>리소스 하나를 생성하되, 프로바이더가 재사용 가능한 오류를 반환하면
 * 기존 리소스를 찾아 채택합니다. 같은 설정으로 다시 실행해도 리소스가 중복되거나 실행이 실패하지 않습니다.</p>
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>선언된 입력을 컨텍스트에서 해석 (없으면 {@link UnresolvedDependencyException})</li>
 *   <li>생성 시도 (호출당 최대 1회)</li>
 *   <li>성공 → {@link Created}, 키 자료가 있으면 {@link KeyMaterialSink}에 한 번 전달</li>
 *   <li>{@link ReusePolicy}에 등록된 오류 → 지정된 방식으로 조회 후 {@link Reused}</li>
 *   <li>그 외 오류 → {@link ProviderRejectedException}</li>
 * </ol>
 *
 * <p>시작 템플릿은 이름으로만 재사용하며 파라미터를 비교하지 않습니다.
 * 이미지나 부트 스크립트가 바뀌어도 기존 템플릿이 채택되므로 WARN 로그를 남깁니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class IdempotentCreateStep {

    private static final Logger log = LoggerFactory.getLogger(IdempotentCreateStep.class);

    private final CloudProvider provider;
    private final ReusePolicy reusePolicy;
    private final KeyMaterialSink keyMaterialSink;

    /**
     * 생성자.
     *
     * @param provider 클라우드 프로바이더
     * @param reusePolicy 재사용 허용 오류 표
     * @param keyMaterialSink 키 자료 수신자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public IdempotentCreateStep(CloudProvider provider, ReusePolicy reusePolicy, KeyMaterialSink keyMaterialSink) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (reusePolicy == null) {
            throw new IllegalArgumentException("reusePolicy cannot be null");
        }
        if (keyMaterialSink == null) {
            throw new IllegalArgumentException("keyMaterialSink cannot be null");
        }
        this.provider = provider;
        this.reusePolicy = reusePolicy;
        this.keyMaterialSink = keyMaterialSink;
    }

    /**
     * 명세 하나를 생성하거나 재사용.
     *
     * @param spec 생성할 명세
     * @param context 선행 단계 출력 (읽기 전용)
     * @return {@link Created} 또는 {@link Reused}
     * @throws UnresolvedDependencyException 입력이 바인딩되지 않은 경우
     * @throws ProviderRejectedException 재사용 대상이 아닌 오류이거나 재사용할 리소스가 없는 경우
     * @throws ReuseConflictException 조회된 리소스의 종류가 다른 경우
     * @throws StepFailedException 생성된 키페어의 키 자료를 저장하지 못한 경우
     */
    public StepResult execute(ResourceSpec spec, ContextView context) {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        ResourceParameters parameters = resolve(spec, context);
        CreatedResource created;
        try {
            created = provider.create(new CreateRequest(spec.kind(), spec.name(), parameters));
        } catch (ProviderException e) {
            return reuse(spec, parameters, e);
        }

        ResourceHandle handle = new ResourceHandle(spec.kind(), spec.name(), created.id());
        log.info("Created {} {} -> {}", spec.kind(), spec.name(), created.id());
        if (created.hasKeyMaterial()) {
            storeKeyMaterial(handle, created.keyMaterial());
        }
        return new Created(handle);
    }

    private void storeKeyMaterial(ResourceHandle handle, String keyMaterial) {
        try {
            keyMaterialSink.accept(handle.name(), keyMaterial);
        } catch (RuntimeException e) {
            throw new StepFailedException(handle.name(), handle.kind(), handle,
                "Key material for " + handle.name() + " could not be stored; key pair " + handle.id()
                    + " exists without its private key and must be deleted before re-running", e);
        }
    }

    private ResourceParameters resolve(ResourceSpec spec, ContextView context) {
        ResourceParameters resolved = spec.parameters();
        for (InputRef input : spec.inputs()) {
            List<String> ids = new ArrayList<>();
            for (LogicalName source : input.sources()) {
                ResourceHandle handle = context.find(source)
                    .orElseThrow(() -> new UnresolvedDependencyException(spec.name(), source));
                ids.add(handle.id());
            }
            resolved = resolved.with(input.parameter(), input.listValued() ? ids : ids.get(0));
        }
        return resolved;
    }

    private Reused reuse(ResourceSpec spec, ResourceParameters parameters, ProviderException rejection) {
        Optional<LookupMode> mode = reusePolicy.lookupFor(spec.kind(), rejection.getErrorCode());
        if (mode.isEmpty()) {
            throw ProviderRejectedException.of(spec.name(), spec.kind(), rejection);
        }

        log.info("{} {} rejected with {}, looking up existing resource ({})",
            spec.kind(), spec.name(), rejection.getErrorCode(), mode.get());

        Optional<ExistingResource> existing;
        try {
            existing = provider.findExisting(new LookupRequest(spec.kind(), spec.name(), mode.get(), parameters));
        } catch (ProviderException e) {
            throw ProviderRejectedException.of(spec.name(), spec.kind(), e);
        }
        if (existing.isEmpty()) {
            throw ProviderRejectedException.of(spec.name(), spec.kind(), rejection);
        }

        ExistingResource found = existing.get();
        if (found.kind() != spec.kind()) {
            throw new ReuseConflictException(spec.name(), spec.kind(), found.kind(), found.id());
        }
        if (spec.kind() == ResourceKind.LAUNCH_TEMPLATE) {
            log.warn("Reusing launch template {} ({}) by name; template parameters are not compared",
                spec.name(), found.id());
        }

        log.info("Reused {} {} -> {}", spec.kind(), spec.name(), found.id());
        return new Reused(new ResourceHandle(spec.kind(), spec.name(), found.id()), rejection.getErrorCode());
    }
}
