package com.ryuqq.provisioner.adapter.runner;

import com.ryuqq.provisioner.application.provisioner.Provisioner;
import com.ryuqq.provisioner.application.provisioner.ProvisioningRun;
import com.ryuqq.provisioner.core.config.ProvisioningConfig;
import com.ryuqq.provisioner.core.context.ProvisioningContext;
import com.ryuqq.provisioner.core.exception.ProviderRejectedException;
import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.executor.PlanExecutor;
import com.ryuqq.provisioner.core.plan.ProvisioningPlan;
import com.ryuqq.provisioner.core.policy.ReusePolicy;
import com.ryuqq.provisioner.core.run.Cancellation;
import com.ryuqq.provisioner.core.run.RunResult;
import com.ryuqq.provisioner.core.spi.CloudProvider;
import com.ryuqq.provisioner.core.spi.KeyMaterialSink;
import com.ryuqq.provisioner.core.spi.ProviderException;
import com.ryuqq.provisioner.core.topology.FleetBuilder;
import com.ryuqq.provisioner.core.topology.NetworkLayout;
import com.ryuqq.provisioner.core.topology.NetworkTopologyBuilder;
import com.ryuqq.provisioner.core.topology.ZoneSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 기본 {@link Provisioner} 구현체.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <ol>
 *   <li>리전의 가용 영역 조회 후 처음 N개 선택 (부족하면 리소스 생성 없이 거부)</li>
 *   <li>{@link NetworkTopologyBuilder}와 {@link FleetBuilder}로 계획 생성, {@code then}으로 결합</li>
 *   <li>{@link PlanExecutor}로 새 컨텍스트에서 실행</li>
 *   <li>{@link ProvisioningRun} 보고서 반환 (성공 INFO, 실패 ERROR 로그)</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Provisioner provisioner = StandardProvisioner.create(
 *     AwsCloudProvider.forRegion(config.region()),
 *     AwsReusePolicy.defaults(),
 *     new PemFileKeyMaterialSink(Path.of(".")),
 *     new RunnerConfig()
 * );
 * ProvisioningRun run = provisioner.provision(config);
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class StandardProvisioner implements Provisioner {

    private static final Logger log = LoggerFactory.getLogger(StandardProvisioner.class);

    private final CloudProvider provider;
    private final PlanExecutor executor;

    /**
     * 생성자.
     *
     * @param provider 영역 조회에 사용할 프로바이더
     * @param executor 계획 실행기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StandardProvisioner(CloudProvider provider, PlanExecutor executor) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.provider = provider;
        this.executor = executor;
    }

    /**
     * 기본 구성요소로 조립.
     *
     * @param provider 클라우드 프로바이더
     * @param reusePolicy 프로바이더의 재사용 허용 오류 표
     * @param keyMaterialSink 키 자료 수신자
     * @param config 실행기 설정
     * @return StandardProvisioner
     */
    public static StandardProvisioner create(CloudProvider provider, ReusePolicy reusePolicy,
                                             KeyMaterialSink keyMaterialSink, RunnerConfig config) {
        IdempotentCreateStep createStep = new IdempotentCreateStep(provider, reusePolicy, keyMaterialSink);
        PollingReadinessWaiter waiter = new PollingReadinessWaiter(provider, BackoffCalculator.forPolling(config));
        return new StandardProvisioner(provider, new DependencyGraphExecutor(createStep, waiter, config));
    }

    @Override
    public ProvisioningRun provision(ProvisioningConfig config, Cancellation cancellation) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }

        List<String> zones;
        try {
            zones = selectZones(config);
        } catch (ProvisioningException e) {
            log.error("Provisioning {} rejected before any resource was created: {}", config.project(), e.getMessage());
            return ProvisioningRun.rejected(config.project(), e);
        }

        ProvisioningPlan plan = buildPlan(config, zones);
        log.info("Provisioning {} in {} across {}: {} step(s)", config.project(), config.region(), zones, plan.size());

        RunResult result = executor.run(plan, new ProvisioningContext(), cancellation);
        ProvisioningRun run = ProvisioningRun.from(config.project(), zones, result);
        if (run.isCompleted()) {
            log.info("Provisioning {} completed: {} created, {} reused", config.project(),
                run.createdCount(), run.reusedCount());
        } else {
            log.error("Provisioning {} failed at {}:{}{}", config.project(), run.getFailedStepOrNull(),
                System.lineSeparator(), run.summary());
        }
        return run;
    }

    @Override
    public ProvisioningPlan plan(ProvisioningConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return buildPlan(config, selectZones(config));
    }

    private List<String> selectZones(ProvisioningConfig config) {
        List<String> available;
        try {
            available = provider.listAvailabilityZones(config.region());
        } catch (ProviderException e) {
            throw new ProviderRejectedException(null, null, e.getErrorCode(), e.getMessage(), e);
        }
        return ZoneSelector.firstDistinct(config.zoneCount()).select(config.region(), available);
    }

    private static ProvisioningPlan buildPlan(ProvisioningConfig config, List<String> zones) {
        NetworkLayout network = new NetworkTopologyBuilder(config).build(zones);
        return network.plan().then(new FleetBuilder(config).build(network));
    }
}
