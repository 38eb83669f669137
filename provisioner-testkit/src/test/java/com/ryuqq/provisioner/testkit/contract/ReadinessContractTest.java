package com.ryuqq.provisioner.testkit.contract;

import com.ryuqq.provisioner.application.provisioner.ProvisioningRun;
import com.ryuqq.provisioner.core.exception.ErrorKind;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.run.Cancellation;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: readiness waiting.
 *
 * <p>The virtual network and address translator are bound only once available.
 * The waiter succeeds iff the resource becomes available within its budget and
 * never hangs past it.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Pending for several polls → run completes</li>
 *   <li>Never ready → READINESS_TIMEOUT close to the budget; created id reported, dependents not created</li>
 *   <li>Failed state → PROVIDER_REJECTED with ResourceFailed</li>
 *   <li>Cancellation wakes a sleeping waiter</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class ReadinessContractTest extends AbstractProvisioningContractTest {

    @Test
    void testReadiness_PendingThenAvailable_RunCompletes() {
        // Given
        provider.setPendingPolls(ResourceKind.VIRTUAL_NETWORK, 2);
        provider.setPendingPolls(ResourceKind.ADDRESS_TRANSLATOR, 5);

        // When
        ProvisioningRun run = provision();

        // Then
        assertCompleted(run);
        assertEquals(3 + 6, provider.describeCalls(), "one describe per pending poll plus the available one");
    }

    @Test
    void testReadiness_NeverReady_TimesOutWithinBudget() {
        // Given
        provider.neverReady(ResourceKind.ADDRESS_TRANSLATOR);
        runnerConfig = runnerConfig.withReadinessTimeoutMs(150);
        long start = System.nanoTime();

        // When
        ProvisioningRun run = provision();

        // Then
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertFailedWith(run, ErrorKind.READINESS_TIMEOUT);
        assertEquals(names.addressTranslator(), run.getFailedStepOrNull());
        assertTrue(elapsedMs < 2000, "waiter overran its budget: " + elapsedMs + "ms");

        assertNotNull(run.idOf(names.addressTranslator()), "created but unready resource must be reported");
        assertFalse(run.getResultOrNull().bindings().containsKey(names.addressTranslator()));
        assertTrue(provider.findByName(ResourceKind.ROUTE_TABLE, names.privateRouteTable()).isEmpty());
    }

    @Test
    void testReadiness_FailedState_ProviderRejected() {
        // Given
        provider.failReadiness(ResourceKind.VIRTUAL_NETWORK);

        // When
        ProvisioningRun run = provision();

        // Then
        assertFailedWith(run, ErrorKind.PROVIDER_REJECTED);
        assertEquals("ResourceFailed", run.getProviderErrorCodeOrNull());
        assertEquals(0, provider.countOf(ResourceKind.GATEWAY));
    }

    @Test
    void testReadiness_CancelledWhileWaiting_WakesImmediately() throws Exception {
        // Given
        provider.neverReady(ResourceKind.ADDRESS_TRANSLATOR);
        runnerConfig = runnerConfig.withReadinessTimeoutMs(60_000).withPollIntervals(10_000, 10_000);
        Cancellation cancellation = Cancellation.create();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        long start = System.nanoTime();

        try {
            scheduler.schedule(() -> cancellation.cancel("operator abort"), 200, TimeUnit.MILLISECONDS);

            // When
            ProvisioningRun run = provision(cancellation);

            // Then
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            assertFailedWith(run, ErrorKind.RUN_CANCELLED);
            assertEquals(names.addressTranslator(), run.getFailedStepOrNull());
            assertTrue(elapsedMs < 5000, "cancellation did not wake the waiter: " + elapsedMs + "ms");
        } finally {
            scheduler.shutdownNow();
            scheduler.awaitTermination(1, TimeUnit.SECONDS);
        }
    }
}
