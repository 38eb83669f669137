package com.ryuqq.provisioner.core.run;

import com.ryuqq.provisioner.core.exception.ErrorKind;
import com.ryuqq.provisioner.core.exception.RunCancelledException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cancellation 테스트.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class CancellationTest {

    @Test
    void create_NotCancelled() throws InterruptedException {
        Cancellation cancellation = Cancellation.create();

        assertFalse(cancellation.isCancelled());
        assertNull(cancellation.getReasonOrNull());
        assertFalse(cancellation.await(10));
        assertDoesNotThrow(cancellation::throwIfCancelled);
    }

    @Test
    void cancel_KeepsFirstReason() {
        Cancellation cancellation = Cancellation.create();

        cancellation.cancel("operator abort");
        cancellation.cancel("second call");

        assertTrue(cancellation.isCancelled());
        assertEquals("operator abort", cancellation.getReasonOrNull());
    }

    @Test
    void throwIfCancelled_Cancelled_ThrowsRunCancelled() {
        Cancellation cancellation = Cancellation.create();
        cancellation.cancel(null);

        RunCancelledException exception = assertThrows(RunCancelledException.class, cancellation::throwIfCancelled);
        assertEquals(ErrorKind.RUN_CANCELLED, exception.getErrorKind());
        assertTrue(exception.getMessage().contains("cancelled by operator"));
    }

    @Test
    void await_CancelledFromAnotherThread_ReturnsEarly() throws InterruptedException {
        // Given
        Cancellation cancellation = Cancellation.create();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            cancellation.cancel("stop");
        });

        // When
        long start = System.nanoTime();
        canceller.start();
        boolean cancelled = cancellation.await(10_000);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        // Then
        assertTrue(cancelled);
        assertTrue(elapsedMs < 5_000, "await should return shortly after cancel (elapsed: " + elapsedMs + "ms)");
        canceller.join();
    }
}
