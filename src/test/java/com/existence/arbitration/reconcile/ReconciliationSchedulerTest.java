package com.existence.arbitration.reconcile;

import com.existence.arbitration.detect.SignalUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReconciliationSchedulerTest {

    @Mock
    private Reconciler reconciler;

    @Test
    @DisplayName("Should keep the last good result when a pass fails")
    void testFailingPassIsContained() {
        ReconcileResult ok = new ReconcileResult("canvas-1", 1, 0, List.of());
        when(reconciler.reconcile("canvas-1", true))
                .thenReturn(ok)
                .thenThrow(new SignalUnavailableException("canvas offline", null));

        try (ReconciliationScheduler scheduler =
                     new ReconciliationScheduler(reconciler, "canvas-1", true, Duration.ofMinutes(5))) {
            scheduler.runOnce();
            assertDoesNotThrow(scheduler::runOnce);

            assertSame(ok, scheduler.getLastResult());
            verify(reconciler, times(2)).reconcile("canvas-1", true);
        }
    }

    @Test
    @DisplayName("Should run passes periodically until stopped")
    void testScheduledRuns() {
        when(reconciler.reconcile("canvas-1", false))
                .thenReturn(new ReconcileResult("canvas-1", 0, 0, List.of()));

        try (ReconciliationScheduler scheduler =
                     new ReconciliationScheduler(reconciler, "canvas-1", false, Duration.ofMillis(20))) {
            scheduler.start();
            assertTrue(scheduler.isRunning());

            verify(reconciler, timeout(2_000).atLeast(2)).reconcile("canvas-1", false);

            scheduler.stop();
            assertFalse(scheduler.isRunning());
        }
    }

    @Test
    @DisplayName("Should reject a non-positive interval")
    void testIntervalValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReconciliationScheduler(reconciler, "canvas-1", true, Duration.ZERO));
    }
}
