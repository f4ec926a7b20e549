package fr.lapetina.llm.verifier.orchestrator;

import fr.lapetina.llm.verifier.domain.model.CapabilityCategory;
import fr.lapetina.llm.verifier.domain.model.VerificationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerificationSchedulerTest {

    @Mock
    private VerificationOrchestrator orchestrator;

    private VerificationScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    private static VerificationResult result() {
        return new VerificationResult("openai", "gpt-4o", List.of(), 90, CapabilityCategory.FULLY_CAPABLE, null, null);
    }

    @Test
    @DisplayName("should force-refresh every registered model each cycle")
    void shouldRunForcedCycle() throws Exception {
        when(orchestrator.verifyAllRegistered(true)).thenReturn(CompletableFuture.completedFuture(List.of(result())));
        scheduler = new VerificationScheduler(orchestrator, Duration.ofMinutes(10));

        List<VerificationResult> results = scheduler.runCycle().get(1, TimeUnit.SECONDS);

        assertThat(results).hasSize(1);
        assertThat(scheduler.getCompletedCycles()).isEqualTo(1);
        verify(orchestrator, never()).verifyAllRegistered(false);
    }

    @Test
    @DisplayName("should skip a cycle while the previous one is running")
    void shouldSkipOverlappingCycle() throws Exception {
        CompletableFuture<List<VerificationResult>> slow = new CompletableFuture<>();
        when(orchestrator.verifyAllRegistered(true)).thenReturn(slow);
        scheduler = new VerificationScheduler(orchestrator, Duration.ofMinutes(10));

        scheduler.runCycle();
        List<VerificationResult> skipped = scheduler.runCycle().get(1, TimeUnit.SECONDS);

        assertThat(skipped).isEmpty();
        verify(orchestrator, times(1)).verifyAllRegistered(true);
        slow.complete(List.of());
        assertThat(scheduler.getCompletedCycles()).isEqualTo(1);
    }

    @Test
    @DisplayName("should recover after a failed cycle")
    void shouldRecoverFromFailure() {
        when(orchestrator.verifyAllRegistered(true))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")))
                .thenReturn(CompletableFuture.completedFuture(List.of()));
        scheduler = new VerificationScheduler(orchestrator, Duration.ofMinutes(10));

        assertThat(scheduler.runCycle()).isCompletedExceptionally();
        assertThat(scheduler.runCycle()).isCompleted();
        assertThat(scheduler.getCompletedCycles()).isEqualTo(1);
    }

    @Test
    @DisplayName("should run periodically once started")
    void shouldRunPeriodically() {
        when(orchestrator.verifyAllRegistered(true)).thenReturn(CompletableFuture.completedFuture(List.of()));
        scheduler = new VerificationScheduler(orchestrator, Duration.ofMillis(50));

        scheduler.start();

        assertThat(scheduler.isRunning()).isTrue();
        verify(orchestrator, timeout(2000).atLeast(2)).verifyAllRegistered(true);
        scheduler.close();
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    @DisplayName("should require a positive interval")
    void shouldRejectNonPositiveInterval() {
        assertThatThrownBy(() -> new VerificationScheduler(orchestrator, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
