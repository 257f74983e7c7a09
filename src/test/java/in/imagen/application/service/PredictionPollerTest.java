package in.imagen.application.service;

import in.imagen.application.port.output.JobProviderException;
import in.imagen.application.port.output.JobStatusProvider;
import in.imagen.application.port.output.JobStatusProvider.JobStatus;
import in.imagen.domain.common.EventType;
import in.imagen.domain.common.LifecycleEvent;
import in.imagen.infrastructure.metrics.LifecycleMetrics;
import in.imagen.service.core.EventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PredictionPoller.
 *
 * Tests:
 * - Output normalization
 * - Succeeded / failed / canceled provider statuses
 * - Timeout after the attempt budget
 * - Provider error ends polling without retry
 * - Cancellation (success and provider failure)
 * - Exactly one terminal event and one index removal
 */
@ExtendWith(MockitoExtension.class)
class PredictionPollerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Duration INTERVAL = Duration.ofMillis(5);

    @Mock
    private JobStatusProvider provider;

    private EventBus bus;
    private ActivePredictionIndex index;
    private ScheduledExecutorService scheduler;
    private EventRecorder recorder;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        index = new ActivePredictionIndex();
        scheduler = Executors.newScheduledThreadPool(2);
        recorder = new EventRecorder(bus,
            EventType.PREDICTION_PROCESSING, EventType.PREDICTION_SUCCEEDED,
            EventType.PREDICTION_FAILED, EventType.PREDICTION_CANCELED);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private PredictionPoller register(JobStatusProvider jobs, String jobId, int maxAttempts) {
        PredictionPoller poller = new PredictionPoller(jobId, "owner/model", jobs, bus, index, scheduler,
                                                       LifecycleMetrics.NOOP, INTERVAL, maxAttempts);
        index.register(jobId, poller);
        return poller;
    }

    private long terminalEvents() {
        return recorder.count(EventType.PREDICTION_SUCCEEDED)
            + recorder.count(EventType.PREDICTION_FAILED)
            + recorder.count(EventType.PREDICTION_CANCELED);
    }

    // ═══════════════════════════════════════════════════════════════
    // NORMALIZATION
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testNormalizeOutputNullIsEmpty() {
        assertEquals(List.of(), PredictionPoller.normalizeOutput(null));
    }

    @Test
    void testNormalizeOutputSingleStringIsSingletonList() {
        assertEquals(List.of("url"), PredictionPoller.normalizeOutput("url"));
    }

    @Test
    void testNormalizeOutputListIsKept() {
        assertEquals(List.of("a", "b"), PredictionPoller.normalizeOutput(List.of("a", "b")));
    }

    @Test
    void testNormalizeOutputOtherValueIsStringified() {
        assertEquals(List.of("42"), PredictionPoller.normalizeOutput(42));
    }

    @Test
    void testNormalizeOutputMixedListStringifiesElements() {
        assertEquals(List.of("1", "null", "x"), PredictionPoller.normalizeOutput(Arrays.asList(1, null, "x")));
    }

    // ═══════════════════════════════════════════════════════════════
    // PROVIDER OUTCOMES
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testTickSucceededPublishesNormalizedOutputs() throws Exception {
        when(provider.getJob("job-1")).thenReturn(new JobStatus("job-1", "succeeded", "http://x/img.png", null));
        PredictionPoller poller = register(provider, "job-1", 10);

        poller.start();

        assertTrue(recorder.await(EventType.PREDICTION_SUCCEEDED, TIMEOUT));
        LifecycleEvent event = recorder.ofType(EventType.PREDICTION_SUCCEEDED).get(0);
        assertEquals("job-1", event.entityId());
        assertEquals(List.of("http://x/img.png"), event.outputs());
        assertEquals(PollerState.SUCCEEDED, poller.getState());
        assertFalse(index.contains("job-1"));
    }

    @Test
    void testTickFailedWithoutErrorUsesPlaceholder() throws Exception {
        when(provider.getJob("job-1")).thenReturn(new JobStatus("job-1", "failed", null, null));
        PredictionPoller poller = register(provider, "job-1", 10);

        poller.start();

        assertTrue(recorder.await(EventType.PREDICTION_FAILED, TIMEOUT));
        assertEquals("Unknown error", recorder.ofType(EventType.PREDICTION_FAILED).get(0).error());
        assertEquals(PollerState.FAILED, poller.getState());
    }

    @Test
    void testTickCanceledByProviderPublishesCanceled() throws Exception {
        when(provider.getJob("job-1")).thenReturn(new JobStatus("job-1", "canceled", null, null));
        PredictionPoller poller = register(provider, "job-1", 10);

        poller.start();

        assertTrue(recorder.await(EventType.PREDICTION_CANCELED, TIMEOUT));
        assertEquals(PollerState.CANCELED, poller.getState());
        assertFalse(index.contains("job-1"));
    }

    @Test
    void testTickProcessingThenSucceededPublishesProcessingOnce() throws Exception {
        when(provider.getJob("job-1")).thenReturn(
            new JobStatus("job-1", "starting", null, null),
            new JobStatus("job-1", "processing", null, null),
            new JobStatus("job-1", "processing", null, null),
            new JobStatus("job-1", "succeeded", List.of("a", "b"), null));
        PredictionPoller poller = register(provider, "job-1", 10);

        poller.start();

        assertTrue(recorder.await(EventType.PREDICTION_SUCCEEDED, TIMEOUT));
        assertEquals(List.of("prediction.processing", "prediction.succeeded"), recorder.kinds());
        assertEquals(3, poller.getAttempts());
        verify(provider, times(4)).getJob("job-1");
    }

    @Test
    void testTickAlwaysProcessingTimesOutExactlyOnce() throws Exception {
        FakeJobStatusProvider jobs = new FakeJobStatusProvider();
        PredictionPoller poller = register(jobs, "job-1", 5);

        poller.start();

        assertTrue(recorder.await(EventType.PREDICTION_FAILED, TIMEOUT));
        Thread.sleep(50);

        List<LifecycleEvent> failures = recorder.ofType(EventType.PREDICTION_FAILED);
        assertEquals(1, failures.size(), "Exactly one failure event on timeout");
        assertTrue(failures.get(0).error().contains("timed out"), failures.get(0).error());
        assertEquals(PollerState.TIMED_OUT, poller.getState());
        assertEquals(5, jobs.getCalls("job-1"), "Polling stops at the attempt budget");
        assertFalse(index.contains("job-1"), "Timed out poller leaves the index");
        assertEquals(1, terminalEvents());
    }

    @Test
    void testTickProviderErrorFailsWithoutRetry() throws Exception {
        when(provider.getJob("job-1")).thenThrow(new JobProviderException("get", "job-1", "connection refused"));
        PredictionPoller poller = register(provider, "job-1", 10);

        poller.start();

        assertTrue(recorder.await(EventType.PREDICTION_FAILED, TIMEOUT));
        Thread.sleep(50);

        assertTrue(recorder.ofType(EventType.PREDICTION_FAILED).get(0).error().contains("connection refused"));
        assertEquals(PollerState.FAILED, poller.getState());
        assertFalse(index.contains("job-1"));
        verify(provider, times(1)).getJob("job-1");
    }

    // ═══════════════════════════════════════════════════════════════
    // CANCELLATION
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testCancelPublishesCanceledImmediately() {
        PredictionPoller poller = register(provider, "job-1", 10);

        CancelOutcome outcome = poller.cancel();

        assertEquals(CancelOutcome.CANCELED, outcome);
        verify(provider).cancelJob("job-1");
        assertEquals(List.of("prediction.canceled"), recorder.kinds());
        assertEquals(PollerState.CANCELED, poller.getState());
        assertFalse(index.contains("job-1"));
    }

    @Test
    void testCancelTwiceSecondIsNotActive() {
        PredictionPoller poller = register(provider, "job-1", 10);

        assertEquals(CancelOutcome.CANCELED, poller.cancel());
        assertEquals(CancelOutcome.NOT_ACTIVE, poller.cancel());

        verify(provider, times(1)).cancelJob("job-1");
        assertEquals(1, terminalEvents());
    }

    @Test
    void testCancelProviderFailurePublishesFailed() {
        doThrow(new JobProviderException("cancel", "job-1", "HTTP error 500")).when(provider).cancelJob("job-1");
        PredictionPoller poller = register(provider, "job-1", 10);

        CancelOutcome outcome = poller.cancel();

        assertEquals(CancelOutcome.FAILED, outcome);
        List<LifecycleEvent> failures = recorder.ofType(EventType.PREDICTION_FAILED);
        assertEquals(1, failures.size());
        assertTrue(failures.get(0).error().startsWith("Failed to cancel prediction: "));
        assertFalse(index.contains("job-1"));
    }

    @Test
    void testCancelAfterTerminalIsNotActive() throws Exception {
        when(provider.getJob("job-1")).thenReturn(new JobStatus("job-1", "succeeded", null, null));
        PredictionPoller poller = register(provider, "job-1", 10);
        poller.start();
        assertTrue(recorder.await(EventType.PREDICTION_SUCCEEDED, TIMEOUT));

        assertEquals(CancelOutcome.NOT_ACTIVE, poller.cancel());
        verify(provider, never()).cancelJob(anyString());
        assertEquals(1, terminalEvents());
    }

    @Test
    void testDiscardRemovesWithoutEvents() {
        PredictionPoller poller = register(provider, "job-1", 10);

        poller.discard();

        assertTrue(recorder.events().isEmpty());
        assertFalse(index.contains("job-1"));
        verify(provider).cancelJob("job-1");
    }

    @Test
    void testCancelRacingWithTicksEmitsSingleTerminalEvent() throws Exception {
        FakeJobStatusProvider jobs = new FakeJobStatusProvider();
        PredictionPoller poller = register(jobs, "job-1", 1000);
        poller.start();
        Thread.sleep(20);

        jobs.respond("job-1", FakeJobStatusProvider.succeeded("http://x/late.png"));
        poller.cancel();
        Thread.sleep(50);

        assertEquals(1, terminalEvents());
        assertFalse(index.contains("job-1"));
    }
}
