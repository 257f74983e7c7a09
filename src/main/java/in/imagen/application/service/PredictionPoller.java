package in.imagen.application.service;

import in.imagen.application.port.output.JobStatusProvider;
import in.imagen.application.port.output.JobStatusProvider.JobStatus;
import in.imagen.domain.common.EventType;
import in.imagen.domain.common.LifecycleEvent;
import in.imagen.infrastructure.metrics.LifecycleMetrics;
import in.imagen.service.core.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls one external job until it reaches a terminal state and turns the
 * outcome into a prediction.* event on the bus.
 *
 * TICK:
 * - succeeded → prediction.succeeded with normalized outputs
 * - failed    → prediction.failed with the provider error
 * - canceled  → prediction.canceled
 * - otherwise → attempt++, reschedule after the poll interval;
 *               prediction.failed with a timeout message once attempts reach the bound
 * - provider error → prediction.failed, no retry
 *
 * Ticks run on a shared scheduler, one in flight per poller. A compare-and-set on
 * the state admits exactly one terminal transition; that transition removes the
 * poller from the index and publishes the terminal event. Nothing is persisted here.
 */
public final class PredictionPoller {
    private static final Logger log = LoggerFactory.getLogger(PredictionPoller.class);
    private static final String CREATED_BY = "prediction-poller";

    static final String UNKNOWN_ERROR = "Unknown error";

    private final String jobId;
    private final String model;
    private final JobStatusProvider provider;
    private final EventBus eventBus;
    private final ActivePredictionIndex index;
    private final ScheduledExecutorService scheduler;
    private final LifecycleMetrics metrics;
    private final Duration pollInterval;
    private final int maxAttempts;

    private final AtomicReference<PollerState> state = new AtomicReference<>(PollerState.POLLING);
    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean processingSeen = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> nextTick;
    private volatile Instant startedAt = Instant.now();

    public PredictionPoller(
            String jobId,
            String model,
            JobStatusProvider provider,
            EventBus eventBus,
            ActivePredictionIndex index,
            ScheduledExecutorService scheduler,
            LifecycleMetrics metrics,
            Duration pollInterval,
            int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.jobId = jobId;
        this.model = model;
        this.provider = provider;
        this.eventBus = eventBus;
        this.index = index;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.pollInterval = pollInterval;
        this.maxAttempts = maxAttempts;
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Schedule the first tick immediately. Subsequent calls are ignored.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        startedAt = Instant.now();
        log.debug("Polling started: jobId={}, interval={}ms, maxAttempts={}",
                  jobId, pollInterval.toMillis(), maxAttempts);
        schedule(0);
    }

    /**
     * Cancel the job at the provider and publish prediction.canceled without
     * waiting for the next tick. An in-flight provider query is not interrupted;
     * its result is discarded.
     */
    public CancelOutcome cancel() {
        if (state.get() != PollerState.POLLING) {
            return CancelOutcome.NOT_ACTIVE;
        }

        Instant callStart = Instant.now();
        try {
            provider.cancelJob(jobId);
            metrics.recordProviderCall("cancel", true, Duration.between(callStart, Instant.now()));
        } catch (Exception e) {
            metrics.recordProviderCall("cancel", false, Duration.between(callStart, Instant.now()));
            log.error("Failed to cancel prediction {}: {}", jobId, e.getMessage());
            boolean failed = finish(PollerState.FAILED, EventType.PREDICTION_FAILED, null,
                                    "Failed to cancel prediction: " + e.getMessage());
            return failed ? CancelOutcome.FAILED : CancelOutcome.NOT_ACTIVE;
        }

        if (finish(PollerState.CANCELED, EventType.PREDICTION_CANCELED, null, null)) {
            log.info("Prediction canceled: {}", jobId);
            return CancelOutcome.CANCELED;
        }
        return CancelOutcome.NOT_ACTIVE;
    }

    /**
     * Stop polling without publishing anything. Used when submission is rolled back.
     * The provider is asked to cancel on a best-effort basis.
     */
    public void discard() {
        if (!state.compareAndSet(PollerState.POLLING, PollerState.CANCELED)) {
            return;
        }
        cancelNextTick();
        index.remove(jobId, this);
        try {
            provider.cancelJob(jobId);
        } catch (Exception e) {
            log.warn("Best-effort cancel of discarded prediction {} failed: {}", jobId, e.getMessage());
        }
        log.info("Prediction discarded: {}", jobId);
    }

    // ═══════════════════════════════════════════════════════════════
    // POLLING
    // ═══════════════════════════════════════════════════════════════

    private void schedule(long delayMillis) {
        if (state.get() != PollerState.POLLING) {
            return;
        }
        try {
            nextTick = scheduler.schedule(this::tick, delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // Scheduler is shutting down
            log.warn("Polling scheduler rejected job {}, stopping", jobId);
            if (state.compareAndSet(PollerState.POLLING, PollerState.CANCELED)) {
                index.remove(jobId, this);
            }
        }
    }

    void tick() {
        if (state.get() != PollerState.POLLING) {
            return;
        }

        JobStatus status;
        Instant callStart = Instant.now();
        try {
            status = provider.getJob(jobId);
            metrics.recordProviderCall("get", true, Duration.between(callStart, Instant.now()));
        } catch (Exception e) {
            metrics.recordProviderCall("get", false, Duration.between(callStart, Instant.now()));
            log.error("Provider query failed for prediction {}: {}", jobId, e.getMessage());
            finish(PollerState.FAILED, EventType.PREDICTION_FAILED, null, errorText(e));
            return;
        }

        try {
            handleStatus(status);
        } catch (RuntimeException e) {
            log.error("Polling failed for prediction {}", jobId, e);
            finish(PollerState.FAILED, EventType.PREDICTION_FAILED, null, errorText(e));
        }
    }

    private void handleStatus(JobStatus status) {
        if (status == null) {
            throw new IllegalStateException("Provider returned no status");
        }

        if (status.isSucceeded()) {
            List<String> outputs = normalizeOutput(status.output());
            if (finish(PollerState.SUCCEEDED, EventType.PREDICTION_SUCCEEDED, outputs, null)) {
                log.info("Prediction succeeded: jobId={}, outputs={}", jobId, outputs.size());
            }
            return;
        }

        if (status.isFailed()) {
            String error = status.error() != null && !status.error().isBlank() ? status.error() : UNKNOWN_ERROR;
            if (finish(PollerState.FAILED, EventType.PREDICTION_FAILED, null, error)) {
                log.warn("Prediction failed: jobId={}, error={}", jobId, error);
            }
            return;
        }

        if (status.isCanceled()) {
            if (finish(PollerState.CANCELED, EventType.PREDICTION_CANCELED, null, null)) {
                log.info("Prediction canceled by provider: {}", jobId);
            }
            return;
        }

        int attempt = attempts.incrementAndGet();
        log.debug("Prediction {} still {} (attempt {}/{})", jobId, status.status(), attempt, maxAttempts);

        if (status.isProcessing() && processingSeen.compareAndSet(false, true)
                && state.get() == PollerState.POLLING) {
            eventBus.publish(LifecycleEvent.prediction(EventType.PREDICTION_PROCESSING, jobId, null, null, CREATED_BY));
        }

        if (attempt >= maxAttempts) {
            String message = "Prediction timed out after " + attempt + " polling attempts";
            if (finish(PollerState.TIMED_OUT, EventType.PREDICTION_FAILED, null, message)) {
                log.warn("Prediction timed out: jobId={}, attempts={}", jobId, attempt);
            }
            return;
        }

        schedule(pollInterval.toMillis());
    }

    /**
     * Single terminal transition: index removal, metrics, then the event.
     *
     * @return false if another path already reached a terminal state
     */
    private boolean finish(PollerState terminal, EventType type, List<String> outputs, String error) {
        if (!state.compareAndSet(PollerState.POLLING, terminal)) {
            log.debug("Prediction {} already {}, dropping {}", jobId, state.get(), type);
            return false;
        }
        try {
            cancelNextTick();
        } finally {
            index.remove(jobId, this);
            metrics.recordPredictionOutcome(terminal.name(), attempts.get(),
                                            Duration.between(startedAt, Instant.now()));
        }
        eventBus.publish(LifecycleEvent.prediction(type, jobId, outputs, error, CREATED_BY));
        return true;
    }

    private void cancelNextTick() {
        ScheduledFuture<?> future = nextTick;
        if (future != null) {
            future.cancel(false);
        }
    }

    private static String errorText(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    // ═══════════════════════════════════════════════════════════════
    // OUTPUT NORMALIZATION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Normalize a raw provider output into a list of strings.
     * null → [], "url" → ["url"], collection → elements as strings, other → [String.valueOf(o)]
     */
    public static List<String> normalizeOutput(Object output) {
        if (output == null) {
            return List.of();
        }
        if (output instanceof CharSequence) {
            return List.of(output.toString());
        }
        if (output instanceof Collection) {
            Collection<?> items = (Collection<?>) output;
            List<String> result = new ArrayList<>(items.size());
            for (Object item : items) {
                result.add(String.valueOf(item));
            }
            return List.copyOf(result);
        }
        return List.of(String.valueOf(output));
    }

    // ═══════════════════════════════════════════════════════════════
    // ACCESSORS
    // ═══════════════════════════════════════════════════════════════

    public String getJobId() {
        return jobId;
    }

    public String getModel() {
        return model;
    }

    public PollerState getState() {
        return state.get();
    }

    public int getAttempts() {
        return attempts.get();
    }
}
