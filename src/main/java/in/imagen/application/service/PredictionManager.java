package in.imagen.application.service;

import in.imagen.application.port.output.JobProviderException;
import in.imagen.application.port.output.JobStatusProvider;
import in.imagen.infrastructure.metrics.LifecycleMetrics;
import in.imagen.service.core.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates prediction jobs and owns their pollers.
 *
 * All pollers share one scheduled pool; a poller waiting for its next tick holds
 * no thread. Creation and polling are split so the caller can persist the job
 * before any outcome event can arrive.
 */
public final class PredictionManager {
    private static final Logger log = LoggerFactory.getLogger(PredictionManager.class);

    private final JobStatusProvider provider;
    private final EventBus eventBus;
    private final ActivePredictionIndex index;
    private final LifecycleMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final Duration pollInterval;
    private final int maxAttempts;

    public PredictionManager(JobStatusProvider provider, EventBus eventBus, ActivePredictionIndex index) {
        this(provider, eventBus, index, LifecycleMetrics.NOOP, Duration.ofSeconds(1), 60, 4);
    }

    public PredictionManager(
            JobStatusProvider provider,
            EventBus eventBus,
            ActivePredictionIndex index,
            LifecycleMetrics metrics,
            Duration pollInterval,
            int maxAttempts,
            int pollerThreads) {
        this.provider = provider;
        this.eventBus = eventBus;
        this.index = index;
        this.metrics = metrics;
        this.pollInterval = pollInterval;
        this.maxAttempts = maxAttempts;

        AtomicInteger threadCount = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, pollerThreads), r -> {
            Thread t = new Thread(r, "prediction-poller-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Create a job at the provider and register its poller. Polling does not
     * start until {@link #startPolling(String)}.
     *
     * @return Provider job id
     * @throws JobProviderException if the provider call fails
     */
    public String createPrediction(String model, Map<String, Object> params) {
        Instant callStart = Instant.now();
        String jobId;
        try {
            jobId = provider.createJob(model, params);
        } catch (JobProviderException e) {
            metrics.recordProviderCall("create", false, Duration.between(callStart, Instant.now()));
            throw e;
        } catch (RuntimeException e) {
            metrics.recordProviderCall("create", false, Duration.between(callStart, Instant.now()));
            throw new JobProviderException("create", model, e.getMessage(), e);
        }
        metrics.recordProviderCall("create", true, Duration.between(callStart, Instant.now()));

        if (jobId == null || jobId.isBlank()) {
            throw new JobProviderException("create", model, "Provider returned no job id");
        }

        PredictionPoller poller = new PredictionPoller(
            jobId, model, provider, eventBus, index, scheduler, metrics, pollInterval, maxAttempts);
        index.register(jobId, poller);
        metrics.recordPredictionStarted(model);

        log.info("Prediction created: jobId={}, model={}", jobId, model);
        return jobId;
    }

    /**
     * Start polling a registered prediction.
     *
     * @return false if the job is not active
     */
    public boolean startPolling(String jobId) {
        PredictionPoller poller = index.get(jobId);
        if (poller == null) {
            log.warn("Cannot start polling, prediction not active: {}", jobId);
            return false;
        }
        poller.start();
        return true;
    }

    /**
     * Cancel an active prediction.
     */
    public CancelOutcome cancelPrediction(String jobId) {
        PredictionPoller poller = index.get(jobId);
        if (poller == null) {
            log.debug("Cancel ignored, prediction not active: {}", jobId);
            return CancelOutcome.NOT_ACTIVE;
        }
        return poller.cancel();
    }

    /**
     * Drop a prediction without publishing events (submission rollback).
     */
    public void discardPrediction(String jobId) {
        PredictionPoller poller = index.get(jobId);
        if (poller != null) {
            poller.discard();
        }
    }

    public boolean isActive(String jobId) {
        return index.contains(jobId);
    }

    public Set<String> activeJobIds() {
        return index.activeJobIds();
    }

    /**
     * Stop all polling. Pending ticks are dropped and the index is cleared.
     */
    public void shutdown() {
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Prediction pollers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int active = index.size();
        index.clear();
        log.info("Prediction manager stopped ({} active predictions dropped)", active);
    }
}
