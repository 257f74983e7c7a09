package in.imagen.application.service;

import in.imagen.infrastructure.metrics.LifecycleMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ActivePredictionIndex - job id → poller for every prediction still being polled.
 *
 * STRUCTURE:
 * - Map<jobId, PredictionPoller>, at most one poller per job id
 *
 * THREAD-SAFETY:
 * ConcurrentHashMap. Pollers remove themselves from their own threads while the
 * manager registers new ones and the orchestrator looks entries up for cancellation.
 *
 * LIFECYCLE:
 * 1. Register when the provider has created the job
 * 2. Remove exactly once when the poller reaches a terminal state
 */
public final class ActivePredictionIndex {
    private static final Logger log = LoggerFactory.getLogger(ActivePredictionIndex.class);

    private final Map<String, PredictionPoller> pollers = new ConcurrentHashMap<>();
    private final LifecycleMetrics metrics;

    private final AtomicLong totalRegistered = new AtomicLong();
    private final AtomicLong totalRemoved = new AtomicLong();

    public ActivePredictionIndex() {
        this(LifecycleMetrics.NOOP);
    }

    public ActivePredictionIndex(LifecycleMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Register a poller.
     *
     * @throws IllegalStateException if a poller is already registered for the job id
     */
    public void register(String jobId, PredictionPoller poller) {
        PredictionPoller existing = pollers.putIfAbsent(jobId, poller);
        if (existing != null) {
            throw new IllegalStateException("Prediction already active: " + jobId);
        }
        totalRegistered.incrementAndGet();
        metrics.updateActivePredictions(pollers.size());
        log.debug("Prediction added to index: {}", jobId);
    }

    /**
     * Remove the entry only if it still maps to {@code poller}.
     *
     * @return true for the single call that actually removed it
     */
    public boolean remove(String jobId, PredictionPoller poller) {
        boolean removed = pollers.remove(jobId, poller);
        if (removed) {
            totalRemoved.incrementAndGet();
            metrics.updateActivePredictions(pollers.size());
            log.debug("Prediction removed from index: {}", jobId);
        }
        return removed;
    }

    /**
     * @return the poller, or null if the job is not active
     */
    public PredictionPoller get(String jobId) {
        return pollers.get(jobId);
    }

    public boolean contains(String jobId) {
        return pollers.containsKey(jobId);
    }

    public int size() {
        return pollers.size();
    }

    /**
     * Snapshot of active job ids (safe to iterate).
     */
    public Set<String> activeJobIds() {
        return Set.copyOf(pollers.keySet());
    }

    public IndexStats getStats() {
        return new IndexStats(pollers.size(), totalRegistered.get(), totalRemoved.get());
    }

    /**
     * Clear the entire index (shutdown and tests).
     */
    public void clear() {
        pollers.clear();
        metrics.updateActivePredictions(0);
        log.info("ActivePredictionIndex cleared");
    }

    /**
     * Index statistics for monitoring.
     */
    public record IndexStats(int active, long totalRegistered, long totalRemoved) {}
}
