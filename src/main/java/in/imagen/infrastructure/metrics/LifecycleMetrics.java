package in.imagen.infrastructure.metrics;

import in.imagen.domain.common.EventType;
import in.imagen.domain.order.OrderStatus;

import java.time.Duration;

/**
 * Lifecycle metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Events published and subscriber failures per kind
 * - Prediction outcomes, polling attempts and duration
 * - Provider call success/failure and latency
 * - Order terminal outcomes
 * - Artifact storage results
 */
public interface LifecycleMetrics {

    /**
     * Record an event handed to the bus.
     *
     * @param type Event kind
     */
    void recordEventPublished(EventType type);

    /**
     * Record a subscriber that threw during delivery.
     *
     * @param type Event kind being delivered
     */
    void recordSubscriberFailure(EventType type);

    /**
     * Record a prediction job created at the provider.
     *
     * @param model Model identifier
     */
    void recordPredictionStarted(String model);

    /**
     * Record the terminal outcome of a prediction poller.
     *
     * @param outcome Terminal poller state (SUCCEEDED, FAILED, CANCELED, TIMED_OUT)
     * @param attempts Non-terminal responses observed before the outcome
     * @param duration Time from polling start to outcome
     */
    void recordPredictionOutcome(String outcome, int attempts, Duration duration);

    /**
     * Record a call to the job provider.
     *
     * @param operation create, get or cancel
     * @param success Whether the call succeeded
     * @param latency Call latency
     */
    void recordProviderCall(String operation, boolean success, Duration latency);

    /**
     * Update the number of active predictions.
     */
    void updateActivePredictions(int count);

    /**
     * Record an order reaching a terminal status.
     */
    void recordOrderOutcome(OrderStatus status);

    /**
     * Record an output retrieval attempt.
     */
    void recordArtifactStored(boolean success);

    /**
     * Metrics sink that drops everything.
     */
    LifecycleMetrics NOOP = new LifecycleMetrics() {
        @Override public void recordEventPublished(EventType type) {}
        @Override public void recordSubscriberFailure(EventType type) {}
        @Override public void recordPredictionStarted(String model) {}
        @Override public void recordPredictionOutcome(String outcome, int attempts, Duration duration) {}
        @Override public void recordProviderCall(String operation, boolean success, Duration latency) {}
        @Override public void updateActivePredictions(int count) {}
        @Override public void recordOrderOutcome(OrderStatus status) {}
        @Override public void recordArtifactStored(boolean success) {}
    };
}
