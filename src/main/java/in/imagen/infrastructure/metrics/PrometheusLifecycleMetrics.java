package in.imagen.infrastructure.metrics;

import in.imagen.domain.common.EventType;
import in.imagen.domain.order.OrderStatus;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of LifecycleMetrics.
 *
 * Key Metrics:
 * - imagen_events_published_total{kind}
 * - imagen_subscriber_failures_total{kind}
 * - imagen_predictions_started_total{model}
 * - imagen_predictions_total{outcome}
 * - imagen_prediction_poll_attempts{outcome}
 * - imagen_prediction_duration_seconds{outcome}
 * - imagen_provider_calls_total{operation, status}
 * - imagen_provider_latency_seconds{operation}
 * - imagen_active_predictions
 * - imagen_orders_total{status}
 * - imagen_artifacts_stored_total{status}
 *
 * Usage:
 * <pre>
 * PrometheusLifecycleMetrics metrics = new PrometheusLifecycleMetrics(new CollectorRegistry());
 * EventBus bus = new EventBus(metrics);
 *
 * // Expose at /metrics
 * Undertow.builder().setHandler(new PrometheusMetricsHandler(metrics.getRegistry()))...
 * </pre>
 */
public class PrometheusLifecycleMetrics implements LifecycleMetrics {

    private final CollectorRegistry registry;

    // Event metrics
    private final Counter eventsPublished;
    private final Counter subscriberFailures;

    // Prediction metrics
    private final Counter predictionsStarted;
    private final Counter predictionOutcomes;
    private final Histogram pollAttempts;
    private final Histogram predictionDuration;
    private final Gauge activePredictions;

    // Provider metrics
    private final Counter providerCalls;
    private final Histogram providerLatency;

    // Order / artifact metrics
    private final Counter orderOutcomes;
    private final Counter artifactsStored;

    public PrometheusLifecycleMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusLifecycleMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.eventsPublished = Counter.build()
            .name("imagen_events_published_total")
            .help("Total number of lifecycle events published")
            .labelNames("kind")
            .register(registry);

        this.subscriberFailures = Counter.build()
            .name("imagen_subscriber_failures_total")
            .help("Total number of subscriber exceptions caught during delivery")
            .labelNames("kind")
            .register(registry);

        this.predictionsStarted = Counter.build()
            .name("imagen_predictions_started_total")
            .help("Total number of prediction jobs created")
            .labelNames("model")
            .register(registry);

        this.predictionOutcomes = Counter.build()
            .name("imagen_predictions_total")
            .help("Total number of predictions by terminal outcome")
            .labelNames("outcome")
            .register(registry);

        this.pollAttempts = Histogram.build()
            .name("imagen_prediction_poll_attempts")
            .help("Non-terminal polling responses before the outcome")
            .labelNames("outcome")
            .buckets(1, 2, 5, 10, 20, 40, 60)
            .register(registry);

        this.predictionDuration = Histogram.build()
            .name("imagen_prediction_duration_seconds")
            .help("Time from polling start to outcome in seconds")
            .labelNames("outcome")
            .buckets(1, 2, 5, 10, 20, 30, 60, 120)
            .register(registry);

        this.activePredictions = Gauge.build()
            .name("imagen_active_predictions")
            .help("Number of predictions currently being polled")
            .register(registry);

        this.providerCalls = Counter.build()
            .name("imagen_provider_calls_total")
            .help("Total number of job provider calls")
            .labelNames("operation", "status")
            .register(registry);

        this.providerLatency = Histogram.build()
            .name("imagen_provider_latency_seconds")
            .help("Job provider call latency in seconds")
            .labelNames("operation")
            .buckets(0.05, 0.1, 0.2, 0.5, 1.0, 2.0, 5.0, 10.0)
            .register(registry);

        this.orderOutcomes = Counter.build()
            .name("imagen_orders_total")
            .help("Total number of orders by terminal status")
            .labelNames("status")
            .register(registry);

        this.artifactsStored = Counter.build()
            .name("imagen_artifacts_stored_total")
            .help("Total number of output retrievals")
            .labelNames("status")
            .register(registry);
    }

    @Override
    public void recordEventPublished(EventType type) {
        eventsPublished.labels(type.kind()).inc();
    }

    @Override
    public void recordSubscriberFailure(EventType type) {
        subscriberFailures.labels(type.kind()).inc();
    }

    @Override
    public void recordPredictionStarted(String model) {
        predictionsStarted.labels(model).inc();
    }

    @Override
    public void recordPredictionOutcome(String outcome, int attempts, Duration duration) {
        predictionOutcomes.labels(outcome).inc();
        pollAttempts.labels(outcome).observe(attempts);
        predictionDuration.labels(outcome).observe(duration.toMillis() / 1000.0);
    }

    @Override
    public void recordProviderCall(String operation, boolean success, Duration latency) {
        providerCalls.labels(operation, success ? "success" : "failure").inc();
        providerLatency.labels(operation).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void updateActivePredictions(int count) {
        activePredictions.set(count);
    }

    @Override
    public void recordOrderOutcome(OrderStatus status) {
        orderOutcomes.labels(status.name()).inc();
    }

    @Override
    public void recordArtifactStored(boolean success) {
        artifactsStored.labels(success ? "success" : "failure").inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
