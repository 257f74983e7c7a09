package in.imagen.bootstrap;

import in.imagen.application.port.output.ArtifactStore;
import in.imagen.application.port.output.JobStatusProvider;
import in.imagen.application.service.ActivePredictionIndex;
import in.imagen.application.service.ArtifactService;
import in.imagen.application.service.LifecycleOrchestrator;
import in.imagen.application.service.OrderCoordinator;
import in.imagen.application.service.PredictionManager;
import in.imagen.config.LifecycleConfig;
import in.imagen.config.StartupConfigValidator;
import in.imagen.infrastructure.metrics.PrometheusLifecycleMetrics;
import in.imagen.infrastructure.metrics.PrometheusMetricsHandler;
import in.imagen.infrastructure.persistence.InMemoryArtifactRepository;
import in.imagen.infrastructure.persistence.InMemoryGenerationRepository;
import in.imagen.infrastructure.persistence.InMemoryOrderRepository;
import in.imagen.infrastructure.provider.ReplicateJobStatusProvider;
import in.imagen.infrastructure.storage.FileSystemArtifactStore;
import in.imagen.service.core.EventBus;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the lifecycle components for a host process.
 *
 * Usage:
 * <pre>
 * try (LifecycleModule module = LifecycleModule.create(LifecycleConfig.fromEnvironment())) {
 *     module.eventBus().subscribe(EventType.ORDER_FULFILLED, e -> ...);
 *     module.orchestrator().createOrder("owner/model", "a cat", Map.of("prompt", "a cat"), null);
 * }
 * </pre>
 */
public final class LifecycleModule implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LifecycleModule.class);

    private final LifecycleConfig config;
    private final PrometheusLifecycleMetrics metrics;
    private final EventBus eventBus;
    private final InMemoryOrderRepository orderRepository;
    private final InMemoryGenerationRepository generationRepository;
    private final InMemoryArtifactRepository artifactRepository;
    private final PredictionManager predictionManager;
    private final LifecycleOrchestrator orchestrator;
    private final ArtifactService artifactService;

    private LifecycleModule(LifecycleConfig config, JobStatusProvider provider,
                            ArtifactStore artifactStore, CollectorRegistry registry) {
        this.config = config;
        this.metrics = new PrometheusLifecycleMetrics(registry);
        this.eventBus = new EventBus(metrics);
        this.orderRepository = new InMemoryOrderRepository();
        this.generationRepository = new InMemoryGenerationRepository();
        this.artifactRepository = new InMemoryArtifactRepository();

        ActivePredictionIndex index = new ActivePredictionIndex(metrics);
        this.predictionManager = new PredictionManager(
            provider, eventBus, index, metrics,
            config.pollInterval(), config.maxPollAttempts(), config.pollerThreads());

        this.orchestrator = new LifecycleOrchestrator(
            orderRepository, generationRepository, artifactRepository, artifactStore,
            predictionManager, eventBus, new OrderCoordinator(), metrics);
        this.artifactService = new ArtifactService(artifactRepository, eventBus);
    }

    /**
     * Replicate provider, file-system artifact store, fresh metrics registry.
     */
    public static LifecycleModule create(LifecycleConfig config) {
        StartupConfigValidator.validate(config, true);
        ReplicateJobStatusProvider provider =
            new ReplicateJobStatusProvider(config.baseUrl(), config.apiToken(), config.httpTimeout());
        FileSystemArtifactStore store = new FileSystemArtifactStore(config.artifactDirectory(), config.httpTimeout());
        LifecycleModule module = new LifecycleModule(config, provider, store, new CollectorRegistry());
        log.info("✓ Lifecycle module started (Replicate at {})", config.baseUrl());
        return module;
    }

    /**
     * Custom provider and store (store may be null: artifacts reference raw outputs).
     */
    public static LifecycleModule create(LifecycleConfig config, JobStatusProvider provider,
                                         ArtifactStore artifactStore, CollectorRegistry registry) {
        StartupConfigValidator.validate(config, false);
        LifecycleModule module = new LifecycleModule(config, provider, artifactStore, registry);
        log.info("✓ Lifecycle module started ({})", provider.getClass().getSimpleName());
        return module;
    }

    public LifecycleConfig config() {
        return config;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public LifecycleOrchestrator orchestrator() {
        return orchestrator;
    }

    public ArtifactService artifactService() {
        return artifactService;
    }

    public InMemoryOrderRepository orderRepository() {
        return orderRepository;
    }

    public InMemoryGenerationRepository generationRepository() {
        return generationRepository;
    }

    public InMemoryArtifactRepository artifactRepository() {
        return artifactRepository;
    }

    public PrometheusLifecycleMetrics metrics() {
        return metrics;
    }

    /**
     * Handler a host can mount on its own Undertow server at /metrics.
     */
    public PrometheusMetricsHandler metricsHandler() {
        return new PrometheusMetricsHandler(metrics.getRegistry());
    }

    @Override
    public void close() {
        orchestrator.shutdown();
        eventBus.clearAll();
        log.info("Lifecycle module stopped");
    }
}
