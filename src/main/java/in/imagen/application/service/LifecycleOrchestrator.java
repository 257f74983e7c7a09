package in.imagen.application.service;

import in.imagen.application.port.output.ArtifactRepository;
import in.imagen.application.port.output.ArtifactStorageException;
import in.imagen.application.port.output.ArtifactStore;
import in.imagen.application.port.output.ArtifactStore.StoredFile;
import in.imagen.application.port.output.GenerationRepository;
import in.imagen.application.port.output.OrderRepository;
import in.imagen.domain.artifact.Artifact;
import in.imagen.domain.artifact.ArtifactType;
import in.imagen.domain.artifact.NewArtifact;
import in.imagen.domain.common.EventType;
import in.imagen.domain.common.LifecycleEvent;
import in.imagen.domain.generation.Generation;
import in.imagen.domain.generation.GenerationStatus;
import in.imagen.domain.order.Order;
import in.imagen.domain.order.OrderStatus;
import in.imagen.domain.order.SubmissionResult;
import in.imagen.domain.order.SubmissionStep;
import in.imagen.infrastructure.metrics.LifecycleMetrics;
import in.imagen.service.core.EventBus;
import in.imagen.service.core.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lifecycle Orchestrator.
 * Sequences order → generation → artifact creation and aggregates generation
 * outcomes into the order's final status.
 *
 * EVENTS:
 * - consumes prediction.* from pollers (subscribed at construction, removed by shutdown)
 * - publishes order.* and generation.* for consumers
 *
 * AGGREGATION:
 * Once every generation of an order is terminal: any COMPLETED → FULFILLED,
 * otherwise any FAILED → FAILED, otherwise CANCELED. Evaluated under the
 * order's lock once per terminal generation; a terminal order never changes.
 *
 * Handlers run on poller threads. Output retrieval through the ArtifactStore runs
 * on the orchestrator's own retrieval pool so downloads never hold a poller thread;
 * the generation is completed and the order aggregated once retrieval is done.
 */
public final class LifecycleOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(LifecycleOrchestrator.class);
    private static final String CREATED_BY = "lifecycle-orchestrator";

    static final String NOT_CONFIGURED = "Persistence repositories not configured";
    static final int DEFAULT_RETRIEVAL_THREADS = 4;

    private final OrderRepository orderRepository;
    private final GenerationRepository generationRepository;
    private final ArtifactRepository artifactRepository;
    private final ArtifactStore artifactStore;  // null: artifacts reference the raw output
    private final PredictionManager predictionManager;
    private final EventBus eventBus;
    private final OrderCoordinator coordinator;
    private final LifecycleMetrics metrics;
    private final ExecutorService retrievalExecutor;  // null without an artifact store

    // Job ids whose outcome has not been handled yet
    private final Set<String> trackedJobs = ConcurrentHashMap.newKeySet();

    private final EventHandler onProcessing = this::handlePredictionProcessing;
    private final EventHandler onSucceeded = this::handlePredictionSucceeded;
    private final EventHandler onFailed = this::handlePredictionFailed;
    private final EventHandler onCanceled = this::handlePredictionCanceled;

    public LifecycleOrchestrator(
            OrderRepository orderRepository,
            GenerationRepository generationRepository,
            ArtifactRepository artifactRepository,
            PredictionManager predictionManager,
            EventBus eventBus) {
        this(orderRepository, generationRepository, artifactRepository, null,
             predictionManager, eventBus, new OrderCoordinator(), LifecycleMetrics.NOOP);
    }

    public LifecycleOrchestrator(
            OrderRepository orderRepository,
            GenerationRepository generationRepository,
            ArtifactRepository artifactRepository,
            ArtifactStore artifactStore,
            PredictionManager predictionManager,
            EventBus eventBus,
            OrderCoordinator coordinator,
            LifecycleMetrics metrics) {
        this(orderRepository, generationRepository, artifactRepository, artifactStore,
             predictionManager, eventBus, coordinator, metrics, DEFAULT_RETRIEVAL_THREADS);
    }

    public LifecycleOrchestrator(
            OrderRepository orderRepository,
            GenerationRepository generationRepository,
            ArtifactRepository artifactRepository,
            ArtifactStore artifactStore,
            PredictionManager predictionManager,
            EventBus eventBus,
            OrderCoordinator coordinator,
            LifecycleMetrics metrics,
            int retrievalThreads) {
        this.orderRepository = orderRepository;
        this.generationRepository = generationRepository;
        this.artifactRepository = artifactRepository;
        this.artifactStore = artifactStore;
        this.predictionManager = predictionManager;
        this.eventBus = eventBus;
        this.coordinator = coordinator;
        this.metrics = metrics;

        if (artifactStore != null) {
            AtomicInteger threadCount = new AtomicInteger();
            this.retrievalExecutor = Executors.newFixedThreadPool(Math.max(1, retrievalThreads), r -> {
                Thread t = new Thread(r, "artifact-retrieval-" + threadCount.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        } else {
            this.retrievalExecutor = null;
        }

        eventBus.subscribe(EventType.PREDICTION_PROCESSING, onProcessing);
        eventBus.subscribe(EventType.PREDICTION_SUCCEEDED, onSucceeded);
        eventBus.subscribe(EventType.PREDICTION_FAILED, onFailed);
        eventBus.subscribe(EventType.PREDICTION_CANCELED, onCanceled);
    }

    // ═══════════════════════════════════════════════════════════════
    // SUBMISSION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Create an order and its first generation, then start polling the job.
     *
     * On failure after the order was persisted, the order is marked FAILED and
     * any job already created is canceled and dropped.
     *
     * @param parameters Model input, passed to the provider unchanged
     * @param projectId Optional project reference, may be null
     */
    public SubmissionResult createOrder(String model, String prompt, Map<String, Object> parameters, String projectId) {
        if (orderRepository == null || generationRepository == null) {
            log.error("Cannot create order: {}", NOT_CONFIGURED);
            return SubmissionResult.failure(SubmissionStep.CONFIGURATION, NOT_CONFIGURED);
        }

        Map<String, Object> params = parameters != null ? parameters : Map.of();

        Order order;
        try {
            order = orderRepository.createOrder(model, prompt, params, projectId, OrderStatus.PENDING);
        } catch (RuntimeException e) {
            log.error("Failed to persist order for model {}: {}", model, e.getMessage(), e);
            return SubmissionResult.failure(SubmissionStep.PERSIST_ORDER, "Failed to persist order: " + e.getMessage());
        }
        log.info("Order created: orderId={}, model={}", order.orderId(), model);
        publishOrder(EventType.ORDER_CREATED, order, null);

        return submitGeneration(order, params, true);
    }

    /**
     * Start one more generation under an existing, non-terminal order.
     * The order's base parameters are overlaid with {@code parameters}.
     */
    public SubmissionResult addGeneration(String orderId, Map<String, Object> parameters) {
        if (orderRepository == null || generationRepository == null) {
            log.error("Cannot add generation: {}", NOT_CONFIGURED);
            return SubmissionResult.failure(SubmissionStep.CONFIGURATION, NOT_CONFIGURED);
        }

        return coordinator.executeWithResult(orderId, () -> {
            Optional<Order> found;
            try {
                found = orderRepository.findById(orderId);
            } catch (RuntimeException e) {
                log.error("Failed to load order {}: {}", orderId, e.getMessage(), e);
                return SubmissionResult.failure(SubmissionStep.LOAD_ORDER, "Failed to load order: " + e.getMessage());
            }
            if (found.isEmpty()) {
                return SubmissionResult.failure(SubmissionStep.LOAD_ORDER, "Order not found: " + orderId);
            }
            Order order = found.get();
            if (order.status().isTerminal()) {
                return SubmissionResult.failure(order, SubmissionStep.LOAD_ORDER, "Order already " + order.status());
            }

            Map<String, Object> merged = new HashMap<>(order.baseParameters());
            if (parameters != null) {
                merged.putAll(parameters);
            }
            return submitGeneration(order, merged, false);
        });
    }

    private SubmissionResult submitGeneration(Order order, Map<String, Object> params, boolean firstGeneration) {
        String orderId = order.orderId();

        String jobId;
        try {
            jobId = predictionManager.createPrediction(order.model(), params);
        } catch (RuntimeException e) {
            return rollback(order, SubmissionStep.CREATE_JOB,
                            "Failed to create prediction: " + e.getMessage(), null, false, firstGeneration);
        }

        try {
            generationRepository.createGeneration(jobId, orderId, order.model(), order.prompt(),
                                                  params, GenerationStatus.STARTING);
        } catch (RuntimeException e) {
            return rollback(order, SubmissionStep.PERSIST_GENERATION,
                            "Failed to persist generation: " + e.getMessage(), jobId, false, firstGeneration);
        }

        Order current = order;
        if (firstGeneration) {
            try {
                current = orderRepository.updateOrderStatus(orderId, OrderStatus.PROCESSING);
            } catch (RuntimeException e) {
                return rollback(order, SubmissionStep.UPDATE_ORDER_STATUS,
                                "Failed to update order status: " + e.getMessage(), jobId, true, true);
            }
            publishOrder(EventType.ORDER_STATUS_CHANGED, current, null);
        }

        trackedJobs.add(jobId);
        predictionManager.startPolling(jobId);

        log.info("Generation submitted: orderId={}, jobId={}", orderId, jobId);
        return SubmissionResult.success(current, jobId);
    }

    private SubmissionResult rollback(Order order, SubmissionStep step, String error, String jobId,
                                      boolean generationPersisted, boolean failOrder) {
        log.error("Submission for order {} failed at {}: {}", order.orderId(), step, error);

        if (jobId != null) {
            predictionManager.discardPrediction(jobId);
            if (generationPersisted) {
                try {
                    generationRepository.updateGenerationStatus(jobId, GenerationStatus.FAILED, error);
                } catch (RuntimeException e) {
                    log.warn("Could not mark generation {} FAILED during rollback: {}", jobId, e.getMessage());
                }
            }
        }

        Order result = order;
        if (failOrder) {
            result = coordinator.executeWithResult(order.orderId(),
                () -> transitionOrder(order, OrderStatus.FAILED, error));
        }
        return SubmissionResult.failure(result, step, error);
    }

    /**
     * Publish generation.started for a tracked job.
     */
    public void notifyGenerationStarted(String jobId) {
        if (!trackedJobs.contains(jobId)) {
            log.debug("Ignoring started notification for untracked job {}", jobId);
            return;
        }
        try {
            generationRepository.findById(jobId).ifPresentOrElse(
                g -> publishGeneration(EventType.GENERATION_STARTED, g, null, null),
                () -> log.warn("Generation not found for started job {}", jobId));
        } catch (RuntimeException e) {
            log.error("Failed to load generation {}: {}", jobId, e.getMessage(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // CANCELLATION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Cancel a tracked generation. The outcome events flow through the normal handlers.
     */
    public CancelOutcome cancelGeneration(String jobId) {
        if (!trackedJobs.contains(jobId)) {
            log.debug("Cancel ignored for untracked job {}", jobId);
            return CancelOutcome.NOT_ACTIVE;
        }
        log.info("Canceling generation {}", jobId);
        return predictionManager.cancelPrediction(jobId);
    }

    // ═══════════════════════════════════════════════════════════════
    // PREDICTION EVENT HANDLERS
    // ═══════════════════════════════════════════════════════════════

    private void handlePredictionProcessing(LifecycleEvent event) {
        String jobId = event.entityId();
        if (!trackedJobs.contains(jobId)) {
            log.debug("Ignoring {} for untracked job {}", event.type(), jobId);
            return;
        }
        try {
            Optional<Generation> found = generationRepository.findById(jobId);
            if (found.isEmpty()) {
                log.warn("Generation not found for processing job {}", jobId);
                return;
            }
            coordinator.execute(found.get().orderId(), () -> {
                Generation current = generationRepository.findById(jobId).orElse(null);
                if (current == null || current.status() != GenerationStatus.STARTING || !trackedJobs.contains(jobId)) {
                    return;
                }
                Generation updated = generationRepository.updateGenerationStatus(jobId, GenerationStatus.IN_PROGRESS, null);
                publishGeneration(EventType.GENERATION_PROCESSING, updated, null, null);
            });
        } catch (RuntimeException e) {
            log.error("Failed to mark generation {} in progress: {}", jobId, e.getMessage(), e);
        }
    }

    private void handlePredictionSucceeded(LifecycleEvent event) {
        String jobId = event.entityId();
        if (!claim(jobId, event)) {
            return;
        }
        try {
            Optional<Generation> found = generationRepository.findById(jobId);
            if (found.isEmpty()) {
                log.warn("Generation not found for completed job {}", jobId);
                return;
            }
            String orderId = found.get().orderId();
            List<String> outputs = event.outputs();

            if (retrievalExecutor == null || outputs.isEmpty()) {
                completeGeneration(jobId, orderId, outputs);
                return;
            }
            try {
                retrievalExecutor.execute(() -> completeGeneration(jobId, orderId, outputs));
            } catch (RejectedExecutionException e) {
                log.warn("Retrieval pool stopped, dropping completion of {}", jobId);
            }
        } catch (RuntimeException e) {
            log.error("Failed to complete generation {}: {}", jobId, e.getMessage(), e);
        }
    }

    private void completeGeneration(String jobId, String orderId, List<String> outputs) {
        try {
            // Outputs are retrieved outside the order lock
            List<Artifact> artifacts = createArtifacts(jobId, outputs);

            coordinator.execute(orderId, () -> {
                Generation completed = generationRepository.updateGenerationStatus(jobId, GenerationStatus.COMPLETED, null);
                log.info("Generation completed: jobId={}, artifacts={}", jobId, artifacts.size());
                publishGeneration(EventType.GENERATION_COMPLETED, completed, artifacts, null);
                aggregateOrder(orderId, null);
            });
        } catch (RuntimeException e) {
            log.error("Failed to complete generation {}: {}", jobId, e.getMessage(), e);
        }
    }

    private void handlePredictionFailed(LifecycleEvent event) {
        String jobId = event.entityId();
        if (!claim(jobId, event)) {
            return;
        }
        String error = event.error() != null ? event.error() : PredictionPoller.UNKNOWN_ERROR;
        finishGeneration(jobId, GenerationStatus.FAILED, EventType.GENERATION_FAILED, error);
    }

    private void handlePredictionCanceled(LifecycleEvent event) {
        String jobId = event.entityId();
        if (!claim(jobId, event)) {
            return;
        }
        finishGeneration(jobId, GenerationStatus.CANCELLED, EventType.GENERATION_CANCELED, null);
    }

    private void finishGeneration(String jobId, GenerationStatus status, EventType type, String error) {
        try {
            Optional<Generation> found = generationRepository.findById(jobId);
            if (found.isEmpty()) {
                log.warn("Generation not found for {} job {}", status, jobId);
                return;
            }
            String orderId = found.get().orderId();

            coordinator.execute(orderId, () -> {
                Generation updated = generationRepository.updateGenerationStatus(jobId, status, error);
                log.info("Generation {}: jobId={}{}", status, jobId, error != null ? ", error=" + error : "");
                publishGeneration(type, updated, null, error);
                aggregateOrder(orderId, error);
            });
        } catch (RuntimeException e) {
            log.error("Failed to mark generation {} {}: {}", jobId, status, e.getMessage(), e);
        }
    }

    /**
     * Take ownership of a job's terminal outcome. Only the first caller wins.
     */
    private boolean claim(String jobId, LifecycleEvent event) {
        if (trackedJobs.remove(jobId)) {
            return true;
        }
        log.debug("Ignoring {} for untracked job {}", event.type(), jobId);
        return false;
    }

    // ═══════════════════════════════════════════════════════════════
    // ARTIFACTS
    // ═══════════════════════════════════════════════════════════════

    private List<Artifact> createArtifacts(String jobId, List<String> outputs) {
        if (outputs.isEmpty()) {
            return List.of();
        }
        if (artifactRepository == null) {
            log.warn("No artifact repository configured, {} outputs of {} not recorded", outputs.size(), jobId);
            return List.of();
        }

        List<Artifact> created = new ArrayList<>();
        for (int i = 0; i < outputs.size(); i++) {
            String output = outputs.get(i);
            try {
                NewArtifact artifact = describeOutput(jobId, i, output);
                created.add(artifactRepository.createArtifact(artifact));
            } catch (ArtifactStorageException e) {
                log.warn("Skipping output {} of {}: {}", i, jobId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to create artifact for output {} of {}: {}", i, jobId, e.getMessage(), e);
            }
        }
        return created;
    }

    private NewArtifact describeOutput(String jobId, int index, String output) {
        if (artifactStore == null) {
            return NewArtifact.ofReference(jobId, output);
        }
        StoredFile file;
        try {
            file = artifactStore.store(jobId, index, output);
        } catch (RuntimeException e) {
            metrics.recordArtifactStored(false);
            throw e;
        }
        metrics.recordArtifactStored(true);
        return new NewArtifact(jobId, file.path(), ArtifactType.fromReference(file.path()),
                               file.width(), file.height(), file.format(), file.sizeBytes(),
                               Map.of("source_url", output));
    }

    // ═══════════════════════════════════════════════════════════════
    // ORDER AGGREGATION (caller holds the order lock)
    // ═══════════════════════════════════════════════════════════════

    private void aggregateOrder(String orderId, String triggeringError) {
        Optional<Order> found = orderRepository.findById(orderId);
        if (found.isEmpty()) {
            log.warn("Order {} not found during aggregation", orderId);
            return;
        }
        Order order = found.get();
        if (order.status().isTerminal()) {
            log.debug("Order {} already {}, skipping aggregation", orderId, order.status());
            return;
        }

        List<Generation> siblings = generationRepository.findByOrderId(orderId);
        long pending = siblings.stream().filter(g -> !g.isTerminal()).count();
        if (siblings.isEmpty() || pending > 0) {
            log.debug("Order {} waiting on {} of {} generations", orderId, pending, siblings.size());
            return;
        }

        OrderStatus target = resolveTerminalStatus(siblings);
        String error = null;
        if (target == OrderStatus.FAILED) {
            error = triggeringError != null ? triggeringError : firstError(siblings);
        }
        transitionOrder(order, target, error);
    }

    static OrderStatus resolveTerminalStatus(List<Generation> generations) {
        boolean anyCompleted = generations.stream().anyMatch(g -> g.status() == GenerationStatus.COMPLETED);
        if (anyCompleted) {
            return OrderStatus.FULFILLED;
        }
        boolean anyFailed = generations.stream().anyMatch(g -> g.status() == GenerationStatus.FAILED);
        return anyFailed ? OrderStatus.FAILED : OrderStatus.CANCELED;
    }

    private static String firstError(List<Generation> generations) {
        return generations.stream()
            .filter(g -> g.status() == GenerationStatus.FAILED && g.error() != null)
            .map(Generation::error)
            .findFirst()
            .orElse(PredictionPoller.UNKNOWN_ERROR);
    }

    /**
     * Move an order forward and publish the matching event. No-op if the
     * transition would not advance the order.
     */
    private Order transitionOrder(Order order, OrderStatus target, String error) {
        Order current;
        try {
            current = orderRepository.findById(order.orderId()).orElse(order);
            if (!current.status().canTransitionTo(target)) {
                log.debug("Order {} stays {} (requested {})", current.orderId(), current.status(), target);
                return current;
            }
            current = orderRepository.updateOrderStatus(order.orderId(), target);
        } catch (RuntimeException e) {
            log.error("Failed to move order {} to {}: {}", order.orderId(), target, e.getMessage(), e);
            return order;
        }

        log.info("Order {}: {}", target, current.orderId());
        if (target.isTerminal()) {
            metrics.recordOrderOutcome(target);
        }
        publishOrder(eventTypeFor(target), current, error);
        return current;
    }

    private static EventType eventTypeFor(OrderStatus status) {
        return switch (status) {
            case FULFILLED -> EventType.ORDER_FULFILLED;
            case FAILED -> EventType.ORDER_FAILED;
            case CANCELED -> EventType.ORDER_CANCELED;
            default -> EventType.ORDER_STATUS_CHANGED;
        };
    }

    // ═══════════════════════════════════════════════════════════════
    // PUBLISHING
    // ═══════════════════════════════════════════════════════════════

    private void publishOrder(EventType type, Order order, String error) {
        eventBus.publish(LifecycleEvent.order(type, order, error, CREATED_BY));
    }

    private void publishGeneration(EventType type, Generation generation, List<Artifact> artifacts, String error) {
        eventBus.publish(LifecycleEvent.generation(type, generation, artifacts, error, CREATED_BY));
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    public boolean isTracked(String jobId) {
        return trackedJobs.contains(jobId);
    }

    public Set<String> activeJobIds() {
        return Set.copyOf(trackedJobs);
    }

    /**
     * Unsubscribe from the bus, stop all polling and any output retrieval in progress.
     */
    public void shutdown() {
        eventBus.unsubscribe(EventType.PREDICTION_PROCESSING, onProcessing);
        eventBus.unsubscribe(EventType.PREDICTION_SUCCEEDED, onSucceeded);
        eventBus.unsubscribe(EventType.PREDICTION_FAILED, onFailed);
        eventBus.unsubscribe(EventType.PREDICTION_CANCELED, onCanceled);
        predictionManager.shutdown();
        if (retrievalExecutor != null) {
            retrievalExecutor.shutdownNow();
            try {
                if (!retrievalExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Artifact retrieval did not stop within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        int dropped = trackedJobs.size();
        trackedJobs.clear();
        log.info("Lifecycle orchestrator stopped ({} tracked jobs dropped)", dropped);
    }
}
