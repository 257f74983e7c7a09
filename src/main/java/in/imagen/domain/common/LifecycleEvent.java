package in.imagen.domain.common;

import in.imagen.domain.artifact.Artifact;
import in.imagen.domain.generation.Generation;
import in.imagen.domain.order.Order;

import java.time.Instant;
import java.util.List;

/**
 * Immutable lifecycle event envelope. Dispatched on the bus, never persisted.
 */
public record LifecycleEvent(
    EventType type,

    // Subject
    String entityId,
    EntityType entityType,

    // Payload
    Order order,               // order.* events
    Generation generation,     // generation.* events
    List<Artifact> artifacts,  // generation.completed, artifact.updated
    List<String> outputs,      // prediction.succeeded
    String error,              // *.failed

    // Metadata
    Instant ts,
    String createdBy           // publishing component
) {
    public LifecycleEvent {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    /**
     * Create an order event.
     */
    public static LifecycleEvent order(EventType type, Order order, String error, String createdBy) {
        return new LifecycleEvent(type, order.orderId(), EntityType.ORDER,
                                  order, null, null, null, error, Instant.now(), createdBy);
    }

    /**
     * Create a generation event.
     */
    public static LifecycleEvent generation(EventType type, Generation generation, List<Artifact> artifacts,
                                            String error, String createdBy) {
        return new LifecycleEvent(type, generation.generationId(), EntityType.GENERATION,
                                  null, generation, artifacts, null, error, Instant.now(), createdBy);
    }

    /**
     * Create a raw prediction outcome event.
     */
    public static LifecycleEvent prediction(EventType type, String jobId, List<String> outputs,
                                            String error, String createdBy) {
        return new LifecycleEvent(type, jobId, EntityType.PREDICTION,
                                  null, null, null, outputs, error, Instant.now(), createdBy);
    }

    /**
     * Create an artifact event.
     */
    public static LifecycleEvent artifact(EventType type, Artifact artifact, String createdBy) {
        return new LifecycleEvent(type, artifact.artifactId(), EntityType.ARTIFACT,
                                  null, null, List.of(artifact), null, null, Instant.now(), createdBy);
    }

    public String kind() {
        return type.kind();
    }
}
