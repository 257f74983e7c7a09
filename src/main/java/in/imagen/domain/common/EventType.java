package in.imagen.domain.common;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lifecycle event kinds.
 * Each kind carries its dotted domain.verb name (e.g. "generation.completed").
 */
public enum EventType {
    // ═══════════════════════════════════════════════════════════════
    // ORDER EVENTS
    // ═══════════════════════════════════════════════════════════════
    ORDER_CREATED("order.created"),
    ORDER_STATUS_CHANGED("order.status_changed"),
    ORDER_FULFILLED("order.fulfilled"),
    ORDER_FAILED("order.failed"),
    ORDER_CANCELED("order.canceled"),

    // ═══════════════════════════════════════════════════════════════
    // GENERATION EVENTS (published by the orchestrator only)
    // ═══════════════════════════════════════════════════════════════
    GENERATION_STARTED("generation.started"),
    GENERATION_PROCESSING("generation.processing"),
    GENERATION_COMPLETED("generation.completed"),
    GENERATION_FAILED("generation.failed"),
    GENERATION_CANCELED("generation.canceled"),

    // ═══════════════════════════════════════════════════════════════
    // ARTIFACT EVENTS
    // ═══════════════════════════════════════════════════════════════
    ARTIFACT_UPDATED("artifact.updated"),

    // ═══════════════════════════════════════════════════════════════
    // PREDICTION EVENTS (raw poller outcomes, consumed by the orchestrator)
    // ═══════════════════════════════════════════════════════════════
    PREDICTION_PROCESSING("prediction.processing"),
    PREDICTION_SUCCEEDED("prediction.succeeded"),
    PREDICTION_FAILED("prediction.failed"),
    PREDICTION_CANCELED("prediction.canceled");

    private static final Map<String, EventType> BY_KIND = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(EventType::kind, Function.identity()));

    private final String kind;

    EventType(String kind) {
        this.kind = kind;
    }

    public String kind() {
        return kind;
    }

    /**
     * Resolve a dotted kind string.
     *
     * @throws IllegalArgumentException if the kind is unknown
     */
    public static EventType fromKind(String kind) {
        EventType type = BY_KIND.get(kind);
        if (type == null) {
            throw new IllegalArgumentException("Unknown event kind: " + kind);
        }
        return type;
    }

    /**
     * Terminal outcome of a single prediction or generation.
     */
    public boolean isTerminalOutcome() {
        return switch (this) {
            case GENERATION_COMPLETED, GENERATION_FAILED, GENERATION_CANCELED,
                 PREDICTION_SUCCEEDED, PREDICTION_FAILED, PREDICTION_CANCELED -> true;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return kind;
    }
}
