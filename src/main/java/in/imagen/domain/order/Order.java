package in.imagen.domain.order;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * User-initiated generation request.
 */
public record Order(
    String orderId,
    String model,
    String prompt,
    Map<String, Object> baseParameters,  // opaque, passed to the provider as-is
    OrderStatus status,
    String projectId,                    // null when not filed under a project
    Instant createdAt
) {
    public Order {
        // Values may be null (e.g. "negative_prompt": null)
        baseParameters = baseParameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(baseParameters));
    }

    public Order withStatus(OrderStatus newStatus) {
        return new Order(orderId, model, prompt, baseParameters, newStatus, projectId, createdAt);
    }
}
