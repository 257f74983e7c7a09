package in.imagen.domain.generation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One external job spawned for an order. Keyed by the provider's job id.
 */
public record Generation(
    String generationId,
    String orderId,
    String model,
    String prompt,
    Map<String, Object> parameters,
    GenerationStatus status,
    String error,                          // null unless FAILED
    Map<String, Object> returnParameters,  // provider metadata, may be null
    Instant createdAt
) {
    public Generation {
        // Values may be null (e.g. "negative_prompt": null)
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public Generation withStatus(GenerationStatus newStatus, String newError) {
        return new Generation(generationId, orderId, model, prompt, parameters,
                              newStatus, newError, returnParameters, createdAt);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
