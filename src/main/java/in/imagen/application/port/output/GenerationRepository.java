package in.imagen.application.port.output;

import in.imagen.domain.generation.Generation;
import in.imagen.domain.generation.GenerationStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generation persistence, keyed by the provider's job id.
 * Implementations throw {@link PersistenceException} on failure.
 */
public interface GenerationRepository {
    Generation createGeneration(String jobId, String orderId, String model, String prompt,
                                Map<String, Object> parameters, GenerationStatus status);

    /**
     * @param error failure text, null for non-failed statuses
     */
    Generation updateGenerationStatus(String jobId, GenerationStatus status, String error);

    Optional<Generation> findById(String jobId);

    List<Generation> findByOrderId(String orderId);
}
