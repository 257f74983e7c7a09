package in.imagen.infrastructure.persistence;

import in.imagen.application.port.output.GenerationRepository;
import in.imagen.application.port.output.PersistenceException;
import in.imagen.domain.generation.Generation;
import in.imagen.domain.generation.GenerationStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory generation store keyed by job id.
 */
public final class InMemoryGenerationRepository implements GenerationRepository {

    private final Map<String, Generation> generations = new ConcurrentHashMap<>();

    @Override
    public Generation createGeneration(String jobId, String orderId, String model, String prompt,
                                       Map<String, Object> parameters, GenerationStatus status) {
        Generation generation = new Generation(jobId, orderId, model, prompt, parameters,
                                               status, null, null, Instant.now());
        if (generations.putIfAbsent(jobId, generation) != null) {
            throw new PersistenceException("generation", jobId, "Generation already exists");
        }
        return generation;
    }

    @Override
    public Generation updateGenerationStatus(String jobId, GenerationStatus status, String error) {
        Generation updated = generations.computeIfPresent(jobId, (id, existing) -> existing.withStatus(status, error));
        if (updated == null) {
            throw new PersistenceException("generation", jobId, "Generation not found");
        }
        return updated;
    }

    @Override
    public Optional<Generation> findById(String jobId) {
        return Optional.ofNullable(generations.get(jobId));
    }

    @Override
    public List<Generation> findByOrderId(String orderId) {
        return generations.values().stream()
            .filter(g -> g.orderId().equals(orderId))
            .sorted(Comparator.comparing(Generation::createdAt))
            .collect(Collectors.toList());
    }
}
