package in.imagen.infrastructure.persistence;

import in.imagen.application.port.output.ArtifactRepository;
import in.imagen.domain.artifact.Artifact;
import in.imagen.domain.artifact.NewArtifact;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory artifact store.
 */
public final class InMemoryArtifactRepository implements ArtifactRepository {

    private final Map<String, Artifact> artifacts = new ConcurrentHashMap<>();

    @Override
    public Artifact createArtifact(NewArtifact values) {
        Artifact artifact = new Artifact(
            UUID.randomUUID().toString(),
            values.generationId(),
            values.fileReference(),
            values.type(),
            values.width(),
            values.height(),
            values.format(),
            values.sizeBytes(),
            false,
            values.metadata(),
            Instant.now()
        );
        artifacts.put(artifact.artifactId(), artifact);
        return artifact;
    }

    @Override
    public Optional<Artifact> findById(String artifactId) {
        return Optional.ofNullable(artifacts.get(artifactId));
    }

    @Override
    public List<Artifact> findByGenerationId(String generationId) {
        return artifacts.values().stream()
            .filter(a -> a.generationId().equals(generationId))
            .sorted(Comparator.comparing(Artifact::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<Artifact> setFavorite(String artifactId, boolean favorite) {
        return Optional.ofNullable(artifacts.computeIfPresent(artifactId, (id, a) -> a.withFavorite(favorite)));
    }

    @Override
    public Optional<Artifact> updateMetadata(String artifactId, Map<String, Object> metadata) {
        return Optional.ofNullable(artifacts.computeIfPresent(artifactId, (id, a) -> a.withMetadata(metadata)));
    }

    public int size() {
        return artifacts.size();
    }
}
