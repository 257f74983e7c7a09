package in.imagen.application.service;

import in.imagen.application.port.output.ArtifactRepository;
import in.imagen.domain.artifact.Artifact;
import in.imagen.domain.common.EventType;
import in.imagen.domain.common.LifecycleEvent;
import in.imagen.service.core.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Post-creation artifact updates: favorite flag and metadata.
 * Every successful update publishes artifact.updated.
 */
public final class ArtifactService {
    private static final Logger log = LoggerFactory.getLogger(ArtifactService.class);
    private static final String CREATED_BY = "artifact-service";

    private final ArtifactRepository artifactRepository;
    private final EventBus eventBus;

    public ArtifactService(ArtifactRepository artifactRepository, EventBus eventBus) {
        this.artifactRepository = artifactRepository;
        this.eventBus = eventBus;
    }

    public Optional<Artifact> markFavorite(String artifactId, boolean favorite) {
        Optional<Artifact> updated = artifactRepository.setFavorite(artifactId, favorite);
        updated.ifPresentOrElse(
            a -> {
                log.info("Artifact {} favorite={}", artifactId, favorite);
                eventBus.publish(LifecycleEvent.artifact(EventType.ARTIFACT_UPDATED, a, CREATED_BY));
            },
            () -> log.warn("Artifact not found: {}", artifactId));
        return updated;
    }

    /**
     * Replace the artifact's metadata map.
     */
    public Optional<Artifact> updateMetadata(String artifactId, Map<String, Object> metadata) {
        Optional<Artifact> updated = artifactRepository.updateMetadata(artifactId, metadata);
        updated.ifPresentOrElse(
            a -> {
                log.debug("Artifact {} metadata updated ({} keys)", artifactId, a.metadata().size());
                eventBus.publish(LifecycleEvent.artifact(EventType.ARTIFACT_UPDATED, a, CREATED_BY));
            },
            () -> log.warn("Artifact not found: {}", artifactId));
        return updated;
    }

    public List<Artifact> findByGeneration(String generationId) {
        return artifactRepository.findByGenerationId(generationId);
    }
}
