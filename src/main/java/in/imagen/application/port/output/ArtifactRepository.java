package in.imagen.application.port.output;

import in.imagen.domain.artifact.Artifact;
import in.imagen.domain.artifact.NewArtifact;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Artifact persistence. Implementations throw {@link PersistenceException} on failure.
 */
public interface ArtifactRepository {
    Artifact createArtifact(NewArtifact artifact);

    Optional<Artifact> findById(String artifactId);

    List<Artifact> findByGenerationId(String generationId);

    Optional<Artifact> setFavorite(String artifactId, boolean favorite);

    Optional<Artifact> updateMetadata(String artifactId, Map<String, Object> metadata);
}
