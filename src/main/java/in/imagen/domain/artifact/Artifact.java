package in.imagen.domain.artifact;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One concrete output produced by a completed generation.
 * Only {@code favorite} and {@code metadata} change after creation.
 */
public record Artifact(
    String artifactId,
    String generationId,
    String fileReference,   // local path, or the output URL when nothing was stored
    ArtifactType type,
    Integer width,
    Integer height,
    String format,
    Long sizeBytes,
    boolean favorite,
    Map<String, Object> metadata,
    Instant createdAt
) {
    public Artifact {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Artifact withFavorite(boolean newFavorite) {
        return new Artifact(artifactId, generationId, fileReference, type, width, height,
                            format, sizeBytes, newFavorite, metadata, createdAt);
    }

    public Artifact withMetadata(Map<String, Object> newMetadata) {
        return new Artifact(artifactId, generationId, fileReference, type, width, height,
                            format, sizeBytes, favorite, newMetadata, createdAt);
    }
}
