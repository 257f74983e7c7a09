package in.imagen.domain.artifact;

import java.util.Map;

/**
 * Values for creating an artifact. The repository assigns id and timestamp.
 */
public record NewArtifact(
    String generationId,
    String fileReference,
    ArtifactType type,
    Integer width,
    Integer height,
    String format,
    Long sizeBytes,
    Map<String, Object> metadata
) {
    /**
     * Artifact that only references the raw output, no local file.
     */
    public static NewArtifact ofReference(String generationId, String outputUrl) {
        String ext = ArtifactType.extensionOf(outputUrl);
        return new NewArtifact(generationId, outputUrl, ArtifactType.fromReference(outputUrl),
                               null, null, ext.isEmpty() ? null : ext, null,
                               Map.of("source_url", outputUrl));
    }
}
