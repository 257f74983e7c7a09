package in.imagen.application.service;

import in.imagen.application.port.output.ArtifactRepository;
import in.imagen.domain.artifact.Artifact;
import in.imagen.domain.artifact.ArtifactType;
import in.imagen.domain.common.EntityType;
import in.imagen.domain.common.EventType;
import in.imagen.domain.common.LifecycleEvent;
import in.imagen.service.core.EventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for ArtifactService.
 *
 * Tests:
 * - Favorite toggle publishes artifact.updated with the new state
 * - Metadata update publishes artifact.updated
 * - Unknown artifact: empty result, no event
 */
@ExtendWith(MockitoExtension.class)
class ArtifactServiceTest {

    @Mock
    private ArtifactRepository artifactRepository;

    private EventBus eventBus;
    private EventRecorder recorder;
    private ArtifactService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        recorder = new EventRecorder(eventBus, EventType.ARTIFACT_UPDATED);
        service = new ArtifactService(artifactRepository, eventBus);
    }

    private static Artifact artifact(boolean favorite, Map<String, Object> metadata) {
        return new Artifact("art-1", "job-1", "http://x/img.png", ArtifactType.IMAGE,
                            null, null, "png", null, favorite, metadata, Instant.now());
    }

    @Test
    void testMarkFavorite() {
        when(artifactRepository.setFavorite("art-1", true)).thenReturn(Optional.of(artifact(true, Map.of())));

        Optional<Artifact> result = service.markFavorite("art-1", true);

        assertTrue(result.isPresent());
        assertTrue(result.get().favorite());
        List<LifecycleEvent> events = recorder.events();
        assertEquals(1, events.size());
        assertEquals("artifact.updated", events.get(0).kind());
        assertEquals(EntityType.ARTIFACT, events.get(0).entityType());
        assertEquals("art-1", events.get(0).entityId());
        assertTrue(events.get(0).artifacts().get(0).favorite());
    }

    @Test
    void testUpdateMetadata() {
        Map<String, Object> metadata = Map.of("caption", "a cat on a mat");
        when(artifactRepository.updateMetadata("art-1", metadata)).thenReturn(Optional.of(artifact(false, metadata)));

        Optional<Artifact> result = service.updateMetadata("art-1", metadata);

        assertEquals("a cat on a mat", result.orElseThrow().metadata().get("caption"));
        assertEquals(1, recorder.count(EventType.ARTIFACT_UPDATED));
    }

    @Test
    void testUnknownArtifactNoEvent() {
        when(artifactRepository.setFavorite("missing", true)).thenReturn(Optional.empty());
        when(artifactRepository.updateMetadata("missing", Map.of())).thenReturn(Optional.empty());

        assertTrue(service.markFavorite("missing", true).isEmpty());
        assertTrue(service.updateMetadata("missing", Map.of()).isEmpty());
        assertTrue(recorder.events().isEmpty());
    }

    @Test
    void testFindByGenerationDelegates() {
        when(artifactRepository.findByGenerationId("job-1")).thenReturn(List.of(artifact(false, Map.of())));

        assertEquals(1, service.findByGeneration("job-1").size());
        verify(artifactRepository).findByGenerationId("job-1");
    }
}
