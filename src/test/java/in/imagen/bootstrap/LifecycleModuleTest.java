package in.imagen.bootstrap;

import in.imagen.application.port.output.JobStatusProvider;
import in.imagen.application.port.output.JobStatusProvider.JobStatus;
import in.imagen.config.ConfigurationException;
import in.imagen.config.LifecycleConfig;
import in.imagen.domain.common.EventType;
import in.imagen.domain.order.OrderStatus;
import in.imagen.domain.order.SubmissionResult;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for LifecycleModule wiring.
 *
 * Tests:
 * - End-to-end order through a custom provider, metrics recorded
 * - Replicate wiring requires a token
 * - close() stops delivery
 */
@ExtendWith(MockitoExtension.class)
class LifecycleModuleTest {

    @Mock
    private JobStatusProvider provider;

    @TempDir
    Path tempDir;

    private LifecycleConfig config(String token) {
        return new LifecycleConfig(token, LifecycleConfig.DEFAULT_BASE_URL, Duration.ofMillis(5), 100, 2,
                                   tempDir, Duration.ofSeconds(5));
    }

    @Test
    void testOrderFulfilledThroughCustomProvider() throws Exception {
        when(provider.createJob(eq("owner/model"), anyMap())).thenReturn("job-1");
        when(provider.getJob("job-1"))
            .thenReturn(new JobStatus("job-1", "starting", null, null))
            .thenReturn(new JobStatus("job-1", "succeeded", List.of("http://x/img.png"), null));

        CollectorRegistry registry = new CollectorRegistry();
        try (LifecycleModule module = LifecycleModule.create(config(null), provider, null, registry)) {
            CountDownLatch fulfilled = new CountDownLatch(1);
            module.eventBus().subscribe(EventType.ORDER_FULFILLED, e -> fulfilled.countDown());

            SubmissionResult result = module.orchestrator()
                .createOrder("owner/model", "a cat", Map.of("prompt", "a cat"), "proj-1");

            assertTrue(result.succeeded(), result.error());
            assertTrue(fulfilled.await(5, TimeUnit.SECONDS), "Order should be fulfilled");

            String orderId = result.order().orderId();
            assertEquals(OrderStatus.FULFILLED, module.orderRepository().findById(orderId).orElseThrow().status());
            assertEquals(1, module.artifactService().findByGeneration("job-1").size());
            assertEquals(1.0, registry.getSampleValue("imagen_orders_total",
                new String[]{"status"}, new String[]{"FULFILLED"}));
            assertEquals(1.0, registry.getSampleValue("imagen_predictions_total",
                new String[]{"outcome"}, new String[]{"SUCCEEDED"}));
            assertNotNull(module.metricsHandler());
        }
    }

    @Test
    void testReplicateWiringRequiresToken() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> LifecycleModule.create(config(null)));
        assertEquals("REPLICATE_API_TOKEN", e.getKey());
        verifyNoInteractions(provider);
    }

    @Test
    void testReplicateWiringWithToken() {
        try (LifecycleModule module = LifecycleModule.create(config("r8_token"))) {
            assertEquals("r8_token", module.config().apiToken());
            assertTrue(module.orchestrator().activeJobIds().isEmpty());
        }
    }

    @Test
    void testCloseClearsSubscribers() {
        LifecycleModule module = LifecycleModule.create(config(null), provider, null, new CollectorRegistry());
        module.eventBus().subscribe(EventType.ORDER_CREATED, e -> { });

        module.close();

        assertEquals(0, module.eventBus().subscriberCount(EventType.ORDER_CREATED));
        assertEquals(0, module.eventBus().subscriberCount(EventType.PREDICTION_SUCCEEDED));
    }
}
