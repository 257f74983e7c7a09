package in.imagen.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.imagen.application.port.output.JobProviderException;
import in.imagen.application.port.output.JobStatusProvider.JobStatus;
import io.undertow.Undertow;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReplicateJobStatusProvider against a local Undertow stand-in for the API.
 *
 * Tests:
 * - Prediction creation with explicit and latest model version
 * - Status parsing: list output, string output, structured error
 * - Cancel endpoint
 * - Non-2xx responses surface the status code and detail
 */
public class ReplicateJobStatusProviderTest {

    private static final int TEST_PORT = 19091;
    private static final String TOKEN = "r8_test_token";

    private record Reply(int status, String body) {}

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, Reply> routes = new ConcurrentHashMap<>();
    private final Map<String, String> requestBodies = new ConcurrentHashMap<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();

    private Undertow server;
    private ReplicateJobStatusProvider provider;

    @BeforeEach
    public void setUp() {
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(new BlockingHandler(exchange -> {
                String route = exchange.getRequestMethod() + " " + exchange.getRequestPath();
                authHeaders.add(exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION));
                requestBodies.put(route, new String(exchange.getInputStream().readAllBytes(), StandardCharsets.UTF_8));

                Reply reply = routes.getOrDefault(route, new Reply(404, "{\"detail\":\"Not found.\"}"));
                exchange.setStatusCode(reply.status());
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                exchange.getResponseSender().send(reply.body());
            }))
            .build();
        server.start();

        provider = new ReplicateJobStatusProvider("http://localhost:" + TEST_PORT + "/", TOKEN, Duration.ofSeconds(5));
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    public void testCreateJobExplicitVersion() throws Exception {
        routes.put("POST /predictions", new Reply(201, "{\"id\":\"abc123\",\"status\":\"starting\"}"));

        String id = provider.createJob("owner/model:v1", Map.of("prompt", "a cat", "num_outputs", 2));

        assertEquals("abc123", id);
        JsonNode sent = mapper.readTree(requestBodies.get("POST /predictions"));
        assertEquals("v1", sent.get("version").asText());
        assertEquals("a cat", sent.path("input").path("prompt").asText());
        assertEquals(2, sent.path("input").path("num_outputs").asInt());
        assertEquals(List.of("Bearer " + TOKEN), authHeaders);
    }

    @Test
    public void testCreateJobLatestVersionLookedUp() throws Exception {
        routes.put("GET /models/owner/model", new Reply(200, "{\"latest_version\":{\"id\":\"v42\"}}"));
        routes.put("POST /predictions", new Reply(201, "{\"id\":\"abc123\"}"));

        provider.createJob("owner/model", Map.of());

        JsonNode sent = mapper.readTree(requestBodies.get("POST /predictions"));
        assertEquals("v42", sent.get("version").asText());
        assertEquals(2, authHeaders.size());
    }

    @Test
    public void testCreateJobUnknownModel() {
        JobProviderException e = assertThrows(JobProviderException.class,
            () -> provider.createJob("owner/missing", Map.of()));

        assertEquals(404, e.getStatusCode());
        assertEquals("create", e.getOperation());
        assertTrue(e.getMessage().contains("Not found."), e.getMessage());
    }

    @Test
    public void testResolveVersionEmptyVersionRejected() {
        assertThrows(JobProviderException.class, () -> provider.resolveVersion("owner/model:"));
        assertTrue(authHeaders.isEmpty(), "No request for an explicit version");
    }

    @Test
    public void testGetJobListOutput() {
        routes.put("GET /predictions/abc123", new Reply(200,
            "{\"id\":\"abc123\",\"status\":\"succeeded\","
                + "\"output\":[\"http://x/1.png\",\"http://x/2.png\"],\"error\":null}"));

        JobStatus status = provider.getJob("abc123");

        assertTrue(status.isSucceeded());
        assertEquals(List.of("http://x/1.png", "http://x/2.png"), status.output());
        assertNull(status.error());
    }

    @Test
    public void testGetJobStringOutputAndError() {
        routes.put("GET /predictions/abc123", new Reply(200,
            "{\"id\":\"abc123\",\"status\":\"processing\",\"output\":\"http://x/partial.png\"}"));
        assertEquals("http://x/partial.png", provider.getJob("abc123").output());
        assertTrue(provider.getJob("abc123").isProcessing());

        routes.put("GET /predictions/abc123", new Reply(200,
            "{\"id\":\"abc123\",\"status\":\"failed\",\"output\":null,\"error\":\"CUDA out of memory\"}"));
        JobStatus failed = provider.getJob("abc123");
        assertTrue(failed.isFailed());
        assertNull(failed.output());
        assertEquals("CUDA out of memory", failed.error());
    }

    @Test
    public void testGetJobStructuredErrorRenderedAsJson() {
        routes.put("GET /predictions/abc123", new Reply(200,
            "{\"id\":\"abc123\",\"status\":\"failed\",\"error\":{\"code\":\"E001\"}}"));

        assertEquals("{\"code\":\"E001\"}", provider.getJob("abc123").error());
    }

    @Test
    public void testCancelJob() {
        routes.put("POST /predictions/abc123/cancel", new Reply(200, "{\"id\":\"abc123\",\"status\":\"canceled\"}"));

        provider.cancelJob("abc123");

        assertTrue(requestBodies.containsKey("POST /predictions/abc123/cancel"));
    }

    @Test
    public void testServerErrorCarriesStatusCode() {
        routes.put("GET /predictions/abc123", new Reply(500, "{\"detail\":\"Internal server error\"}"));

        JobProviderException e = assertThrows(JobProviderException.class, () -> provider.getJob("abc123"));

        assertEquals(500, e.getStatusCode());
        assertEquals("abc123", e.getJobId());
        assertTrue(e.getMessage().contains("HTTP error 500: Internal server error"), e.getMessage());
    }

    @Test
    public void testBlankTokenRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new ReplicateJobStatusProvider("http://localhost:" + TEST_PORT, " ", Duration.ofSeconds(1)));
    }
}
