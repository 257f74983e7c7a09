package in.imagen.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.imagen.application.port.output.JobProviderException;
import in.imagen.application.port.output.JobStatusProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Replicate predictions API client.
 *
 * Endpoints:
 * - GET  /models/{owner}/{name}            → latest_version.id
 * - POST /predictions                      {"version", "input"} → id
 * - GET  /predictions/{id}                 → status, output, error
 * - POST /predictions/{id}/cancel
 *
 * Models are "owner/name" (latest version looked up) or "owner/name:version".
 */
public class ReplicateJobStatusProvider implements JobStatusProvider {
    private static final Logger log = LoggerFactory.getLogger(ReplicateJobStatusProvider.class);

    public static final String DEFAULT_BASE_URL = "https://api.replicate.com/v1";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiToken;
    private final Duration requestTimeout;

    public ReplicateJobStatusProvider(String apiToken) {
        this(DEFAULT_BASE_URL, apiToken, Duration.ofSeconds(30));
    }

    public ReplicateJobStatusProvider(String baseUrl, String apiToken, Duration requestTimeout) {
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalArgumentException("Replicate API token is required");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiToken = apiToken;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Override
    public String createJob(String model, Map<String, Object> params) {
        if (model == null || model.isBlank()) {
            throw new JobProviderException("create", null, "Model identifier is required");
        }
        String version = resolveVersion(model);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("version", version);
        payload.set("input", objectMapper.valueToTree(params != null ? params : Map.of()));

        JsonNode response = send("create", model, "/predictions", "POST", payload);
        String id = response.path("id").asText(null);
        if (id == null || id.isBlank()) {
            throw new JobProviderException("create", model, "No prediction id in response");
        }
        log.info("[REPLICATE] Prediction created: id={}, model={}, version={}", id, model, version);
        return id;
    }

    @Override
    public JobStatus getJob(String jobId) {
        JsonNode response = send("get", jobId, "/predictions/" + encode(jobId), "GET", null);

        String status = response.path("status").asText(null);
        JsonNode outputNode = response.get("output");
        Object output = outputNode == null || outputNode.isNull()
            ? null
            : objectMapper.convertValue(outputNode, Object.class);
        JsonNode errorNode = response.get("error");
        String error = errorNode == null || errorNode.isNull()
            ? null
            : (errorNode.isTextual() ? errorNode.asText() : errorNode.toString());

        log.debug("[REPLICATE] Prediction {} status={}", jobId, status);
        return new JobStatus(jobId, status, output, error);
    }

    @Override
    public void cancelJob(String jobId) {
        send("cancel", jobId, "/predictions/" + encode(jobId) + "/cancel", "POST", null);
        log.info("[REPLICATE] Prediction cancel requested: {}", jobId);
    }

    /**
     * "owner/name:version" → version; "owner/name" → the model's latest version.
     */
    String resolveVersion(String model) {
        int colon = model.indexOf(':');
        if (colon >= 0) {
            String version = model.substring(colon + 1);
            if (version.isBlank()) {
                throw new JobProviderException("create", model, "Empty model version");
            }
            return version;
        }

        JsonNode response = send("create", model, "/models/" + model, "GET", null);
        String version = response.path("latest_version").path("id").asText(null);
        if (version == null || version.isBlank()) {
            throw new JobProviderException("create", model, "Model has no latest version");
        }
        return version;
    }

    private JsonNode send(String operation, String subject, String path, String method, JsonNode body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(requestTimeout)
            .header("Authorization", "Bearer " + apiToken)
            .header("Accept", "application/json");

        try {
            if ("POST".equals(method)) {
                String payload = body != null ? objectMapper.writeValueAsString(body) : "{}";
                builder.header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload));
            } else {
                builder.GET();
            }

            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());

            int statusCode = response.statusCode();
            if (statusCode < 200 || statusCode >= 300) {
                log.error("[REPLICATE] {} {} HTTP {}: {}", method, path, statusCode, response.body());
                throw new JobProviderException(operation, subject, statusCode,
                    "HTTP error " + statusCode + ": " + detail(response.body()), null);
            }

            String responseBody = response.body();
            return responseBody == null || responseBody.isBlank()
                ? objectMapper.createObjectNode()
                : objectMapper.readTree(responseBody);

        } catch (IOException e) {
            throw new JobProviderException(operation, subject, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobProviderException(operation, subject, "Request interrupted", e);
        }
    }

    /**
     * Replicate error bodies carry a "detail" field.
     */
    private String detail(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node.has("detail") ? node.get("detail").asText() : body;
        } catch (IOException e) {
            return body;
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
