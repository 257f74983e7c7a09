package in.imagen.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.imagen.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Runtime configuration.
 *
 * Keys (environment, then system property):
 * - REPLICATE_API_TOKEN          provider token; else "api_key" in ~/.replicate-desktop/config.json
 * - REPLICATE_BASE_URL           default https://api.replicate.com/v1
 * - IMAGEN_POLL_INTERVAL_MS      default 1000
 * - IMAGEN_POLL_MAX_ATTEMPTS     default 60
 * - IMAGEN_POLLER_THREADS        default 4
 * - IMAGEN_ARTIFACT_DIR          default ~/.imagen-desktop/products
 * - IMAGEN_HTTP_TIMEOUT_SECONDS  default 30
 */
public record LifecycleConfig(
    String apiToken,
    String baseUrl,
    Duration pollInterval,
    int maxPollAttempts,
    int pollerThreads,
    Path artifactDirectory,
    Duration httpTimeout
) {
    private static final Logger log = LoggerFactory.getLogger(LifecycleConfig.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_BASE_URL = "https://api.replicate.com/v1";
    public static final long DEFAULT_POLL_INTERVAL_MS = 1000;
    public static final int DEFAULT_MAX_POLL_ATTEMPTS = 60;
    public static final int DEFAULT_POLLER_THREADS = 4;
    public static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 30;

    /**
     * Load from the environment, with the desktop config file as token fallback.
     */
    public static LifecycleConfig fromEnvironment() {
        Path home = Path.of(System.getProperty("user.home"));
        return fromEnvironment(home.resolve(".replicate-desktop").resolve("config.json"),
                               home.resolve(".imagen-desktop").resolve("products"));
    }

    static LifecycleConfig fromEnvironment(Path tokenFile, Path defaultArtifactDir) {
        String token = Env.get("REPLICATE_API_TOKEN", null);
        if (token == null) {
            token = readTokenFile(tokenFile);
        }

        String artifactDir = Env.get("IMAGEN_ARTIFACT_DIR", null);

        return new LifecycleConfig(
            token,
            Env.get("REPLICATE_BASE_URL", DEFAULT_BASE_URL),
            Duration.ofMillis(Env.getLong("IMAGEN_POLL_INTERVAL_MS", DEFAULT_POLL_INTERVAL_MS)),
            Env.getInt("IMAGEN_POLL_MAX_ATTEMPTS", DEFAULT_MAX_POLL_ATTEMPTS),
            Env.getInt("IMAGEN_POLLER_THREADS", DEFAULT_POLLER_THREADS),
            artifactDir != null ? Path.of(artifactDir) : defaultArtifactDir,
            Duration.ofSeconds(Env.getInt("IMAGEN_HTTP_TIMEOUT_SECONDS", DEFAULT_HTTP_TIMEOUT_SECONDS))
        );
    }

    /**
     * @return the "api_key" field, or null if the file is absent or has none
     * @throws ConfigurationException if the file exists but cannot be parsed
     */
    static String readTokenFile(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return null;
        }
        try {
            JsonNode root = MAPPER.readTree(file.toFile());
            String token = root.path("api_key").asText(null);
            if (token != null && !token.isBlank()) {
                log.info("Using API token from {}", file);
                return token;
            }
            return null;
        } catch (IOException e) {
            throw new ConfigurationException("REPLICATE_API_TOKEN", "Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    public boolean hasApiToken() {
        return apiToken != null && !apiToken.isBlank();
    }

    @Override
    public String toString() {
        return "LifecycleConfig[baseUrl=" + baseUrl
            + ", apiToken=" + (hasApiToken() ? "****" : "<none>")
            + ", pollInterval=" + pollInterval.toMillis() + "ms"
            + ", maxPollAttempts=" + maxPollAttempts
            + ", pollerThreads=" + pollerThreads
            + ", artifactDirectory=" + artifactDirectory
            + ", httpTimeout=" + httpTimeout.toSeconds() + "s]";
    }
}
