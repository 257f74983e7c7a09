package in.imagen.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Startup configuration validator.
 *
 * Validates configuration before anything is wired.
 * Throws ConfigurationException if configuration is invalid.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @param requireToken false when a custom job provider replaces the Replicate one
     * @throws ConfigurationException on the first invalid value
     */
    public static void validate(LifecycleConfig config, boolean requireToken) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        if (requireToken && !config.hasApiToken()) {
            throw new ConfigurationException("REPLICATE_API_TOKEN",
                "No API token. Set REPLICATE_API_TOKEN or add \"api_key\" to ~/.replicate-desktop/config.json");
        }

        try {
            URI uri = new URI(config.baseUrl());
            String scheme = uri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new ConfigurationException("REPLICATE_BASE_URL", "Not an http(s) URL: " + config.baseUrl());
            }
        } catch (URISyntaxException e) {
            throw new ConfigurationException("REPLICATE_BASE_URL", "Malformed URL: " + config.baseUrl(), e);
        }

        if (config.pollInterval().isNegative() || config.pollInterval().isZero()) {
            throw new ConfigurationException("IMAGEN_POLL_INTERVAL_MS", "Must be positive");
        }
        if (config.maxPollAttempts() < 1) {
            throw new ConfigurationException("IMAGEN_POLL_MAX_ATTEMPTS", "Must be at least 1");
        }
        if (config.pollerThreads() < 1) {
            throw new ConfigurationException("IMAGEN_POLLER_THREADS", "Must be at least 1");
        }
        if (config.artifactDirectory() == null) {
            throw new ConfigurationException("IMAGEN_ARTIFACT_DIR", "Artifact directory is required");
        }

        log.info("✓ {}", config);
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private StartupConfigValidator() {}
}
