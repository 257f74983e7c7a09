package in.imagen.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StartupConfigValidator.
 */
class StartupConfigValidatorTest {

    private static LifecycleConfig config(String token, String baseUrl, Duration interval, int attempts, int threads) {
        return new LifecycleConfig(token, baseUrl, interval, attempts, threads,
                                   Path.of("/tmp/imagen-products"), Duration.ofSeconds(30));
    }

    private static LifecycleConfig valid() {
        return config("r8_token", LifecycleConfig.DEFAULT_BASE_URL, Duration.ofSeconds(1), 60, 4);
    }

    @Test
    void testValidConfigPasses() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(valid(), true));
    }

    @Test
    void testMissingTokenOnlyWhenRequired() {
        LifecycleConfig noToken = config(null, LifecycleConfig.DEFAULT_BASE_URL, Duration.ofSeconds(1), 60, 4);

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> StartupConfigValidator.validate(noToken, true));
        assertEquals("REPLICATE_API_TOKEN", e.getKey());
        assertDoesNotThrow(() -> StartupConfigValidator.validate(noToken, false));
    }

    @Test
    void testBadBaseUrlRejected() {
        assertEquals("REPLICATE_BASE_URL", assertThrows(ConfigurationException.class, () ->
            StartupConfigValidator.validate(config("t", "ftp://example.com", Duration.ofSeconds(1), 60, 4), true)).getKey());
        assertEquals("REPLICATE_BASE_URL", assertThrows(ConfigurationException.class, () ->
            StartupConfigValidator.validate(config("t", "http://bad host", Duration.ofSeconds(1), 60, 4), true)).getKey());
    }

    @Test
    void testNonPositiveValuesRejected() {
        assertEquals("IMAGEN_POLL_INTERVAL_MS", assertThrows(ConfigurationException.class, () ->
            StartupConfigValidator.validate(config("t", LifecycleConfig.DEFAULT_BASE_URL, Duration.ZERO, 60, 4), true)).getKey());
        assertEquals("IMAGEN_POLL_MAX_ATTEMPTS", assertThrows(ConfigurationException.class, () ->
            StartupConfigValidator.validate(config("t", LifecycleConfig.DEFAULT_BASE_URL, Duration.ofSeconds(1), 0, 4), true)).getKey());
        assertEquals("IMAGEN_POLLER_THREADS", assertThrows(ConfigurationException.class, () ->
            StartupConfigValidator.validate(config("t", LifecycleConfig.DEFAULT_BASE_URL, Duration.ofSeconds(1), 60, 0), true)).getKey());
    }

    @Test
    void testMissingArtifactDirectoryRejected() {
        LifecycleConfig noDir = new LifecycleConfig("t", LifecycleConfig.DEFAULT_BASE_URL, Duration.ofSeconds(1),
                                                    60, 4, null, Duration.ofSeconds(30));

        assertEquals("IMAGEN_ARTIFACT_DIR",
            assertThrows(ConfigurationException.class, () -> StartupConfigValidator.validate(noDir, true)).getKey());
    }
}
