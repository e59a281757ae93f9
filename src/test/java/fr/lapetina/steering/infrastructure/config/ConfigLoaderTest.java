package fr.lapetina.steering.infrastructure.config;

import fr.lapetina.steering.breaker.BreakerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static ByteArrayInputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load the shipped defaults from the classpath")
    void shouldLoadShippedDefaults() {
        SteeringConfig config = new ConfigLoader().load();

        assertThat(config.getCircuitBreaker().toBreakerConfig()).isEqualTo(BreakerConfig.defaults());
        assertThat(config.getLoadBalancer().getAlgorithm()).isEqualTo("round-robin");
        assertThat(config.getMetrics().getPrefix()).isEqualTo("steering");
    }

    @Test
    @DisplayName("should bind every section")
    void shouldBindSections() {
        SteeringConfig config = new ConfigLoader("test-steering.yaml").load();

        SteeringConfig.CircuitBreakerConfig breaker = config.getCircuitBreaker();
        assertThat(breaker.getFailureThreshold()).isEqualTo(3);
        assertThat(breaker.getTimeoutMs()).isEqualTo(1000);
        assertThat(breaker.getFailureStatusCodes()).containsExactly(500, 503);
        assertThat(breaker.toBreakerConfig().getInterval()).isEqualTo(Duration.ZERO);
        assertThat(config.getLoadBalancer().getWeights()).containsEntry("a", 3).containsEntry("b", 1);
        assertThat(config.getMetrics().getPrefix()).isEqualTo("test");
    }

    @Test
    @DisplayName("should fall back to defaults for an empty document and missing keys")
    void shouldApplyDefaults() {
        ConfigLoader loader = new ConfigLoader("unused.yaml");

        SteeringConfig empty = loader.loadFromStream(yaml(""));
        SteeringConfig partial = loader.loadFromStream(yaml("loadBalancer:\n  algorithm: random\n"));

        assertThat(empty.getCircuitBreaker().getFailureThreshold()).isEqualTo(5);
        assertThat(partial.getLoadBalancer().getAlgorithm()).isEqualTo("random");
        assertThat(partial.getLoadBalancer().isHealthCheckEnabled()).isTrue();
        assertThat(partial.getCircuitBreaker().getBulkheadMaxConcurrent()).isZero();
    }

    @Test
    @DisplayName("should reject out-of-range breaker values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new ConfigLoader("invalid-steering.yaml").load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("failureThreshold");
    }

    @Test
    @DisplayName("should reject malformed YAML and unknown keys")
    void shouldRejectMalformedYaml() {
        ConfigLoader loader = new ConfigLoader("unused.yaml");

        assertThatThrownBy(() -> loader.loadFromStream(yaml("circuitBreaker: [unclosed")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class);
        assertThatThrownBy(() -> loader.loadFromStream(yaml("circuitBreaker:\n  bogus: 1\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class);
    }

    @Test
    @DisplayName("should fail when the file exists nowhere")
    void shouldFailWhenMissing() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should reload from disk, notify listeners and keep the old config on failure")
    void shouldReload() throws IOException {
        Path file = tempDir.resolve("steering.yaml");
        Files.writeString(file, "loadBalancer:\n  algorithm: random\n");
        ConfigLoader loader = new ConfigLoader(file.toString());
        List<String> changes = new ArrayList<>();
        loader.addListener((oldConfig, newConfig) ->
                changes.add((oldConfig == null ? "none" : oldConfig.getLoadBalancer().getAlgorithm())
                        + "->" + newConfig.getLoadBalancer().getAlgorithm()));

        SteeringConfig initial = loader.load();
        Files.writeString(file, "loadBalancer:\n  algorithm: source-hash\n");
        SteeringConfig reloaded = loader.reload();
        Files.writeString(file, "circuitBreaker:\n  maxRequests: 0\n");
        SteeringConfig kept = loader.reload();

        assertThat(initial.getLoadBalancer().getAlgorithm()).isEqualTo("random");
        assertThat(reloaded.getLoadBalancer().getAlgorithm()).isEqualTo("source-hash");
        assertThat(kept).isSameAs(reloaded);
        assertThat(loader.getCurrentConfig()).isSameAs(reloaded);
        assertThat(changes).containsExactly("none->random", "random->source-hash");
    }
}
