package fr.lapetina.inference.gateway.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static ByteArrayInputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load the classpath file and keep defaults for unset keys")
    void shouldLoadFromClasspath() {
        GatewayConfig config = new ConfigLoader("test-gateway.yaml").load();

        assertThat(config.getServer().getPort()).isZero();
        assertThat(config.getServer().getHost()).isEqualTo("127.0.0.1");
        assertThat(config.getServer().getBacklog()).isEqualTo(100);
        assertThat(config.getLimits().getMaxBodyBytes()).isEqualTo(65536);
        assertThat(config.getLimits().getMaxDepth()).isEqualTo(10);
        assertThat(config.getAdmission().getMaxConcurrent()).isEqualTo(1);
        assertThat(config.operation("chat").getMaxRequests()).isEqualTo(30);
        assertThat(config.operation("embedding").getRequireApiKey()).isTrue();
        assertThat(config.getBackend().getType()).isEqualTo("none");
        assertThat(config.getMetrics().getPrefix()).isEqualTo("test_gateway");
    }

    @Test
    @DisplayName("should fall back to defaults when the file does not exist")
    void shouldUseDefaultsWhenMissing() {
        GatewayConfig config = new ConfigLoader("does-not-exist.yaml").load();

        assertThat(config.getServer().getPort()).isEqualTo(8080);
        assertThat(config.getRateLimit().getMaxRequests()).isEqualTo(60);
        assertThat(config.getRateLimit().getWindowSeconds()).isEqualTo(60);
        assertThat(config.getAdmission().getMaxConcurrent()).isEqualTo(10);
        assertThat(config.getAdmission().getGpuMemoryThreshold()).isEqualTo(0.9);
        assertThat(config.getOperations()).isEmpty();
    }

    @Test
    @DisplayName("should return defaults for an empty document")
    void shouldHandleEmptyDocument() {
        GatewayConfig config = new ConfigLoader("unused.yaml").loadFromStream(yaml(""));

        assertThat(config.getLimits().getMaxStringLength()).isEqualTo(10000);
    }

    @Test
    @DisplayName("should reject a document that does not match the configuration shape")
    void shouldRejectInvalidYaml() {
        ConfigLoader loader = new ConfigLoader("unused.yaml");

        assertThatThrownBy(() -> loader.loadFromStream(yaml("server:\n  port: [not, a, number]\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Invalid configuration");
    }
}
