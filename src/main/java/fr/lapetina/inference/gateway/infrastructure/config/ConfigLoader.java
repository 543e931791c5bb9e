package fr.lapetina.inference.gateway.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads {@link GatewayConfig} from YAML, file system first then classpath.
 *
 * <p>A missing file yields the built-in defaults with a warning. A file that exists but
 * cannot be parsed is a {@link ConfigurationException}.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(GatewayConfig.class, new LoaderOptions()));
    }

    public GatewayConfig load() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        log.warn("Configuration not found, using defaults: {}", configPath);
        return createDefault();
    }

    /**
     * Loads configuration from an input stream.
     */
    public GatewayConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private GatewayConfig parse(InputStream inputStream, String source) {
        try {
            GatewayConfig config = yaml.load(inputStream);
            // An empty document loads as null
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    public static GatewayConfig createDefault() {
        return new GatewayConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
