package fr.lapetina.llm.verifier.infrastructure.config;

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
 * Loads and validates the verifier configuration.
 *
 * Looks on the file system first, then on the classpath. Configuration is read once;
 * later changes go through the typed {@code update*} methods of each section.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(VerifierConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The validated configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public VerifierConfig load() {
        return validated(loadFromPath(), configPath.toString());
    }

    /**
     * Loads configuration from an input stream.
     */
    public VerifierConfig loadFromStream(InputStream inputStream) {
        return validated(parse(inputStream, "stream"), "stream");
    }

    private VerifierConfig loadFromPath() {
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

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private VerifierConfig parse(InputStream inputStream, String origin) {
        try {
            VerifierConfig config = yaml.load(inputStream);
            return config != null ? config : new VerifierConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + origin + ": " + e.getMessage(), e);
        }
    }

    private VerifierConfig validated(VerifierConfig config, String origin) {
        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
        log.info("Configuration loaded: providers={}, models={}, cacheEnabled={}, redisEnabled={}",
                config.getProviders().size(), config.getModels().size(),
                config.getCache().isEnabled(), config.getCache().getRedis().isEnabled());
        return config;
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
