package com.seriessentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the service-wide {@link DetectionSettings} defaults from YAML.
 *
 * <p>
 * An operator points {@value #ENV_CONFIG_PATH} at a settings file; without
 * it the bundled {@value #DEFAULT_RESOURCE} is used. Keys are the bean
 * property names of {@link DetectionSettings}; omitted keys keep their
 * built-in defaults and an empty document yields the defaults unchanged.
 * Duplicate keys are refused.
 * </p>
 *
 * <p>
 * The result is always validated, so a contamination or threshold that
 * requests could never use stops the service at start-up.
 * </p>
 *
 * @since 1.0.0
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    /** Environment variable naming a settings file on disk. */
    public static final String ENV_CONFIG_PATH = "DETECTION_CONFIG_PATH";

    /** Bundled defaults on the classpath. */
    public static final String DEFAULT_RESOURCE = "detection.yml";

    private SettingsLoader() {
        // utility class, not instantiable
    }

    /**
     * Settings from the file named by {@value #ENV_CONFIG_PATH}, or the
     * bundled defaults when the variable is unset or names no file.
     *
     * @return validated settings
     * @throws IllegalStateException if the chosen source is unreadable,
     *                               malformed or out of range
     */
    public static DetectionSettings load() {
        String configured = System.getenv(ENV_CONFIG_PATH);
        if (configured == null || configured.isBlank()) {
            return fromClasspath(DEFAULT_RESOURCE);
        }
        if (!Files.isRegularFile(Path.of(configured))) {
            LOG.warn("{} points at '{}', which is not a file; falling back to bundled {}",
                    ENV_CONFIG_PATH, configured, DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        return fromFile(configured);
    }

    /**
     * @param path settings file on disk
     * @return validated settings
     * @throws IllegalArgumentException if no file exists at {@code path}
     * @throws IllegalStateException    if the file is unreadable, malformed
     *                                  or out of range
     */
    public static DetectionSettings fromFile(String path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        Path file = Path.of(path);
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toAbsolutePath().toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Detection settings file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read detection settings from " + path, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return validated settings
     * @throws IllegalArgumentException if the resource is not on the classpath
     * @throws IllegalStateException    if it is malformed or out of range
     */
    public static DetectionSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Settings resource name must not be null");
        InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Detection settings resource not found on classpath: " + resource);
        }
        try (in) {
            return read(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read detection settings from classpath:" + resource, e);
        }
    }

    private static DetectionSettings read(InputStream in, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);

        DetectionSettings settings;
        try {
            settings = new Yaml(new Constructor(DetectionSettings.class, options)).load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed detection settings in " + origin + ": " + e.getMessage(), e);
        }
        if (settings == null) {
            LOG.warn("{} holds no settings; built-in defaults apply", origin);
            settings = new DetectionSettings();
        }

        settings.validate();
        LOG.info("Detection defaults from {}: {}", origin, settings);
        return settings;
    }
}
