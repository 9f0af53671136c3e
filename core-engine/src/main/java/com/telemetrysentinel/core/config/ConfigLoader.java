package com.telemetrysentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.BeanAccess;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a {@link DetectionConfig} from YAML and validates it before handing it
 * out, so a run never starts with a method that has nothing to analyze.
 *
 * <h3>Where the YAML comes from</h3>
 * <p>
 * {@link #load()} prefers the file named by {@value #ENV_CONFIG_PATH} and
 * otherwise reads {@value #DEFAULT_RESOURCE} from the classpath. Callers that
 * already know the location use {@link #fromFile(Path)},
 * {@link #fromClasspath(String)} or, for inline settings,
 * {@link #fromString(String)}.
 * </p>
 *
 * <h3>Format notes</h3>
 * <p>
 * Keys are bound straight onto fields ({@code zScoreThreshold},
 * {@code subjects.counterMetrics}). Repeated keys are rejected by the YAML
 * parser. Nullable decimal options such as {@code absoluteThreshold} need a
 * decimal point ({@code 500.0}, not {@code 500}).
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Names a YAML file that takes precedence over the bundled defaults. */
    public static final String ENV_CONFIG_PATH = "DETECTION_CONFIG_PATH";

    /** Bundled detection settings. */
    public static final String DEFAULT_RESOURCE = "detection.yml";

    private ConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Entry points
    // ---------------------------------------------------------------

    /**
     * Read the detection settings for this process.
     *
     * @return validated configuration
     * @throws IllegalStateException if the settings are invalid
     */
    public static DetectionConfig load() {
        String override = System.getenv(ENV_CONFIG_PATH);
        if (override != null && !override.isBlank()) {
            Path path = Path.of(override.trim());
            if (Files.isRegularFile(path)) {
                return fromFile(path);
            }
            LOG.warn("{} points at '{}', which is not a file; using bundled {}",
                    ENV_CONFIG_PATH, override, DEFAULT_RESOURCE);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @see #fromFile(Path)
     */
    public static DetectionConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        return fromFile(Path.of(path));
    }

    /**
     * @param path YAML file
     * @return validated configuration
     * @throws IllegalArgumentException if there is no such file
     * @throws IllegalStateException    if the file cannot be read or the
     *                                  settings are invalid
     */
    public static DetectionConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Detection config not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read detection config " + path, e);
        }
    }

    /**
     * @param resource resource name relative to the classpath root
     * @return validated configuration
     * @throws IllegalArgumentException if the resource is not on the classpath
     * @throws IllegalStateException    if the settings are invalid
     */
    public static DetectionConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Config resource name must not be null");
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Detection config resource not found on classpath: " + resource);
        }
        try (in) {
            return read(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read detection config classpath:" + resource, e);
        }
    }

    /**
     * Parse settings held in memory, e.g. passed on a command line.
     *
     * @param yaml YAML document
     * @return validated configuration
     * @throws IllegalStateException if the settings are invalid
     */
    public static DetectionConfig fromString(String yaml) {
        Objects.requireNonNull(yaml, "Config text must not be null");
        try (Reader reader = new StringReader(yaml)) {
            return bind(newYaml().load(reader), "inline");
        } catch (IOException e) {
            throw new IllegalStateException("Could not read inline detection config", e);
        }
    }

    // ---------------------------------------------------------------
    // Binding
    // ---------------------------------------------------------------

    private static DetectionConfig read(InputStream in, String origin) {
        return bind(newYaml().load(in), origin);
    }

    private static Yaml newYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectionConfig.class, loaderOptions));
        yaml.setBeanAccess(BeanAccess.FIELD);
        return yaml;
    }

    private static DetectionConfig bind(DetectionConfig parsed, String origin) {
        DetectionConfig config = parsed;
        if (config == null) {
            // a blank document still has to name subjects for the default methods
            LOG.warn("Detection config {} is empty; falling back to default options", origin);
            config = new DetectionConfig();
        }
        try {
            config.validate();
        } catch (IllegalStateException e) {
            throw new IllegalStateException("Rejected detection config " + origin + ": " + e.getMessage(), e);
        }
        LOG.info("Detection config {}: methods={}, {}", origin, config.getOptions().getMethods(),
                config.getSubjects());
        return config;
    }
}
