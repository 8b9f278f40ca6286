package com.questrail.bridge.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Loads and validates {@link BridgeConfig} from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Explicit path (first command-line argument)</li>
 * <li>Environment variable {@value #ENV_CONFIG_PATH}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>After parsing, {@value #ENV_SUPERVISOR_URL} replaces {@code control.url}
 * when set. Every {@code load*} method validates before returning.</p>
 */
public final class BridgeConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(BridgeConfigLoader.class);

    public static final String ENV_CONFIG_PATH = "BRIDGE_CONFIG_PATH";
    public static final String ENV_SUPERVISOR_URL = "SUPERVISOR_URL";
    public static final String DEFAULT_RESOURCE = "bridge.yml";

    private BridgeConfigLoader() {
    }

    /**
     * Load using the resolution order above.
     *
     * @param explicitPath path given on the command line, or {@code null}
     */
    public static BridgeConfig load(String explicitPath) {
        return load(explicitPath, System::getenv);
    }

    static BridgeConfig load(String explicitPath, UnaryOperator<String> env) {
        BridgeConfig config;
        if (explicitPath != null && !explicitPath.isBlank()) {
            LOG.info("Loading bridge configuration from {}", explicitPath);
            config = parse(explicitPath);
        } else {
            String envPath = env.apply(ENV_CONFIG_PATH);
            if (envPath != null && !envPath.isBlank()) {
                LOG.info("Loading bridge configuration from environment path: {}", envPath);
                config = parse(envPath);
            } else {
                LOG.info("Loading bridge configuration from classpath: {}", DEFAULT_RESOURCE);
                config = parseClasspath(DEFAULT_RESOURCE);
            }
        }
        return finish(config, env);
    }

    /**
     * Load from a file system path.
     *
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static BridgeConfig fromFile(String path) {
        return finish(parse(path), System::getenv);
    }

    /**
     * Load from a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static BridgeConfig fromClasspath(String resource) {
        return finish(parseClasspath(resource), System::getenv);
    }

    /** Parses and validates without consulting the environment. */
    public static BridgeConfig fromStream(InputStream is) {
        Objects.requireNonNull(is, "is");
        BridgeConfig config = parseStream(is, "stream");
        config.validate();
        return config;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static BridgeConfig finish(BridgeConfig config, UnaryOperator<String> env) {
        String url = env.apply(ENV_SUPERVISOR_URL);
        if (url != null && !url.isBlank()) {
            LOG.info("Control endpoint overridden by {}: {}", ENV_SUPERVISOR_URL, url);
            config.getControl().setUrl(url.trim());
        }
        config.validate();
        LOG.info("Loaded {} rule(s); control endpoint {}", config.getRules().size(), config.getControl().getUrl());
        return config;
    }

    private static BridgeConfig parse(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseStream(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    private static BridgeConfig parseClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = BridgeConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseStream(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static BridgeConfig parseStream(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(BridgeConfig.class, options));
        BridgeConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Configuration {} is empty; using defaults with no rules", source);
            config = new BridgeConfig();
        } else if (config.getRules().isEmpty()) {
            LOG.warn("No rules defined in {}", source);
        }
        return config;
    }
}
