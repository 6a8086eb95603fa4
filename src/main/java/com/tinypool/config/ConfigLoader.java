package com.tinypool.config;

import com.tinypool.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Loads pool configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_PATH = "classpath:tiny-pool.yaml";

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static PoolConfig load(String path) {
        log.info("Loading pool configuration from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("Configuration path is empty");
        }
        if (path.startsWith("classpath:")) {
            return new ClassPathResource(path.substring("classpath:".length()));
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse configuration from a YAML stream.
     * Keys may sit at the root or under a {@code pool} key.
     */
    @SuppressWarnings("unchecked")
    public static PoolConfig parse(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Configuration is not a YAML mapping", e);
        }
        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        Object section = root.getOrDefault("pool", root);
        if (!(section instanceof Map)) {
            throw new ConfigurationException("'pool' section must be a mapping");
        }
        Map<String, Object> poolMap = (Map<String, Object>) section;

        String name = getString(poolMap, "name", PoolConfig.DEFAULT_NAME);
        int workerCount = getInt(poolMap, "worker-count", 0);
        if (workerCount == 0) {
            // 0 or absent means hardware parallelism
            workerCount = PoolConfig.defaultWorkerCount();
        }
        int maxQueueSize = getInt(poolMap, "max-queue-size", PoolConfig.DEFAULT_MAX_QUEUE_SIZE);
        String threadNamePrefix = getString(poolMap, "thread-name-prefix", name + "-worker-");
        boolean daemonThreads = getBoolean(poolMap, "daemon-threads", true);

        if (workerCount < 0) {
            throw new ConfigurationException("worker-count must not be negative: " + workerCount);
        }
        if (maxQueueSize < 0) {
            throw new ConfigurationException("max-queue-size must not be negative: " + maxQueueSize);
        }

        PoolConfig config = new PoolConfig(name, workerCount, maxQueueSize, threadNamePrefix, daemonThreads);
        log.info("Loaded pool configuration: {} (workers={}, maxQueueSize={}, daemon={})",
                name, workerCount, maxQueueSize, daemonThreads);
        return config;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        try {
            // Rejects fractions and anything outside the int range instead of truncating
            return new BigDecimal(value.toString().trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
