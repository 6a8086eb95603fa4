package com.tinypool.adapter.spring;

import com.tinypool.config.ConfigLoader;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for tiny-pool.
 */
@ConfigurationProperties(prefix = "tiny-pool")
public class PoolProperties {

    /**
     * Whether the pool is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the pool configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = ConfigLoader.DEFAULT_PATH;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
