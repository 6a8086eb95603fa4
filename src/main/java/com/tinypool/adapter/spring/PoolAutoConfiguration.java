package com.tinypool.adapter.spring;

import com.tinypool.config.ConfigLoader;
import com.tinypool.config.PoolConfig;
import com.tinypool.core.DefaultTaskPool;
import com.tinypool.core.TaskPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for tiny-pool.
 * The pool bean is closed with the application context.
 */
@Configuration
@ConditionalOnProperty(prefix = "tiny-pool", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PoolProperties.class)
public class PoolAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PoolAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public PoolConfig poolConfig(PoolProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public TaskPool<Object> taskPool(PoolConfig config) {
        log.info("Creating TaskPool: {}", config.name());
        return new DefaultTaskPool<>(config);
    }
}
