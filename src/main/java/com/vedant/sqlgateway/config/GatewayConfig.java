package com.vedant.sqlgateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class GatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Pool that runs queries so callers can bound the wait.
     */
    @Bean(name = "queryExecutor", destroyMethod = "shutdownNow")
    public ExecutorService queryExecutor(@Value("${explorer.query.pool-size:8}") int poolSize) {
        return Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("explorer-query-"));
    }

    @Bean(name = "healthCheckExecutor", destroyMethod = "shutdownNow")
    public ExecutorService healthCheckExecutor(@Value("${explorer.query.health-check-pool-size:2}") int poolSize) {
        return Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("explorer-health-"));
    }
}
