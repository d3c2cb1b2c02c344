package com.regdoc.acquirer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class AcquirerConfig {

    @Bean(name = "acquisitionExecutor", destroyMethod = "shutdown")
    public ExecutorService acquisitionExecutor(AcquirerProperties properties) {
        // One slot per batch fan-out permit plus room for single-target calls running alongside.
        int size = properties.getBatch().getMaxConcurrencyLimit() + 4;
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "acquisitionTimeoutScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService acquisitionTimeoutScheduler() {
        return Executors.newSingleThreadScheduledExecutor();
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(AcquirerProperties properties) {
        int size = Math.max(4, properties.getBatch().getMaxConcurrencyLimit() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "healthCheckExecutor", destroyMethod = "shutdown")
    public ExecutorService healthCheckExecutor(AcquirerProperties properties) {
        return Executors.newFixedThreadPool(properties.getIdentityPool().getHealthCheckConcurrency());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
