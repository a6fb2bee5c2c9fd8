package com.al.hl7siu.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pool for batch conversion.
 */
@Configuration
@EnableConfigurationProperties(BatchProperties.class)
@Slf4j
public class PerformanceConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService batchExecutor(BatchProperties batchProperties) {
        int threadPoolSize = batchProperties.resolveThreadPoolSize();
        log.info("Batch executor initialized with {} threads", threadPoolSize);
        return Executors.newFixedThreadPool(threadPoolSize);
    }
}
