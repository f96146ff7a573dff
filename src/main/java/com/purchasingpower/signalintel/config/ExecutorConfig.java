package com.purchasingpower.signalintel.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for the parallel parts of a pipeline run: search sub-queries and
 * per-candidate contact enrichment.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    public static final String INTELLIGENCE_EXECUTOR = "intelligenceExecutor";

    @Bean(name = INTELLIGENCE_EXECUTOR)
    public Executor intelligenceExecutor(ExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCorePoolSize());
        executor.setMaxPoolSize(properties.getMaxPoolSize());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("intel-");

        // Saturation runs the task on the request thread instead of failing the stage
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("✅ Intelligence executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                properties.getQueueCapacity());

        return executor;
    }

    @Data
    @ConfigurationProperties(prefix = "app.executor")
    public static class ExecutorProperties {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int queueCapacity = 200;
    }
}
