package com.purchasingpower.discovery.configuration;

import com.purchasingpower.discovery.config.DiscoveryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pool used to run discovery strategies and document batches in parallel.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    public static final String DISCOVERY_EXECUTOR = "discoveryExecutor";

    @Bean(name = DISCOVERY_EXECUTOR)
    public Executor discoveryExecutor(DiscoveryProperties properties) {
        DiscoveryProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(settings.getCorePoolSize(), settings.getMaxPoolSize()));
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix(settings.getThreadNamePrefix());

        // Finish in-flight discovery runs on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("✅ Discovery executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                settings.getQueueCapacity());

        return executor;
    }
}
