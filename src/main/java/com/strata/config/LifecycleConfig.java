package com.strata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.compression.CompressionService;
import com.strata.metrics.LifecycleMetrics;
import com.strata.monitor.AlertRegistry;
import com.strata.monitor.StorageThresholdRepository;
import com.strata.policy.PolicyRepository;
import com.strata.policy.RetentionPolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Wiring for the components that are plain classes (no stereotype) so tests
 * can build them directly.
 */
@Configuration
@EnableConfigurationProperties(LifecycleProperties.class)
public class LifecycleConfig {
    private static final Logger logger = LoggerFactory.getLogger(LifecycleConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PolicyRepository policyRepository(LifecycleProperties properties, ObjectMapper objectMapper) {
        return new PolicyRepository(properties.getDirectories().getConfig(), objectMapper);
    }

    @Bean
    public RetentionPolicyStore retentionPolicyStore(PolicyRepository repository, Clock clock,
                                                     LifecycleProperties properties) {
        return new RetentionPolicyStore(repository, clock, properties.getTransition().getBucket());
    }

    @Bean
    public StorageThresholdRepository storageThresholdRepository(LifecycleProperties properties,
                                                                 ObjectMapper objectMapper) {
        return new StorageThresholdRepository(properties.getDirectories().getConfig(), objectMapper);
    }

    @Bean
    public AlertRegistry alertRegistry(Clock clock, LifecycleMetrics metrics, LifecycleProperties properties) {
        return new AlertRegistry(clock, metrics, properties.getHistoryCapacity());
    }

    /**
     * Runs compression trials in parallel; a full queue falls back to the caller.
     */
    @Bean(name = "compressionExecutor")
    public ThreadPoolTaskExecutor compressionExecutor(LifecycleProperties properties) {
        LifecycleProperties.Compression compression = properties.getCompression();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(compression.getPoolSize());
        executor.setMaxPoolSize(compression.getPoolSize());
        executor.setQueueCapacity(compression.getQueueCapacity());
        executor.setThreadNamePrefix("compression-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        logger.info("Initializing compression executor with {} threads", compression.getPoolSize());
        return executor;
    }

    @Bean
    public CompressionService compressionService(@Qualifier("compressionExecutor") ThreadPoolTaskExecutor executor,
                                                 LifecycleProperties properties, Clock clock,
                                                 LifecycleMetrics metrics) {
        return new CompressionService(executor, properties.getCompression().getDefaultAlgorithm(),
            properties.getHistoryCapacity(), clock, metrics);
    }
}
