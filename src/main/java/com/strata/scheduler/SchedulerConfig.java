package com.strata.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.config.LifecycleProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;

/**
 * Thread pools and persistent state for the lifecycle scheduler.
 */
@Configuration
public class SchedulerConfig {
    private static final Logger logger = LoggerFactory.getLogger(SchedulerConfig.class);

    /**
     * One thread per periodic job type, so a job waiting on the exclusion lock
     * never delays the dispatch of another.
     */
    @Bean(name = "lifecycleDispatcher")
    public ThreadPoolTaskExecutor lifecycleDispatcher() {
        int periodic = (int) Arrays.stream(JobType.values()).filter(JobType::isPeriodic).count();
        logger.info("Initializing lifecycle dispatcher with {} threads", periodic);
        return createPlatformThreadPool("lifecycle-dispatch-", periodic, periodic);
    }

    @Bean(name = "lifecycleWorkers")
    public ThreadPoolTaskExecutor lifecycleWorkers(LifecycleProperties properties) {
        int size = properties.getScheduler().getWorkerPoolSize();
        logger.info("Initializing lifecycle workers with {} threads", size);
        return createPlatformThreadPool("lifecycle-worker-", size, 100);
    }

    @Bean
    public SchedulerStateRepository schedulerStateRepository(LifecycleProperties properties,
                                                             ObjectMapper objectMapper) {
        return new SchedulerStateRepository(properties.getDirectories().getState(), objectMapper);
    }

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
