package com.storeradar.discovery.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@Slf4j
public class ExecutorConfig {

    /**
     * Validation workers. Pool size is fixed at startup; when the queue is full the
     * submitting run thread validates the candidate itself, which slows intake.
     */
    @Bean(name = "validationExecutor")
    public Executor validationExecutor(DiscoveryProperties properties) {
        int workers = properties.getPipeline().getWorkerCount();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(workers * 50);
        executor.setThreadNamePrefix("validate-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Concurrent storefront probes made by a single validation (meta.json, product pages).
     */
    @Bean(name = "probeExecutor")
    public Executor probeExecutor(DiscoveryProperties properties) {
        int workers = properties.getPipeline().getProbeWorkerCount();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers * 2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("probe-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean(name = "notificationExecutor")
    public Executor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("notify-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler((r, e) ->
                log.warn("Notification dropped, queue full: {}", r));
        executor.initialize();
        return executor;
    }

    /**
     * Single thread that runs discovery runs in the background.
     */
    @Bean(name = "runLauncher")
    public Executor runLauncher() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(2);
        executor.setThreadNamePrefix("discovery-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(300);
        executor.setRejectedExecutionHandler((r, e) ->
                log.warn("Run launch rejected: {}", r));
        executor.initialize();
        return executor;
    }
}
