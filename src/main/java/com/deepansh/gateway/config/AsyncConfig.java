package com.deepansh.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;

/**
 * Thread pools kept apart from the web threads.
 *
 * - gatewayIoExecutor: blocking provider calls, tool dispatches and stream producers.
 *   Tasks wait on other tasks of the same pool, so it hands off directly and grows
 *   on demand instead of queueing.
 * - responseTaskExecutor: background responses; bounded so a burst of async
 *   requests queues instead of spawning threads.
 * - gatewayScheduler: the response sweep.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "gatewayIoExecutor", destroyMethod = "shutdownNow")
    public ExecutorService gatewayIoExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("gateway-io-");
        executor.initialize();
        return executor.getThreadPoolExecutor();
    }

    @Bean(name = "responseTaskExecutor")
    public ThreadPoolTaskExecutor responseTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("response-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "gatewayScheduler")
    public ThreadPoolTaskScheduler gatewayScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("response-sweep-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }
}
