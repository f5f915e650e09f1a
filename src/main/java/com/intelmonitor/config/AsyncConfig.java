package com.intelmonitor.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Two pools: {@code eventExecutor} backs {@code @Async} event listeners, and
 * {@code taskExecutor} runs task handlers for {@link com.intelmonitor.worker.TaskQueueProcessor}
 * so a slow check cycle cannot starve listeners and vice versa.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${intelmonitor.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${intelmonitor.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${intelmonitor.async.queue-capacity:500}")
    private int queueCapacity;

    @Value("${intelmonitor.worker.worker-threads:5}")
    private int workerThreads;

    @Value("${intelmonitor.worker.handler-queue-capacity:100}")
    private int handlerQueueCapacity;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * One thread per queue consumer. A handler that ignores cancellation after a timeout
     * keeps its thread, so the queue absorbs the overlap; past that the consumer runs the
     * handler itself rather than failing the task.
     */
    @Bean("taskExecutor")
    public ThreadPoolTaskExecutor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workerThreads);
        executor.setMaxPoolSize(workerThreads);
        executor.setQueueCapacity(handlerQueueCapacity);
        executor.setThreadNamePrefix("task-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
