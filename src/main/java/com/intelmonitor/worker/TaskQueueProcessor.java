package com.intelmonitor.worker;

import com.intelmonitor.config.WorkerConfig;
import com.intelmonitor.domain.enums.TaskType;
import com.intelmonitor.exception.TaskTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Consumer threads that drain the {@link TaskQueue}.
 *
 * <p>For each task: take a rate-limit permit for its type (or park it until one frees up),
 * run its handler on the task executor under the task timeout, then either complete it,
 * schedule a retry with backoff, or dead-letter it once the retry budget is spent.
 */
@Component
public class TaskQueueProcessor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TaskQueueProcessor.class);

    private final TaskQueue taskQueue;
    private final LaneRateLimiter laneRateLimiter;
    private final RetryPolicy retryPolicy;
    private final DeadLetterService deadLetterService;
    private final WorkerConfig workerConfig;
    private final ThreadPoolTaskExecutor taskExecutor;
    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<Thread> consumerThreads = new ArrayList<>();

    public TaskQueueProcessor(
            TaskQueue taskQueue,
            LaneRateLimiter laneRateLimiter,
            RetryPolicy retryPolicy,
            DeadLetterService deadLetterService,
            WorkerConfig workerConfig,
            @Qualifier("taskExecutor") ThreadPoolTaskExecutor taskExecutor,
            List<TaskHandler> taskHandlers) {
        this.taskQueue = taskQueue;
        this.laneRateLimiter = laneRateLimiter;
        this.retryPolicy = retryPolicy;
        this.deadLetterService = deadLetterService;
        this.workerConfig = workerConfig;
        this.taskExecutor = taskExecutor;
        for (TaskHandler handler : taskHandlers) {
            TaskHandler previous = handlers.put(handler.getTaskType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for " + handler.getTaskType());
            }
        }
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            for (int i = 0; i < workerConfig.getWorkerThreads(); i++) {
                Thread thread = new Thread(this::processLoop, "task-consumer-" + i);
                thread.setDaemon(true);
                thread.start();
                consumerThreads.add(thread);
            }
            log.info("TaskQueueProcessor started with {} consumers", consumerThreads.size());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            consumerThreads.forEach(Thread::interrupt);
            consumerThreads.clear();
            log.info("TaskQueueProcessor stopping");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return workerConfig.isEnabled();
    }

    private void processLoop() {
        while (running.get()) {
            try {
                MonitoringTask task = taskQueue.take();
                long wait = laneRateLimiter.tryAcquire(task.getTaskType());
                if (wait > 0) {
                    log.debug("Rate limit reached for {}, parking task {} for {}ms", task.getTaskType(), task.getTaskId(), wait);
                    taskQueue.enqueueDelayed(task, Duration.ofMillis(wait));
                    continue;
                }
                process(task);
            } catch (InterruptedException e) {
                if (!running.get()) {
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("Task consumer interrupted unexpectedly, resuming");
            }
        }
    }

    /**
     * Runs one attempt of a task and routes the outcome. Rate limiting is applied by the
     * consumer loop before this is called.
     */
    public void process(MonitoringTask task) {
        TaskHandler handler = handlers.get(task.getTaskType());
        if (handler == null) {
            log.error("No handler for task type {}, dropping task {}", task.getTaskType(), task.getTaskId());
            taskQueue.release(task);
            task.getCompletion().completeExceptionally(
                    new IllegalStateException("No handler for " + task.getTaskType()));
            return;
        }

        try {
            runWithTimeout(handler, task);
            onSuccess(task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            onFailure(task, e);
        } catch (Exception e) {
            onFailure(task, e);
        }
    }

    private void runWithTimeout(TaskHandler handler, MonitoringTask task) throws Exception {
        long timeoutSeconds = workerConfig.getTaskTimeoutSeconds();
        Future<?> future = taskExecutor.submit(() -> {
            handler.handle(task);
            return null;
        });
        try {
            future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TaskTimeoutException(task.getTaskId(), timeoutSeconds);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    private void onSuccess(MonitoringTask task) {
        String deadLetterId = task.getPayload().get(MonitoringTask.DEAD_LETTER_ID);
        if (deadLetterId != null) {
            deadLetterService.markResolved(Long.valueOf(deadLetterId));
        }
        taskQueue.release(task);
        task.getCompletion().complete(null);
        log.debug("Task {} ({}) completed", task.getTaskId(), task.getTaskType());
    }

    private void onFailure(MonitoringTask task, Exception error) {
        int failedAttempts = task.getAttempt() + 1;
        task.setAttempt(failedAttempts);

        if (retryPolicy.shouldRetry(failedAttempts, error)) {
            Duration delay = retryPolicy.nextDelay(failedAttempts - 1);
            log.warn(
                    "Task {} ({} on {}) failed on attempt {}/{}, retrying in {}s: {}",
                    task.getTaskId(),
                    task.getTaskType(),
                    task.getMonitorId(),
                    failedAttempts,
                    workerConfig.getMaxRetries(),
                    delay.toSeconds(),
                    error.getMessage());
            taskQueue.enqueueDelayed(task, delay);
            return;
        }

        if (retryPolicy.isRetryable(error)) {
            deadLetterService.deadLetter(task, error, workerConfig.getMaxRetries());
        } else {
            log.warn(
                    "Task {} ({} on {}) failed with non-retryable error: {}",
                    task.getTaskId(),
                    task.getTaskType(),
                    task.getMonitorId(),
                    error.getMessage());
        }
        taskQueue.release(task);
        task.getCompletion().completeExceptionally(error);
    }
}
