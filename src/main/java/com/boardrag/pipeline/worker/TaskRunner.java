package com.boardrag.pipeline.worker;

import com.boardrag.pipeline.config.TaskProperties;
import com.boardrag.pipeline.exception.TaskExecutionException;
import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.repository.TaskRepository;
import com.boardrag.pipeline.task.TaskHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.FutureTask;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pulls pending tasks from the queue table and runs them on the worker pool. Claims never exceed
 * the number of free worker threads, so a claimed task is always running.
 */
@Slf4j
@Component
public class TaskRunner {

    private final TaskRepository taskRepository;
    private final ThreadPoolTaskExecutor executor;
    private final TaskProperties properties;
    private final Map<TaskType, TaskHandler> handlers;
    private final Map<UUID, FutureTask<Void>> running = new ConcurrentHashMap<>();
    private final Semaphore slots;
    private final String workerName;

    public TaskRunner(TaskRepository taskRepository,
                      @Qualifier("taskWorkerExecutor") ThreadPoolTaskExecutor executor,
                      TaskProperties properties,
                      List<TaskHandler> handlers) {
        this.taskRepository = taskRepository;
        this.executor = executor;
        this.properties = properties;
        this.handlers = new EnumMap<>(TaskType.class);
        handlers.forEach(handler -> this.handlers.put(handler.type(), handler));
        this.slots = new Semaphore(properties.workerPoolSize());
        this.workerName = ManagementFactory.getRuntimeMXBean().getName();
    }

    @Scheduled(fixedDelayString = "${app.tasks.poll-interval-ms:2000}")
    public void poll() {
        dispatchAvailable();
    }

    /**
     * Claims and starts tasks until the queue is empty or every worker is busy.
     */
    public int dispatchAvailable() {
        int started = 0;
        while (slots.tryAcquire()) {
            Optional<DeferredTask> claimed;
            try {
                claimed = taskRepository.claimNext(workerName);
            } catch (RuntimeException e) {
                slots.release();
                log.error("Failed to claim next task: {}", e.getMessage(), e);
                return started;
            }
            if (claimed.isEmpty()) {
                slots.release();
                return started;
            }
            submit(claimed.get());
            started++;
        }
        return started;
    }

    /**
     * Interrupts a task running in this process. Returns false when it is not running here. The
     * worker slot stays taken until the handler actually returns.
     */
    public boolean cancel(UUID taskId) {
        FutureTask<Void> future = running.get(taskId);
        if (future == null) {
            return false;
        }
        log.info("Task {}: cancelling", taskId);
        return future.cancel(true);
    }

    public boolean isRunning(UUID taskId) {
        return running.containsKey(taskId);
    }

    /**
     * Ids of the tasks whose handler has not yet returned in this process.
     */
    public Set<UUID> runningTaskIds() {
        return Set.copyOf(running.keySet());
    }

    private void submit(DeferredTask task) {
        // whichever side flips this owns the slot: the worker once it starts, done() if it never does
        AtomicBoolean owned = new AtomicBoolean();
        FutureTask<Void> future = new FutureTask<>(() -> {
            if (!owned.compareAndSet(false, true)) {
                return;
            }
            try {
                execute(task);
            } finally {
                releaseSlot(task.id());
            }
        }, null) {
            @Override
            protected void done() {
                if (owned.compareAndSet(false, true)) {
                    releaseSlot(task.id());
                }
            }
        };
        running.put(task.id(), future);
        try {
            executor.execute(future);
        } catch (TaskRejectedException e) {
            log.warn("Task {}: worker pool rejected it, returning to queue", task.id());
            future.cancel(false);
            taskRepository.reschedule(task.id(), "Worker pool saturated", properties.retryBackoff());
        }
    }

    private void releaseSlot(UUID taskId) {
        running.remove(taskId);
        slots.release();
    }

    void execute(DeferredTask task) {
        TaskHandler handler = handlers.get(task.type());
        if (handler == null) {
            log.error("Task {}: no handler for {}", task.id(), task.type());
            taskRepository.markFailed(task.id(), "No handler for task type " + task.type());
            return;
        }

        log.info("Task {}: running {} (attempt {}/{})", task.id(), task.type(), task.attempts(), task.maxAttempts());
        try {
            Map<String, Object> result = handler.handle(task);
            if (!taskRepository.markSucceeded(task.id(), result)) {
                log.warn("Task {}: finished but was revoked meanwhile, result discarded", task.id());
            }
        } catch (TaskExecutionException e) {
            handleFailure(task, e.getMessage(), e.isRetryable(), e);
        } catch (RuntimeException e) {
            handleFailure(task, e.getClass().getSimpleName() + ": " + e.getMessage(), true, e);
        }
    }

    private void handleFailure(DeferredTask task, String error, boolean retryable, Exception cause) {
        if (retryable && task.hasAttemptsLeft()) {
            Duration delay = properties.retryBackoff().multipliedBy(task.attempts());
            log.warn("Task {}: attempt {} failed, retrying in {}: {}", task.id(), task.attempts(), delay, error);
            taskRepository.reschedule(task.id(), error, delay);
            return;
        }
        log.error("Task {}: failed permanently after {} attempt(s): {}", task.id(), task.attempts(), error, cause);
        taskRepository.markFailed(task.id(), error);
    }
}
