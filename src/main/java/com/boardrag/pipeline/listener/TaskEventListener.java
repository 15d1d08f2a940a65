package com.boardrag.pipeline.listener;

import com.boardrag.pipeline.task.TaskEnqueuedEvent;
import com.boardrag.pipeline.worker.TaskRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@Slf4j
@RequiredArgsConstructor
public class TaskEventListener {

    private final TaskRunner taskRunner;

    @Async("taskDispatchExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTaskEnqueued(TaskEnqueuedEvent event) {
        log.debug("Task {}: enqueued {}, waking workers", event.taskId(), event.type());
        taskRunner.dispatchAvailable();
    }
}
