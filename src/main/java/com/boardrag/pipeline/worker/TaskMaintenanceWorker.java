package com.boardrag.pipeline.worker;

import com.boardrag.pipeline.config.TaskProperties;
import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.DocumentFile;
import com.boardrag.pipeline.model.FileMetadataKeys;
import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.repository.DocumentFileRepository;
import com.boardrag.pipeline.repository.TaskRepository;
import com.boardrag.pipeline.task.TaskEnqueuedEvent;
import com.boardrag.pipeline.task.TaskPayloads;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Recovers tasks whose worker died mid-flight. Tasks with attempts left go back to the queue, the
 * rest fail; an upload that can no longer run takes its file row to {@code FAILED} with it. Tasks
 * still running in this process get their start time refreshed first, so a long handler is never
 * mistaken for a dead one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TaskMaintenanceWorker {

    private final TaskRepository taskRepository;
    private final TaskRunner taskRunner;
    private final DocumentFileRepository fileRepository;
    private final TaskProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    @Scheduled(fixedDelayString = "${app.tasks.maintenance-interval-ms:60000}")
    @Transactional
    public void recoverStaleTasks() {
        log.debug("Starting maintenance: checking for stuck tasks...");

        Set<UUID> alive = taskRunner.runningTaskIds();
        if (!alive.isEmpty()) {
            int refreshed = taskRepository.refreshStarted(alive);
            log.debug("Refreshed start time of {} task(s) still running here", refreshed);
        }

        List<UUID> requeued = taskRepository.requeueStale(properties.staleAfter());
        List<UUID> exhausted = taskRepository.failExhaustedStale(properties.staleAfter());

        if (requeued.isEmpty() && exhausted.isEmpty()) {
            return;
        }
        log.info("Maintenance requeued {} stale task(s), failed {} exhausted task(s)", requeued.size(), exhausted.size());

        exhausted.forEach(this::failUploadedFile);
        requeued.forEach(taskId -> taskRepository.findById(taskId)
            .ifPresent(task -> eventPublisher.publishEvent(new TaskEnqueuedEvent(task.id(), task.type()))));
    }

    private void failUploadedFile(UUID taskId) {
        DeferredTask task = taskRepository.findById(taskId).orElse(null);
        if (task == null || task.type() != TaskType.UPLOAD_FILE) {
            return;
        }
        Object fileId = task.payload().get(TaskPayloads.FILE_ID);
        if (fileId == null) {
            return;
        }
        fileRepository.findById(UUID.fromString(fileId.toString()))
            .filter(file -> file.processingStatus() == FileProcessingStatus.PROCESSING)
            .map(DocumentFile::id)
            .ifPresent(id -> {
                fileRepository.transition(id, FileProcessingStatus.FAILED, task.error(), Map.of(
                    FileMetadataKeys.UPLOAD_ERROR, String.valueOf(task.error()),
                    FileMetadataKeys.ERROR_TIME, Instant.now().toString()
                ));
                log.warn("Task {}: upload abandoned, file {} marked FAILED", taskId, id);
            });
    }
}
