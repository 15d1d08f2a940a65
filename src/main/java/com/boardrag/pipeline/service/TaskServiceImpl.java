package com.boardrag.pipeline.service;

import com.boardrag.pipeline.exception.TaskNotFoundException;
import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.FileMetadataKeys;
import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.model.TaskStatus;
import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.repository.DocumentFileRepository;
import com.boardrag.pipeline.repository.TaskRepository;
import com.boardrag.pipeline.task.TaskPayloads;
import com.boardrag.pipeline.worker.TaskRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class TaskServiceImpl implements TaskService {

    static final String REVOKED_ERROR = "Upload task revoked";

    private final TaskRepository taskRepository;
    private final DocumentFileRepository fileRepository;
    private final TaskRunner taskRunner;

    @Override
    @Transactional(readOnly = true)
    public TaskView getTask(UUID taskId) {
        return TaskView.of(load(taskId));
    }

    /**
     * Finished tasks are returned unchanged. An upload revoked before it started, or terminated
     * while running, leaves its file {@code FAILED}; a non-terminating revoke lets a running upload
     * finish its current step.
     */
    @Override
    @Transactional
    public TaskView revoke(UUID taskId, boolean terminate) {
        DeferredTask task = load(taskId);
        if (!task.status().isRevocable()) {
            log.debug("Task {}: already {}, revoke ignored", taskId, task.status());
            return TaskView.of(task);
        }

        Optional<DeferredTask> revoked = taskRepository.revoke(taskId);
        if (revoked.isEmpty()) {
            return TaskView.of(load(taskId));
        }

        if (terminate) {
            taskRunner.cancel(taskId);
        }
        if (task.type() == TaskType.UPLOAD_FILE && (task.status() == TaskStatus.PENDING || terminate)) {
            failUploadFile(task);
        }

        log.info("Task {}: revoked (terminate={})", taskId, terminate);
        return TaskView.of(revoked.get());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ActiveTaskView> listActive() {
        return taskRepository.findByStatus(TaskStatus.STARTED).stream()
            .map(ActiveTaskView::of)
            .toList();
    }

    private DeferredTask load(UUID taskId) {
        return taskRepository.findById(taskId)
            .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private void failUploadFile(DeferredTask task) {
        UUID fileId = TaskPayloads.optionalUuid(task.payload(), TaskPayloads.FILE_ID);
        if (fileId == null) {
            return;
        }
        fileRepository.findById(fileId)
            .filter(file -> file.processingStatus() == FileProcessingStatus.PROCESSING)
            .ifPresent(file -> fileRepository.transition(file.id(), FileProcessingStatus.FAILED, REVOKED_ERROR, Map.of(
                FileMetadataKeys.UPLOAD_ERROR, REVOKED_ERROR,
                FileMetadataKeys.ERROR_TIME, Instant.now().toString()
            )));
    }
}
