package com.boardrag.pipeline.worker;

import com.boardrag.pipeline.Fixtures;
import com.boardrag.pipeline.config.TaskProperties;
import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.DocumentFile;
import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.model.TaskStatus;
import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.repository.DocumentFileRepository;
import com.boardrag.pipeline.repository.TaskRepository;
import com.boardrag.pipeline.task.TaskEnqueuedEvent;
import com.boardrag.pipeline.task.TaskPayloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskMaintenanceWorkerTest {

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private TaskRunner taskRunner;

    @Mock
    private DocumentFileRepository fileRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private TaskMaintenanceWorker worker;
    private TaskProperties properties;

    @BeforeEach
    void setUp() {
        properties = Fixtures.fastTaskProperties();
        worker = new TaskMaintenanceWorker(taskRepository, taskRunner, fileRepository, properties, eventPublisher);
    }

    @Test
    @DisplayName("Should do nothing when no task is stuck")
    void shouldDoNothingWhenNothingIsStale() {
        when(taskRepository.requeueStale(properties.staleAfter())).thenReturn(List.of());
        when(taskRepository.failExhaustedStale(properties.staleAfter())).thenReturn(List.of());

        worker.recoverStaleTasks();

        verifyNoInteractions(fileRepository, eventPublisher);
        verify(taskRepository, never()).refreshStarted(anyCollection());
    }

    @Test
    @DisplayName("Should refresh tasks still running here before looking for stale ones")
    void shouldRefreshLocallyRunningTasksFirst() {
        UUID longRunning = UUID.randomUUID();
        when(taskRunner.runningTaskIds()).thenReturn(Set.of(longRunning));
        when(taskRepository.requeueStale(properties.staleAfter())).thenReturn(List.of());
        when(taskRepository.failExhaustedStale(properties.staleAfter())).thenReturn(List.of());

        worker.recoverStaleTasks();

        InOrder inOrder = inOrder(taskRepository);
        inOrder.verify(taskRepository).refreshStarted(Set.of(longRunning));
        inOrder.verify(taskRepository).requeueStale(properties.staleAfter());
        inOrder.verify(taskRepository).failExhaustedStale(properties.staleAfter());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("Should wake the workers for every requeued task")
    void shouldPublishEventForRequeuedTasks() {
        DeferredTask requeued = Fixtures.task(UUID.randomUUID(), TaskType.VECTORIZE_DOCUMENT, TaskStatus.PENDING, Map.of(), 1);
        when(taskRepository.requeueStale(properties.staleAfter())).thenReturn(List.of(requeued.id()));
        when(taskRepository.failExhaustedStale(properties.staleAfter())).thenReturn(List.of());
        when(taskRepository.findById(requeued.id())).thenReturn(Optional.of(requeued));

        worker.recoverStaleTasks();

        verify(eventPublisher).publishEvent(new TaskEnqueuedEvent(requeued.id(), TaskType.VECTORIZE_DOCUMENT));
    }

    @Test
    @DisplayName("Should fail the file of an abandoned upload that ran out of attempts")
    void shouldFailFileOfExhaustedUpload() {
        DocumentFile file = Fixtures.file(UUID.randomUUID(), UUID.randomUUID(), "a.pdf", FileProcessingStatus.PROCESSING);
        DeferredTask exhausted = Fixtures.task(UUID.randomUUID(), TaskType.UPLOAD_FILE, TaskStatus.FAILURE,
            Map.of(TaskPayloads.FILE_ID, file.id().toString()), 3);
        when(taskRepository.requeueStale(properties.staleAfter())).thenReturn(List.of());
        when(taskRepository.failExhaustedStale(properties.staleAfter())).thenReturn(List.of(exhausted.id()));
        when(taskRepository.findById(exhausted.id())).thenReturn(Optional.of(exhausted));
        when(fileRepository.findById(file.id())).thenReturn(Optional.of(file));

        worker.recoverStaleTasks();

        verify(fileRepository).transition(eq(file.id()), eq(FileProcessingStatus.FAILED), any(), anyMap());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("Should leave files alone for exhausted tasks of other types")
    void shouldIgnoreOtherExhaustedTasks() {
        DeferredTask exhausted = Fixtures.task(UUID.randomUUID(), TaskType.DELETE_VECTORS, TaskStatus.FAILURE, Map.of(), 3);
        when(taskRepository.requeueStale(properties.staleAfter())).thenReturn(List.of());
        when(taskRepository.failExhaustedStale(properties.staleAfter())).thenReturn(List.of(exhausted.id()));
        when(taskRepository.findById(exhausted.id())).thenReturn(Optional.of(exhausted));

        worker.recoverStaleTasks();

        verifyNoInteractions(fileRepository);
    }
}
