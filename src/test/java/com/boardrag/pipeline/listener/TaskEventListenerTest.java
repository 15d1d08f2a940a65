package com.boardrag.pipeline.listener;

import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.task.TaskEnqueuedEvent;
import com.boardrag.pipeline.worker.TaskRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TaskEventListenerTest {

    @Mock
    private TaskRunner taskRunner;

    @InjectMocks
    private TaskEventListener listener;

    @Test
    @DisplayName("Should wake the runner when a task is enqueued")
    void shouldDispatchOnEnqueue() {
        listener.onTaskEnqueued(new TaskEnqueuedEvent(UUID.randomUUID(), TaskType.UPLOAD_FILE));

        verify(taskRunner).dispatchAvailable();
    }
}
