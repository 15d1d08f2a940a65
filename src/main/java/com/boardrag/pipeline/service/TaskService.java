package com.boardrag.pipeline.service;

import java.util.List;
import java.util.UUID;

public interface TaskService {
    TaskView getTask(UUID taskId);
    TaskView revoke(UUID taskId, boolean terminate);
    List<ActiveTaskView> listActive();
}
