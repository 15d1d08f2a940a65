package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.service.TaskService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskService taskService;

    @GetMapping("/{id}")
    public ResponseEntity<TaskStatusResponse> getTask(@PathVariable UUID id) {
        return ResponseEntity.ok(TaskStatusResponse.from(taskService.getTask(id)));
    }

    @PostMapping("/{id}/revoke")
    public ResponseEntity<TaskStatusResponse> revoke(
        @PathVariable UUID id,
        @RequestParam(defaultValue = "false") boolean terminate) {

        return ResponseEntity.ok(TaskStatusResponse.from(taskService.revoke(id, terminate)));
    }

    @GetMapping("/active")
    public ResponseEntity<List<ActiveTaskResponse>> active() {
        return ResponseEntity.ok(taskService.listActive().stream()
            .map(ActiveTaskResponse::from)
            .toList());
    }
}
