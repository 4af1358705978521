package com.taskvault.backend.modules.task.presentation;

import java.util.List;
import java.util.UUID;

import com.taskvault.backend.global.security.AuthenticatedPrincipal;
import com.taskvault.backend.modules.task.application.TaskService;
import com.taskvault.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.taskvault.backend.modules.task.presentation.dto.PatchTaskRequest;
import com.taskvault.backend.modules.task.presentation.dto.TaskListResponse;
import com.taskvault.backend.modules.task.presentation.dto.TaskResponse;
import com.taskvault.backend.modules.task.presentation.dto.TaskStatsResponse;
import com.taskvault.backend.modules.task.presentation.dto.UpdateTaskRequest;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tasks")
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping
    public ResponseEntity<TaskResponse> create(
            @AuthenticationPrincipal AuthenticatedPrincipal principal,
            @RequestBody CreateTaskRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(taskService.create(principal.userId(), request));
    }

    @GetMapping
    public ResponseEntity<TaskListResponse> list(
            @AuthenticationPrincipal AuthenticatedPrincipal principal,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "priority", required = false) String priority,
            @RequestParam(name = "sort", required = false) String sort,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Integer offset
    ) {
        return ResponseEntity.ok(taskService.list(principal.userId(), status, priority, sort, limit, offset));
    }

    @GetMapping("/stats")
    public ResponseEntity<TaskStatsResponse> stats(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        return ResponseEntity.ok(taskService.stats(principal.userId()));
    }

    @GetMapping("/overdue")
    public ResponseEntity<List<TaskResponse>> overdue(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        return ResponseEntity.ok(taskService.overdue(principal.userId()));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> get(
            @AuthenticationPrincipal AuthenticatedPrincipal principal,
            @PathVariable UUID taskId
    ) {
        return ResponseEntity.ok(taskService.get(principal.userId(), taskId));
    }

    @PutMapping("/{taskId}")
    public ResponseEntity<TaskResponse> update(
            @AuthenticationPrincipal AuthenticatedPrincipal principal,
            @PathVariable UUID taskId,
            @RequestBody UpdateTaskRequest request
    ) {
        return ResponseEntity.ok(taskService.update(principal.userId(), taskId, request));
    }

    @PatchMapping("/{taskId}")
    public ResponseEntity<TaskResponse> patch(
            @AuthenticationPrincipal AuthenticatedPrincipal principal,
            @PathVariable UUID taskId,
            @RequestBody PatchTaskRequest request
    ) {
        return ResponseEntity.ok(taskService.patch(principal.userId(), taskId, request));
    }

    @PatchMapping("/{taskId}/complete")
    public ResponseEntity<TaskResponse> complete(
            @AuthenticationPrincipal AuthenticatedPrincipal principal,
            @PathVariable UUID taskId
    ) {
        return ResponseEntity.ok(taskService.complete(principal.userId(), taskId));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> delete(
            @AuthenticationPrincipal AuthenticatedPrincipal principal,
            @PathVariable UUID taskId
    ) {
        taskService.delete(principal.userId(), taskId);
        return ResponseEntity.noContent().build();
    }
}
