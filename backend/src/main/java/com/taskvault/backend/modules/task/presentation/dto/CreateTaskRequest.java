package com.taskvault.backend.modules.task.presentation.dto;

import java.time.OffsetDateTime;

import com.taskvault.backend.modules.task.domain.TaskPriority;

public record CreateTaskRequest(
        String title,
        String description,
        OffsetDateTime dueDate,
        TaskPriority priority,
        Boolean completed
) {
}
