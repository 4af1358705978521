package com.taskvault.backend.modules.task.presentation.dto;

import java.time.OffsetDateTime;

import com.taskvault.backend.modules.task.domain.TaskPriority;

/**
 * Fields left {@code null} keep their current value.
 */
public record UpdateTaskRequest(
        String title,
        String description,
        OffsetDateTime dueDate,
        TaskPriority priority,
        Boolean completed
) {
}
