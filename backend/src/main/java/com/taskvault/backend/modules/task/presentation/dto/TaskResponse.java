package com.taskvault.backend.modules.task.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskvault.backend.modules.task.domain.Task;
import com.taskvault.backend.modules.task.domain.TaskPriority;

public record TaskResponse(
        UUID id,
        UUID userId,
        String title,
        String description,
        OffsetDateTime dueDate,
        TaskPriority priority,
        boolean completed,
        boolean overdue,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static TaskResponse from(Task task, OffsetDateTime now) {
        return new TaskResponse(
                task.getId(),
                task.getUserId(),
                task.getTitle(),
                task.getDescription(),
                task.getDueDate(),
                task.getPriority(),
                task.isCompleted(),
                task.isOverdue(now),
                task.getCreatedAt(),
                task.getUpdatedAt()
        );
    }
}
