package com.taskvault.backend.modules.task.infrastructure.persistence;

import java.util.Objects;
import java.util.UUID;

import com.taskvault.backend.modules.task.domain.TaskPriority;
import com.taskvault.backend.modules.task.domain.TaskSort;

public record TaskSearchCondition(
        UUID ownerId,
        Boolean completed,
        TaskPriority priority,
        TaskSort sort,
        int limit,
        int offset
) {

    public TaskSearchCondition {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        sort = sort == null ? TaskSort.DEFAULT : sort;
    }
}
