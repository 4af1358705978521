package com.taskvault.backend.modules.task.infrastructure.persistence;

import java.util.List;

import com.taskvault.backend.modules.task.domain.Task;

public record TaskSearchResult(List<Task> tasks, long total) {

    public TaskSearchResult {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
