package com.taskvault.backend.modules.task.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Completion filter accepted by the task listing.
 */
public enum TaskStatusFilter {
    PENDING(false),
    COMPLETED(true);

    private final boolean completed;

    TaskStatusFilter(boolean completed) {
        this.completed = completed;
    }

    public boolean completed() {
        return completed;
    }

    public static Optional<TaskStatusFilter> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (TaskStatusFilter filter : values()) {
            if (filter.name().equals(normalized)) {
                return Optional.of(filter);
            }
        }
        return Optional.empty();
    }
}
