package com.taskvault.backend.modules.task.domain;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Case-insensitive lookup; empty for anything outside the enum.
     */
    public static Optional<TaskPriority> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (TaskPriority priority : values()) {
            if (priority.name().equals(normalized)) {
                return Optional.of(priority);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static TaskPriority fromJson(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown priority: " + raw));
    }
}
