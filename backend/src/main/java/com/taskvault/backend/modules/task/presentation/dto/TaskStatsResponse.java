package com.taskvault.backend.modules.task.presentation.dto;

public record TaskStatsResponse(long total, long completed, long pending, long overdue) {
}
