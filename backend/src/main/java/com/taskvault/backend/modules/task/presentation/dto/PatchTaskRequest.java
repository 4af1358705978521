package com.taskvault.backend.modules.task.presentation.dto;

public record PatchTaskRequest(Boolean completed) {
}
