package com.taskvault.backend.modules.task.presentation.dto;

import java.util.List;

public record TaskListResponse(List<TaskResponse> tasks, long total, PageInfo pageInfo) {

    public record PageInfo(int limit, int offset, boolean hasMore) {
    }
}
