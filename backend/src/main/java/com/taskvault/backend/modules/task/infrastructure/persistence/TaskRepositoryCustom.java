package com.taskvault.backend.modules.task.infrastructure.persistence;

public interface TaskRepositoryCustom {

    TaskSearchResult searchTasks(TaskSearchCondition condition);
}
