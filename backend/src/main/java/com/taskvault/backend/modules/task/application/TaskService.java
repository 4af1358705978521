package com.taskvault.backend.modules.task.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.taskvault.backend.global.error.ProblemException;
import com.taskvault.backend.global.security.OwnershipAuthorization;
import com.taskvault.backend.modules.task.domain.Task;
import com.taskvault.backend.modules.task.domain.TaskPriority;
import com.taskvault.backend.modules.task.domain.TaskSort;
import com.taskvault.backend.modules.task.domain.TaskStatusFilter;
import com.taskvault.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.taskvault.backend.modules.task.infrastructure.persistence.TaskSearchCondition;
import com.taskvault.backend.modules.task.infrastructure.persistence.TaskSearchResult;
import com.taskvault.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.taskvault.backend.modules.task.presentation.dto.PatchTaskRequest;
import com.taskvault.backend.modules.task.presentation.dto.TaskListResponse;
import com.taskvault.backend.modules.task.presentation.dto.TaskResponse;
import com.taskvault.backend.modules.task.presentation.dto.TaskStatsResponse;
import com.taskvault.backend.modules.task.presentation.dto.UpdateTaskRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-user task operations. Every lookup by id goes through {@link #loadOwnedTask}, so a task
 * belonging to someone else behaves exactly like a missing one.
 */
@Service
@Transactional
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    public static final String TASK_NOT_FOUND = "TASK_NOT_FOUND";
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 100;

    private final TaskRepository taskRepository;
    private final Clock clock;

    public TaskService(TaskRepository taskRepository, Clock clock) {
        this.taskRepository = taskRepository;
        this.clock = clock;
    }

    public TaskResponse create(UUID ownerId, CreateTaskRequest request) {
        Task task = new Task();
        task.setUserId(ownerId);
        task.setTitle(requireTitle(request.title()));
        task.setDescription(checkDescription(request.description()));
        task.setDueDate(request.dueDate());
        task.setPriority(request.priority() != null ? request.priority() : TaskPriority.MEDIUM);
        task.setCompleted(Boolean.TRUE.equals(request.completed()));

        Task saved = taskRepository.save(task);
        log.info("User {} created task {}", ownerId, saved.getId());
        return TaskResponse.from(saved, now());
    }

    @Transactional(readOnly = true)
    public TaskResponse get(UUID ownerId, UUID taskId) {
        return TaskResponse.from(loadOwnedTask(ownerId, taskId), now());
    }

    @Transactional(readOnly = true)
    public TaskListResponse list(UUID ownerId, String status, String priority, String sort, Integer limit, Integer offset) {
        Boolean completed = null;
        if (status != null && !status.isBlank()) {
            completed = TaskStatusFilter.parse(status)
                    .map(TaskStatusFilter::completed)
                    .orElseThrow(() -> ProblemException.invalidInput("INVALID_STATUS",
                            "status must be one of pending, completed"));
        }
        TaskPriority priorityFilter = null;
        if (priority != null && !priority.isBlank()) {
            priorityFilter = TaskPriority.parse(priority)
                    .orElseThrow(() -> ProblemException.invalidInput("INVALID_PRIORITY",
                            "priority must be one of low, medium, high"));
        }
        TaskSort taskSort = TaskSort.parse(sort)
                .orElseThrow(() -> ProblemException.invalidInput("INVALID_SORT",
                        "sort must be one of createdAt, updatedAt, dueDate, priority, title with optional '-' prefix"));

        int effectiveLimit = limit == null ? DEFAULT_LIMIT : limit;
        int effectiveOffset = offset == null ? 0 : offset;
        if (effectiveLimit < 1 || effectiveLimit > MAX_LIMIT) {
            throw ProblemException.invalidInput("INVALID_LIMIT", "limit must be between 1 and " + MAX_LIMIT);
        }
        if (effectiveOffset < 0) {
            throw ProblemException.invalidInput("INVALID_OFFSET", "offset must not be negative");
        }

        TaskSearchResult result = taskRepository.searchTasks(new TaskSearchCondition(
                ownerId, completed, priorityFilter, taskSort, effectiveLimit, effectiveOffset));

        OffsetDateTime now = now();
        List<TaskResponse> tasks = result.tasks().stream().map(task -> TaskResponse.from(task, now)).toList();
        boolean hasMore = (long) effectiveOffset + tasks.size() < result.total();
        return new TaskListResponse(tasks, result.total(),
                new TaskListResponse.PageInfo(effectiveLimit, effectiveOffset, hasMore));
    }

    public TaskResponse update(UUID ownerId, UUID taskId, UpdateTaskRequest request) {
        Task task = loadOwnedTask(ownerId, taskId);
        if (request.title() != null) {
            task.setTitle(requireTitle(request.title()));
        }
        if (request.description() != null) {
            task.setDescription(checkDescription(request.description()));
        }
        if (request.dueDate() != null) {
            task.setDueDate(request.dueDate());
        }
        if (request.priority() != null) {
            task.setPriority(request.priority());
        }
        if (request.completed() != null) {
            task.setCompleted(request.completed());
        }
        return TaskResponse.from(taskRepository.saveAndFlush(task), now());
    }

    public TaskResponse patch(UUID ownerId, UUID taskId, PatchTaskRequest request) {
        Task task = loadOwnedTask(ownerId, taskId);
        if (request.completed() != null) {
            task.setCompleted(request.completed());
        }
        return TaskResponse.from(taskRepository.saveAndFlush(task), now());
    }

    public TaskResponse complete(UUID ownerId, UUID taskId) {
        return patch(ownerId, taskId, new PatchTaskRequest(true));
    }

    public void delete(UUID ownerId, UUID taskId) {
        Task task = loadOwnedTask(ownerId, taskId);
        taskRepository.delete(task);
        log.info("User {} deleted task {}", ownerId, taskId);
    }

    @Transactional(readOnly = true)
    public TaskStatsResponse stats(UUID ownerId) {
        long total = taskRepository.countByUserId(ownerId);
        long completed = taskRepository.countByUserIdAndCompleted(ownerId, true);
        long overdue = taskRepository.countOverdue(ownerId, now());
        return new TaskStatsResponse(total, completed, total - completed, overdue);
    }

    @Transactional(readOnly = true)
    public List<TaskResponse> overdue(UUID ownerId) {
        OffsetDateTime now = now();
        return taskRepository.findOverdue(ownerId, now).stream()
                .map(task -> TaskResponse.from(task, now))
                .toList();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private Task loadOwnedTask(UUID ownerId, UUID taskId) {
        Task task = taskRepository.findById(taskId)
                .orElseThrow(() -> ProblemException.notFound(TASK_NOT_FOUND));
        OwnershipAuthorization.requireOwner(ownerId, task.getUserId(), TASK_NOT_FOUND);
        return task;
    }

    private static String requireTitle(String rawTitle) {
        String title = rawTitle == null ? "" : rawTitle.trim();
        if (title.isEmpty()) {
            throw ProblemException.invalidInput("INVALID_TITLE", "title is required");
        }
        if (title.length() > Task.TITLE_MAX_LENGTH) {
            throw ProblemException.invalidInput("INVALID_TITLE",
                    "title must be at most " + Task.TITLE_MAX_LENGTH + " characters");
        }
        return title;
    }

    private static String checkDescription(String description) {
        if (description != null && description.length() > Task.DESCRIPTION_MAX_LENGTH) {
            throw ProblemException.invalidInput("INVALID_DESCRIPTION",
                    "description must be at most " + Task.DESCRIPTION_MAX_LENGTH + " characters");
        }
        return description;
    }
}
