package com.taskvault.backend.modules.task.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.taskvault.backend.modules.task.domain.Task;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID>, TaskRepositoryCustom {

    long countByUserId(UUID userId);

    long countByUserIdAndCompleted(UUID userId, boolean completed);

    @Query("""
            select count(t)
              from Task t
             where t.userId = :userId
               and t.completed = false
               and t.dueDate < :now
            """)
    long countOverdue(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Query("""
            select t
              from Task t
             where t.userId = :userId
               and t.completed = false
               and t.dueDate < :now
             order by t.dueDate asc, t.id
            """)
    List<Task> findOverdue(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);
}
