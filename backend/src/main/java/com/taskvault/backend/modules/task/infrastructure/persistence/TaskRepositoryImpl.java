package com.taskvault.backend.modules.task.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.taskvault.backend.modules.task.domain.Task;
import com.taskvault.backend.modules.task.domain.TaskSort;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import jakarta.persistence.TypedQuery;

import org.springframework.stereotype.Repository;

@Repository
public class TaskRepositoryImpl implements TaskRepositoryCustom {

    // LOW < MEDIUM < HIGH regardless of the enum's storage text
    private static final String PRIORITY_RANK = "case t.priority"
            + " when com.taskvault.backend.modules.task.domain.TaskPriority.LOW then 0"
            + " when com.taskvault.backend.modules.task.domain.TaskPriority.MEDIUM then 1"
            + " else 2 end";

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public TaskSearchResult searchTasks(TaskSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        whereClauses.add("t.userId = :ownerId");
        params.put("ownerId", condition.ownerId());

        if (condition.completed() != null) {
            whereClauses.add("t.completed = :completed");
            params.put("completed", condition.completed());
        }
        if (condition.priority() != null) {
            whereClauses.add("t.priority = :priority");
            params.put("priority", condition.priority());
        }

        String whereJpql = " where " + String.join(" and ", whereClauses);

        Query countQuery = entityManager.createQuery("select count(t) from Task t" + whereJpql);
        applyParameters(countQuery, params);
        long total = ((Number) countQuery.getSingleResult()).longValue();

        if (total == 0 || condition.offset() >= total) {
            return new TaskSearchResult(List.of(), total);
        }

        TypedQuery<Task> dataQuery = entityManager.createQuery(
                "select t from Task t" + whereJpql + orderBy(condition.sort()), Task.class);
        applyParameters(dataQuery, params);
        dataQuery.setFirstResult(condition.offset());
        dataQuery.setMaxResults(condition.limit());
        return new TaskSearchResult(dataQuery.getResultList(), total);
    }

    private static String orderBy(TaskSort sort) {
        String direction = sort.descending() ? " desc" : " asc";
        String expression = sort.field() == TaskSort.Field.PRIORITY
                ? PRIORITY_RANK
                : "t." + sort.field().property();
        String nulls = sort.field() == TaskSort.Field.DUE_DATE ? " nulls last" : "";
        return " order by " + expression + direction + nulls + ", t.id";
    }

    private static void applyParameters(Query query, Map<String, Object> params) {
        params.forEach(query::setParameter);
    }
}
