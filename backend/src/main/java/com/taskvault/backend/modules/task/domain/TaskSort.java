package com.taskvault.backend.modules.task.domain;

import java.util.Map;
import java.util.Optional;

/**
 * Listing order: a field name, optionally prefixed with {@code -} for descending.
 * Snake-case names ({@code due_date}) are accepted as aliases.
 */
public record TaskSort(Field field, boolean descending) {

    public static final TaskSort DEFAULT = new TaskSort(Field.CREATED_AT, true);

    public enum Field {
        CREATED_AT("createdAt"),
        UPDATED_AT("updatedAt"),
        DUE_DATE("dueDate"),
        PRIORITY("priority"),
        TITLE("title");

        private final String property;

        Field(String property) {
            this.property = property;
        }

        public String property() {
            return property;
        }
    }

    private static final Map<String, Field> NAMES = Map.ofEntries(
            Map.entry("createdAt", Field.CREATED_AT),
            Map.entry("created_at", Field.CREATED_AT),
            Map.entry("updatedAt", Field.UPDATED_AT),
            Map.entry("updated_at", Field.UPDATED_AT),
            Map.entry("dueDate", Field.DUE_DATE),
            Map.entry("due_date", Field.DUE_DATE),
            Map.entry("priority", Field.PRIORITY),
            Map.entry("title", Field.TITLE)
    );

    /**
     * Empty when the expression names an unknown field.
     */
    public static Optional<TaskSort> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.of(DEFAULT);
        }
        String trimmed = expression.trim();
        boolean descending = trimmed.startsWith("-");
        String name = descending ? trimmed.substring(1) : trimmed;
        Field field = NAMES.get(name);
        if (field == null) {
            return Optional.empty();
        }
        return Optional.of(new TaskSort(field, descending));
    }
}
