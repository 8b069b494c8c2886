package com.example.studio.scope.filter;

import java.util.Set;

/**
 * {@code field IN (values)}.
 */
public record FieldCondition(
        String field,
        Set<String> values
) {
    public FieldCondition {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Condition field is required");
        }
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Condition on " + field + " needs at least one value");
        }
        values = Set.copyOf(values);
    }

    public static FieldCondition eq(String field, String value) {
        return new FieldCondition(field, Set.of(value));
    }

    public boolean matches(Object rowValue) {
        return rowValue != null && values.contains(String.valueOf(rowValue));
    }
}
