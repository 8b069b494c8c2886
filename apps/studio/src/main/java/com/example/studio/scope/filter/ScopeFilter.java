package com.example.studio.scope.filter;

import java.util.List;
import java.util.Map;

/**
 * Storage independent row filter produced from a scope.
 *
 * <p>{@link Type#ANY_OF} admits a row when at least one condition holds.
 * Renderers turn this into a store specific query; {@link #matches(Map)} is
 * the in-memory form.
 */
public record ScopeFilter(
        Type type,
        List<FieldCondition> conditions
) {
    private static final ScopeFilter MATCH_ALL = new ScopeFilter(Type.MATCH_ALL, List.of());
    private static final ScopeFilter MATCH_NONE = new ScopeFilter(Type.MATCH_NONE, List.of());

    public enum Type {
        MATCH_ALL,
        MATCH_NONE,
        ANY_OF
    }

    public ScopeFilter {
        if (type == null) {
            throw new IllegalArgumentException("Filter type is required");
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        if (type == Type.ANY_OF && conditions.isEmpty()) {
            // An empty disjunction would read as "no filter"
            throw new IllegalArgumentException("ANY_OF filter needs at least one condition");
        }
        if (type != Type.ANY_OF && !conditions.isEmpty()) {
            throw new IllegalArgumentException(type + " filter takes no conditions");
        }
    }

    public static ScopeFilter matchAll() {
        return MATCH_ALL;
    }

    public static ScopeFilter matchNone() {
        return MATCH_NONE;
    }

    public static ScopeFilter anyOf(List<FieldCondition> conditions) {
        return new ScopeFilter(Type.ANY_OF, conditions);
    }

    public boolean matchesAll() {
        return type == Type.MATCH_ALL;
    }

    public boolean matchesNone() {
        return type == Type.MATCH_NONE;
    }

    public boolean matches(Map<String, ?> row) {
        return switch (type) {
            case MATCH_ALL -> true;
            case MATCH_NONE -> false;
            case ANY_OF -> row != null && conditions.stream()
                    .anyMatch(condition -> condition.matches(row.get(condition.field())));
        };
    }
}
