package com.example.studio.scope.model;

import com.example.studio.scope.filter.ScopeQueryContext;
import org.springframework.lang.NonNull;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Resource types whose rows are scoped per principal, with the row fields the
 * scope filter is compiled against. A null field means the resource has no
 * such column.
 */
public enum ScopedResource {
    STUDIOS("studios", new ScopeQueryContext("id", null, null)),
    TEACHERS("teachers", new ScopeQueryContext("studioId", null, null)),
    STUDENTS("students", new ScopeQueryContext("studioId", "id", "userId")),
    LESSONS("lessons", new ScopeQueryContext("studioId", "studentId", "studentUserId")),
    INVOICES("invoices", new ScopeQueryContext("studioId", "studentId", null)),
    PAYMENTS("payments", new ScopeQueryContext("studioId", "studentId", null));

    private final String pathSegment;
    private final ScopeQueryContext queryContext;

    ScopedResource(String pathSegment, ScopeQueryContext queryContext) {
        this.pathSegment = pathSegment;
        this.queryContext = queryContext;
    }

    @NonNull
    public static Optional<ScopedResource> fromPathSegment(String segment) {
        if (segment == null) {
            return Optional.empty();
        }
        String normalized = segment.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(resource -> resource.pathSegment.equals(normalized))
                .findFirst();
    }

    public ScopeQueryContext queryContext() {
        return queryContext;
    }
}
