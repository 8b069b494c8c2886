package com.example.studio.scope.filter;

import com.example.studio.scope.model.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link Scope} into a {@link ScopeFilter} for one resource.
 *
 * <p>Only the scope variant is inspected, never the principal or the reason the
 * scope was chosen. A scope that cannot be expressed with the fields of the
 * query context compiles to {@link ScopeFilter#matchNone()}.
 */
@Slf4j
@Component
public class ScopeFilterCompiler {

    @NonNull
    public ScopeFilter compile(@NonNull Scope scope, @NonNull ScopeQueryContext queryContext) {
        return switch (scope.kind()) {
            case UNRESTRICTED -> ScopeFilter.matchAll();
            case TENANT -> compileTenant(scope, queryContext);
            case SELF -> compileSelf(scope, queryContext);
            case SUBJECT_SET -> compileSubjectSet(scope, queryContext);
            case DENY -> ScopeFilter.matchNone();
        };
    }

    private ScopeFilter compileTenant(Scope scope, ScopeQueryContext queryContext) {
        if (!hasField(queryContext.tenantField())) {
            return unsupported(scope, queryContext);
        }
        return ScopeFilter.anyOf(List.of(FieldCondition.eq(queryContext.tenantField(), scope.tenantId())));
    }

    private ScopeFilter compileSelf(Scope scope, ScopeQueryContext queryContext) {
        List<FieldCondition> conditions = new ArrayList<>(2);
        if (hasField(queryContext.subjectField())) {
            conditions.add(FieldCondition.eq(queryContext.subjectField(), scope.subjectId()));
        }
        if (hasField(queryContext.userField())) {
            conditions.add(FieldCondition.eq(queryContext.userField(), scope.userId()));
        }
        if (conditions.isEmpty()) {
            return unsupported(scope, queryContext);
        }
        return ScopeFilter.anyOf(conditions);
    }

    private ScopeFilter compileSubjectSet(Scope scope, ScopeQueryContext queryContext) {
        if (!hasField(queryContext.subjectField())) {
            return unsupported(scope, queryContext);
        }
        return ScopeFilter.anyOf(List.of(new FieldCondition(queryContext.subjectField(), scope.subjectIds())));
    }

    private ScopeFilter unsupported(Scope scope, ScopeQueryContext queryContext) {
        log.debug("Scope {} has no matching field in {}, compiling to match-none", scope.kind(), queryContext);
        return ScopeFilter.matchNone();
    }

    private static boolean hasField(String field) {
        return field != null && !field.isBlank();
    }
}
