package com.example.studio.scope.filter;

import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders a {@link ScopeFilter} as Spring Data MongoDB {@link Criteria}.
 */
@Component
public class MongoCriteriaRenderer {

    static final String ID_FIELD = "_id";

    @NonNull
    public Criteria render(@NonNull ScopeFilter filter) {
        return switch (filter.type()) {
            case MATCH_ALL -> new Criteria();
            // $in with an empty list matches no document
            case MATCH_NONE -> Criteria.where(ID_FIELD).in(List.of());
            case ANY_OF -> renderAnyOf(filter.conditions());
        };
    }

    private Criteria renderAnyOf(List<FieldCondition> conditions) {
        if (conditions.size() == 1) {
            return renderCondition(conditions.get(0));
        }
        return new Criteria().orOperator(conditions.stream()
                .map(this::renderCondition)
                .toList());
    }

    private Criteria renderCondition(FieldCondition condition) {
        if (condition.values().size() == 1) {
            return Criteria.where(condition.field()).is(condition.values().iterator().next());
        }
        return Criteria.where(condition.field()).in(condition.values().stream().sorted().toList());
    }
}
