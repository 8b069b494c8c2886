package com.example.studio.observability.metrics;

import com.example.studio.scope.model.RelationKind;
import com.example.studio.scope.model.Scope;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Counters for scope resolution. Tag values come from closed enums only.
 */
@Component
public class ScopeMetrics {

    public enum LookupOutcome {
        FOUND, NOT_FOUND, ERROR, TIMEOUT
    }

    private final MeterRegistry registry;

    public ScopeMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordResolution(@NonNull Scope.Kind kind) {
        Counter.builder("scope.resolution")
                .tag("kind", kind.name().toLowerCase())
                .description("Scopes resolved, by variant")
                .register(registry)
                .increment();
    }

    public void recordLookup(@NonNull RelationKind relation, @NonNull LookupOutcome outcome) {
        Counter.builder("scope.lookup")
                .tag("relation", relation.name().toLowerCase())
                .tag("outcome", outcome.name().toLowerCase())
                .description("Relation lookups performed during scope resolution")
                .register(registry)
                .increment();
    }

    public void recordRejection(@NonNull String stage) {
        Counter.builder("scope.rejection")
                .tag("stage", stage)
                .description("Requests rejected by the scope filter")
                .register(registry)
                .increment();
    }
}
