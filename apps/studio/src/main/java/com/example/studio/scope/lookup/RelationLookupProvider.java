package com.example.studio.scope.lookup;

import com.example.studio.scope.model.RelationFact;
import com.example.studio.scope.model.RelationKind;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only access to the user/record relations needed to scope data.
 *
 * <p>Absence is data: no relation completes empty. Store or input failures
 * signal {@link RelationLookupException}. Implementations must not cache
 * results across calls.
 */
public interface RelationLookupProvider {

    /**
     * The single record of {@code kind} owned by the user, or empty.
     *
     * @param kind a relation with {@link RelationKind#isSetValued()} false
     */
    Mono<RelationFact> findOwnedRecord(String userId, RelationKind kind);

    /**
     * All records of {@code kind} the user manages, possibly none.
     *
     * @param kind a relation with {@link RelationKind#isSetValued()} true
     */
    Flux<RelationFact> findManagedSet(String userId, RelationKind kind);
}
