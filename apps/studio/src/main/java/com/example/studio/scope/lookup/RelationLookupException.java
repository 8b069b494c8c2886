package com.example.studio.scope.lookup;

import com.example.studio.scope.model.RelationKind;

/**
 * A relation lookup could not be answered: the store failed or the request was
 * malformed. Distinct from an absent relation, which is an empty result.
 */
public class RelationLookupException extends RuntimeException {

    private final RelationKind relationKind;

    public RelationLookupException(RelationKind relationKind, String message) {
        super(String.format("%s lookup failed: %s", relationKind, message));
        this.relationKind = relationKind;
    }

    public RelationLookupException(RelationKind relationKind, Throwable cause) {
        super(String.format("%s lookup failed: %s", relationKind, cause.getMessage()), cause);
        this.relationKind = relationKind;
    }

    public RelationKind getRelationKind() {
        return relationKind;
    }
}
