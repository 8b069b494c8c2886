package com.example.studio.scope.model;

/**
 * Relations the lookup provider can resolve for a user.
 */
public enum RelationKind {
    STAFF_RECORD(false),    // teacher record owned by the user
    SUBJECT_RECORD(false),  // student record owned by the user
    DEPENDENTS(true);       // student records the user is guardian of

    private final boolean setValued;

    RelationKind(boolean setValued) {
        this.setValued = setValued;
    }

    public boolean isSetValued() {
        return setValued;
    }
}
