package com.example.studio.scope.model;

import java.util.Set;

/**
 * Row visibility boundary for one principal on one request.
 *
 * <p>Exactly one of the variants described by {@link Kind}. Instances are
 * immutable; build them through the static factories.
 *
 * @param kind       the variant
 * @param tenantId   studio id, only for {@link Kind#TENANT}
 * @param subjectId  student record id, only for {@link Kind#SELF}
 * @param userId     user id, only for {@link Kind#SELF}
 * @param subjectIds student record ids, only for {@link Kind#SUBJECT_SET}
 */
public record Scope(
        Kind kind,
        String tenantId,
        String subjectId,
        String userId,
        Set<String> subjectIds
) {
    private static final Scope UNRESTRICTED = new Scope(Kind.UNRESTRICTED, null, null, null, Set.of());
    private static final Scope DENY = new Scope(Kind.DENY, null, null, null, Set.of());

    public enum Kind {
        UNRESTRICTED,
        TENANT,
        SELF,
        SUBJECT_SET,
        DENY
    }

    public Scope {
        if (kind == null) {
            throw new IllegalArgumentException("Scope kind is required");
        }
        subjectIds = subjectIds == null ? Set.of() : Set.copyOf(subjectIds);

        switch (kind) {
            case TENANT -> {
                requireText(tenantId, "tenantId");
                requireAbsent(kind, subjectId == null && userId == null && subjectIds.isEmpty());
            }
            case SELF -> {
                requireText(subjectId, "subjectId");
                requireText(userId, "userId");
                requireAbsent(kind, tenantId == null && subjectIds.isEmpty());
            }
            case SUBJECT_SET -> {
                if (subjectIds.isEmpty()) {
                    throw new IllegalArgumentException("SUBJECT_SET scope needs at least one subject id");
                }
                subjectIds.forEach(id -> requireText(id, "subjectIds[]"));
                requireAbsent(kind, tenantId == null && subjectId == null && userId == null);
            }
            case UNRESTRICTED, DENY -> requireAbsent(kind,
                    tenantId == null && subjectId == null && userId == null && subjectIds.isEmpty());
        }
    }

    public static Scope unrestricted() {
        return UNRESTRICTED;
    }

    public static Scope tenant(String tenantId) {
        return new Scope(Kind.TENANT, tenantId, null, null, Set.of());
    }

    public static Scope self(String subjectId, String userId) {
        return new Scope(Kind.SELF, null, subjectId, userId, Set.of());
    }

    public static Scope subjects(Set<String> subjectIds) {
        return new Scope(Kind.SUBJECT_SET, null, null, null, subjectIds);
    }

    public static Scope deny() {
        return DENY;
    }

    public boolean isUnrestricted() {
        return kind == Kind.UNRESTRICTED;
    }

    public boolean isDenied() {
        return kind == Kind.DENY;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static void requireAbsent(Kind kind, boolean absent) {
        if (!absent) {
            throw new IllegalArgumentException("Fields set that do not belong to a " + kind + " scope");
        }
    }
}
