package com.example.studio.security.context;

/**
 * Authenticated caller of one request. Built by the authentication filter
 * from the current user record and never changed afterwards.
 */
public record Principal(
        String id,
        Role role,
        boolean superuser,
        String email
) {
    public Principal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Principal id is required");
        }
        if (role == null) {
            role = Role.UNRECOGNIZED;
        }
    }

    public static Principal of(String id, Role role) {
        return new Principal(id, role, false, null);
    }
}
