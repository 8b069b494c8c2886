package com.example.studio.security.context;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Locale;

public enum Role {
    OWNER("admin"),         // studio owner / administrator
    STAFF("teacher"),       // teaches within one studio
    SUBJECT("student"),     // the person lessons are about
    GUARDIAN("parent"),     // manages one or more students
    UNRECOGNIZED(null);     // stored role this service does not know

    private final String storedValue;

    Role(String storedValue) {
        this.storedValue = storedValue;
    }

    /**
     * Maps the role string stored on the user record. Accepts the stored
     * value ("teacher") or the constant name ("STAFF"); anything else is
     * {@link #UNRECOGNIZED}.
     */
    @NonNull
    public static Role fromValue(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return UNRECOGNIZED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role == UNRECOGNIZED) {
                continue;
            }
            if (normalized.equals(role.storedValue) || normalized.equals(role.name().toLowerCase(Locale.ROOT))) {
                return role;
            }
        }
        return UNRECOGNIZED;
    }
}
