package com.example.studio.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

public final class StringSanitizer {

    /** Ids accepted from clients and tokens. */
    public static final String SAFE_ID_REGEX = "[a-zA-Z0-9_@.-]{1,128}";

    private static final Pattern SAFE_ID_PATTERN = Pattern.compile("^" + SAFE_ID_REGEX + "$");
    private static final Pattern CORRELATION_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");
    private static final int DEFAULT_LOG_MAX_LENGTH = 64;

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
        return sanitized.substring(0, Math.min(sanitized.length(), maxLength));
    }

    @NonNull
    public static String escapeJson(@NonNull String value) {
        return value
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    public static boolean isValidSafeId(@Nullable String id) {
        if (id == null || id.isBlank()) {
            return false;
        }
        return SAFE_ID_PATTERN.matcher(id).matches();
    }

    public static boolean isValidCorrelationId(@Nullable String value) {
        return value != null && CORRELATION_ID_PATTERN.matcher(value).matches();
    }
}
