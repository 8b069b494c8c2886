package com.example.studio.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.scope")
public record ScopeProperties(
        Duration lookupTimeout,
        DenyMode denyMode,
        String resourcePattern,
        AuditProperties audit
) {
    public static final String DEFAULT_RESOURCE_PATTERN =
            "^/api/(studios|teachers|students|lessons|invoices|payments)(?:/.*)?$";

    public ScopeProperties {
        if (lookupTimeout == null || lookupTimeout.isZero() || lookupTimeout.isNegative()) {
            lookupTimeout = Duration.ofSeconds(2);
        }
        if (denyMode == null) {
            denyMode = DenyMode.FORBID;
        }
        if (resourcePattern == null || resourcePattern.isBlank()) {
            resourcePattern = DEFAULT_RESOURCE_PATTERN;
        }
        if (audit == null) {
            audit = new AuditProperties(true);
        }
    }

    public static ScopeProperties defaults() {
        return new ScopeProperties(null, null, null, null);
    }

    /**
     * How a DENY scope is surfaced to the caller.
     */
    public enum DenyMode {
        FORBID,     // 403 before the handler runs
        EMPTY       // handler runs and compiles DENY to a filter matching nothing
    }

    public record AuditProperties(
            boolean enabled
    ) {}
}
