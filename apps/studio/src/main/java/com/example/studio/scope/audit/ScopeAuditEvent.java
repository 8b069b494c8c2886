package com.example.studio.scope.audit;

import com.example.studio.scope.model.Scope;
import com.example.studio.scope.model.ScopedResource;
import com.example.studio.security.context.Principal;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured audit event for one scope decision.
 */
public record ScopeAuditEvent(
        Instant timestamp,
        String correlationId,

        // Decision
        Outcome outcome,
        Scope.Kind scopeKind,
        int dependentCount,

        // Principal
        String userId,
        String role,
        boolean superuser,

        // Request
        String resource,
        String path,
        String method
) {
    public enum Outcome {
        /** Scope attached, request continues to the handler. */
        ATTACHED,
        /** DENY attached in EMPTY mode, handler returns nothing. */
        EMPTY,
        /** DENY answered with 403. */
        REJECTED
    }

    public static ScopeAuditEvent of(
            Principal principal,
            ScopedResource resource,
            Scope scope,
            Outcome outcome,
            RequestContext requestContext) {

        return new ScopeAuditEvent(
                Instant.now(),
                requestContext.correlationId(),
                outcome,
                scope.kind(),
                scope.subjectIds().size(),
                principal.id(),
                principal.role().name(),
                principal.superuser(),
                resource.name(),
                requestContext.path(),
                requestContext.method()
        );
    }

    /**
     * Flattens the event for JSON logging. Dependent ids are counted, never listed.
     */
    public Map<String, Object> toStructuredLog() {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("event_type", "scope_decision");
        log.put("timestamp", timestamp.toString());
        log.put("correlation_id", correlationId != null ? correlationId : "");
        log.put("outcome", outcome.name());
        log.put("scope_kind", scopeKind.name());
        log.put("dependent_count", dependentCount);
        log.put("user_id", userId != null ? userId : "");
        log.put("role", role != null ? role : "");
        log.put("superuser", superuser);
        log.put("resource", resource != null ? resource : "");
        log.put("path", path != null ? path : "");
        log.put("method", method != null ? method : "");
        return log;
    }

    public record RequestContext(
            String correlationId,
            String path,
            String method
    ) {
        public static RequestContext empty() {
            return new RequestContext(null, null, null);
        }
    }
}
