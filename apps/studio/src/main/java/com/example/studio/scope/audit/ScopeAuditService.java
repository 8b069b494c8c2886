package com.example.studio.scope.audit;

import com.example.studio.common.util.StringSanitizer;
import com.example.studio.config.properties.ScopeProperties;
import com.example.studio.observability.filter.CorrelationIdFilter;
import com.example.studio.scope.model.Scope;
import com.example.studio.scope.model.ScopedResource;
import com.example.studio.security.context.Principal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Publishes scope decisions to the {@code SCOPE_AUDIT} logger as JSON.
 * Turned off with {@code app.scope.audit.enabled=false}.
 */
@Service
@RequiredArgsConstructor
public class ScopeAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("SCOPE_AUDIT");

    private static final int MAX_PATH_LENGTH = 2000;

    private final ObjectMapper objectMapper;
    private final ScopeProperties scopeProperties;

    public void logDecision(
            @NonNull Principal principal,
            @NonNull ScopedResource resource,
            @NonNull Scope scope,
            @NonNull ScopeAuditEvent.Outcome outcome,
            @Nullable ServerHttpRequest request) {

        if (!scopeProperties.audit().enabled()) {
            return;
        }
        ScopeAuditEvent event = ScopeAuditEvent.of(
                principal, resource, scope, outcome, extractRequestContext(request));
        logEvent(event);
    }

    private void logEvent(@NonNull ScopeAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            switch (event.outcome()) {
                case ATTACHED -> AUDIT_LOG.info(json);
                case EMPTY, REJECTED -> AUDIT_LOG.warn(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize scope audit event: {}", StringSanitizer.forLog(e.getMessage()));
            AUDIT_LOG.warn("Scope {} - user={}, role={}, resource={}, scope={}",
                    event.outcome(),
                    StringSanitizer.forLog(event.userId()),
                    event.role(),
                    event.resource(),
                    event.scopeKind());
        }
    }

    @NonNull
    private ScopeAuditEvent.RequestContext extractRequestContext(@Nullable ServerHttpRequest request) {
        if (request == null) {
            return ScopeAuditEvent.RequestContext.empty();
        }

        String correlationId = request.getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER);
        if (!StringSanitizer.isValidCorrelationId(correlationId)) {
            correlationId = null;
        }
        String method = request.getMethod() != null ? request.getMethod().name() : "UNKNOWN";

        return new ScopeAuditEvent.RequestContext(
                correlationId,
                StringSanitizer.forLog(request.getPath().value(), MAX_PATH_LENGTH),
                method
        );
    }
}
