package com.example.studio.scope.web;

import com.example.studio.common.dto.ErrorResponse;
import com.example.studio.common.filter.FilterResponseUtils;
import com.example.studio.common.util.StringSanitizer;
import com.example.studio.config.properties.ScopeProperties;
import com.example.studio.config.properties.ScopeProperties.DenyMode;
import com.example.studio.observability.filter.CorrelationIdFilter;
import com.example.studio.observability.metrics.ScopeMetrics;
import com.example.studio.scope.audit.ScopeAuditEvent.Outcome;
import com.example.studio.scope.audit.ScopeAuditService;
import com.example.studio.scope.model.Scope;
import com.example.studio.scope.model.ScopedResource;
import com.example.studio.scope.service.ScopeResolver;
import com.example.studio.security.context.Principal;
import com.example.studio.security.context.PrincipalHolder;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.lang.NonNull;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the caller's {@link Scope} for scoped resource paths and attaches it
 * to the request before any handler runs.
 *
 * <p>Runs after authentication. A request without a principal fails with
 * {@code AuthenticationException} and the resolver is never called. A
 * {@link Scope.Kind#DENY} scope is answered with 403 in {@link DenyMode#FORBID}
 * mode, or attached as-is in {@link DenyMode#EMPTY} mode so the handler returns
 * an empty result. Resolver failures look exactly like a legitimate deny.
 *
 * <p>Not a Spring bean: it is added to the security chain by {@code SecurityConfig}.
 */
@Slf4j
public class ScopeResolutionFilter implements WebFilter, Ordered {

    private final ScopeResolver scopeResolver;
    private final ScopeAuditService auditService;
    private final ScopeMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Pattern resourcePattern;
    private final DenyMode denyMode;

    public ScopeResolutionFilter(
            ScopeResolver scopeResolver,
            ScopeAuditService auditService,
            ScopeMetrics metrics,
            ObjectMapper objectMapper,
            ScopeProperties properties) {
        this.scopeResolver = scopeResolver;
        this.auditService = auditService;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.resourcePattern = Pattern.compile(properties.resourcePattern());
        this.denyMode = properties.denyMode();
    }

    @Override
    public int getOrder() {
        return 10; // After PermissionAuthorizationFilter
    }

    @Override
    @NonNull
    public Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        Optional<ScopedResource> resource = matchResource(exchange.getRequest().getPath().value());
        if (resource.isEmpty()) {
            return chain.filter(exchange);
        }

        return PrincipalHolder.getPrincipal()
                .flatMap(principal -> resolveAndContinue(principal, resource.get(), exchange, chain));
    }

    private Mono<Void> resolveAndContinue(
            Principal principal,
            ScopedResource resource,
            ServerWebExchange exchange,
            WebFilterChain chain) {

        return scopeResolver.resolve(principal, resource)
                .onErrorResume(e -> {
                    log.error("Scope resolver failed for user {} on {}, denying",
                            StringSanitizer.forLog(principal.id()), resource, e);
                    return Mono.just(Scope.deny());
                })
                .defaultIfEmpty(Scope.deny())
                .flatMap(scope -> {
                    if (scope.isDenied() && denyMode == DenyMode.FORBID) {
                        return reject(principal, resource, scope, exchange);
                    }

                    Outcome outcome = scope.isDenied() ? Outcome.EMPTY : Outcome.ATTACHED;
                    auditService.logDecision(principal, resource, scope, outcome, exchange.getRequest());
                    log.debug("Attached {} scope for user {} on {}",
                            scope.kind(), StringSanitizer.forLog(principal.id()), resource);

                    return chain.filter(exchange)
                            .contextWrite(ScopeContextHolder.withScope(scope));
                });
    }

    private Mono<Void> reject(
            Principal principal,
            ScopedResource resource,
            Scope scope,
            ServerWebExchange exchange) {

        auditService.logDecision(principal, resource, scope, Outcome.REJECTED, exchange.getRequest());
        metrics.recordRejection("scope");

        String correlationId = exchange.getRequest().getHeaders()
                .getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER);
        return FilterResponseUtils.forbidden(
                exchange,
                correlationId,
                ErrorResponse.Codes.FORBIDDEN,
                "Access denied",
                objectMapper);
    }

    Optional<ScopedResource> matchResource(String path) {
        Matcher matcher = resourcePattern.matcher(path);
        if (!matcher.matches() || matcher.groupCount() < 1) {
            return Optional.empty();
        }
        return ScopedResource.fromPathSegment(matcher.group(1));
    }
}
