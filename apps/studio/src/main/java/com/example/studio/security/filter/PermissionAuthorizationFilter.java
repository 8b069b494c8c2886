package com.example.studio.security.filter;

import com.example.studio.common.util.StringSanitizer;
import com.example.studio.observability.metrics.ScopeMetrics;
import com.example.studio.permission.PermissionMatrix;
import com.example.studio.security.annotation.RequiresPermission;
import com.example.studio.security.context.Principal;
import com.example.studio.security.context.PrincipalHolder;
import com.example.studio.security.exception.AuthorizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.reactive.result.method.annotation.RequestMappingHandlerMapping;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Enforces {@link RequiresPermission} on the handler the request maps to.
 * Handlers without the annotation, and paths without a handler, pass through.
 */
@Slf4j
public class PermissionAuthorizationFilter implements WebFilter, Ordered {

    private final RequestMappingHandlerMapping handlerMapping;
    private final PermissionMatrix permissionMatrix;
    private final ScopeMetrics metrics;

    public PermissionAuthorizationFilter(
            RequestMappingHandlerMapping handlerMapping,
            PermissionMatrix permissionMatrix,
            ScopeMetrics metrics) {
        this.handlerMapping = handlerMapping;
        this.permissionMatrix = permissionMatrix;
        this.metrics = metrics;
    }

    @Override
    public int getOrder() {
        return 0; // After authentication
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        // Resolve the annotation first; the chain itself completes empty and must run once
        return handlerMapping.getHandler(exchange)
                .filter(handler -> handler instanceof HandlerMethod)
                .cast(HandlerMethod.class)
                .map(handlerMethod -> Optional.ofNullable(findAnnotation(handlerMethod)))
                .defaultIfEmpty(Optional.empty())
                .flatMap(annotation -> annotation
                        .map(required -> checkPermission(exchange, required, chain))
                        .orElseGet(() -> chain.filter(exchange)));
    }

    private Mono<Void> checkPermission(
            ServerWebExchange exchange,
            RequiresPermission annotation,
            WebFilterChain chain) {

        return PrincipalHolder.getPrincipal()
                .flatMap(principal -> {
                    if (!permissionMatrix.isAllowed(principal, annotation.resource(), annotation.action())) {
                        return deny(principal, annotation);
                    }
                    log.debug("Permission granted: user={}, role={}, {}:{}",
                            StringSanitizer.forLog(principal.id()), principal.role(),
                            annotation.resource(), annotation.action());
                    return chain.filter(exchange);
                });
    }

    private Mono<Void> deny(Principal principal, RequiresPermission annotation) {
        log.warn("Permission denied for user {} (role={}) on {}:{}, allowed roles: {}",
                StringSanitizer.forLog(principal.id()), principal.role(),
                annotation.resource(), annotation.action(),
                permissionMatrix.allowedRoles(annotation.resource(), annotation.action()));
        metrics.recordRejection("permission");
        return Mono.error(new AuthorizationException(
                "Role " + principal.role() + " may not " + annotation.action() + " " + annotation.resource()));
    }

    private RequiresPermission findAnnotation(HandlerMethod method) {
        RequiresPermission annotation = method.getMethodAnnotation(RequiresPermission.class);
        if (annotation != null) {
            return annotation;
        }
        return AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), RequiresPermission.class);
    }
}
