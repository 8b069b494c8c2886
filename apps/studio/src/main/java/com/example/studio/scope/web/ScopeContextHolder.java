package com.example.studio.scope.web;

import com.example.studio.scope.model.Scope;
import com.example.studio.security.exception.AuthorizationException;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.function.Function;

/**
 * Request-scoped access to the resolved {@link Scope}. The scope lives in the
 * Reactor context of the request and is gone when the request completes.
 */
public final class ScopeContextHolder {

    private static final String SCOPE_KEY = Scope.class.getName();

    private ScopeContextHolder() {
        // Utility class
    }

    /**
     * The scope of the current request. Errors with {@link AuthorizationException}
     * when no scope was resolved, so a handler mounted outside the scope filter
     * cannot read unfiltered data.
     */
    public static Mono<Scope> getScope() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(SCOPE_KEY)) {
                return Mono.just(ctx.get(SCOPE_KEY));
            }
            return Mono.error(new AuthorizationException(
                    "No Scope found in reactive context"));
        });
    }

    public static Function<Context, Context> withScope(Scope scope) {
        return context -> context.put(SCOPE_KEY, scope);
    }
}
