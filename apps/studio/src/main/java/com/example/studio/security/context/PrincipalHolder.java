package com.example.studio.security.context;

import com.example.studio.security.exception.AuthenticationException;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.function.Function;

public final class PrincipalHolder {

    private static final String PRINCIPAL_KEY = Principal.class.getName();

    private PrincipalHolder() {
        // Utility class
    }

    public static Mono<Principal> getPrincipal() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(PRINCIPAL_KEY)) {
                return Mono.just(ctx.get(PRINCIPAL_KEY));
            }
            return Mono.error(new AuthenticationException(
                    "No Principal found in reactive context"));
        });
    }

    public static Function<Context, Context> withPrincipal(Principal principal) {
        return context -> context.put(PRINCIPAL_KEY, principal);
    }
}
