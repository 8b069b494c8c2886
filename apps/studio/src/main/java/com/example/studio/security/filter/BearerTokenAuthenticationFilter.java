package com.example.studio.security.filter;

import com.example.studio.common.util.StringSanitizer;
import com.example.studio.config.properties.AuthProperties;
import com.example.studio.roster.document.UserDoc;
import com.example.studio.roster.repository.UserRepository;
import com.example.studio.security.context.Principal;
import com.example.studio.security.context.PrincipalHolder;
import com.example.studio.security.context.Role;
import com.example.studio.security.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Authenticates {@code Authorization: Bearer} requests.
 *
 * <p>The token is an HS256 JWT issued by the identity service; only its user id
 * claim is trusted. Role, superuser flag and active flag come from the user
 * record, loaded on every request. The resulting {@link Principal} is put in the
 * Reactor context for the filters and handlers downstream.
 */
@Slf4j
public class BearerTokenAuthenticationFilter implements WebFilter, Ordered {

    private static final String BEARER_PREFIX = "Bearer ";

    private final ReactiveJwtDecoder jwtDecoder;
    private final UserRepository userRepository;
    private final String userIdClaim;

    public BearerTokenAuthenticationFilter(
            ReactiveJwtDecoder jwtDecoder,
            UserRepository userRepository,
            AuthProperties authProperties) {
        this.jwtDecoder = jwtDecoder;
        this.userRepository = userRepository;
        this.userIdClaim = authProperties.userIdClaim();
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }

    @Override
    @NonNull
    public Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        String authHeader = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            return Mono.error(new AuthenticationException("No bearer token provided"));
        }

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            return Mono.error(new AuthenticationException("Empty bearer token"));
        }

        return jwtDecoder.decode(token)
                .onErrorMap(JwtException.class, e -> new AuthenticationException("Invalid token", e))
                .map(this::extractUserId)
                .flatMap(this::loadPrincipal)
                .flatMap(principal -> {
                    log.debug("Authenticated user {} (role={})",
                            StringSanitizer.forLog(principal.id()), principal.role());
                    return chain.filter(exchange)
                            .contextWrite(PrincipalHolder.withPrincipal(principal));
                });
    }

    private String extractUserId(Jwt jwt) {
        Object claim = jwt.getClaim(userIdClaim);
        String userId = claim != null ? String.valueOf(claim) : null;
        if (!StringSanitizer.isValidSafeId(userId)) {
            throw new AuthenticationException("Token has no valid " + userIdClaim + " claim");
        }
        return userId;
    }

    private Mono<Principal> loadPrincipal(String userId) {
        return userRepository.findById(userId)
                .switchIfEmpty(Mono.error(() -> new AuthenticationException(
                        "Unknown user " + StringSanitizer.forLog(userId))))
                .flatMap(user -> {
                    if (!user.isActive()) {
                        log.warn("Rejected token for inactive user {}", StringSanitizer.forLog(userId));
                        return Mono.error(new AuthenticationException("Inactive user"));
                    }
                    return Mono.just(toPrincipal(user));
                });
    }

    private Principal toPrincipal(UserDoc user) {
        Role role = Role.fromValue(user.getRole());
        if (role == Role.UNRECOGNIZED) {
            log.warn("User {} has unrecognized role '{}'",
                    StringSanitizer.forLog(user.getId()), StringSanitizer.forLog(user.getRole()));
        }
        return new Principal(user.getId(), role, user.isSuperuser(), user.getEmail());
    }
}
