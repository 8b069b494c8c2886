package com.example.studio.config;

import com.example.studio.config.properties.AuthProperties;
import com.example.studio.config.properties.ScopeProperties;
import com.example.studio.observability.metrics.ScopeMetrics;
import com.example.studio.permission.PermissionMatrix;
import com.example.studio.roster.repository.UserRepository;
import com.example.studio.scope.audit.ScopeAuditService;
import com.example.studio.scope.service.ScopeResolver;
import com.example.studio.scope.web.ScopeResolutionFilter;
import com.example.studio.security.filter.BearerTokenAuthenticationFilter;
import com.example.studio.security.filter.PermissionAuthorizationFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.NimbusReactiveJwtDecoder;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.util.matcher.PathPatternParserServerWebExchangeMatcher;
import org.springframework.security.web.server.util.matcher.ServerWebExchangeMatchers;
import org.springframework.web.reactive.result.method.annotation.RequestMappingHandlerMapping;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

/**
 * Security chains. The custom filters are built here rather than declared as
 * beans so WebFlux does not also run them outside the security chain.
 */
@Configuration
@EnableWebFluxSecurity
public class SecurityConfig {

    private static final int MIN_SECRET_BYTES = 32;

    @Bean
    public ReactiveJwtDecoder jwtDecoder(AuthProperties authProperties) {
        String secret = authProperties.jwtSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "app.auth.jwt-secret must be set and at least " + MIN_SECRET_BYTES + " bytes long");
        }
        SecretKeySpec key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        return NimbusReactiveJwtDecoder.withSecretKey(key)
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
    }

    // API: /api/** - bearer token, permission matrix, row scope
    @Bean
    @Order(1)
    public SecurityWebFilterChain apiSecurityFilterChain(
            ServerHttpSecurity http,
            ReactiveJwtDecoder jwtDecoder,
            UserRepository userRepository,
            AuthProperties authProperties,
            @Qualifier("requestMappingHandlerMapping") RequestMappingHandlerMapping handlerMapping,
            PermissionMatrix permissionMatrix,
            ScopeResolver scopeResolver,
            ScopeAuditService scopeAuditService,
            ScopeMetrics scopeMetrics,
            ObjectMapper objectMapper,
            ScopeProperties scopeProperties) {

        BearerTokenAuthenticationFilter authenticationFilter =
                new BearerTokenAuthenticationFilter(jwtDecoder, userRepository, authProperties);
        PermissionAuthorizationFilter permissionFilter =
                new PermissionAuthorizationFilter(handlerMapping, permissionMatrix, scopeMetrics);
        ScopeResolutionFilter scopeFilter = new ScopeResolutionFilter(
                scopeResolver, scopeAuditService, scopeMetrics, objectMapper, scopeProperties);

        return http
                .securityMatcher(new PathPatternParserServerWebExchangeMatcher("/api/**"))
                .csrf(ServerHttpSecurity.CsrfSpec::disable) // stateless bearer API
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .logout(ServerHttpSecurity.LogoutSpec::disable)
                .authorizeExchange(exchanges -> exchanges.anyExchange().permitAll())
                .addFilterAt(authenticationFilter, SecurityWebFiltersOrder.AUTHENTICATION)
                .addFilterAfter(permissionFilter, SecurityWebFiltersOrder.AUTHORIZATION)
                .addFilterAt(scopeFilter, SecurityWebFiltersOrder.LAST)
                .build();
    }

    // Public: health and info only
    @Bean
    @Order(2)
    public SecurityWebFilterChain publicSecurityFilterChain(ServerHttpSecurity http) {
        return http
                .securityMatcher(ServerWebExchangeMatchers.pathMatchers(
                        "/actuator/health", "/actuator/health/**", "/actuator/info"))
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .authorizeExchange(exchanges -> exchanges.anyExchange().permitAll())
                .build();
    }

    // Catch-all: deny unmatched paths
    @Bean
    @Order(Integer.MAX_VALUE)
    public SecurityWebFilterChain catchAllSecurityFilterChain(ServerHttpSecurity http) {
        return http
                .securityMatcher(ServerWebExchangeMatchers.anyExchange())
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .authorizeExchange(exchanges -> exchanges.anyExchange().denyAll())
                .build();
    }
}
