package com.example.studio.security.filter;

import com.example.studio.config.SecurityConfig;
import com.example.studio.config.properties.AuthProperties;
import com.example.studio.roster.document.UserDoc;
import com.example.studio.roster.repository.UserRepository;
import com.example.studio.security.context.Principal;
import com.example.studio.security.context.PrincipalHolder;
import com.example.studio.security.context.Role;
import com.example.studio.security.exception.AuthenticationException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BearerTokenAuthenticationFilter")
class BearerTokenAuthenticationFilterTest {

    private static final String SECRET = "test-secret-that-is-at-least-32-bytes-long";
    private static final AuthProperties AUTH_PROPERTIES = new AuthProperties(SECRET, null);

    @Mock
    private ReactiveJwtDecoder jwtDecoder;

    @Mock
    private UserRepository userRepository;

    private BearerTokenAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        filter = new BearerTokenAuthenticationFilter(jwtDecoder, userRepository, AUTH_PROPERTIES);
    }

    private static MockServerWebExchange exchangeWithToken(String token) {
        return MockServerWebExchange.from(MockServerHttpRequest.get("/api/lessons")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .build());
    }

    private static Jwt jwt(Object userId) {
        return Jwt.withTokenValue("token")
                .header("alg", "HS256")
                .claim("user_id", userId)
                .issuedAt(Instant.now())
                .build();
    }

    private static UserDoc user(String id, String role, boolean active) {
        return UserDoc.builder()
                .id(id)
                .email(id + "@studio.test")
                .role(role)
                .active(active)
                .build();
    }

    private static WebFilterChain capturingChain(AtomicReference<Principal> seen) {
        return ex -> PrincipalHolder.getPrincipal()
                .doOnNext(seen::set)
                .then();
    }

    @Nested
    @DisplayName("with a valid token")
    class ValidToken {

        @Test
        @DisplayName("should put the principal built from the user record in the context")
        void buildsPrincipalFromUserRecord() {
            when(jwtDecoder.decode("token")).thenReturn(Mono.just(jwt("u1")));
            when(userRepository.findById("u1")).thenReturn(Mono.just(user("u1", "student", true)));

            AtomicReference<Principal> seen = new AtomicReference<>();

            StepVerifier.create(filter.filter(exchangeWithToken("token"), capturingChain(seen)))
                    .verifyComplete();

            assertThat(seen.get().id()).isEqualTo("u1");
            assertThat(seen.get().role()).isEqualTo(Role.SUBJECT);
            assertThat(seen.get().superuser()).isFalse();
        }

        @Test
        @DisplayName("should accept a numeric user id claim")
        void numericClaim() {
            when(jwtDecoder.decode("token")).thenReturn(Mono.just(jwt(42)));
            when(userRepository.findById("42")).thenReturn(Mono.just(user("42", "teacher", true)));

            AtomicReference<Principal> seen = new AtomicReference<>();

            StepVerifier.create(filter.filter(exchangeWithToken("token"), capturingChain(seen)))
                    .verifyComplete();

            assertThat(seen.get().role()).isEqualTo(Role.STAFF);
        }

        @Test
        @DisplayName("should carry an unknown stored role as UNRECOGNIZED")
        void unknownRole() {
            when(jwtDecoder.decode("token")).thenReturn(Mono.just(jwt("u-aud")));
            when(userRepository.findById("u-aud")).thenReturn(Mono.just(user("u-aud", "auditor", true)));

            AtomicReference<Principal> seen = new AtomicReference<>();

            StepVerifier.create(filter.filter(exchangeWithToken("token"), capturingChain(seen)))
                    .verifyComplete();

            assertThat(seen.get().role()).isEqualTo(Role.UNRECOGNIZED);
        }

        @Test
        @DisplayName("should verify a real HS256 token with the configured decoder")
        void realToken() throws Exception {
            SignedJWT signed = new SignedJWT(
                    new JWSHeader(JWSAlgorithm.HS256),
                    new JWTClaimsSet.Builder()
                            .claim("user_id", "u1")
                            .issueTime(new Date())
                            .expirationTime(Date.from(Instant.now().plusSeconds(300)))
                            .build());
            signed.sign(new MACSigner(SECRET.getBytes(StandardCharsets.UTF_8)));

            ReactiveJwtDecoder realDecoder = new SecurityConfig().jwtDecoder(AUTH_PROPERTIES);
            BearerTokenAuthenticationFilter realFilter =
                    new BearerTokenAuthenticationFilter(realDecoder, userRepository, AUTH_PROPERTIES);
            when(userRepository.findById("u1")).thenReturn(Mono.just(user("u1", "parent", true)));

            AtomicReference<Principal> seen = new AtomicReference<>();

            StepVerifier.create(realFilter.filter(exchangeWithToken(signed.serialize()), capturingChain(seen)))
                    .verifyComplete();

            assertThat(seen.get().role()).isEqualTo(Role.GUARDIAN);
        }
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        private final AtomicBoolean chainCalled = new AtomicBoolean(false);
        private final WebFilterChain chain = ex -> {
            chainCalled.set(true);
            return Mono.empty();
        };

        @Test
        @DisplayName("should reject a request without Authorization header")
        void missingHeader() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.get("/api/lessons").build());

            StepVerifier.create(filter.filter(exchange, chain))
                    .expectError(AuthenticationException.class)
                    .verify();

            assertThat(chainCalled.get()).isFalse();
            verifyNoInteractions(jwtDecoder, userRepository);
        }

        @Test
        @DisplayName("should reject a token the decoder refuses")
        void badToken() {
            when(jwtDecoder.decode("forged")).thenReturn(Mono.error(new BadJwtException("bad signature")));

            StepVerifier.create(filter.filter(exchangeWithToken("forged"), chain))
                    .expectError(AuthenticationException.class)
                    .verify();

            assertThat(chainCalled.get()).isFalse();
            verifyNoInteractions(userRepository);
        }

        @Test
        @DisplayName("should reject a token without user id claim")
        void missingClaim() {
            when(jwtDecoder.decode("token")).thenReturn(Mono.just(Jwt.withTokenValue("token")
                    .header("alg", "HS256")
                    .claim("sub", "someone")
                    .build()));

            StepVerifier.create(filter.filter(exchangeWithToken("token"), chain))
                    .expectError(AuthenticationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should reject an unknown user")
        void unknownUser() {
            when(jwtDecoder.decode("token")).thenReturn(Mono.just(jwt("ghost")));
            when(userRepository.findById("ghost")).thenReturn(Mono.empty());

            StepVerifier.create(filter.filter(exchangeWithToken("token"), chain))
                    .expectError(AuthenticationException.class)
                    .verify();

            assertThat(chainCalled.get()).isFalse();
        }

        @Test
        @DisplayName("should reject an inactive user")
        void inactiveUser() {
            when(jwtDecoder.decode("token")).thenReturn(Mono.just(jwt("u1")));
            when(userRepository.findById("u1")).thenReturn(Mono.just(user("u1", "teacher", false)));

            StepVerifier.create(filter.filter(exchangeWithToken("token"), chain))
                    .expectError(AuthenticationException.class)
                    .verify();

            assertThat(chainCalled.get()).isFalse();
        }
    }
}
