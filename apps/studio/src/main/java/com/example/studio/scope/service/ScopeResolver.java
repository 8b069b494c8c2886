package com.example.studio.scope.service;

import com.example.studio.common.util.StringSanitizer;
import com.example.studio.config.properties.ScopeProperties;
import com.example.studio.observability.metrics.ScopeMetrics;
import com.example.studio.observability.metrics.ScopeMetrics.LookupOutcome;
import com.example.studio.scope.lookup.RelationLookupProvider;
import com.example.studio.scope.model.RelationFact;
import com.example.studio.scope.model.RelationKind;
import com.example.studio.scope.model.Scope;
import com.example.studio.scope.model.ScopedResource;
import com.example.studio.security.context.Principal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Computes the {@link Scope} a principal gets on a resource.
 *
 * <p>Dispatch is by role, first match wins:
 * <ol>
 *   <li>superuser or {@code OWNER}: unrestricted</li>
 *   <li>{@code STAFF}: the studio of the user's teacher record</li>
 *   <li>{@code SUBJECT}: the user's own student record and user id</li>
 *   <li>{@code GUARDIAN}: the student records of the user's families</li>
 *   <li>anything else: deny</li>
 * </ol>
 *
 * <p>At most one relation lookup runs per call. A missing relation, a failed
 * lookup or a lookup exceeding {@code app.scope.lookup-timeout} resolves to
 * {@link Scope#deny()}. The returned {@code Mono} always emits exactly one
 * scope and never errors. Nothing is cached between calls.
 */
@Slf4j
@Service
public class ScopeResolver {

    private final RelationLookupProvider lookupProvider;
    private final ScopeMetrics metrics;
    private final Duration lookupTimeout;

    public ScopeResolver(
            RelationLookupProvider lookupProvider,
            ScopeMetrics metrics,
            ScopeProperties properties) {
        this.lookupProvider = lookupProvider;
        this.metrics = metrics;
        this.lookupTimeout = properties.lookupTimeout();
    }

    @NonNull
    public Mono<Scope> resolve(@NonNull Principal principal, @NonNull ScopedResource resource) {
        return Mono.defer(() -> dispatch(principal, resource))
                .onErrorResume(e -> {
                    log.error("Scope resolution failed for user {} (role={}) on {}, denying: {}",
                            StringSanitizer.forLog(principal.id()), principal.role(), resource, e.toString());
                    return Mono.just(Scope.deny());
                })
                .defaultIfEmpty(Scope.deny())
                .doOnNext(scope -> {
                    metrics.recordResolution(scope.kind());
                    log.debug("Resolved {} scope for user {} (role={}) on {}",
                            scope.kind(), StringSanitizer.forLog(principal.id()), principal.role(), resource);
                });
    }

    private Mono<Scope> dispatch(Principal principal, ScopedResource resource) {
        if (principal.superuser()) {
            return Mono.just(Scope.unrestricted());
        }

        return switch (principal.role()) {
            case OWNER -> Mono.just(Scope.unrestricted());
            case STAFF -> resolveStaff(principal, resource);
            case SUBJECT -> resolveSubject(principal, resource);
            case GUARDIAN -> resolveGuardian(principal, resource);
            // New roles get nothing until they are given a branch of their own
            default -> {
                log.warn("No scope rule for role {} of user {}, denying access to {}",
                        principal.role(), StringSanitizer.forLog(principal.id()), resource);
                yield Mono.just(Scope.deny());
            }
        };
    }

    private Mono<Scope> resolveStaff(Principal principal, ScopedResource resource) {
        RelationKind kind = RelationKind.STAFF_RECORD;
        return lookupProvider.findOwnedRecord(principal.id(), kind)
                .timeout(lookupTimeout)
                .map(fact -> {
                    metrics.recordLookup(kind, LookupOutcome.FOUND);
                    if (isBlank(fact.tenantId())) {
                        log.warn("Teacher record {} of user {} has no studio, denying access to {}",
                                fact.ownedRecordId(), StringSanitizer.forLog(principal.id()), resource);
                        return Scope.deny();
                    }
                    return Scope.tenant(fact.tenantId());
                })
                .switchIfEmpty(Mono.fromSupplier(() -> notFound(principal, kind, resource)))
                .onErrorResume(e -> Mono.just(lookupFailed(principal, kind, resource, e)));
    }

    private Mono<Scope> resolveSubject(Principal principal, ScopedResource resource) {
        RelationKind kind = RelationKind.SUBJECT_RECORD;
        return lookupProvider.findOwnedRecord(principal.id(), kind)
                .timeout(lookupTimeout)
                .map(fact -> {
                    metrics.recordLookup(kind, LookupOutcome.FOUND);
                    if (isBlank(fact.ownedRecordId())) {
                        return Scope.deny();
                    }
                    return Scope.self(fact.ownedRecordId(), principal.id());
                })
                .switchIfEmpty(Mono.fromSupplier(() -> notFound(principal, kind, resource)))
                .onErrorResume(e -> Mono.just(lookupFailed(principal, kind, resource, e)));
    }

    private Mono<Scope> resolveGuardian(Principal principal, ScopedResource resource) {
        RelationKind kind = RelationKind.DEPENDENTS;
        return lookupProvider.findManagedSet(principal.id(), kind)
                .map(RelationFact::ownedRecordId)
                .filter(Objects::nonNull)
                .filter(id -> !id.isBlank())
                .collect(Collectors.toUnmodifiableSet())
                .timeout(lookupTimeout)
                .map(dependentIds -> toGuardianScope(principal, kind, resource, dependentIds))
                .onErrorResume(e -> Mono.just(lookupFailed(principal, kind, resource, e)));
    }

    private Scope toGuardianScope(
            Principal principal,
            RelationKind kind,
            ScopedResource resource,
            Set<String> dependentIds) {
        if (dependentIds.isEmpty()) {
            return notFound(principal, kind, resource);
        }
        metrics.recordLookup(kind, LookupOutcome.FOUND);
        return Scope.subjects(dependentIds);
    }

    private Scope notFound(Principal principal, RelationKind kind, ScopedResource resource) {
        metrics.recordLookup(kind, LookupOutcome.NOT_FOUND);
        log.warn("No {} relation for user {} (role={}), denying access to {}",
                kind, StringSanitizer.forLog(principal.id()), principal.role(), resource);
        return Scope.deny();
    }

    private Scope lookupFailed(Principal principal, RelationKind kind, ScopedResource resource, Throwable error) {
        if (error instanceof TimeoutException) {
            metrics.recordLookup(kind, LookupOutcome.TIMEOUT);
            log.error("{} lookup for user {} timed out after {}, denying access to {}",
                    kind, StringSanitizer.forLog(principal.id()), lookupTimeout, resource);
        } else {
            metrics.recordLookup(kind, LookupOutcome.ERROR);
            log.error("{} lookup for user {} failed, denying access to {}: {}",
                    kind, StringSanitizer.forLog(principal.id()), resource, error.getMessage(), error);
        }
        return Scope.deny();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
