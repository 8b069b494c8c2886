package com.example.studio.roster.service;

import com.example.studio.roster.dto.PageParams;
import com.example.studio.roster.dto.PagedResponse;
import com.example.studio.scope.filter.MongoCriteriaRenderer;
import com.example.studio.scope.filter.ScopeFilter;
import com.example.studio.scope.filter.ScopeFilterCompiler;
import com.example.studio.scope.model.ScopedResource;
import com.example.studio.scope.web.ScopeContextHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads rows through the scope attached to the current request. The scope
 * filter is always ANDed with the caller's own filters, so request parameters
 * can only narrow what the scope allows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScopedQueryService {

    private final ReactiveMongoTemplate mongoTemplate;
    private final ScopeFilterCompiler filterCompiler;
    private final MongoCriteriaRenderer criteriaRenderer;

    @NonNull
    public <T> Mono<PagedResponse<T>> findPage(
            @NonNull ScopedResource resource,
            @NonNull Class<T> documentType,
            @NonNull List<Criteria> requestCriteria,
            @NonNull PageParams page,
            @NonNull Sort sort) {

        return scopeFilter(resource).flatMap(filter -> {
            if (filter.matchesNone()) {
                return Mono.just(PagedResponse.<T>empty());
            }

            Criteria criteria = combine(criteriaRenderer.render(filter), requestCriteria);
            Query pageQuery = new Query(criteria)
                    .with(sort)
                    .skip(page.offset())
                    .limit(page.perPage());

            Mono<List<T>> rows = mongoTemplate.find(pageQuery, documentType).collectList();
            Mono<Long> total = mongoTemplate.count(new Query(criteria), documentType);

            return Mono.zip(rows, total)
                    .map(tuple -> new PagedResponse<>(tuple.getT1(), tuple.getT2()));
        });
    }

    /**
     * Single row by id, empty when the row does not exist or lies outside the scope.
     */
    @NonNull
    public <T> Mono<T> findById(
            @NonNull ScopedResource resource,
            @NonNull Class<T> documentType,
            @NonNull String id) {

        return scopeFilter(resource).flatMap(filter -> {
            if (filter.matchesNone()) {
                return Mono.empty();
            }
            Criteria criteria = combine(criteriaRenderer.render(filter),
                    List.of(Criteria.where("id").is(id)));
            return mongoTemplate.findOne(new Query(criteria), documentType);
        });
    }

    private Mono<ScopeFilter> scopeFilter(ScopedResource resource) {
        return ScopeContextHolder.getScope()
                .map(scope -> {
                    ScopeFilter filter = filterCompiler.compile(scope, resource.queryContext());
                    log.debug("Querying {} with {} scope filter", resource, filter.type());
                    return filter;
                });
    }

    static Criteria combine(Criteria scopeCriteria, List<Criteria> requestCriteria) {
        List<Criteria> parts = new ArrayList<>();
        if (!scopeCriteria.getCriteriaObject().isEmpty()) {
            parts.add(scopeCriteria);
        }
        for (Criteria criteria : requestCriteria) {
            if (!criteria.getCriteriaObject().isEmpty()) {
                parts.add(criteria);
            }
        }

        if (parts.isEmpty()) {
            return new Criteria();
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new Criteria().andOperator(parts);
    }
}
