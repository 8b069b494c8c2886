package com.example.studio.roster.service;

import com.example.studio.roster.document.LessonDoc;
import com.example.studio.roster.dto.PageParams;
import com.example.studio.scope.filter.MongoCriteriaRenderer;
import com.example.studio.scope.filter.ScopeFilterCompiler;
import com.example.studio.scope.model.Scope;
import com.example.studio.scope.model.ScopedResource;
import com.example.studio.scope.web.ScopeContextHolder;
import com.example.studio.security.exception.AuthorizationException;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScopedQueryService")
class ScopedQueryServiceTest {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "scheduledStart");

    @Mock
    private ReactiveMongoTemplate mongoTemplate;

    private ScopedQueryService service;

    @BeforeEach
    void setUp() {
        service = new ScopedQueryService(mongoTemplate, new ScopeFilterCompiler(), new MongoCriteriaRenderer());
    }

    private LessonDoc lesson(String id, String studioId) {
        return LessonDoc.builder().id(id).studioId(studioId).build();
    }

    @Nested
    @DisplayName("findPage")
    class FindPage {

        @Test
        @DisplayName("should AND the tenant filter with request filters and page the result")
        void tenantScope() {
            when(mongoTemplate.find(any(Query.class), eq(LessonDoc.class)))
                    .thenReturn(Flux.just(lesson("l1", "X"), lesson("l2", "X")));
            when(mongoTemplate.count(any(Query.class), eq(LessonDoc.class))).thenReturn(Mono.just(42L));

            StepVerifier.create(service.findPage(
                                    ScopedResource.LESSONS,
                                    LessonDoc.class,
                                    List.of(Criteria.where("teacherId").is("t1")),
                                    new PageParams(2, 10),
                                    NEWEST_FIRST)
                            .contextWrite(ScopeContextHolder.withScope(Scope.tenant("X"))))
                    .assertNext(page -> {
                        assertThat(page.data()).extracting(LessonDoc::getId).containsExactly("l1", "l2");
                        assertThat(page.total()).isEqualTo(42L);
                    })
                    .verifyComplete();

            ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
            verify(mongoTemplate).find(captor.capture(), eq(LessonDoc.class));
            Query query = captor.getValue();

            assertThat(query.getQueryObject()).isEqualTo(new Document("$and", List.of(
                    new Document("studioId", "X"),
                    new Document("teacherId", "t1"))));
            assertThat(query.getSkip()).isEqualTo(10L);
            assertThat(query.getLimit()).isEqualTo(10);
            assertThat(query.getSortObject()).isEqualTo(new Document("scheduledStart", -1));
        }

        @Test
        @DisplayName("should not add a scope clause for an unrestricted scope")
        void unrestrictedScope() {
            when(mongoTemplate.find(any(Query.class), eq(LessonDoc.class))).thenReturn(Flux.empty());
            when(mongoTemplate.count(any(Query.class), eq(LessonDoc.class))).thenReturn(Mono.just(0L));

            StepVerifier.create(service.findPage(
                                    ScopedResource.LESSONS, LessonDoc.class, List.of(),
                                    PageParams.of(null, null), NEWEST_FIRST)
                            .contextWrite(ScopeContextHolder.withScope(Scope.unrestricted())))
                    .assertNext(page -> assertThat(page.data()).isEmpty())
                    .verifyComplete();

            ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
            verify(mongoTemplate).count(captor.capture(), eq(LessonDoc.class));
            assertThat(captor.getValue().getQueryObject()).isEmpty();
        }

        @Test
        @DisplayName("should restrict a guardian to their dependents")
        void guardianScope() {
            when(mongoTemplate.find(any(Query.class), eq(LessonDoc.class))).thenReturn(Flux.empty());
            when(mongoTemplate.count(any(Query.class), eq(LessonDoc.class))).thenReturn(Mono.just(0L));

            StepVerifier.create(service.findPage(
                                    ScopedResource.LESSONS, LessonDoc.class, List.of(),
                                    PageParams.of(1, 25), NEWEST_FIRST)
                            .contextWrite(ScopeContextHolder.withScope(Scope.subjects(Set.of("D2", "D1")))))
                    .expectNextCount(1)
                    .verifyComplete();

            ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
            verify(mongoTemplate).find(captor.capture(), eq(LessonDoc.class));
            assertThat(captor.getValue().getQueryObject())
                    .isEqualTo(new Document("studentId", new Document("$in", List.of("D1", "D2"))));
        }

        @Test
        @DisplayName("should return an empty page without querying for a deny scope")
        void denyScope() {
            StepVerifier.create(service.findPage(
                                    ScopedResource.LESSONS, LessonDoc.class, List.of(),
                                    PageParams.of(1, 25), NEWEST_FIRST)
                            .contextWrite(ScopeContextHolder.withScope(Scope.deny())))
                    .assertNext(page -> {
                        assertThat(page.data()).isEmpty();
                        assertThat(page.total()).isZero();
                    })
                    .verifyComplete();

            verifyNoInteractions(mongoTemplate);
        }

        @Test
        @DisplayName("should fail closed when no scope is attached")
        void noScope() {
            StepVerifier.create(service.findPage(
                            ScopedResource.LESSONS, LessonDoc.class, List.of(),
                            PageParams.of(1, 25), NEWEST_FIRST))
                    .expectError(AuthorizationException.class)
                    .verify();

            verifyNoInteractions(mongoTemplate);
        }
    }

    @Nested
    @DisplayName("findById")
    class FindById {

        @Test
        @DisplayName("should look the row up inside the scope")
        void insideScope() {
            when(mongoTemplate.findOne(any(Query.class), eq(LessonDoc.class)))
                    .thenReturn(Mono.just(lesson("l1", "X")));

            StepVerifier.create(service.findById(ScopedResource.LESSONS, LessonDoc.class, "l1")
                            .contextWrite(ScopeContextHolder.withScope(Scope.tenant("X"))))
                    .assertNext(found -> assertThat(found.getId()).isEqualTo("l1"))
                    .verifyComplete();

            ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
            verify(mongoTemplate).findOne(captor.capture(), eq(LessonDoc.class));
            assertThat(captor.getValue().getQueryObject()).isEqualTo(new Document("$and", List.of(
                    new Document("studioId", "X"),
                    new Document("id", "l1"))));
        }

        @Test
        @DisplayName("should complete empty for a deny scope")
        void denyScope() {
            StepVerifier.create(service.findById(ScopedResource.LESSONS, LessonDoc.class, "l1")
                            .contextWrite(ScopeContextHolder.withScope(Scope.deny())))
                    .verifyComplete();

            verifyNoInteractions(mongoTemplate);
        }
    }

    @Test
    @DisplayName("page parameters are clamped to sane bounds")
    void pageParams() {
        PageParams params = PageParams.of(0, 500);

        assertThat(params.page()).isEqualTo(1);
        assertThat(params.perPage()).isEqualTo(PageParams.MAX_PER_PAGE);
        assertThat(PageParams.of(null, null).perPage()).isEqualTo(PageParams.DEFAULT_PER_PAGE);
        assertThat(new PageParams(3, 20).offset()).isEqualTo(40L);
    }
}
