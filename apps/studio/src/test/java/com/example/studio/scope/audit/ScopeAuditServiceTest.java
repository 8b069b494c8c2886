package com.example.studio.scope.audit;

import com.example.studio.config.properties.ScopeProperties;
import com.example.studio.scope.model.Scope;
import com.example.studio.scope.model.ScopedResource;
import com.example.studio.security.context.Principal;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;

import java.util.Map;
import java.util.Set;

import static com.example.studio.util.PrincipalTestBuilder.aGuardian;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScopeAuditService")
class ScopeAuditServiceTest {

    @Mock
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("should log nothing when auditing is disabled")
    void disabled() {
        ScopeProperties properties = new ScopeProperties(
                null, null, null, new ScopeProperties.AuditProperties(false));
        ScopeAuditService service = new ScopeAuditService(objectMapper, properties);

        service.logDecision(aGuardian("p1"), ScopedResource.LESSONS, Scope.deny(),
                ScopeAuditEvent.Outcome.REJECTED, null);

        verifyNoInteractions(objectMapper);
    }

    @Test
    @DisplayName("should serialize the decision when auditing is enabled")
    void enabled() throws Exception {
        ObjectMapper mapper = spy(new ObjectMapper().findAndRegisterModules());
        ScopeAuditService service = new ScopeAuditService(mapper, ScopeProperties.defaults());

        service.logDecision(aGuardian("p1"), ScopedResource.LESSONS, Scope.subjects(Set.of("D1")),
                ScopeAuditEvent.Outcome.ATTACHED,
                MockServerHttpRequest.get("/api/lessons").header("X-Correlation-Id", "corr-1").build());

        verify(mapper).writeValueAsString(anyMap());
    }

    @Test
    @DisplayName("structured log counts dependents instead of listing them")
    void structuredLog() {
        Principal guardian = aGuardian("p1");
        ScopeAuditEvent event = ScopeAuditEvent.of(guardian, ScopedResource.STUDENTS,
                Scope.subjects(Set.of("D1", "D2")), ScopeAuditEvent.Outcome.ATTACHED,
                new ScopeAuditEvent.RequestContext("corr-1", "/api/students", "GET"));

        Map<String, Object> log = event.toStructuredLog();

        assertThat(log).containsEntry("event_type", "scope_decision")
                .containsEntry("scope_kind", "SUBJECT_SET")
                .containsEntry("dependent_count", 2)
                .containsEntry("role", "GUARDIAN")
                .containsEntry("correlation_id", "corr-1");
        assertThat(log.values()).doesNotContain("D1", "D2");
    }
}
