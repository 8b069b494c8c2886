package com.example.studio.permission;

import com.example.studio.scope.model.ScopedResource;
import com.example.studio.security.context.Principal;
import com.example.studio.security.context.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.example.studio.util.PrincipalTestBuilder.aGuardian;
import static com.example.studio.util.PrincipalTestBuilder.aPrincipal;
import static com.example.studio.util.PrincipalTestBuilder.aStaffMember;
import static com.example.studio.util.PrincipalTestBuilder.aSubject;
import static com.example.studio.util.PrincipalTestBuilder.anOwner;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PermissionMatrix")
class PermissionMatrixTest {

    private final PermissionMatrix matrix = new PermissionMatrix();

    @ParameterizedTest
    @EnumSource(ScopedResource.class)
    @DisplayName("owner may do everything")
    void ownerMayDoEverything(ScopedResource resource) {
        for (Action action : Action.values()) {
            assertThat(matrix.isAllowed(anOwner(), resource, action)).isTrue();
        }
    }

    @ParameterizedTest
    @EnumSource(ScopedResource.class)
    @DisplayName("only the owner may delete")
    void onlyOwnerDeletes(ScopedResource resource) {
        assertThat(matrix.allowedRoles(resource, Action.DELETE)).containsExactly(Role.OWNER);
    }

    @Test
    @DisplayName("staff may view and edit lessons but not invoices")
    void staffGrants() {
        Principal staff = aStaffMember("u-teacher");

        assertThat(matrix.isAllowed(staff, ScopedResource.LESSONS, Action.VIEW)).isTrue();
        assertThat(matrix.isAllowed(staff, ScopedResource.LESSONS, Action.EDIT)).isTrue();
        assertThat(matrix.isAllowed(staff, ScopedResource.INVOICES, Action.VIEW)).isFalse();
        assertThat(matrix.isAllowed(staff, ScopedResource.STUDIOS, Action.VIEW)).isFalse();
    }

    @Test
    @DisplayName("subjects and guardians may only view lessons and students")
    void readOnlyRoles() {
        for (Principal principal : new Principal[]{aSubject("u1"), aGuardian("p1")}) {
            assertThat(matrix.isAllowed(principal, ScopedResource.LESSONS, Action.VIEW)).isTrue();
            assertThat(matrix.isAllowed(principal, ScopedResource.STUDENTS, Action.VIEW)).isTrue();
            assertThat(matrix.isAllowed(principal, ScopedResource.LESSONS, Action.CREATE)).isFalse();
            assertThat(matrix.isAllowed(principal, ScopedResource.PAYMENTS, Action.VIEW)).isFalse();
        }
    }

    @Test
    @DisplayName("unrecognized role is granted nothing")
    void unrecognizedRole() {
        Principal auditor = aPrincipal().withId("u-aud").withRole(Role.UNRECOGNIZED).build();

        for (ScopedResource resource : ScopedResource.values()) {
            for (Action action : Action.values()) {
                assertThat(matrix.isAllowed(auditor, resource, action)).isFalse();
            }
        }
    }

    @Test
    @DisplayName("superuser is granted everything")
    void superuser() {
        Principal root = aPrincipal().withId("root").withRole(Role.UNRECOGNIZED).asSuperuser().build();

        assertThat(matrix.isAllowed(root, ScopedResource.PAYMENTS, Action.DELETE)).isTrue();
    }
}
