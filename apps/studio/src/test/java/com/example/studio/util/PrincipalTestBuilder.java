package com.example.studio.util;

import com.example.studio.security.context.Principal;
import com.example.studio.security.context.Role;

/**
 * Test builder for Principal.
 */
public class PrincipalTestBuilder {

    private String id = "user-001";
    private Role role = Role.STAFF;
    private boolean superuser = false;
    private String email = "user-001@studio.test";

    public static PrincipalTestBuilder aPrincipal() {
        return new PrincipalTestBuilder();
    }

    public static Principal anOwner() {
        return aPrincipal().withId("owner-001").withRole(Role.OWNER).build();
    }

    public static Principal aStaffMember(String userId) {
        return aPrincipal().withId(userId).withRole(Role.STAFF).build();
    }

    public static Principal aSubject(String userId) {
        return aPrincipal().withId(userId).withRole(Role.SUBJECT).build();
    }

    public static Principal aGuardian(String userId) {
        return aPrincipal().withId(userId).withRole(Role.GUARDIAN).build();
    }

    public PrincipalTestBuilder withId(String id) {
        this.id = id;
        this.email = id + "@studio.test";
        return this;
    }

    public PrincipalTestBuilder withRole(Role role) {
        this.role = role;
        return this;
    }

    public PrincipalTestBuilder asSuperuser() {
        this.superuser = true;
        return this;
    }

    public PrincipalTestBuilder withEmail(String email) {
        this.email = email;
        return this;
    }

    public Principal build() {
        return new Principal(id, role, superuser, email);
    }
}
