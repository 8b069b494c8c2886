package com.example.studio.permission;

import com.example.studio.scope.model.ScopedResource;
import com.example.studio.security.context.Principal;
import com.example.studio.security.context.Role;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.example.studio.security.context.Role.GUARDIAN;
import static com.example.studio.security.context.Role.OWNER;
import static com.example.studio.security.context.Role.STAFF;
import static com.example.studio.security.context.Role.SUBJECT;

/**
 * Which roles may perform which action on which resource. This decides whether
 * a call is allowed at all; which rows it sees is the scope's business.
 *
 * <p>Superusers pass every check. A combination missing from the table is denied.
 */
@Component
public class PermissionMatrix {

    private final Map<ScopedResource, Map<Action, Set<Role>>> grants;

    public PermissionMatrix() {
        Map<ScopedResource, Map<Action, Set<Role>>> table = new EnumMap<>(ScopedResource.class);

        table.put(ScopedResource.STUDIOS, grants(
                EnumSet.of(OWNER),
                EnumSet.of(OWNER),
                EnumSet.of(OWNER),
                EnumSet.of(OWNER)));
        table.put(ScopedResource.TEACHERS, grants(
                EnumSet.of(OWNER, STAFF),
                EnumSet.of(OWNER),
                EnumSet.of(OWNER),
                EnumSet.of(OWNER)));
        table.put(ScopedResource.STUDENTS, grants(
                EnumSet.of(OWNER, STAFF, SUBJECT, GUARDIAN),
                EnumSet.of(OWNER, STAFF),
                EnumSet.of(OWNER, STAFF),
                EnumSet.of(OWNER)));
        table.put(ScopedResource.LESSONS, grants(
                EnumSet.of(OWNER, STAFF, SUBJECT, GUARDIAN),
                EnumSet.of(OWNER, STAFF),
                EnumSet.of(OWNER, STAFF),
                EnumSet.of(OWNER)));
        table.put(ScopedResource.INVOICES, grants(
                EnumSet.of(OWNER),
                EnumSet.of(OWNER),
                EnumSet.of(OWNER),
                EnumSet.of(OWNER)));
        table.put(ScopedResource.PAYMENTS, grants(
                EnumSet.of(OWNER),
                EnumSet.of(OWNER),
                EnumSet.of(OWNER),
                EnumSet.of(OWNER)));

        this.grants = Collections.unmodifiableMap(table);
    }

    public boolean isAllowed(@NonNull Principal principal, @NonNull ScopedResource resource, @NonNull Action action) {
        if (principal.superuser()) {
            return true;
        }
        return allowedRoles(resource, action).contains(principal.role());
    }

    @NonNull
    public Set<Role> allowedRoles(@NonNull ScopedResource resource, @NonNull Action action) {
        return grants.getOrDefault(resource, Map.of()).getOrDefault(action, Set.of());
    }

    private static Map<Action, Set<Role>> grants(
            Set<Role> view, Set<Role> create, Set<Role> edit, Set<Role> delete) {
        Map<Action, Set<Role>> byAction = new EnumMap<>(Action.class);
        byAction.put(Action.VIEW, Collections.unmodifiableSet(view));
        byAction.put(Action.CREATE, Collections.unmodifiableSet(create));
        byAction.put(Action.EDIT, Collections.unmodifiableSet(edit));
        byAction.put(Action.DELETE, Collections.unmodifiableSet(delete));
        return Collections.unmodifiableMap(byAction);
    }
}
