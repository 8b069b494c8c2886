package com.example.studio.scope.filter;

/**
 * Row fields a scope is compiled against. Any field may be null when the
 * queried resource has no such column.
 *
 * @param tenantField  studio foreign key
 * @param subjectField student record key
 * @param userField    owning user key
 */
public record ScopeQueryContext(
        String tenantField,
        String subjectField,
        String userField
) {
}
