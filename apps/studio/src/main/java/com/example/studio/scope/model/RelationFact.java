package com.example.studio.scope.model;

/**
 * A persisted link between a user and a record.
 *
 * @param ownerUserId   the user the relation was looked up for
 * @param ownedRecordId the teacher or student record id
 * @param kind          which relation produced the fact
 * @param tenantId      studio the owned record belongs to, may be null
 */
public record RelationFact(
        String ownerUserId,
        String ownedRecordId,
        RelationKind kind,
        String tenantId
) {
}
