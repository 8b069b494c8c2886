package com.example.studio.scope.lookup;

import com.example.studio.common.util.StringSanitizer;
import com.example.studio.roster.document.FamilyDoc;
import com.example.studio.roster.document.StudentDoc;
import com.example.studio.roster.document.TeacherDoc;
import com.example.studio.roster.repository.FamilyRepository;
import com.example.studio.roster.repository.StudentRepository;
import com.example.studio.roster.repository.TeacherRepository;
import com.example.studio.scope.model.RelationFact;
import com.example.studio.scope.model.RelationKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Relation lookups over the teachers, students and families collections.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoRelationLookupProvider implements RelationLookupProvider {

    private final TeacherRepository teacherRepository;
    private final StudentRepository studentRepository;
    private final FamilyRepository familyRepository;

    @Override
    @NonNull
    public Mono<RelationFact> findOwnedRecord(String userId, RelationKind kind) {
        return Mono.defer(() -> {
            validate(userId, kind, false);
            return switch (kind) {
                case STAFF_RECORD -> teacherRepository.findFirstByUserId(userId)
                        .map(teacher -> toFact(userId, teacher));
                case SUBJECT_RECORD -> studentRepository.findFirstByUserId(userId)
                        .map(student -> toFact(userId, student, kind));
                default -> Mono.<RelationFact>error(new RelationLookupException(
                        kind, "not a single-record relation"));
            };
        }).onErrorMap(e -> !(e instanceof RelationLookupException), e -> new RelationLookupException(kind, e))
                .doOnNext(fact -> log.debug("Found {} {} for user {}", kind, fact.ownedRecordId(),
                        StringSanitizer.forLog(userId)));
    }

    @Override
    @NonNull
    public Flux<RelationFact> findManagedSet(String userId, RelationKind kind) {
        return Flux.defer(() -> {
            validate(userId, kind, true);
            return familyRepository.findByGuardianUserIdsContaining(userId)
                    .map(FamilyDoc::getId)
                    .filter(Objects::nonNull)
                    .collectList()
                    .flatMapMany(familyIds -> findDependents(userId, familyIds));
        }).onErrorMap(e -> !(e instanceof RelationLookupException), e -> new RelationLookupException(kind, e));
    }

    private Flux<RelationFact> findDependents(String userId, List<String> familyIds) {
        if (familyIds.isEmpty()) {
            return Flux.empty();
        }
        return studentRepository.findByFamilyIdIn(familyIds)
                .filter(student -> student.getId() != null)
                .map(student -> toFact(userId, student, RelationKind.DEPENDENTS));
    }

    private void validate(String userId, RelationKind kind, boolean setValued) {
        if (kind == null) {
            throw new RelationLookupException(null, "relation kind is required");
        }
        if (!StringSanitizer.isValidSafeId(userId)) {
            throw new RelationLookupException(kind, "invalid user id");
        }
        if (kind.isSetValued() != setValued) {
            throw new RelationLookupException(kind,
                    setValued ? "not a set-valued relation" : "not a single-record relation");
        }
    }

    private static RelationFact toFact(String userId, TeacherDoc teacher) {
        return new RelationFact(userId, teacher.getId(), RelationKind.STAFF_RECORD, teacher.getStudioId());
    }

    private static RelationFact toFact(String userId, StudentDoc student, RelationKind kind) {
        return new RelationFact(userId, student.getId(), kind, student.getStudioId());
    }
}
