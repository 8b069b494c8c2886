package com.example.studio.roster.repository;

import com.example.studio.roster.document.StudentDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
public interface StudentRepository extends ReactiveMongoRepository<StudentDoc, String> {

    /**
     * Find the student record backing a user account.
     */
    Mono<StudentDoc> findFirstByUserId(String userId);

    /**
     * Find all students belonging to any of the given families.
     */
    Flux<StudentDoc> findByFamilyIdIn(Collection<String> familyIds);
}
