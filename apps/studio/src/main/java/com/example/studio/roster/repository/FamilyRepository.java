package com.example.studio.roster.repository;

import com.example.studio.roster.document.FamilyDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface FamilyRepository extends ReactiveMongoRepository<FamilyDoc, String> {

    /**
     * Find the families a user is listed as guardian of.
     */
    Flux<FamilyDoc> findByGuardianUserIdsContaining(String userId);
}
