package com.example.studio.roster.repository;

import com.example.studio.roster.document.TeacherDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface TeacherRepository extends ReactiveMongoRepository<TeacherDoc, String> {

    /**
     * Find the teacher record backing a user account.
     */
    Mono<TeacherDoc> findFirstByUserId(String userId);
}
