package com.example.studio.roster.repository;

import com.example.studio.roster.document.UserDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UserRepository extends ReactiveMongoRepository<UserDoc, String> {
}
