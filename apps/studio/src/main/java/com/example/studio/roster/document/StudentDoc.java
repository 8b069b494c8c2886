package com.example.studio.roster.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "students")
public class StudentDoc {

    @Id
    private String id;

    /**
     * Login of the student, absent for young students managed only by a guardian.
     */
    @Indexed
    private String userId;

    @Indexed
    private String studioId;

    @Indexed
    private String familyId;

    private String firstName;

    private String lastName;

    private String instrument;

    private String skillLevel;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
