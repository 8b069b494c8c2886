package com.example.studio.roster.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Scheduled lesson. Carries the studio and the student's user id alongside the
 * student record id so every scope variant can be applied without a join.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "lessons")
@CompoundIndexes({
        @CompoundIndex(name = "studio_start_idx", def = "{'studioId': 1, 'scheduledStart': -1}"),
        @CompoundIndex(name = "student_start_idx", def = "{'studentId': 1, 'scheduledStart': -1}")
})
public class LessonDoc {

    @Id
    private String id;

    private String studioId;

    @Indexed
    private String teacherId;

    private String studentId;

    @Indexed
    private String studentUserId;

    private String roomId;

    private Instant scheduledStart;

    private Instant scheduledEnd;

    private String lessonType;

    private String status;

    private BigDecimal rate;

    private String notes;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
