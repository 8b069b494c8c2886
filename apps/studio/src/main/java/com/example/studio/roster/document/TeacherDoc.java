package com.example.studio.roster.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "teachers")
public class TeacherDoc {

    @Id
    private String id;

    @Indexed
    private String userId;

    @Indexed
    private String studioId;

    private List<String> instruments;

    private String bio;

    @CreatedDate
    private Instant createdAt;
}
