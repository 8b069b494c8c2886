package com.example.studio.roster.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

/**
 * Groups students under the guardians who manage them. A family may have more
 * than one guardian.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "families")
public class FamilyDoc {

    @Id
    private String id;

    private String name;

    private String studioId;

    @Indexed
    private List<String> guardianUserIds;
}
