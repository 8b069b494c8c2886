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

/**
 * Account record, owned by the identity service. Read here on every request so
 * role and active flag changes apply immediately.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "users")
public class UserDoc {

    @Id
    private String id;

    @Indexed(unique = true)
    private String email;

    private String firstName;

    private String lastName;

    /**
     * Stored role name: admin, teacher, student or parent.
     */
    private String role;

    private boolean active;

    private boolean superuser;

    @CreatedDate
    private Instant createdAt;
}
