package com.example.filterengine.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * The live filter. Owned by the CRUD layer; evaluation only ever touches
 * {@code usageCount} and {@code lastUsedAt}, and only through an atomic update.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Document("saved_filters")
public class SavedFilter {
    @Id
    private String id;
    private String ownerId;
    private String teamId;
    private String name;
    private String description;
    private String visibility;
    private List<RuleClause> rules;
    private int version;
    private Instant createdAt;
    private Instant updatedAt;

    // Usage stats
    private Instant lastUsedAt;
    private long usageCount;
}
