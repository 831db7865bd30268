package com.profileplatform.claims.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One asserted fact about a user, unique per
 * (subjectUserId, predicate, objectValue, modelVersion). Re-running the same
 * model version updates the row in place.
 */
@Data
@NoArgsConstructor
@Table("claims")
public class Claim {

    @Id
    private Long id;

    private Long subjectUserId;
    private String predicate;
    private String objectValue;
    private String status;
    private double confidence;
    private String modelVersion;
    private LocalDateTime generatedAt;
    private String notes;
}
