package com.profileplatform.claims.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Why no claim was emitted for a predicate. Append-only: every run adds rows.
 */
@Data
@NoArgsConstructor
@Table("abstention_log")
public class AbstentionRecord {

    @Id
    private Long id;

    private Long subjectUserId;
    private String predicate;
    private String reasonCode;
    private String details;
    private String modelVersion;
    private LocalDateTime generatedAt;
}
