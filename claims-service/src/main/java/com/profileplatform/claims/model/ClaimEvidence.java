package com.profileplatform.claims.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * A single weighted evidence row attached to a claim. Unique per
 * (claimId, evidenceType, evidenceRef); replaced wholesale when the claim is rewritten.
 */
@Data
@NoArgsConstructor
@Table("claim_evidence")
public class ClaimEvidence {

    @Id
    private Long id;

    private Long claimId;
    private String evidenceType;
    private String evidenceRef;
    private double weight;
}
