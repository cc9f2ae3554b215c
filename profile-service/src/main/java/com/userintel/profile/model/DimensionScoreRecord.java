package com.userintel.profile.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Current belief for one (user, domain).
 *
 * confidence     : already decayed up to {@code lastDecayedAt}
 * lastUpdated    : when the value itself last changed
 * sources        : comma-separated {@code EvidenceSource} names
 */
@Data
@NoArgsConstructor
@Table("dimension_score")
public class DimensionScoreRecord {

    @Id
    private Long id;

    private String userId;

    private String domain;

    /** JSON-serialised domain value */
    private String value;

    private double confidence;

    private double decayRate;

    private String sources;

    private LocalDateTime lastUpdated;

    private LocalDateTime lastDecayedAt;
}
