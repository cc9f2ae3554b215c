package com.userintel.profile.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("elicitation_response")
public class ElicitationResponseRecord {

    @Id
    private Long id;

    private String userId;

    private String questionId;

    private String domain;

    private String response;

    private boolean skipped;

    private int sessionNumber;

    private int phase;

    /** JSON-serialised {@code List<KnownFact>} */
    private String extractedFacts;

    private LocalDateTime askedAt;
}
