package com.userintel.profile.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Append-only signal log. Rows are never updated except to mark them processed.
 *
 * payload : JSON-serialised {@code SignalPayload}, tagged by its {@code kind}
 */
@Data
@NoArgsConstructor
@Table("profile_signal")
public class SignalRecord {

    @Id
    private Long id;

    private String userId;

    private String signalType;

    private String category;

    private double strength;

    private String sessionId;

    private String messageId;

    /** JSON-serialised {@code SignalPayload} */
    private String payload;

    private LocalDateTime observedAt;

    private boolean processed;

    private LocalDateTime processedAt;
}
