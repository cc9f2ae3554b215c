package com.userintel.profile.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One row per user. All timestamps are UTC.
 *
 * privacyTier          : A / B / C; A never persists signals or reflects
 * questionsAsked       : elicitation questions recorded so far, answered or skipped
 * lastQuestionSession  : session number in which a question was last served
 */
@Data
@NoArgsConstructor
@Table("user_profile")
public class UserProfile {

    @Id
    private Long id;

    private String userId;

    private int sessionCount;

    private long signalCount;

    private int questionsAsked;

    private Integer lastQuestionSession;

    private LocalDateTime lastReflectionAt;

    private LocalDateTime nextReflectionAt;

    private String privacyTier;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
