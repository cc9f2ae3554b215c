package com.userintel.profile.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/** Unique on (userId, factType, factKey). */
@Data
@NoArgsConstructor
@Table("profile_fact")
public class ProfileFactRecord {

    @Id
    private Long id;

    private String userId;

    private String domain;

    private String factType;

    private String factKey;

    private String factValue;

    private String source;

    private boolean explicit;

    private double confidence;

    private LocalDateTime updatedAt;
}
