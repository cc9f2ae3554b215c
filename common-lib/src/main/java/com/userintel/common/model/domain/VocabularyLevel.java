package com.userintel.common.model.domain;

public enum VocabularyLevel {
    BASIC, INTERMEDIATE, ADVANCED, EXPERT
}
