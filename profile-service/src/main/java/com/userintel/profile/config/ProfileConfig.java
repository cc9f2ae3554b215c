package com.userintel.profile.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.userintel.common.inference.DimensionInferenceEngine;
import com.userintel.common.signal.KeywordTopicClassifier;
import com.userintel.common.signal.SignalExtractor;
import com.userintel.common.signal.TopicClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ProfileConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SignalExtractor signalExtractor(Clock clock) {
        return SignalExtractor.withDefaults(clock);
    }

    @Bean
    public DimensionInferenceEngine dimensionInferenceEngine() {
        return new DimensionInferenceEngine();
    }

    @Bean
    public TopicClassifier topicClassifier() {
        return new KeywordTopicClassifier();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
