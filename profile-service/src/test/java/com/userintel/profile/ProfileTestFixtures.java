package com.userintel.profile;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.userintel.common.model.PrivacyTier;
import com.userintel.common.model.Signal;
import com.userintel.common.signal.MessageMetadata;
import com.userintel.common.signal.SignalExtractor;
import com.userintel.profile.codec.ProfileCodec;
import com.userintel.profile.config.ProfileConfig;
import com.userintel.profile.model.SignalRecord;
import com.userintel.profile.model.UserProfile;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Shared builders for service tests. */
public final class ProfileTestFixtures {

    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static final AtomicLong IDS = new AtomicLong(1);

    private ProfileTestFixtures() {}

    public static ObjectMapper objectMapper() {
        return new ProfileConfig().objectMapper();
    }

    public static ProfileCodec codec() {
        return new ProfileCodec(objectMapper());
    }

    public static UserProfile profile(String userId, PrivacyTier tier, int sessions) {
        UserProfile p = new UserProfile();
        p.setId(IDS.getAndIncrement());
        p.setUserId(userId);
        p.setPrivacyTier(tier.name());
        p.setSessionCount(sessions);
        p.setCreatedAt(ProfileCodec.toUtc(NOW.minusSeconds(86_400 * 30L)));
        p.setUpdatedAt(p.getCreatedAt());
        return p;
    }

    /** Extracts signals from each message and maps them to stored, unprocessed rows. */
    public static List<SignalRecord> signalRows(String userId, String... messages) {
        SignalExtractor extractor = SignalExtractor.withDefaults(CLOCK);
        ProfileCodec codec = codec();
        List<SignalRecord> rows = new ArrayList<>();
        for (String m : messages) {
            for (Signal s : extractor.extract(m, MessageMetadata.of("s-1", null, NOW))) {
                SignalRecord r = codec.toRecord(userId, s);
                r.setId(IDS.getAndIncrement());
                rows.add(r);
            }
        }
        return rows;
    }
}
