package com.userintel.profile.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.userintel.common.context.StoredBelief;
import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.EvidenceSource;
import com.userintel.common.model.KnownFact;
import com.userintel.common.model.Signal;
import com.userintel.common.model.SignalType;
import com.userintel.common.model.domain.DomainValue;
import com.userintel.common.model.payload.SignalPayload;
import com.userintel.profile.model.DimensionScoreRecord;
import com.userintel.profile.model.ProfileFactRecord;
import com.userintel.profile.model.SignalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps between persisted rows and common-lib types. Writing a row that cannot
 * be serialised is an error; reading a row that cannot be parsed skips it.
 */
@Component
public class ProfileCodec {

    private static final Logger log = LoggerFactory.getLogger(ProfileCodec.class);

    private static final TypeReference<List<KnownFact>> FACT_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ProfileCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ── Signals ─────────────────────────────────────────────────────────────

    public SignalRecord toRecord(String userId, Signal signal) {
        try {
            SignalRecord record = new SignalRecord();
            record.setUserId(userId);
            record.setSignalType(signal.signalType().name());
            record.setCategory(signal.category().name());
            record.setStrength(signal.strength());
            record.setSessionId(signal.sessionId());
            record.setMessageId(signal.messageId());
            record.setPayload(objectMapper.writeValueAsString(signal.payload()));
            record.setObservedAt(toUtc(signal.timestamp()));
            record.setProcessed(false);
            return record;
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize signal for persistence", e);
        }
    }

    public Optional<Signal> toSignal(SignalRecord record) {
        try {
            SignalType type = SignalType.valueOf(record.getSignalType());
            SignalPayload payload = objectMapper.readValue(record.getPayload(), SignalPayload.class);
            return Optional.of(new Signal(type, record.getStrength(), record.getSessionId(),
                record.getMessageId(), toInstant(record.getObservedAt()), payload));
        } catch (Exception e) {
            log.warn("Skipping unparseable signal. id={} type={}", record.getId(), record.getSignalType(), e);
            return Optional.empty();
        }
    }

    // ── Dimension scores ────────────────────────────────────────────────────

    public String writeValue(DomainValue value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize domain value for " + value.domain(), e);
        }
    }

    public Optional<StoredBelief> toBelief(DimensionScoreRecord record) {
        try {
            BeliefDomain domain = BeliefDomain.valueOf(record.getDomain());
            DomainValue value = objectMapper.readValue(record.getValue(), domain.valueType());
            return Optional.of(new StoredBelief(domain, value, record.getConfidence(),
                record.getDecayRate(), toInstant(record.getLastDecayedAt())));
        } catch (Exception e) {
            log.warn("Skipping unparseable dimension score. id={} domain={}", record.getId(), record.getDomain(), e);
            return Optional.empty();
        }
    }

    public static String writeSources(Collection<EvidenceSource> sources) {
        if (sources == null || sources.isEmpty()) return "";
        return EnumSet.copyOf(sources).stream().map(Enum::name).collect(Collectors.joining(","));
    }

    public static Set<EvidenceSource> readSources(String raw) {
        if (raw == null || raw.isBlank()) return Set.of();
        EnumSet<EvidenceSource> sources = EnumSet.noneOf(EvidenceSource.class);
        Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .forEach(s -> {
                try {
                    sources.add(EvidenceSource.valueOf(s));
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring unknown evidence source. value={}", s);
                }
            });
        return sources;
    }

    // ── Facts ───────────────────────────────────────────────────────────────

    public KnownFact toFact(ProfileFactRecord record) {
        BeliefDomain domain = record.getDomain() != null ? BeliefDomain.valueOf(record.getDomain()) : null;
        EvidenceSource source = record.getSource() != null
            ? EvidenceSource.valueOf(record.getSource()) : EvidenceSource.ELICITATION;
        return new KnownFact(domain, record.getFactType(), record.getFactKey(), record.getFactValue(),
            source, record.isExplicit());
    }

    public String writeFacts(List<KnownFact> facts) {
        try {
            return objectMapper.writeValueAsString(facts);
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize extracted facts", e);
        }
    }

    public List<KnownFact> readFacts(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, FACT_LIST);
        } catch (Exception e) {
            log.warn("Skipping unparseable extracted facts", e);
            return List.of();
        }
    }

    // ── Time ────────────────────────────────────────────────────────────────

    public static LocalDateTime toUtc(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    public static Instant toInstant(LocalDateTime utc) {
        return utc == null ? null : utc.toInstant(ZoneOffset.UTC);
    }
}
