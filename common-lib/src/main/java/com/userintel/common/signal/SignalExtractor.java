package com.userintel.common.signal;

import com.userintel.common.model.Signal;
import com.userintel.common.model.SignalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns one user message into typed, timestamped signals.
 *
 * <p>Always emits exactly one {@link SignalType#MESSAGE_STYLE} signal first,
 * then whatever the configured {@link SignalClassifier}s recognise, then a
 * {@link SignalType#MODE_SELECTION} signal when the metadata declares a mode.
 * A classifier that fails is logged and skipped. Extraction itself never throws.
 *
 * <p>Never touches storage. Deterministic for a given message, metadata and clock.
 */
public class SignalExtractor {

    private static final Logger log = LoggerFactory.getLogger(SignalExtractor.class);

    /** Strength of the always-present style signal. */
    static final double STYLE_STRENGTH = 0.5;

    private final List<SignalClassifier> classifiers;
    private final Clock clock;

    public SignalExtractor(List<SignalClassifier> classifiers, Clock clock) {
        this.classifiers = List.copyOf(classifiers);
        this.clock       = Objects.requireNonNull(clock, "clock");
    }

    /** Extractor with the default English vocabulary. */
    public static SignalExtractor withDefaults(Clock clock) {
        return new SignalExtractor(List.of(new PatternSignalClassifier()), clock);
    }

    public List<Signal> extract(String message) {
        return extract(message, null);
    }

    public List<Signal> extract(String message, MessageMetadata metadata) {
        MessageMetadata meta = normalise(metadata);
        String text = message == null ? "" : message;

        List<Signal> signals = new ArrayList<>();
        signals.add(new Signal(SignalType.MESSAGE_STYLE, STYLE_STRENGTH,
            meta.sessionId(), meta.messageId(), meta.timestamp(), MessageStyleAnalyzer.analyze(text)));

        for (SignalClassifier classifier : classifiers) {
            try {
                List<Signal> found = classifier.classify(text, meta);
                if (found != null) signals.addAll(found);
            } catch (RuntimeException e) {
                log.warn("Signal classifier failed (non-fatal). classifier={} reason={}",
                         classifier.getClass().getSimpleName(), e.getMessage());
            }
        }

        if (meta.declaredMode() != null) {
            signals.add(BehaviorSignals.modeSelection(meta.declaredMode(), meta.sessionId(), meta.timestamp()));
        }
        return signals;
    }

    private MessageMetadata normalise(MessageMetadata metadata) {
        if (metadata == null) {
            return MessageMetadata.at(clock.instant());
        }
        if (metadata.timestamp() == null) {
            return new MessageMetadata(metadata.sessionId(), metadata.messageId(),
                clock.instant(), metadata.declaredMode());
        }
        return metadata;
    }
}
