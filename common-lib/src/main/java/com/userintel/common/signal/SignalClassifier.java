package com.userintel.common.signal;

import com.userintel.common.model.Signal;

import java.util.List;

/**
 * Swappable vocabulary that turns message text into content signals
 * (feedback, stated preferences, goals, decisions, question sophistication).
 *
 * <p>Implementations must be deterministic and side-effect free. They may
 * return an empty list; they must not return null.
 */
public interface SignalClassifier {

    List<Signal> classify(String message, MessageMetadata metadata);
}
