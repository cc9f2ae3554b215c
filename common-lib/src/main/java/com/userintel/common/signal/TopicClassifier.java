package com.userintel.common.signal;

import java.util.List;

/**
 * Swappable mapping from message text to coarse topic labels. Used by the
 * pattern-break detector and by contextual insight matching.
 */
public interface TopicClassifier {

    /** Never null; empty when no topic is recognised. */
    List<String> classify(String text);
}
