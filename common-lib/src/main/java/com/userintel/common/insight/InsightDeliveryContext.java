package com.userintel.common.insight;

/**
 * Live conversational state supplied with a delivery request.
 *
 * @param idleSeconds        seconds since the user last did anything, null when unknown
 * @param currentTopic       topic of the ongoing conversation, matched against context tags
 * @param conversationActive true while an exchange is in flight
 * @param focusMode          true while the user has asked not to be disturbed
 */
public record InsightDeliveryContext(Long idleSeconds,
                                     String currentTopic,
                                     boolean conversationActive,
                                     boolean focusMode) {

    public static InsightDeliveryContext none() {
        return new InsightDeliveryContext(null, null, false, false);
    }

    public static InsightDeliveryContext idleFor(long seconds) {
        return new InsightDeliveryContext(seconds, null, false, false);
    }

    public static InsightDeliveryContext onTopic(String topic) {
        return new InsightDeliveryContext(null, topic, false, false);
    }
}
