package com.userintel.common.signal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword-list topic classifier. A message may carry several topics; they are
 * returned in declaration order.
 */
public class KeywordTopicClassifier implements TopicClassifier {

    private static final Map<String, Pattern> TOPICS = new LinkedHashMap<>();

    static {
        TOPICS.put("technical", keywords("code", "api", "bug", "deploy", "database", "server", "function", "error"));
        TOPICS.put("business", keywords("revenue", "customer", "market", "pricing", "sales", "strategy", "growth"));
        TOPICS.put("creative", keywords("design", "write", "story", "idea", "brainstorm", "draft"));
        TOPICS.put("personal", keywords("family", "health", "feel", "habit", "weekend", "life"));
        TOPICS.put("operational", keywords("process", "workflow", "schedule", "meeting", "deadline", "plan"));
        TOPICS.put("learning", keywords("learn", "understand", "explain", "course", "study", "tutorial"));
    }

    @Override
    public List<String> classify(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<String> topics = new ArrayList<>();
        for (Map.Entry<String, Pattern> e : TOPICS.entrySet()) {
            if (e.getValue().matcher(text).find()) topics.add(e.getKey());
        }
        return topics;
    }

    private static Pattern keywords(String... words) {
        return Pattern.compile("\\b(" + String.join("|", words) + ")\\w*\\b", Pattern.CASE_INSENSITIVE);
    }
}
