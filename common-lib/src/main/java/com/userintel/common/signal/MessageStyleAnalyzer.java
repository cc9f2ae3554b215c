package com.userintel.common.signal;

import com.userintel.common.model.payload.MessageStylePayload;
import com.userintel.common.model.payload.MessageTone;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Measures how a message was written: length, sentence count, list structure,
 * technical vocabulary, question marks and overall tone.
 *
 * <p>Never fails. A null or blank message yields zero words and one sentence.
 */
public final class MessageStyleAnalyzer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern STRUCTURE = Pattern.compile("^\\s*[-*•]\\s|^\\s*\\d+[.)]\\s", Pattern.MULTILINE);

    private static final List<Pattern> TECHNICAL_TERMS = List.of(
        Pattern.compile("\\b(api|sdk|framework|algorithm|database|server|client|async|await|function|class|interface)\\b",
            Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(machine learning|neural|tensor|gradient|optimization)\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(kubernetes|docker|aws|azure|gcp|terraform)\\b", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern CASUAL = Pattern.compile(
        "\\b(hi|hey|thanks|please|could you|would you)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern FORMAL = Pattern.compile(
        "\\b(pursuant|regarding|hereby|accordingly)\\b", Pattern.CASE_INSENSITIVE);

    /** Technical vocabulary only sets the tone for messages longer than this. */
    private static final int TECHNICAL_TONE_MIN_WORDS = 20;

    private MessageStyleAnalyzer() {}

    public static MessageStylePayload analyze(String message) {
        String text = message == null ? "" : message;

        int wordCount = countWords(text);
        int sentenceCount = Math.max(1, countSentences(text));
        boolean hasStructure = STRUCTURE.matcher(text).find();
        boolean hasTechnical = hasTechnicalTerms(text);
        int questionCount = countChar(text, '?');

        MessageTone tone;
        if (hasTechnical && wordCount > TECHNICAL_TONE_MIN_WORDS) {
            tone = MessageTone.TECHNICAL;
        } else if (CASUAL.matcher(text).find()) {
            tone = MessageTone.CASUAL;
        } else if (FORMAL.matcher(text).find()) {
            tone = MessageTone.FORMAL;
        } else {
            tone = MessageTone.MIXED;
        }

        return new MessageStylePayload(wordCount, sentenceCount, hasStructure, hasTechnical, questionCount, tone);
    }

    public static int countWords(String text) {
        if (text == null || text.isBlank()) return 0;
        int count = 0;
        for (String w : WHITESPACE.split(text.trim())) {
            if (!w.isEmpty()) count++;
        }
        return count;
    }

    public static boolean hasTechnicalTerms(String text) {
        if (text == null) return false;
        return TECHNICAL_TERMS.stream().anyMatch(p -> p.matcher(text).find());
    }

    static int countChar(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) n++;
        }
        return n;
    }

    private static int countSentences(String text) {
        int count = 0;
        for (String s : SENTENCE_END.split(text)) {
            if (!s.isBlank()) count++;
        }
        return count;
    }
}
