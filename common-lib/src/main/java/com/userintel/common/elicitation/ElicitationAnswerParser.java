package com.userintel.common.elicitation;

import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.KnownFact;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a free-text answer into explicit facts. Blank answers are skips and
 * produce nothing.
 */
public final class ElicitationAnswerParser {

    /** At most this many areas are kept from a list answer. */
    static final int MAX_AREAS = 5;

    private static final Pattern LIST_SEPARATOR = Pattern.compile("[,;]|\\band\\b", Pattern.CASE_INSENSITIVE);

    private ElicitationAnswerParser() {}

    public static boolean isSkip(String response) {
        return response == null || response.isBlank();
    }

    public static List<KnownFact> parse(ElicitationQuestion question, String response) {
        if (question == null || isSkip(response)) {
            return List.of();
        }
        String answer = response.trim();
        String lower = answer.toLowerCase(Locale.ROOT);

        return switch (question.id()) {
            case QuestionBank.IDENTITY_NAME -> List.of(
                KnownFact.elicited(BeliefDomain.IDENTITY_CONTEXT, "name", "preferredName", answer));
            case QuestionBank.IDENTITY_ROLE -> List.of(
                KnownFact.elicited(BeliefDomain.IDENTITY_CONTEXT, "identity", "role", answer));
            case QuestionBank.GOALS_CURRENT -> List.of(
                KnownFact.elicited(BeliefDomain.GOALS_VALUES, "goal", "current", answer));
            case QuestionBank.GOALS_CHALLENGE -> List.of(
                KnownFact.elicited(BeliefDomain.GOALS_VALUES, "challenge", "main", answer));
            case QuestionBank.COMM_VERBOSITY -> List.of(
                KnownFact.elicited(BeliefDomain.COMMUNICATION_PREFS, "preference", "verbosity", verbosity(lower)));
            case QuestionBank.COMM_STYLE -> List.of(
                KnownFact.elicited(BeliefDomain.COMMUNICATION_PREFS, "preference", "optionsVsRecommendation",
                    optionsPreference(lower)));
            case QuestionBank.EXPERTISE_AREAS -> areas(answer, "expert");
            case QuestionBank.EXPERTISE_LEARNING -> areas(answer, "learning");
            default -> List.of();
        };
    }

    static String verbosity(String lower) {
        if (lower.contains("brief") || lower.contains("short") || lower.contains("concise")) return "concise";
        if (lower.contains("detail") || lower.contains("thorough") || lower.contains("comprehensive")) return "detailed";
        return "moderate";
    }

    static String optionsPreference(String lower) {
        if (lower.contains("one") || lower.contains("single") || lower.contains("recommendation")) return "-1";
        if (lower.contains("multiple") || lower.contains("options") || lower.contains("choice")) return "1";
        return "0";
    }

    static List<String> splitAreas(String answer) {
        List<String> areas = new ArrayList<>();
        for (String part : LIST_SEPARATOR.split(answer)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) areas.add(trimmed);
            if (areas.size() == MAX_AREAS) break;
        }
        return areas;
    }

    private static List<KnownFact> areas(String answer, String factType) {
        List<String> areas = splitAreas(answer);
        List<KnownFact> facts = new ArrayList<>(areas.size());
        for (int i = 0; i < areas.size(); i++) {
            facts.add(KnownFact.elicited(BeliefDomain.EXPERTISE_CALIBRATION, factType, "area_" + i, areas.get(i)));
        }
        return facts;
    }
}
