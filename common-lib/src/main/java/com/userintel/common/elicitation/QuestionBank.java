package com.userintel.common.elicitation;

import com.userintel.common.model.BeliefDomain;

import java.util.List;
import java.util.Optional;

/**
 * The fixed onboarding questions, two per phase.
 */
public final class QuestionBank {

    public static final String IDENTITY_ROLE      = "identity_role";
    public static final String IDENTITY_NAME      = "identity_name";
    public static final String GOALS_CURRENT      = "goals_current";
    public static final String GOALS_CHALLENGE    = "goals_challenge";
    public static final String COMM_VERBOSITY     = "comm_verbosity";
    public static final String COMM_STYLE         = "comm_style";
    public static final String EXPERTISE_AREAS    = "expertise_areas";
    public static final String EXPERTISE_LEARNING = "expertise_learning";

    public static final List<ElicitationQuestion> QUESTIONS = List.of(
        new ElicitationQuestion(IDENTITY_ROLE, BeliefDomain.IDENTITY_CONTEXT,
            "What's your role or what do you do?", "Your role", 10, 1, null),
        new ElicitationQuestion(IDENTITY_NAME, BeliefDomain.IDENTITY_CONTEXT,
            "What should I call you?", "Your name", 9, 1, p -> p.knownName() != null),
        new ElicitationQuestion(GOALS_CURRENT, BeliefDomain.GOALS_VALUES,
            "What are you working on or trying to achieve right now?", "Current goals", 8, 2, null),
        new ElicitationQuestion(GOALS_CHALLENGE, BeliefDomain.GOALS_VALUES,
            "What's the biggest challenge you're facing?", "Main challenge", 7, 2, null),
        new ElicitationQuestion(COMM_VERBOSITY, BeliefDomain.COMMUNICATION_PREFS,
            "Do you prefer brief, to-the-point answers or more detailed explanations?", "Response length", 6, 3, null),
        new ElicitationQuestion(COMM_STYLE, BeliefDomain.COMMUNICATION_PREFS,
            "Would you rather I give you one recommendation or multiple options to choose from?",
            "Options preference", 5, 3, null),
        new ElicitationQuestion(EXPERTISE_AREAS, BeliefDomain.EXPERTISE_CALIBRATION,
            "What topics or areas are you most experienced in?", "Expert areas", 4, 4, null),
        new ElicitationQuestion(EXPERTISE_LEARNING, BeliefDomain.EXPERTISE_CALIBRATION,
            "Is there anything you're actively trying to learn?", "Learning goals", 3, 4, null)
    );

    private QuestionBank() {}

    public static Optional<ElicitationQuestion> find(String id) {
        return QUESTIONS.stream().filter(q -> q.id().equals(id)).findFirst();
    }

    /** Domains that at least one question addresses. */
    public static List<BeliefDomain> coveredDomains() {
        return QUESTIONS.stream().map(ElicitationQuestion::domain).distinct().toList();
    }

    /** Chat-ready wording appended to a response. */
    public static String format(ElicitationQuestion question) {
        return "Quick question to help me help you better: " + question.question()
            + " (Skip if you'd rather not say)";
    }
}
