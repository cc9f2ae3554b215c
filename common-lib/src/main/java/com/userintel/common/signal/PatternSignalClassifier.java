package com.userintel.common.signal;

import com.userintel.common.model.Signal;
import com.userintel.common.model.SignalType;
import com.userintel.common.model.payload.DecisionPayload;
import com.userintel.common.model.payload.FeedbackKind;
import com.userintel.common.model.payload.FeedbackPayload;
import com.userintel.common.model.payload.GoalPayload;
import com.userintel.common.model.payload.GoalTimeframe;
import com.userintel.common.model.payload.PreferenceKey;
import com.userintel.common.model.payload.PreferencePayload;
import com.userintel.common.model.payload.QuestionPayload;
import com.userintel.common.model.payload.SignalPayload;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default English regular-expression vocabulary for content signals.
 *
 * <p>Each pattern class fires at most once per message; several classes may
 * fire for the same message. Within a class the first matching pattern wins.
 *
 * <pre>
 *   feedback     correction 0.8 › praise 0.7 › frustration 0.6
 *   preference   0.9, key/value pair
 *   question     only for messages containing '?', 0.5 + complexity × 0.3
 *   goal         0.7
 *   decision     made 0.8 › still deciding 0.7
 * </pre>
 */
public class PatternSignalClassifier implements SignalClassifier {

    static final double CORRECTION_STRENGTH  = 0.8;
    static final double PRAISE_STRENGTH      = 0.7;
    static final double FRUSTRATION_STRENGTH = 0.6;
    static final double PREFERENCE_STRENGTH  = 0.9;
    static final double GOAL_STRENGTH        = 0.7;
    static final double DECIDED_STRENGTH     = 0.8;
    static final double DECIDING_STRENGTH    = 0.7;

    /** Goal and decision text is cut to this many characters. */
    static final int MAX_TEXT_LENGTH = 200;

    /** Complexity above which a question implies domain expertise. */
    static final double EXPERTISE_COMPLEXITY = 0.6;

    // ── Feedback ───────────────────────────────────────────────────

    private static final List<Pattern> CORRECTION = patterns(
        "\\bthat's (not|wrong|incorrect)\\b",
        "\\bactually,?\\s+(i|it|that)\\b",
        "\\bno,?\\s+(i meant|what i meant|i was asking)",
        "\\byou misunderstood\\b",
        "\\bthat's not what i (meant|asked|wanted)\\b");

    private static final List<Pattern> PRAISE = patterns(
        "\\b(perfect|exactly|great|awesome|thanks|thank you|helpful)\\b",
        "\\bthat's (right|correct|what i needed)\\b",
        "\\bthis (is|looks) (great|good|perfect)\\b");

    private static final List<Pattern> FRUSTRATION = patterns(
        "\\b(still|again|already told you|i said)\\b",
        "\\bwhy (can't you|don't you|won't you)\\b",
        "\\bthis (isn't|doesn't|won't) (work|help)\\b",
        "\\b(frustrated|annoyed|confused)\\b");

    // ── Preferences ────────────────────────────────────────────────

    private record PreferenceRule(Pattern pattern, PreferenceKey key, Function<Matcher, String> value) {}

    private static final List<PreferenceRule> PREFERENCES = List.of(
        new PreferenceRule(pattern("\\bi (prefer|like|want) (shorter|brief|concise|quick) (responses?|answers?)"),
            PreferenceKey.VERBOSITY, m -> "concise"),
        new PreferenceRule(pattern("\\bi (prefer|like|want) (detailed|longer|thorough|comprehensive) (responses?|answers?)"),
            PreferenceKey.VERBOSITY, m -> "detailed"),
        new PreferenceRule(pattern("\\bjust (give me|tell me) the (answer|solution|result)"),
            PreferenceKey.VERBOSITY, m -> "concise"),
        new PreferenceRule(pattern("\\bi (prefer|like|want) (bullet|bulleted) (points|lists)"),
            PreferenceKey.FORMAT, m -> "bullets"),
        new PreferenceRule(pattern("\\bi('m| am) (a|an) (expert|experienced|senior) (in|at|with) (.+)"),
            PreferenceKey.EXPERT_IN, m -> cleanCapture(m.group(5))),
        new PreferenceRule(pattern("\\bi('m| am) (new to|learning|a beginner in|just starting with) (.+)"),
            PreferenceKey.LEARNING, m -> cleanCapture(m.group(3))),
        new PreferenceRule(pattern("\\bmy name is (.+)"),
            PreferenceKey.NAME, m -> cleanCapture(m.group(1))),
        new PreferenceRule(pattern("\\bi('m| am) (a|an) (.+?) (at|for|in|working)\\b"),
            PreferenceKey.ROLE, m -> cleanCapture(m.group(3))),
        new PreferenceRule(pattern("\\bcall me (.+)"),
            PreferenceKey.PREFERRED_NAME, m -> cleanCapture(m.group(1)))
    );

    // ── Question sophistication ────────────────────────────────────

    private static final List<Pattern> COMPLEX_TERMS = patterns(
        "\\b(architecture|implementation|optimization|algorithm|performance|scalability)\\b",
        "\\b(trade-?offs?|considerations?|implications?|constraints?)\\b",
        "\\b(best practices?|patterns?|anti-?patterns?)\\b");

    private static final Pattern COMPARATIVE = pattern(
        "\\b(compare|versus|vs\\.?|better|worse|pros|cons|advantages|disadvantages)\\b");
    private static final Pattern WHY = pattern("\\bwhy\\b");
    private static final Pattern FOLLOW_UP = pattern("\\b(also|another|follow.?up|related)\\b");

    private record TopicRule(String domain, Pattern pattern) {}

    private static final List<TopicRule> QUESTION_DOMAINS = List.of(
        new TopicRule("programming",
            pattern("\\b(code|function|class|api|database|frontend|backend|react|node|python)\\b")),
        new TopicRule("business",
            pattern("\\b(revenue|market|customer|strategy|growth|pricing|sales)\\b")),
        new TopicRule("writing",
            pattern("\\b(write|writing|essay|article|blog|content|copy)\\b"))
    );

    // ── Goals ──────────────────────────────────────────────────────

    private static final List<Pattern> GOALS = patterns(
        "\\bi('m| am) (trying|working|aiming) to (.+)",
        "\\bmy goal is to (.+)",
        "\\bi want to (.+)",
        "\\bi need to (.+)",
        "\\bi('m| am) (building|creating|developing|launching) (.+)",
        "\\bi('m| am) (planning|preparing) (to|for) (.+)");

    private static final Pattern SHORT_TERM  = pattern("\\b(today|this week|soon|right now|asap)\\b");
    private static final Pattern LONG_TERM   = pattern("\\b(eventually|someday|long.?term|next year|future)\\b");
    private static final Pattern MEDIUM_TERM = pattern("\\b(this month|next month|this quarter|next few weeks)\\b");

    private static final List<Pattern> PROGRESS = patterns(
        "\\bi (made|achieved|completed|finished|done with)\\b",
        "\\bi (finally|just) (did|finished|completed)\\b",
        "\\bprogress on\\b");

    // ── Decisions ──────────────────────────────────────────────────

    private static final List<Pattern> DECIDED = patterns(
        "\\bi('ve| have) decided to (.+)",
        "\\bi (decided|chose|picked|went with) (.+)",
        "\\bi('m| am) going (to|with) (.+)",
        "\\bmy decision is (.+)");

    private static final List<Pattern> DECIDING = patterns(
        "\\bi('m| am) (deciding|considering|thinking about|debating) (whether to|if|between)(.*)",
        "\\bshould i (.+)",
        "\\bi can't decide (whether|if|between)(.*)",
        "\\bhelp me (decide|choose|pick)(.*)",
        "\\bwhat (should i|would you) (do|choose|recommend)(.*)");

    @Override
    public List<Signal> classify(String message, MessageMetadata metadata) {
        if (message == null || message.isBlank()) {
            return List.of();
        }
        List<Signal> signals = new ArrayList<>(5);
        detectFeedback(message).ifPresent(s -> signals.add(s.toSignal(metadata)));
        detectPreference(message).ifPresent(s -> signals.add(s.toSignal(metadata)));
        analyzeQuestion(message).ifPresent(s -> signals.add(s.toSignal(metadata)));
        detectGoal(message).ifPresent(s -> signals.add(s.toSignal(metadata)));
        detectDecision(message).ifPresent(s -> signals.add(s.toSignal(metadata)));
        return signals;
    }

    // ── Detectors ──────────────────────────────────────────────────

    Optional<Draft> detectFeedback(String message) {
        if (anyFind(CORRECTION, message)) {
            return draft(SignalType.FEEDBACK, CORRECTION_STRENGTH, new FeedbackPayload(FeedbackKind.CORRECTION, true));
        }
        if (anyFind(PRAISE, message)) {
            return draft(SignalType.FEEDBACK, PRAISE_STRENGTH, new FeedbackPayload(FeedbackKind.PRAISE, true));
        }
        if (anyFind(FRUSTRATION, message)) {
            return draft(SignalType.FEEDBACK, FRUSTRATION_STRENGTH, new FeedbackPayload(FeedbackKind.FRUSTRATION, false));
        }
        return Optional.empty();
    }

    Optional<Draft> detectPreference(String message) {
        for (PreferenceRule rule : PREFERENCES) {
            Matcher m = rule.pattern().matcher(message);
            if (m.find()) {
                String value = rule.value().apply(m);
                if (value == null || value.isEmpty()) continue;
                return draft(SignalType.PREFERENCE_STATEMENT, PREFERENCE_STRENGTH,
                    new PreferencePayload(rule.key(), value));
            }
        }
        return Optional.empty();
    }

    Optional<Draft> analyzeQuestion(String message) {
        if (message.indexOf('?') < 0) {
            return Optional.empty();
        }
        int words = MessageStyleAnalyzer.countWords(message);
        double complexity = 0.0;
        if (words > 30) complexity += 0.2;
        if (words > 50) complexity += 0.2;
        if (MessageStyleAnalyzer.countChar(message, '?') > 1) complexity += 0.2;
        if (anyFind(COMPLEX_TERMS, message)) complexity += 0.3;
        if (COMPARATIVE.matcher(message).find()) complexity += 0.2;
        if (WHY.matcher(message).find()) complexity += 0.1;
        complexity = Math.min(1.0, complexity);

        String domain = QUESTION_DOMAINS.stream()
            .filter(t -> t.pattern().matcher(message).find())
            .map(TopicRule::domain)
            .findFirst()
            .orElse(null);

        return draft(SignalType.QUESTION_SOPHISTICATION, 0.5 + complexity * 0.3,
            new QuestionPayload(complexity, domain, complexity > EXPERTISE_COMPLEXITY,
                FOLLOW_UP.matcher(message).find()));
    }

    Optional<Draft> detectGoal(String message) {
        for (Pattern p : GOALS) {
            Matcher m = p.matcher(message);
            if (!m.find()) continue;

            GoalTimeframe timeframe = GoalTimeframe.MEDIUM;
            if (SHORT_TERM.matcher(message).find())       timeframe = GoalTimeframe.SHORT;
            else if (LONG_TERM.matcher(message).find())   timeframe = GoalTimeframe.LONG;
            else if (MEDIUM_TERM.matcher(message).find()) timeframe = GoalTimeframe.MEDIUM;

            boolean progress = anyFind(PROGRESS, message);
            return draft(SignalType.GOAL_REFERENCE, GOAL_STRENGTH,
                new GoalPayload(lastCaptureOr(m, message), timeframe, progress));
        }
        return Optional.empty();
    }

    Optional<Draft> detectDecision(String message) {
        for (Pattern p : DECIDED) {
            Matcher m = p.matcher(message);
            if (m.find()) {
                return draft(SignalType.DECISION_MENTION, DECIDED_STRENGTH,
                    new DecisionPayload(lastCaptureOr(m, message), true));
            }
        }
        for (Pattern p : DECIDING) {
            Matcher m = p.matcher(message);
            if (m.find()) {
                return draft(SignalType.DECISION_MENTION, DECIDING_STRENGTH,
                    new DecisionPayload(lastCaptureOr(m, message), false));
            }
        }
        return Optional.empty();
    }

    // ── Helpers ────────────────────────────────────────────────────

    /** A signal without its message context. */
    record Draft(SignalType type, double strength, SignalPayload payload) {
        Signal toSignal(MessageMetadata meta) {
            return new Signal(type, strength, meta.sessionId(), meta.messageId(), meta.timestamp(), payload);
        }
    }

    private static Optional<Draft> draft(SignalType type, double strength, SignalPayload payload) {
        return Optional.of(new Draft(type, strength, payload));
    }

    private static String lastCaptureOr(Matcher m, String message) {
        String captured = m.groupCount() > 0 ? m.group(m.groupCount()) : null;
        String text = captured == null || captured.isBlank() ? message.trim() : captured.trim();
        return text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;
    }

    private static String cleanCapture(String raw) {
        if (raw == null) return null;
        String trimmed = raw.trim().replaceAll("[.!?,;]+$", "").trim();
        return trimmed.length() > MAX_TEXT_LENGTH ? trimmed.substring(0, MAX_TEXT_LENGTH) : trimmed;
    }

    private static boolean anyFind(List<Pattern> patterns, String message) {
        return patterns.stream().anyMatch(p -> p.matcher(message).find());
    }

    private static Pattern pattern(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private static List<Pattern> patterns(String... regexes) {
        List<Pattern> list = new ArrayList<>(regexes.length);
        for (String r : regexes) list.add(pattern(r));
        return List.copyOf(list);
    }
}
