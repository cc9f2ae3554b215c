package com.userintel.common.context;

import com.userintel.common.confidence.ConfidenceModel;
import com.userintel.common.confidence.ConfidenceThresholds;
import com.userintel.common.model.BeliefDomain;
import com.userintel.common.model.KnownFact;
import com.userintel.common.model.ResponseMode;
import com.userintel.common.model.domain.CommunicationPrefs;
import com.userintel.common.model.domain.ExpertiseCalibration;
import com.userintel.common.model.domain.GoalsValues;
import com.userintel.common.model.domain.IdentityContext;
import com.userintel.common.model.domain.RelationshipState;
import com.userintel.common.model.domain.TonePreference;
import com.userintel.common.model.domain.TrackedGoal;
import com.userintel.common.model.domain.Verbosity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the per-turn {@link ContextSummary} from stored beliefs and explicit facts.
 *
 * <p>Confidences are decayed to {@code now} first; beliefs that fall below
 * {@link ConfidenceThresholds#TREAT_AS_UNKNOWN} are ignored, and so is the
 * whole profile when the mean decayed confidence does. Explicit facts replace
 * the matching inferred fields.
 *
 * <p>No Spring dependency. No I/O. Pure function.
 */
public final class ProfileContextAssembler {

    private static final int MAX_LISTED = 3;

    private ProfileContextAssembler() {}

    public static ContextSummary assemble(Collection<StoredBelief> beliefs,
                                          Collection<KnownFact> facts,
                                          Instant now) {
        if (beliefs == null || beliefs.isEmpty()) {
            return ContextSummary.unknownUser();
        }

        Map<BeliefDomain, StoredBelief> usable = new EnumMap<>(BeliefDomain.class);
        double sum = 0;
        for (StoredBelief belief : beliefs) {
            double decayed = belief.decayedConfidence(now);
            sum += decayed;
            if (decayed >= ConfidenceThresholds.TREAT_AS_UNKNOWN) {
                usable.put(belief.domain(), belief);
            }
        }
        double overall = ConfidenceModel.round(sum / beliefs.size());
        if (overall < ConfidenceThresholds.TREAT_AS_UNKNOWN) {
            return ContextSummary.neutral(overall);
        }

        View view = View.from(usable, facts == null ? List.of() : facts);
        return format(view, overall);
    }

    // ── view ──────────────────────────────────────────────────────────────────

    private record View(String name, String role,
                        List<String> expert, List<String> learning,
                        Verbosity verbosity, TonePreference tone, double proactivity,
                        TrustLevel trust, AutonomyLevel autonomy,
                        List<String> goals) {

        static View from(Map<BeliefDomain, StoredBelief> beliefs, Collection<KnownFact> facts) {
            IdentityContext identity = valueOf(beliefs, BeliefDomain.IDENTITY_CONTEXT, IdentityContext.class, IdentityContext.empty());
            CommunicationPrefs comm  = valueOf(beliefs, BeliefDomain.COMMUNICATION_PREFS, CommunicationPrefs.class, CommunicationPrefs.DEFAULT);
            ExpertiseCalibration exp = valueOf(beliefs, BeliefDomain.EXPERTISE_CALIBRATION, ExpertiseCalibration.class, ExpertiseCalibration.empty());
            GoalsValues goals        = valueOf(beliefs, BeliefDomain.GOALS_VALUES, GoalsValues.class, GoalsValues.empty());
            RelationshipState rel    = beliefs.containsKey(BeliefDomain.RELATIONSHIP_STATE)
                ? valueOf(beliefs, BeliefDomain.RELATIONSHIP_STATE, RelationshipState.class, null) : null;

            String name = identity.name() != null ? identity.name() : identity.preferredName();
            String role = identity.role();
            Verbosity verbosity = comm.verbosity() == null ? Verbosity.MODERATE : comm.verbosity();
            List<String> expert   = new ArrayList<>(exp.expertDomains());
            List<String> learning = new ArrayList<>(exp.learningDomains());
            List<String> goalList = new ArrayList<>();
            for (TrackedGoal g : goals.activeGoals()) goalList.add(g.goal());

            List<String> factExpert = new ArrayList<>();
            List<String> factLearning = new ArrayList<>();
            for (KnownFact fact : facts) {
                if (!fact.explicit() || fact.value() == null || fact.value().isBlank()) continue;
                String key = fact.factType() + "/" + fact.key();
                switch (key) {
                    case "name/preferredName", "name/name" -> name = fact.value();
                    case "identity/role"                  -> role = fact.value();
                    case "preference/verbosity"           -> verbosity = parseVerbosity(fact.value(), verbosity);
                    case "goal/current"                   -> { if (!goalList.contains(fact.value())) goalList.add(0, fact.value()); }
                    default -> {
                        if ("expert".equals(fact.factType()))   factExpert.add(fact.value());
                        if ("learning".equals(fact.factType())) factLearning.add(fact.value());
                    }
                }
            }
            if (!factExpert.isEmpty())   expert = factExpert;
            if (!factLearning.isEmpty()) learning = factLearning;

            TrustLevel trust       = rel == null ? TrustLevel.NEW : TrustLevel.of(rel.trustMaturity());
            AutonomyLevel autonomy = rel == null ? AutonomyLevel.LOW : AutonomyLevel.of(rel.autonomyTolerance());
            TonePreference tone    = comm.tonePreference() == null ? TonePreference.EXPLORATORY : comm.tonePreference();

            return new View(name, role, expert, learning, verbosity, tone,
                comm.proactivityTolerance(), trust, autonomy, goalList);
        }

        private static <V> V valueOf(Map<BeliefDomain, StoredBelief> beliefs, BeliefDomain domain,
                                     Class<V> type, V fallback) {
            StoredBelief belief = beliefs.get(domain);
            if (belief == null || !type.isInstance(belief.value())) return fallback;
            return type.cast(belief.value());
        }

        private static Verbosity parseVerbosity(String raw, Verbosity fallback) {
            try {
                return Verbosity.valueOf(raw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return fallback;
            }
        }
    }

    // ── formatting ────────────────────────────────────────────────────────────

    private static ContextSummary format(View v, double overall) {
        List<String> parts = new ArrayList<>();

        if (v.name() != null) {
            parts.add("User's name is " + v.name() + (v.role() != null ? " (" + v.role() + ")" : "") + ".");
        } else if (v.role() != null) {
            parts.add("Works as " + v.role() + ".");
        }
        if (!v.expert().isEmpty()) {
            parts.add("Expert in: " + String.join(", ", head(v.expert())) + ".");
        }
        if (!v.learning().isEmpty()) {
            parts.add("Currently learning: " + String.join(", ", head(v.learning())) + ".");
        }

        List<String> comm = new ArrayList<>();
        if (v.verbosity() == Verbosity.CONCISE)  comm.add("prefers brief responses");
        if (v.verbosity() == Verbosity.DETAILED) comm.add("prefers detailed explanations");
        if (v.tone() == TonePreference.DIRECTIVE)  comm.add("direct communication");
        if (v.tone() == TonePreference.SUPPORTIVE) comm.add("supportive tone");
        if (!comm.isEmpty()) {
            parts.add("Communication style: " + String.join(", ", comm) + ".");
        }

        if (v.trust() == TrustLevel.ESTABLISHED) {
            parts.add("Established working relationship, can be more direct.");
        }
        if (v.autonomy() == AutonomyLevel.HIGH) {
            parts.add("High autonomy tolerance, can take initiative.");
        }
        if (!v.goals().isEmpty()) {
            parts.add("Current goals: " + String.join("; ", head(v.goals())) + ".");
        }

        double verbosityMultiplier = switch (v.verbosity()) {
            case CONCISE  -> 0.6;
            case DETAILED -> 1.5;
            case MODERATE -> 1.0;
        };
        ResponseMode suggested = v.verbosity() == Verbosity.CONCISE ? ResponseMode.QUICK
            : v.trust() == TrustLevel.ESTABLISHED ? ResponseMode.THOUGHTFUL : null;

        BehaviorAdapters adapters = new BehaviorAdapters(suggested, verbosityMultiplier,
            ConfidenceModel.clamp(v.proactivity()), v.autonomy().adapterValue());
        String summary = parts.isEmpty() ? "" : "User Profile:\n" + String.join("\n", parts);
        return new ContextSummary(true, summary, adapters, overall);
    }

    private static List<String> head(List<String> items) {
        return items.size() <= MAX_LISTED ? items : items.subList(0, MAX_LISTED);
    }
}
