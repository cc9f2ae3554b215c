package com.userintel.common.elicitation;

import com.userintel.common.model.KnownFact;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ElicitationAnswerParserTest {

    private static ElicitationQuestion q(String id) {
        return QuestionBank.find(id).orElseThrow();
    }

    @Test
    @DisplayName("blank answer → skip, no facts")
    void blank_skip() {
        assertTrue(ElicitationAnswerParser.isSkip("  "));
        assertTrue(ElicitationAnswerParser.parse(q(QuestionBank.IDENTITY_ROLE), "").isEmpty());
    }

    @Test
    @DisplayName("role answer → identity/role fact, explicit")
    void role() {
        KnownFact fact = ElicitationAnswerParser.parse(q(QuestionBank.IDENTITY_ROLE), " Staff engineer ").get(0);
        assertEquals("identity", fact.factType());
        assertEquals("role", fact.key());
        assertEquals("Staff engineer", fact.value());
        assertTrue(fact.explicit());
        assertEquals(1.0, fact.confidence());
    }

    @Test
    @DisplayName("verbosity answer keywords → concise / detailed / moderate")
    void verbosity() {
        assertEquals("concise", ElicitationAnswerParser.parse(q(QuestionBank.COMM_VERBOSITY), "Keep it brief").get(0).value());
        assertEquals("detailed", ElicitationAnswerParser.parse(q(QuestionBank.COMM_VERBOSITY), "Thorough please").get(0).value());
        assertEquals("moderate", ElicitationAnswerParser.parse(q(QuestionBank.COMM_VERBOSITY), "depends").get(0).value());
    }

    @Test
    @DisplayName("options answer → -1 / 1 / 0")
    void options() {
        assertEquals("-1", ElicitationAnswerParser.parse(q(QuestionBank.COMM_STYLE), "just a recommendation").get(0).value());
        assertEquals("1", ElicitationAnswerParser.parse(q(QuestionBank.COMM_STYLE), "multiple paths").get(0).value());
    }

    @Test
    @DisplayName("areas split on comma, semicolon and 'and', at most five")
    void areas() {
        List<KnownFact> facts = ElicitationAnswerParser.parse(q(QuestionBank.EXPERTISE_AREAS),
            "Java, Kafka; search and caching, compilers, networking, databases");
        assertEquals(5, facts.size());
        assertEquals("Java", facts.get(0).value());
        assertEquals("search", facts.get(2).value());
        assertEquals("area_4", facts.get(4).key());
        assertTrue(facts.stream().allMatch(f -> "expert".equals(f.factType())));
    }
}
