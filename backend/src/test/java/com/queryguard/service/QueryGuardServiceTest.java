package com.queryguard.service;

import com.queryguard.model.RejectionReason;
import com.queryguard.model.ValidationOutcome;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryGuardServiceTest {

    private final QueryGuardService service =
            new QueryGuardService(JqlValidator.withDefaults(), GraphQlValidator.withDefaults());

    @Test
    void shouldReturnSanitizedOutcomeForAcceptedJql() {
        ValidationOutcome outcome = service.checkJql(" project = TEST ");

        assertTrue(outcome.accepted());
        assertEquals("project = TEST", outcome.sanitized());
        assertNull(outcome.reason());
    }

    @Test
    void shouldReturnRejectedOutcomeInsteadOfThrowing() {
        ValidationOutcome outcome = service.checkJql("evilField = 1");

        assertFalse(outcome.accepted());
        assertNull(outcome.sanitized());
        assertEquals(RejectionReason.UNKNOWN_FIELD, outcome.reason());
        assertEquals("evilField", outcome.matchedText());
        assertNotNull(outcome.message());
    }

    @Test
    void shouldCheckGraphQlWithVariables() {
        ValidationOutcome accepted = service.checkGraphQl("query { getTests { total } }", Map.of("limit", 10));
        assertTrue(accepted.accepted());

        ValidationOutcome rejected = service.checkGraphQl("query { getTests { total } }",
                Map.of("limit", "${jndi}"));
        assertEquals(RejectionReason.DANGEROUS_PATTERN, rejected.reason());
    }

    @Test
    void shouldCheckGraphQlOperation() {
        assertTrue(service.checkGraphQlOperation("{ getTests { total } }", "getTests", null).accepted());
        assertEquals(RejectionReason.UNKNOWN_OPERATION,
                service.checkGraphQlOperation("{ getTests { total } }", "getTest", null).reason());
    }

    @Test
    void shouldEscapeByLanguage() {
        assertEquals("a\\\"b", service.escape("a\"b", "JQL"));
        assertEquals("a\\nb", service.escape("a\nb", "graphql"));
        assertEquals("ab", service.escape("a\nb", "jql"));
        assertThrows(IllegalArgumentException.class, () -> service.escape("x", "sql"));
    }
}
