package com.queryguard.rule.checker;

import com.queryguard.model.RejectionReason;
import com.queryguard.rule.JqlRules;
import com.queryguard.rule.checker.QueryChecker.CheckResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JqlFieldCheckerTest {

    private final JqlFieldChecker checker = new JqlFieldChecker(JqlRules.defaults());

    @Test
    void shouldAcceptCompoundKeywordOperators() {
        assertFalse(checker.check("status NOT IN (Done, Closed)").violated());
        assertFalse(checker.check("assignee IS NOT EMPTY").violated());
        assertFalse(checker.check("status WAS \"Open\"").violated());
        assertFalse(checker.check("status WAS NOT IN (Open)").violated());
        assertFalse(checker.check("priority NOT CHANGED").violated());
    }

    @Test
    void shouldCheckFieldsInsideParentheses() {
        CheckResult result = checker.check("project = TEST AND (evilField = 1)");

        assertEquals(RejectionReason.UNKNOWN_FIELD, result.reason());
        assertEquals("evilField", result.matchedText());
    }

    @Test
    void shouldRejectLiteralInFieldPosition() {
        assertEquals(RejectionReason.UNKNOWN_FIELD, checker.check("'1'='1'").reason());
        assertEquals(RejectionReason.UNKNOWN_FIELD, checker.check("1 = 1").reason());
    }

    @Test
    void shouldValidateCustomFieldRange() {
        assertFalse(checker.check("cf[10001] = \"x\"").violated());
        assertEquals(RejectionReason.UNKNOWN_FIELD, checker.check("cf[1] = \"x\"").reason());
        assertEquals(RejectionReason.UNKNOWN_FIELD, checker.check("cf[abc] = \"x\"").reason());
    }

    @Test
    void shouldValidateOrderByTerms() {
        assertFalse(checker.check("project = TEST ORDER BY created DESC, priority ASC").violated());
        assertEquals(RejectionReason.UNKNOWN_FIELD, checker.check("project = TEST ORDER BY password").reason());
        assertEquals(RejectionReason.UNKNOWN_FIELD, checker.check("project = TEST ORDER BY created foo").reason());
    }

    @Test
    void shouldIgnoreValuesInInList() {
        assertFalse(checker.check("labels IN (anything, whatever)").violated());
    }
}
