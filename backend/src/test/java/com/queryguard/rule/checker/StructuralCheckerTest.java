package com.queryguard.rule.checker;

import com.queryguard.model.RejectionReason;
import com.queryguard.rule.checker.QueryChecker.CheckResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StructuralCheckerTest {

    private final StructuralChecker jql = StructuralChecker.forJql(3);
    private final StructuralChecker graphQl = StructuralChecker.forGraphQl(10);

    @Test
    void shouldAcceptEscapedQuotesInsideLiteral() {
        assertFalse(jql.check("summary ~ \"a \\\"b\\\" c\"").violated());
    }

    @Test
    void shouldIgnoreParenthesesInsideLiteral() {
        assertFalse(jql.check("summary ~ \"((\"").violated());
    }

    @Test
    void shouldRejectCloseBeforeOpen() {
        CheckResult result = jql.check(") project = TEST (");

        assertTrue(result.violated());
        assertEquals(RejectionReason.UNBALANCED_DELIMITERS, result.reason());
    }

    @Test
    void shouldRejectOddDoubleQuoteCountEvenWhenEscaped() {
        assertEquals(RejectionReason.UNBALANCED_QUOTES, jql.check("summary ~ \"a\\\"b\"").reason());
        assertEquals(RejectionReason.UNBALANCED_QUOTES, jql.check("summary ~ 'a\"b'").reason());
    }

    @Test
    void shouldRejectUnterminatedSingleQuote() {
        CheckResult result = jql.check("summary ~ 'abc");

        assertEquals(RejectionReason.UNBALANCED_QUOTES, result.reason());
        assertEquals(10, StructuralChecker.findUnterminatedQuote("summary ~ 'abc"));
        assertEquals(-1, StructuralChecker.findUnterminatedQuote("summary ~ \"it's\""));
    }

    @Test
    void shouldEnforceDepthLimit() {
        assertFalse(jql.check("(((project = TEST)))").violated());
        assertEquals(RejectionReason.NESTING_TOO_DEEP, jql.check("((((project = TEST))))").reason());
    }

    @Test
    void shouldCountOnlyBracesForGraphQl() {
        assertFalse(graphQl.check("query { getTest(id: \"}\") { issueId } }").violated());
        assertEquals(RejectionReason.UNBALANCED_DELIMITERS, graphQl.check("query { getTests { id }").reason());
    }

    @Test
    void shouldComputeMaxDepth() {
        assertEquals(2, StructuralChecker.maxDepth("((a)(b))", '(', ')'));
        assertEquals(0, StructuralChecker.maxDepth("no parens", '(', ')'));
    }
}
