package com.queryguard.rule.checker;

import com.queryguard.model.QueryLanguage;
import com.queryguard.model.RejectionReason;
import com.queryguard.rule.DangerousPatterns;
import com.queryguard.rule.GraphQlRules;
import com.queryguard.rule.checker.QueryChecker.CheckResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphQlVariableCheckerTest {

    private final GraphQlVariableChecker checker = new GraphQlVariableChecker(GraphQlRules.defaults(),
            new DangerousPatternChecker(QueryLanguage.GRAPHQL, DangerousPatterns.GRAPHQL));

    @Test
    void shouldPassNullAndEmptyVariables() {
        assertFalse(checker.check(null).violated());
        assertFalse(checker.check(Map.of()).violated());
    }

    @Test
    void shouldPassScalarsAndNull() {
        Map<String, Object> variables = new HashMap<>();
        variables.put("issueId", "12345");
        variables.put("limit", 10);
        variables.put("active", true);
        variables.put("cursor", null);

        assertFalse(checker.check(variables).violated());
    }

    @Test
    void shouldRejectTooManyVariablesBeforeCheckingNames() {
        Map<String, Object> variables = new HashMap<>();
        for (int i = 0; i < 51; i++) {
            variables.put("1bad" + i, i);
        }

        assertEquals(RejectionReason.TOO_MANY_VARIABLES, checker.check(variables).reason());
    }

    @Test
    void shouldRejectInvalidVariableName() {
        CheckResult result = checker.check(Map.of("issue-id", "1"));

        assertEquals(RejectionReason.INVALID_VARIABLE_NAME, result.reason());
        assertEquals("issue-id", result.matchedText());
    }

    @Test
    void shouldReportPathOfDangerousNestedValue() {
        Map<String, Object> filter = Map.of("items", List.of("a", "b", "javascript:alert(1)"));

        CheckResult result = checker.check(Map.of("filter", filter));

        assertEquals(RejectionReason.DANGEROUS_PATTERN, result.reason());
        assertTrue(result.message().contains("filter.items[2]"));
        assertEquals("javascript:", result.matchedText());
    }

    @Test
    void shouldRejectOversizedValues() {
        assertEquals(RejectionReason.VARIABLE_TOO_LARGE,
                checker.check(Map.of("text", "a".repeat(1001))).reason());
        assertFalse(checker.check(Map.of("text", "a".repeat(1000))).violated());

        List<Integer> items = new ArrayList<>();
        for (int i = 0; i < 101; i++) {
            items.add(i);
        }
        assertEquals(RejectionReason.VARIABLE_TOO_LARGE, checker.check(Map.of("ids", items)).reason());

        Map<String, Object> wide = new HashMap<>();
        for (int i = 0; i < 51; i++) {
            wide.put("k" + i, i);
        }
        assertEquals(RejectionReason.VARIABLE_TOO_LARGE, checker.check(Map.of("input", wide)).reason());
    }

    @Test
    void shouldRejectDeeplyNestedValueWithoutDescending() {
        Object nested = "leaf";
        for (int i = 0; i < 20000; i++) {
            nested = List.of(nested);
        }

        CheckResult result = checker.check(Map.of("deep", nested));

        assertEquals(RejectionReason.VARIABLE_TOO_LARGE, result.reason());
        assertEquals("deep" + "[0]".repeat(10), result.matchedText());
    }

    @Test
    void shouldAllowNestingUpToLimit() {
        Object withinLimit = "leaf";
        for (int i = 0; i < 10; i++) {
            withinLimit = Map.of("child", withinLimit);
        }
        assertFalse(checker.check(Map.of("tree", withinLimit)).violated());

        Object overLimit = Map.of("child", withinLimit);
        assertEquals(RejectionReason.VARIABLE_TOO_LARGE, checker.check(Map.of("tree", overLimit)).reason());
    }

    @Test
    void shouldRejectDataUrlInVariable() {
        CheckResult result = checker.check(Map.of("x", "data:;base64,PHNjcmlwdD5hbGVydCgxKTwvc2NyaXB0Pg=="));

        assertEquals(RejectionReason.DANGEROUS_PATTERN, result.reason());
        assertEquals("data:;", result.matchedText());
    }

    @Test
    void shouldRejectUnsupportedType() {
        CheckResult result = checker.check(Map.of("when", new Object()));

        assertEquals(RejectionReason.UNSUPPORTED_VARIABLE_TYPE, result.reason());
        assertEquals("Object", result.matchedText());
    }
}
