package com.queryguard.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueryTextUtilsTest {

    @Test
    void shouldKeepShortTextOnOneLine() {
        assertEquals("a b", QueryTextUtils.abbreviate("a\nb"));
        assertEquals("null", QueryTextUtils.abbreviate(null));
    }

    @Test
    void shouldTruncateLongText() {
        String abbreviated = QueryTextUtils.abbreviate("x".repeat(500));

        assertTrue(abbreviated.startsWith("x".repeat(QueryTextUtils.MAX_LOGGED_LENGTH) + "..."));
        assertTrue(abbreviated.contains("500"));
    }
}
