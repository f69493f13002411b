package com.queryguard.parser;

import com.queryguard.parser.Token.Kind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JqlLexerTest {

    @Test
    void shouldSplitComparisonIntoTokens() {
        List<Token> tokens = JqlLexer.tokenize("project = \"TEST\" AND cf[10001] >= -7d");

        assertEquals(List.of(Kind.IDENTIFIER, Kind.OPERATOR, Kind.STRING, Kind.IDENTIFIER,
                Kind.CUSTOM_FIELD, Kind.OPERATOR, Kind.NUMBER), kinds(tokens));
        assertEquals(List.of("project", "=", "\"TEST\"", "AND", "cf[10001]", ">=", "-7d"), texts(tokens));
    }

    @Test
    void shouldKeepParenthesesInsideStringLiteral() {
        List<Token> tokens = JqlLexer.tokenize("summary ~ \"a (b) c\"");

        assertEquals(3, tokens.size());
        assertEquals(Kind.STRING, tokens.get(2).kind());
        assertTrue(tokens.stream().noneMatch(t -> t.is(Kind.OPEN)));
    }

    @Test
    void shouldRecognizeTwoCharacterOperators() {
        assertEquals("!=", JqlLexer.tokenize("status != Done").get(1).text());
        assertEquals("!~", JqlLexer.tokenize("summary !~ x").get(1).text());
        assertEquals("<=", JqlLexer.tokenize("created <= now()").get(1).text());
        assertEquals(Kind.OTHER, JqlLexer.tokenize("! x").get(0).kind());
    }

    @Test
    void shouldTrackParenthesisDepth() {
        List<Token> tokens = JqlLexer.tokenize("(a = (b))");

        assertEquals(List.of(0, 1, 1, 1, 2, 1, 0), tokens.stream().map(Token::depth).toList());
    }

    @Test
    void shouldStopCustomFieldAtOperator() {
        List<Token> tokens = JqlLexer.tokenize("cf[10001=1");

        assertEquals(Kind.CUSTOM_FIELD, tokens.get(0).kind());
        assertEquals("cf[10001", tokens.get(0).text());
        assertEquals("=", tokens.get(1).text());
    }

    @Test
    void shouldTreatEscapedQuoteAsPartOfString() {
        List<Token> tokens = JqlLexer.tokenize("summary ~ \"say \\\"hi\\\"\" AND x");

        assertEquals(Kind.STRING, tokens.get(2).kind());
        assertEquals("AND", tokens.get(3).text());
    }

    private static List<Kind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::kind).toList();
    }

    private static List<String> texts(List<Token> tokens) {
        return tokens.stream().map(Token::text).toList();
    }
}
