package com.queryguard.parser;

import com.queryguard.parser.Token.Kind;

import java.util.ArrayList;
import java.util.List;

/**
 * GraphQL 单遍词法分析。逗号和注释不产生单元；每个单元记录所在的花括号深度。
 */
public final class GraphQlLexer {

    private static final String PUNCTUATORS = "{}()[]:=@!|&";

    private GraphQlLexer() {
    }

    public static List<Token> tokenize(String document) {
        List<Token> tokens = new ArrayList<>();
        int depth = 0;
        int i = 0;
        int n = document.length();

        while (i < n) {
            char c = document.charAt(i);
            int start = i;

            if (Character.isWhitespace(c) || c == ',' || c == '\uFEFF') {
                i++;
                continue;
            }

            if (c == '#') {
                while (i < n && document.charAt(i) != '\n' && document.charAt(i) != '\r') {
                    i++;
                }
                continue;
            }

            if (document.startsWith("\"\"\"", i)) {
                int close = LiteralMasker.skipBlockString(document, i + 3);
                i = Math.min(close + 3, n);
                tokens.add(new Token(Kind.STRING, document.substring(start, i), start, depth));
                continue;
            }
            if (c == '"') {
                int close = LiteralMasker.skipQuoted(document, i + 1, '"');
                i = Math.min(close + 1, n);
                tokens.add(new Token(Kind.STRING, document.substring(start, i), start, depth));
                continue;
            }

            if (c == '$' && i + 1 < n && isNameStart(document.charAt(i + 1))) {
                i++;
                while (i < n && isNameChar(document.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(Kind.VARIABLE, document.substring(start, i), start, depth));
                continue;
            }

            if (document.startsWith("...", i)) {
                tokens.add(new Token(Kind.PUNCTUATOR, "...", start, depth));
                i += 3;
                continue;
            }

            if (isNameStart(c)) {
                i++;
                while (i < n && isNameChar(document.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(Kind.IDENTIFIER, document.substring(start, i), start, depth));
                continue;
            }

            if (Character.isDigit(c) || (c == '-' && i + 1 < n && Character.isDigit(document.charAt(i + 1)))) {
                i++;
                while (i < n && isNumberChar(document.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(Kind.NUMBER, document.substring(start, i), start, depth));
                continue;
            }

            if (PUNCTUATORS.indexOf(c) >= 0) {
                if (c == '{') {
                    tokens.add(new Token(Kind.PUNCTUATOR, "{", start, depth));
                    depth++;
                } else if (c == '}') {
                    depth = Math.max(0, depth - 1);
                    tokens.add(new Token(Kind.PUNCTUATOR, "}", start, depth));
                } else {
                    tokens.add(new Token(Kind.PUNCTUATOR, String.valueOf(c), start, depth));
                }
                i++;
                continue;
            }

            tokens.add(new Token(Kind.OTHER, String.valueOf(c), start, depth));
            i++;
        }
        return tokens;
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isNameChar(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }

    private static boolean isNumberChar(char c) {
        return Character.isDigit(c) || c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-';
    }
}
