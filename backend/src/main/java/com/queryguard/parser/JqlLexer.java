package com.queryguard.parser;

import com.queryguard.parser.Token.Kind;

import java.util.ArrayList;
import java.util.List;

/**
 * JQL 单遍词法分析。
 * <p>
 * 只切分词法单元，不做语法分析：字段、函数、关键字的区分交给检查器，
 * 依据单元类型和前后相邻单元判断。字符串字面量整体成为一个单元，
 * 因此字面量中的内容永远不会被当作标识符。
 */
public final class JqlLexer {

    private static final String OPERATOR_CHARS = "=!<>~";
    /** cf[...] 方括号内容在遇到这些字符时截止，避免吞掉后续运算符 */
    private static final String CUSTOM_FIELD_STOP = "=!<>~(),\"'";

    private JqlLexer() {
    }

    public static List<Token> tokenize(String jql) {
        List<Token> tokens = new ArrayList<>();
        int depth = 0;
        int i = 0;
        int n = jql.length();

        while (i < n) {
            char c = jql.charAt(i);
            int start = i;

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (c == '"' || c == '\'') {
                int close = LiteralMasker.skipQuoted(jql, i + 1, c);
                i = Math.min(close + 1, n);
                tokens.add(new Token(Kind.STRING, jql.substring(start, i), start, depth));
                continue;
            }

            if (c == '(') {
                tokens.add(new Token(Kind.OPEN, "(", start, depth));
                depth++;
                i++;
                continue;
            }
            if (c == ')') {
                depth = Math.max(0, depth - 1);
                tokens.add(new Token(Kind.CLOSE, ")", start, depth));
                i++;
                continue;
            }
            if (c == ',') {
                tokens.add(new Token(Kind.COMMA, ",", start, depth));
                i++;
                continue;
            }

            if (OPERATOR_CHARS.indexOf(c) >= 0) {
                String two = i + 1 < n ? jql.substring(i, i + 2) : "";
                if (two.equals("!=") || two.equals("!~") || two.equals(">=") || two.equals("<=")) {
                    tokens.add(new Token(Kind.OPERATOR, two, start, depth));
                    i += 2;
                } else if (c == '!') {
                    tokens.add(new Token(Kind.OTHER, "!", start, depth));
                    i++;
                } else {
                    tokens.add(new Token(Kind.OPERATOR, String.valueOf(c), start, depth));
                    i++;
                }
                continue;
            }

            if (Character.isDigit(c) || ((c == '-' || c == '+') && i + 1 < n && Character.isDigit(jql.charAt(i + 1)))) {
                i++;
                while (i < n && isValueChar(jql.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(Kind.NUMBER, jql.substring(start, i), start, depth));
                continue;
            }

            if (Character.isLetter(c) || c == '_') {
                i++;
                while (i < n && isIdentifierChar(jql.charAt(i))) {
                    i++;
                }
                String word = jql.substring(start, i);
                if (word.equalsIgnoreCase("cf") && i < n && jql.charAt(i) == '[') {
                    i++;
                    while (i < n && jql.charAt(i) != ']' && !Character.isWhitespace(jql.charAt(i))
                            && CUSTOM_FIELD_STOP.indexOf(jql.charAt(i)) < 0) {
                        i++;
                    }
                    if (i < n && jql.charAt(i) == ']') {
                        i++;
                    }
                    tokens.add(new Token(Kind.CUSTOM_FIELD, jql.substring(start, i), start, depth));
                } else {
                    tokens.add(new Token(Kind.IDENTIFIER, word, start, depth));
                }
                continue;
            }

            tokens.add(new Token(Kind.OTHER, String.valueOf(c), start, depth));
            i++;
        }
        return tokens;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-' || c == '@';
    }

    // 相对日期（-7d）、版本号（1.0）、日期（2024-01-01 / 2024/01/01 10:00）
    private static boolean isValueChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-' || c == ':' || c == '/';
    }
}
