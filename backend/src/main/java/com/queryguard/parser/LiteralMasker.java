package com.queryguard.parser;

import com.queryguard.model.QueryLanguage;

/**
 * 屏蔽字符串字面量的内容，只保留两端引号。
 * 屏蔽后的文本用于关键字、括号等语法层面的扫描，避免字面量里的内容被误当成语法。
 * 未闭合的字面量一直屏蔽到文本末尾。
 */
public final class LiteralMasker {

    private static final String BLOCK_QUOTE = "\"\"\"";

    private LiteralMasker() {
    }

    public static String mask(QueryLanguage language, String text) {
        return language == QueryLanguage.JQL ? maskJql(text) : maskGraphQl(text);
    }

    /**
     * JQL 同时支持双引号和单引号字符串，反斜杠转义下一个字符
     */
    public static String maskJql(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                out.append(c);
                int end = skipQuoted(text, i + 1, c);
                if (end < text.length()) {
                    out.append(c);
                }
                i = end + 1;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * GraphQL 支持普通字符串和 """ 块字符串
     */
    public static String maskGraphQl(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (text.startsWith(BLOCK_QUOTE, i)) {
                out.append(BLOCK_QUOTE);
                int end = skipBlockString(text, i + 3);
                if (end < text.length()) {
                    out.append(BLOCK_QUOTE);
                }
                i = end + 3;
            } else if (c == '"') {
                out.append(c);
                int end = skipQuoted(text, i + 1, c);
                if (end < text.length()) {
                    out.append(c);
                }
                i = end + 1;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * 从 start 开始跳过字面量内容，返回闭合引号的位置；未闭合时返回 text.length()
     */
    static int skipQuoted(String text, int start, char quote) {
        int i = start;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i;
            }
            i++;
        }
        return text.length();
    }

    /**
     * 返回块字符串结束 """ 的起始位置；未闭合时返回 text.length()
     */
    static int skipBlockString(String text, int start) {
        int i = start;
        while (i < text.length()) {
            if (text.startsWith("\\" + BLOCK_QUOTE, i)) {
                i += 4;
                continue;
            }
            if (text.startsWith(BLOCK_QUOTE, i)) {
                return i;
            }
            i++;
        }
        return text.length();
    }
}
