package com.queryguard.util;

/**
 * 字符串字面量转义工具：把用户提供的值安全地嵌入 JQL / GraphQL 的双引号字符串中。
 */
public final class LiteralEscapeUtils {

    private LiteralEscapeUtils() {
    }

    /**
     * JQL：转义反斜杠和双引号，去掉所有 0x20 以下的控制字符（含换行、制表符）
     */
    public static String escapeJql(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\') {
                out.append("\\\\");
            } else if (c == '"') {
                out.append("\\\"");
            } else if (c >= 0x20) {
                out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * GraphQL：转义反斜杠、双引号，换行 / 回车 / 制表符转为转义序列，其余控制字符去掉
     */
    public static String escapeGraphQl(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c >= 0x20) {
                        out.append(c);
                    }
                }
            }
        }
        return out.toString();
    }
}
