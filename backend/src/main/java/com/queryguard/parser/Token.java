package com.queryguard.parser;

import java.util.Locale;

/**
 * 词法单元。depth 为该单元所在位置的嵌套深度（JQL 为圆括号，GraphQL 为花括号），
 * 开括号记录进入前的深度，闭括号记录退出后的深度，两者相等。
 */
public record Token(Kind kind, String text, int offset, int depth) {

    public enum Kind {
        IDENTIFIER,
        /** JQL 自定义字段引用，如 cf[10001]，格式是否合法由检查器判断 */
        CUSTOM_FIELD,
        STRING,
        NUMBER,
        /** JQL 比较运算符 */
        OPERATOR,
        OPEN,
        CLOSE,
        COMMA,
        /** GraphQL 变量引用，如 $issueId */
        VARIABLE,
        /** GraphQL 标点：{ } ( ) [ ] : = @ ! | ... */
        PUNCTUATOR,
        OTHER
    }

    public boolean is(Kind expected) {
        return kind == expected;
    }

    public boolean is(Kind expected, String expectedText) {
        return kind == expected && text.equals(expectedText);
    }

    /**
     * 标识符的不区分大小写比较，仅 JQL 使用
     */
    public boolean isWord(String word) {
        return kind == Kind.IDENTIFIER && text.equalsIgnoreCase(word);
    }

    public String lowerText() {
        return text.toLowerCase(Locale.ROOT);
    }
}
