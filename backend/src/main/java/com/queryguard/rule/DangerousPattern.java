package com.queryguard.rule;

import java.util.regex.Pattern;

/**
 * 一条危险模式。scope 决定匹配的是原始文本，还是屏蔽了字符串字面量内容后的文本。
 */
public record DangerousPattern(String name, Pattern pattern, Scope scope) {

    public enum Scope {
        /** 原始文本，字面量内部同样生效 */
        RAW,
        /** 屏蔽字符串字面量内容后的文本，只匹配查询语法部分 */
        CODE
    }

    public static DangerousPattern raw(String name, String regex) {
        return new DangerousPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), Scope.RAW);
    }

    public static DangerousPattern code(String name, String regex) {
        return new DangerousPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), Scope.CODE);
    }
}
