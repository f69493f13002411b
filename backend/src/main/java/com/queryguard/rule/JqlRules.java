package com.queryguard.rule;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JQL 白名单与限制。构造后只读，可在线程间共享。
 * 字段、函数、关键字一律按小写保存，匹配不区分大小写。
 */
public record JqlRules(Set<String> fields, Set<String> functions, Set<String> keywords,
        int maxLength, int maxNestingDepth, int customFieldMin, int customFieldMax) {

    public static final int DEFAULT_MAX_LENGTH = 1000;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 3;
    public static final int DEFAULT_CUSTOM_FIELD_MIN = 10000;
    public static final int DEFAULT_CUSTOM_FIELD_MAX = 99999;

    public JqlRules {
        fields = lowerCaseCopy(fields);
        functions = lowerCaseCopy(functions);
        keywords = lowerCaseCopy(keywords);
        if (customFieldMin > customFieldMax) {
            throw new IllegalArgumentException(
                    "自定义字段范围不合法: " + customFieldMin + " > " + customFieldMax);
        }
    }

    public static JqlRules defaults() {
        return new JqlRules(DefaultWhitelists.JQL_FIELDS, DefaultWhitelists.JQL_FUNCTIONS,
                DefaultWhitelists.JQL_KEYWORDS, DEFAULT_MAX_LENGTH, DEFAULT_MAX_NESTING_DEPTH,
                DEFAULT_CUSTOM_FIELD_MIN, DEFAULT_CUSTOM_FIELD_MAX);
    }

    /**
     * 在内置白名单上追加字段和函数，并替换各项限制
     */
    public static JqlRules withExtras(Collection<String> extraFields, Collection<String> extraFunctions,
            int maxLength, int maxNestingDepth, int customFieldMin, int customFieldMax) {
        Set<String> allFields = new HashSet<>(DefaultWhitelists.JQL_FIELDS);
        if (extraFields != null) {
            allFields.addAll(extraFields);
        }
        Set<String> allFunctions = new HashSet<>(DefaultWhitelists.JQL_FUNCTIONS);
        if (extraFunctions != null) {
            allFunctions.addAll(extraFunctions);
        }
        return new JqlRules(allFields, allFunctions, DefaultWhitelists.JQL_KEYWORDS,
                maxLength, maxNestingDepth, customFieldMin, customFieldMax);
    }

    public boolean isField(String name) {
        return fields.contains(name.toLowerCase(Locale.ROOT));
    }

    public boolean isFunction(String name) {
        return functions.contains(name.toLowerCase(Locale.ROOT));
    }

    public boolean isKeyword(String name) {
        return keywords.contains(name.toLowerCase(Locale.ROOT));
    }

    public boolean isCustomFieldInRange(long id) {
        return id >= customFieldMin && id <= customFieldMax;
    }

    private static Set<String> lowerCaseCopy(Set<String> names) {
        return names.stream()
                .map(n -> n.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
