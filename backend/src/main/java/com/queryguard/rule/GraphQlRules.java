package com.queryguard.rule;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * GraphQL 白名单与限制。名称区分大小写，与 GraphQL 标识符语义一致。
 */
public record GraphQlRules(Set<String> fields, Set<String> queries, Set<String> mutations,
        int maxLength, int maxDepth, int maxVariables, int maxStringLength,
        int maxListSize, int maxObjectSize, int maxVariableDepth) {

    public static final int DEFAULT_MAX_LENGTH = 5000;
    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_MAX_VARIABLES = 50;
    public static final int DEFAULT_MAX_STRING_LENGTH = 1000;
    public static final int DEFAULT_MAX_LIST_SIZE = 100;
    public static final int DEFAULT_MAX_OBJECT_SIZE = 50;
    /** 变量值中列表 / 对象的最大嵌套层数 */
    public static final int DEFAULT_MAX_VARIABLE_DEPTH = 10;

    public GraphQlRules {
        fields = Set.copyOf(fields);
        queries = Set.copyOf(queries);
        mutations = Set.copyOf(mutations);
    }

    public static GraphQlRules defaults() {
        return new GraphQlRules(DefaultWhitelists.GRAPHQL_FIELDS, DefaultWhitelists.GRAPHQL_QUERIES,
                DefaultWhitelists.GRAPHQL_MUTATIONS, DEFAULT_MAX_LENGTH, DEFAULT_MAX_DEPTH,
                DEFAULT_MAX_VARIABLES, DEFAULT_MAX_STRING_LENGTH, DEFAULT_MAX_LIST_SIZE,
                DEFAULT_MAX_OBJECT_SIZE, DEFAULT_MAX_VARIABLE_DEPTH);
    }

    public static GraphQlRules withExtras(Collection<String> extraFields, Collection<String> extraQueries,
            Collection<String> extraMutations, int maxLength, int maxDepth, int maxVariables,
            int maxStringLength, int maxListSize, int maxObjectSize, int maxVariableDepth) {
        return new GraphQlRules(
                union(DefaultWhitelists.GRAPHQL_FIELDS, extraFields),
                union(DefaultWhitelists.GRAPHQL_QUERIES, extraQueries),
                union(DefaultWhitelists.GRAPHQL_MUTATIONS, extraMutations),
                maxLength, maxDepth, maxVariables, maxStringLength, maxListSize, maxObjectSize,
                maxVariableDepth);
    }

    public boolean isField(String name) {
        return fields.contains(name);
    }

    public boolean isKeyword(String name) {
        return DefaultWhitelists.GRAPHQL_KEYWORDS.contains(name);
    }

    /**
     * 按操作类型选择对应的白名单；fragment 等非操作定义返回 false
     */
    public boolean isOperation(String type, String name) {
        if ("query".equals(type)) {
            return queries.contains(name);
        }
        if ("mutation".equals(type)) {
            return mutations.contains(name);
        }
        return false;
    }

    public boolean isSuspicious(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String part : DefaultWhitelists.SUSPICIOUS_NAME_PARTS) {
            if (lower.contains(part)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> union(Set<String> base, Collection<String> extras) {
        Set<String> all = new HashSet<>(base);
        if (extras != null) {
            all.addAll(extras);
        }
        return all;
    }
}
