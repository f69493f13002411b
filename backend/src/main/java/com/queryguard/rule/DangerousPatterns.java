package com.queryguard.rule;

import java.util.List;

/**
 * JQL 与 GraphQL 各自的危险模式集合
 */
public final class DangerousPatterns {

    private DangerousPatterns() {
    }

    public static final List<DangerousPattern> JQL = List.of(
            DangerousPattern.raw("SQL_LINE_COMMENT", ";\\s*--"),
            DangerousPattern.raw("SQL_BLOCK_COMMENT", ";\\s*/\\*"),
            DangerousPattern.code("SQL_KEYWORD", "\\b(union|select|drop|delete|insert|update|exec)\\b"),
            DangerousPattern.code("SCRIPT_WORD", "\\bscript\\b"),
            DangerousPattern.raw("HTML_TAG", "</?[a-zA-Z][^<>]*>"),
            DangerousPattern.raw("HTML_COMMENT", "<!--"),
            DangerousPattern.raw("TEMPLATE_INTERPOLATION", "\\$\\{"),
            DangerousPattern.raw("HEX_ESCAPE", "\\\\x[0-9a-f]{2}"));

    public static final List<DangerousPattern> GRAPHQL = List.of(
            DangerousPattern.raw("SCHEMA_INTROSPECTION", "__schema"),
            DangerousPattern.raw("TYPE_INTROSPECTION", "__type(?!name)"),
            DangerousPattern.raw("SCRIPT_TAG", "<script[^>]*>"),
            DangerousPattern.raw("JAVASCRIPT_URL", "javascript:"),
            DangerousPattern.raw("DATA_URL", "\\bdata:(?:[\\w.+-]+/[\\w.+-]+)?[;,]"),
            DangerousPattern.raw("EVAL_CALL", "eval\\s*\\("),
            DangerousPattern.raw("FUNCTION_LITERAL", "function\\s*\\("),
            DangerousPattern.raw("TEMPLATE_INTERPOLATION", "\\$\\{"),
            DangerousPattern.raw("HTML_COMMENT_OPEN", "<!--"),
            DangerousPattern.raw("HTML_COMMENT_CLOSE", "--!?>"));
}
