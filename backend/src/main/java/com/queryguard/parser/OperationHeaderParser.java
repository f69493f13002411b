package com.queryguard.parser;

import com.queryguard.parser.Token.Kind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 只解析 GraphQL 文档的顶层定义头：操作类型、可选名称，以及每个定义覆盖的单元范围。
 * 不解析选择集本身。
 */
public final class OperationHeaderParser {

    public static final String QUERY = "query";
    public static final String MUTATION = "mutation";
    public static final String SUBSCRIPTION = "subscription";
    public static final String FRAGMENT = "fragment";

    private static final Set<String> DEFINITION_KEYWORDS = Set.of(QUERY, MUTATION, SUBSCRIPTION, FRAGMENT);

    private OperationHeaderParser() {
    }

    /**
     * @param type            query / mutation / subscription / fragment；匿名 { ... } 视为 query
     * @param name            定义名，可为空
     * @param nameTokenIndex  名称单元的下标，无名称时为 -1
     * @param firstTokenIndex 定义的第一个单元
     * @param lastTokenIndex  定义的最后一个单元（闭合的花括号）；没有主体时为头部最后一个单元
     * @param hasBody         是否带有 { ... } 主体
     */
    public record OperationDefinition(String type, String name, int nameTokenIndex,
            int firstTokenIndex, int lastTokenIndex, boolean hasBody) {

        public boolean isFragment() {
            return FRAGMENT.equals(type);
        }

        public boolean contains(int tokenIndex) {
            return tokenIndex >= firstTokenIndex && tokenIndex <= lastTokenIndex;
        }
    }

    /**
     * @param unexpectedToken 顶层出现的无法识别的单元，结构正常时为 null
     */
    public record OperationDocument(List<Token> tokens, List<OperationDefinition> definitions,
            Token unexpectedToken) {

        /**
         * 文档的主操作类型：第一个非 fragment 定义的类型；没有操作定义时返回 null
         */
        public String primaryType() {
            return definitions.stream()
                    .filter(d -> !d.isFragment())
                    .map(OperationDefinition::type)
                    .findFirst()
                    .orElse(null);
        }

        public OperationDefinition definitionAt(int tokenIndex) {
            for (OperationDefinition definition : definitions) {
                if (definition.contains(tokenIndex)) {
                    return definition;
                }
            }
            return null;
        }
    }

    public static OperationDocument parse(String document) {
        List<Token> tokens = GraphQlLexer.tokenize(document);
        List<OperationDefinition> definitions = new ArrayList<>();

        int i = 0;
        while (i < tokens.size()) {
            Token head = tokens.get(i);
            int first = i;
            String type;
            String name = null;
            int nameIndex = -1;

            if (head.is(Kind.PUNCTUATOR, "}")) {
                // 多余的闭花括号由结构检查报告
                i++;
                continue;
            }
            if (head.is(Kind.PUNCTUATOR, "{")) {
                type = QUERY;
            } else if (head.is(Kind.IDENTIFIER) && DEFINITION_KEYWORDS.contains(head.text())) {
                type = head.text();
                i++;
                if (i < tokens.size() && tokens.get(i).is(Kind.IDENTIFIER)) {
                    name = tokens.get(i).text();
                    nameIndex = i;
                    i++;
                }
                // 头部剩余部分：变量定义、类型条件、指令，直到顶层主体开始
                int parens = 0;
                while (i < tokens.size()) {
                    Token t = tokens.get(i);
                    if (t.is(Kind.PUNCTUATOR, "(")) {
                        parens++;
                    } else if (t.is(Kind.PUNCTUATOR, ")")) {
                        parens = Math.max(0, parens - 1);
                    } else if (parens == 0 && t.is(Kind.PUNCTUATOR, "{")) {
                        break;
                    }
                    i++;
                }
                if (i >= tokens.size()) {
                    definitions.add(new OperationDefinition(type, name, nameIndex, first, tokens.size() - 1, false));
                    break;
                }
            } else {
                return new OperationDocument(tokens, Collections.unmodifiableList(definitions), head);
            }

            int last = skipBody(tokens, i);
            definitions.add(new OperationDefinition(type, name, nameIndex, first, last, true));
            i = last + 1;
        }
        return new OperationDocument(tokens, Collections.unmodifiableList(definitions), null);
    }

    /**
     * 从开花括号开始，返回与之配对的闭花括号下标；未闭合时返回最后一个单元
     */
    private static int skipBody(List<Token> tokens, int open) {
        int depth = tokens.get(open).depth();
        for (int i = open + 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.is(Kind.PUNCTUATOR, "}") && t.depth() == depth) {
                return i;
            }
        }
        return tokens.size() - 1;
    }
}
