package com.queryguard.rule.checker;

import com.queryguard.model.RejectionReason;
import com.queryguard.parser.OperationHeaderParser;
import com.queryguard.parser.OperationHeaderParser.OperationDefinition;
import com.queryguard.parser.OperationHeaderParser.OperationDocument;

/**
 * GraphQL 操作类型检查：只允许 query / mutation，订阅一律拒绝。
 */
public class GraphQlOperationChecker implements QueryChecker {

    @Override
    public String name() {
        return "GRAPHQL_OPERATION";
    }

    @Override
    public CheckResult check(String query) {
        OperationDocument document = OperationHeaderParser.parse(query);

        for (OperationDefinition definition : document.definitions()) {
            if (OperationHeaderParser.SUBSCRIPTION.equals(definition.type())) {
                return CheckResult.fail(RejectionReason.UNSUPPORTED_OPERATION,
                        "不支持 subscription 操作，只允许 query / mutation", definition.type());
            }
        }
        if (document.unexpectedToken() != null) {
            String text = document.unexpectedToken().text();
            return CheckResult.fail(RejectionReason.UNKNOWN_OPERATION,
                    "无法识别的 GraphQL 文档结构: " + text, text);
        }
        for (OperationDefinition definition : document.definitions()) {
            if (!definition.hasBody()) {
                return CheckResult.fail(RejectionReason.UNKNOWN_OPERATION,
                        "GraphQL 定义缺少选择集: " + definition.type(), definition.type());
            }
        }
        if (document.primaryType() == null) {
            return CheckResult.fail(RejectionReason.UNKNOWN_OPERATION,
                    "GraphQL 文档中没有 query 或 mutation 操作", null);
        }
        return CheckResult.pass();
    }
}
