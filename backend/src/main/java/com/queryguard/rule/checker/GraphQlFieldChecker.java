package com.queryguard.rule.checker;

import com.queryguard.model.RejectionReason;
import com.queryguard.parser.OperationHeaderParser;
import com.queryguard.parser.OperationHeaderParser.OperationDefinition;
import com.queryguard.parser.OperationHeaderParser.OperationDocument;
import com.queryguard.parser.Token;
import com.queryguard.parser.Token.Kind;
import com.queryguard.rule.GraphQlRules;

import java.util.List;

/**
 * GraphQL 字段与操作名白名单检查。
 * <p>
 * 每个名称满足以下任一条件即放行：
 * <ol>
 *   <li>在字段白名单中（含 __typename）</li>
 *   <li>结构关键字：query / mutation / fragment / on / true / false / null</li>
 *   <li>定义头中的名称或根选择（花括号第 1 层），且在对应操作类型的白名单中</li>
 *   <li>大写开头，视为类型或枚举引用</li>
 * </ol>
 * 后跟 ":" 的名称是参数名、输入对象键或别名，不要求在白名单中；
 * 但白名单之外的名称只要含有可疑片段（evil / hack / script）都会被拒绝。
 */
public class GraphQlFieldChecker implements QueryChecker {

    private final GraphQlRules rules;

    public GraphQlFieldChecker(GraphQlRules rules) {
        this.rules = rules;
    }

    @Override
    public String name() {
        return "GRAPHQL_FIELD";
    }

    @Override
    public CheckResult check(String query) {
        OperationDocument document = OperationHeaderParser.parse(query);
        List<Token> tokens = document.tokens();
        String primaryType = document.primaryType();

        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (!t.is(Kind.IDENTIFIER)) {
                continue;
            }
            String name = t.text();
            if (rules.isField(name) || rules.isKeyword(name) || isAllowedOperation(document, i, t, primaryType)) {
                continue;
            }
            // 白名单之外的名称，含可疑片段一律拒绝（description 等白名单字段本身含 script）
            if (rules.isSuspicious(name)) {
                return unknown(name);
            }
            boolean followedByColon = i + 1 < tokens.size() && tokens.get(i + 1).is(Kind.PUNCTUATOR, ":");
            if (followedByColon || Character.isUpperCase(name.charAt(0))) {
                continue;
            }
            return unknown(name);
        }
        return CheckResult.pass();
    }

    private boolean isAllowedOperation(OperationDocument document, int index, Token token, String primaryType) {
        OperationDefinition definition = document.definitionAt(index);
        if (definition == null) {
            return false;
        }
        boolean headerName = definition.nameTokenIndex() == index;
        if (!headerName && token.depth() != 1) {
            return false;
        }
        String type = definition.isFragment() ? primaryType : definition.type();
        return rules.isOperation(type, token.text());
    }

    private static CheckResult unknown(String name) {
        return CheckResult.fail(RejectionReason.UNKNOWN_FIELD, "未知或不允许的字段: " + name, name);
    }
}
