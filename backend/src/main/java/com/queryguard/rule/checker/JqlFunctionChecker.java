package com.queryguard.rule.checker;

import com.queryguard.model.RejectionReason;
import com.queryguard.parser.JqlLexer;
import com.queryguard.parser.Token;
import com.queryguard.parser.Token.Kind;
import com.queryguard.rule.JqlRules;

import java.util.List;

/**
 * JQL 函数白名单检查：紧跟 "(" 的标识符视为函数调用。
 * 关键字后跟括号（labels in (...)、AND (...)）不是函数调用。
 */
public class JqlFunctionChecker implements QueryChecker {

    private final JqlRules rules;

    public JqlFunctionChecker(JqlRules rules) {
        this.rules = rules;
    }

    @Override
    public String name() {
        return "JQL_FUNCTION";
    }

    @Override
    public CheckResult check(String query) {
        List<Token> tokens = JqlLexer.tokenize(query);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (!t.is(Kind.IDENTIFIER) || !tokens.get(i + 1).is(Kind.OPEN)) {
                continue;
            }
            if (rules.isKeyword(t.text()) || rules.isFunction(t.text())) {
                continue;
            }
            return CheckResult.fail(RejectionReason.UNKNOWN_FUNCTION,
                    "未知或不允许的函数: " + t.text(), t.text());
        }
        return CheckResult.pass();
    }
}
