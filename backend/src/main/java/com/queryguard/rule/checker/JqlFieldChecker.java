package com.queryguard.rule.checker;

import com.queryguard.model.RejectionReason;
import com.queryguard.parser.JqlLexer;
import com.queryguard.parser.Token;
import com.queryguard.parser.Token.Kind;
import com.queryguard.rule.JqlRules;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JQL 字段白名单检查。
 * <p>
 * 字段位置 = 比较运算符（= != > >= < <= ~ !~）或关键字运算符（in / is / was / changed，
 * 以及 not in / not changed）之前的那个单元。括号内的条件同样检查；
 * IN 列表和函数参数中的值不会出现在字段位置，不受影响。
 * ORDER BY 之后的每一项也必须是字段。
 */
public class JqlFieldChecker implements QueryChecker {

    private static final Pattern CUSTOM_FIELD = Pattern.compile("cf\\[(\\d{1,9})]", Pattern.CASE_INSENSITIVE);
    private static final Set<String> KEYWORD_OPERATORS = Set.of("in", "is", "was", "changed");
    /** 组合运算符中出现在字段位置的单词，如 was in / is not */
    private static final Set<String> OPERATOR_PARTS = Set.of("is", "was", "not");

    private final JqlRules rules;

    public JqlFieldChecker(JqlRules rules) {
        this.rules = rules;
    }

    @Override
    public String name() {
        return "JQL_FIELD";
    }

    @Override
    public CheckResult check(String query) {
        List<Token> tokens = JqlLexer.tokenize(query);

        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            boolean keywordOperator = t.is(Kind.IDENTIFIER) && KEYWORD_OPERATORS.contains(t.lowerText());
            if (!t.is(Kind.OPERATOR) && !keywordOperator) {
                continue;
            }

            int subjectIndex = i - 1;
            if (keywordOperator && subjectIndex >= 0 && tokens.get(subjectIndex).isWord("not")
                    && (t.isWord("in") || t.isWord("changed"))) {
                subjectIndex--;
            }
            if (subjectIndex < 0) {
                continue;
            }

            Token subject = tokens.get(subjectIndex);
            if (subject.is(Kind.IDENTIFIER) && OPERATOR_PARTS.contains(subject.lowerText())) {
                continue;
            }
            CheckResult result = checkFieldToken(subject);
            if (result.violated()) {
                return result;
            }
        }

        return checkOrderBy(tokens);
    }

    private CheckResult checkOrderBy(List<Token> tokens) {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (!tokens.get(i).isWord("order") || !tokens.get(i + 1).isWord("by")) {
                continue;
            }
            boolean expectField = true;
            for (int j = i + 2; j < tokens.size(); j++) {
                Token t = tokens.get(j);
                if (t.is(Kind.COMMA)) {
                    expectField = true;
                } else if (!expectField && (t.isWord("asc") || t.isWord("desc"))) {
                    continue;
                } else {
                    if (!expectField) {
                        return CheckResult.fail(RejectionReason.UNKNOWN_FIELD,
                                "ORDER BY 子句中存在无法识别的内容: " + t.text(), t.text());
                    }
                    CheckResult result = checkFieldToken(t);
                    if (result.violated()) {
                        return result;
                    }
                    expectField = false;
                }
            }
        }
        return CheckResult.pass();
    }

    private CheckResult checkFieldToken(Token token) {
        switch (token.kind()) {
            case IDENTIFIER:
                if (rules.isField(token.text())) {
                    return CheckResult.pass();
                }
                return CheckResult.fail(RejectionReason.UNKNOWN_FIELD,
                        "未知或不允许的字段: " + token.text(), token.text());
            case CUSTOM_FIELD:
                return checkCustomField(token.text());
            case CLOSE:
                // 函数调用结果，交给函数检查
                return CheckResult.pass();
            case STRING:
            case NUMBER:
                return CheckResult.fail(RejectionReason.UNKNOWN_FIELD,
                        "字段位置出现字面量: " + token.text(), token.text());
            default:
                return CheckResult.fail(RejectionReason.UNKNOWN_FIELD,
                        "运算符前缺少字段: " + token.text(), token.text());
        }
    }

    private CheckResult checkCustomField(String text) {
        Matcher matcher = CUSTOM_FIELD.matcher(text);
        if (!matcher.matches()) {
            return CheckResult.fail(RejectionReason.UNKNOWN_FIELD, "自定义字段格式不合法: " + text, text);
        }
        long id = Long.parseLong(matcher.group(1));
        if (!rules.isCustomFieldInRange(id)) {
            return CheckResult.fail(RejectionReason.UNKNOWN_FIELD,
                    "自定义字段超出允许范围 [" + rules.customFieldMin() + ", " + rules.customFieldMax() + "]: " + text,
                    text);
        }
        return CheckResult.pass();
    }
}
