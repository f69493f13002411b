package com.queryguard.rule.checker;

import com.queryguard.model.RejectionReason;
import com.queryguard.model.VariableNode;
import com.queryguard.model.VariableNode.ListValue;
import com.queryguard.model.VariableNode.MapValue;
import com.queryguard.model.VariableNode.StringValue;
import com.queryguard.model.VariableNode.UnsupportedValue;
import com.queryguard.rule.GraphQlRules;
import com.queryguard.rule.checker.DangerousPatternChecker.DangerousPatternHit;
import com.queryguard.rule.checker.QueryChecker.CheckResult;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * GraphQL 变量检查：变量名格式、变量数量，以及对每个值的深度优先递归校验。
 * 每一层先检查嵌套层数和容器大小，再展开子元素。报错信息带上值的路径，如 filter.items[2]。
 */
public class GraphQlVariableChecker {

    private static final Pattern VARIABLE_NAME = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    private final GraphQlRules rules;
    private final DangerousPatternChecker dangerousPatterns;

    public GraphQlVariableChecker(GraphQlRules rules, DangerousPatternChecker dangerousPatterns) {
        this.rules = rules;
        this.dangerousPatterns = dangerousPatterns;
    }

    public String name() {
        return "GRAPHQL_VARIABLES";
    }

    public CheckResult check(Map<String, ?> variables) {
        if (variables == null || variables.isEmpty()) {
            return CheckResult.pass();
        }
        if (variables.size() > rules.maxVariables()) {
            return CheckResult.fail(RejectionReason.TOO_MANY_VARIABLES,
                    "变量过多：" + variables.size() + " 个，上限 " + rules.maxVariables(), null);
        }
        for (Map.Entry<String, ?> entry : variables.entrySet()) {
            String name = entry.getKey();
            if (name == null || !VARIABLE_NAME.matcher(name).matches()) {
                return CheckResult.fail(RejectionReason.INVALID_VARIABLE_NAME,
                        "变量名不合法: " + name, name);
            }
            CheckResult result = checkValue(name, VariableNode.of(entry.getValue()), 0);
            if (result.violated()) {
                return result;
            }
        }
        return CheckResult.pass();
    }

    /**
     * @param depth 当前值外层的容器层数，变量本身为 0
     */
    private CheckResult checkValue(String path, VariableNode node, int depth) {
        if (node instanceof StringValue text) {
            return checkString(path, text.value());
        }
        if ((node instanceof ListValue || node instanceof MapValue) && depth >= rules.maxVariableDepth()) {
            return CheckResult.fail(RejectionReason.VARIABLE_TOO_LARGE,
                    "变量 '" + path + "' 嵌套过深，上限 " + rules.maxVariableDepth() + " 层", path);
        }
        if (node instanceof ListValue list) {
            Collection<?> items = list.items();
            if (items.size() > rules.maxListSize()) {
                return CheckResult.fail(RejectionReason.VARIABLE_TOO_LARGE,
                        "变量 '" + path + "' 数组过大：" + items.size() + " 项，上限 " + rules.maxListSize(), path);
            }
            int index = 0;
            for (Object item : items) {
                CheckResult result = checkValue(path + "[" + index++ + "]", VariableNode.of(item), depth + 1);
                if (result.violated()) {
                    return result;
                }
            }
            return CheckResult.pass();
        }
        if (node instanceof MapValue map) {
            Map<?, ?> entries = map.entries();
            if (entries.size() > rules.maxObjectSize()) {
                return CheckResult.fail(RejectionReason.VARIABLE_TOO_LARGE,
                        "变量 '" + path + "' 对象过大：" + entries.size() + " 个键，上限 " + rules.maxObjectSize(), path);
            }
            for (Map.Entry<?, ?> entry : entries.entrySet()) {
                CheckResult result = checkValue(path + "." + entry.getKey(), VariableNode.of(entry.getValue()),
                        depth + 1);
                if (result.violated()) {
                    return result;
                }
            }
            return CheckResult.pass();
        }
        if (node instanceof UnsupportedValue unsupported) {
            return CheckResult.fail(RejectionReason.UNSUPPORTED_VARIABLE_TYPE,
                    "变量 '" + path + "' 类型不受支持: " + unsupported.typeName(), unsupported.typeName());
        }
        // null / 数字 / 布尔
        return CheckResult.pass();
    }

    private CheckResult checkString(String path, String value) {
        if (value.length() > rules.maxStringLength()) {
            return CheckResult.fail(RejectionReason.VARIABLE_TOO_LARGE,
                    "变量 '" + path + "' 字符串过长：" + value.length() + " 个字符，上限 " + rules.maxStringLength(),
                    path);
        }
        DangerousPatternHit hit = dangerousPatterns.findIn(value);
        if (hit != null) {
            return CheckResult.fail(RejectionReason.DANGEROUS_PATTERN,
                    "变量 '" + path + "' 包含危险模式 " + hit.patternName(), hit.matchedText());
        }
        return CheckResult.pass();
    }
}
