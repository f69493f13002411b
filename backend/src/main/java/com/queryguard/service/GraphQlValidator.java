package com.queryguard.service;

import com.queryguard.model.QueryLanguage;
import com.queryguard.model.QueryValidationException;
import com.queryguard.model.RejectionReason;
import com.queryguard.parser.OperationHeaderParser;
import com.queryguard.parser.OperationHeaderParser.OperationDocument;
import com.queryguard.parser.Token.Kind;
import com.queryguard.rule.DangerousPatterns;
import com.queryguard.rule.GraphQlRules;
import com.queryguard.rule.checker.DangerousPatternChecker;
import com.queryguard.rule.checker.GraphQlFieldChecker;
import com.queryguard.rule.checker.GraphQlOperationChecker;
import com.queryguard.rule.checker.GraphQlVariableChecker;
import com.queryguard.rule.checker.InputSizeChecker;
import com.queryguard.rule.checker.QueryChecker;
import com.queryguard.rule.checker.QueryChecker.CheckResult;
import com.queryguard.rule.checker.StructuralChecker;
import com.queryguard.util.LiteralEscapeUtils;
import com.queryguard.util.QueryTextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * GraphQL 校验服务。
 * <p>
 * 检查顺序：长度 → 危险模式 → 操作类型 → 花括号配对与深度 → 字段 / 操作名白名单 → 变量。
 * 只允许 query / mutation；内省查询（__schema / __type）在危险模式阶段拒绝。
 */
@Service
public class GraphQlValidator {

    private static final Logger log = LoggerFactory.getLogger(GraphQlValidator.class);
    private static final String EXPECTED_OPERATION = "EXPECTED_OPERATION";

    private final GraphQlRules rules;
    private final List<QueryChecker> documentCheckers;
    private final GraphQlVariableChecker variableChecker;

    public GraphQlValidator(GraphQlRules rules) {
        this.rules = rules;
        DangerousPatternChecker dangerousPatterns =
                new DangerousPatternChecker(QueryLanguage.GRAPHQL, DangerousPatterns.GRAPHQL);
        this.documentCheckers = List.of(
                new InputSizeChecker(QueryLanguage.GRAPHQL, rules.maxLength()),
                dangerousPatterns,
                new GraphQlOperationChecker(),
                StructuralChecker.forGraphQl(rules.maxDepth()),
                new GraphQlFieldChecker(rules));
        this.variableChecker = new GraphQlVariableChecker(rules, dangerousPatterns);
        log.info("GraphQL 校验器已加载: {} 个字段, {} 个查询, {} 个变更, 检查顺序 {}",
                rules.fields().size(), rules.queries().size(), rules.mutations().size(), checkerNames());
    }

    public static GraphQlValidator withDefaults() {
        return new GraphQlValidator(GraphQlRules.defaults());
    }

    /**
     * 检查器名称，按执行顺序；变量检查总在最后
     */
    public List<String> checkerNames() {
        List<String> names = new ArrayList<>();
        documentCheckers.forEach(checker -> names.add(checker.name()));
        names.add(variableChecker.name());
        return names;
    }

    /**
     * 校验 GraphQL 文档及其变量
     *
     * @param variables 可为 null
     * @return 去除首尾空白后的文档
     * @throws QueryValidationException 任一检查不通过
     */
    public String validateQuery(String document, Map<String, ?> variables) {
        for (QueryChecker checker : documentCheckers) {
            CheckResult result = checker.check(document);
            if (result.violated()) {
                throw reject(checker.name(), result, document);
            }
        }
        CheckResult variablesResult = variableChecker.check(variables);
        if (variablesResult.violated()) {
            throw reject(variableChecker.name(), variablesResult, document);
        }

        String sanitized = document.strip();
        log.debug("GraphQL 查询校验通过: {}", QueryTextUtils.abbreviate(sanitized));
        return sanitized;
    }

    /**
     * 在 {@link #validateQuery} 的基础上，要求文档中出现指定操作，且该操作属于文档主操作类型的白名单
     */
    public String validateForOperation(String document, String expectedOperation, Map<String, ?> variables) {
        String sanitized = validateQuery(document, variables);

        OperationDocument parsed = OperationHeaderParser.parse(document);
        boolean present = expectedOperation != null && parsed.tokens().stream()
                .anyMatch(t -> t.is(Kind.IDENTIFIER, expectedOperation));
        if (!present) {
            throw reject(EXPECTED_OPERATION, CheckResult.fail(RejectionReason.UNKNOWN_OPERATION,
                    "查询中未找到预期的操作: " + expectedOperation, expectedOperation), document);
        }
        String type = parsed.primaryType();
        if (!rules.isOperation(type, expectedOperation)) {
            throw reject(EXPECTED_OPERATION, CheckResult.fail(RejectionReason.UNKNOWN_OPERATION,
                    "操作 " + expectedOperation + " 不在 " + type + " 白名单中", expectedOperation), document);
        }
        return sanitized;
    }

    /**
     * 转义后可安全嵌入 GraphQL 双引号字符串
     */
    public static String escapeStringValue(String value) {
        return LiteralEscapeUtils.escapeGraphQl(value);
    }

    private static QueryValidationException reject(String checkerName, CheckResult result, String document) {
        log.warn("拒绝 GraphQL 查询 [{}/{}] {}: {}", checkerName, result.reason(), result.message(),
                QueryTextUtils.abbreviate(document));
        return new QueryValidationException(result.reason(), result.message(), result.matchedText());
    }
}
