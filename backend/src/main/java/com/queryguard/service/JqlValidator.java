package com.queryguard.service;

import com.queryguard.model.QueryLanguage;
import com.queryguard.model.QueryValidationException;
import com.queryguard.rule.DangerousPatterns;
import com.queryguard.rule.JqlRules;
import com.queryguard.rule.checker.DangerousPatternChecker;
import com.queryguard.rule.checker.InputSizeChecker;
import com.queryguard.rule.checker.JqlFieldChecker;
import com.queryguard.rule.checker.JqlFunctionChecker;
import com.queryguard.rule.checker.QueryChecker;
import com.queryguard.rule.checker.QueryChecker.CheckResult;
import com.queryguard.rule.checker.SqlKeywordChecker;
import com.queryguard.rule.checker.StructuralChecker;
import com.queryguard.util.LiteralEscapeUtils;
import com.queryguard.util.QueryTextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * JQL 校验服务。
 * <p>
 * 检查顺序固定，遇到第一个不通过的检查即抛出 {@link QueryValidationException}：
 * 长度 → 危险模式 → 结构（引号 / 括号 / 嵌套深度）→ 字段白名单 → 函数白名单 → SQL 关键字。
 * 通过时原样返回去除首尾空白后的查询，不做任何改写。
 */
@Service
public class JqlValidator {

    private static final Logger log = LoggerFactory.getLogger(JqlValidator.class);

    private final List<QueryChecker> checkers;

    public JqlValidator(JqlRules rules) {
        this.checkers = List.of(
                new InputSizeChecker(QueryLanguage.JQL, rules.maxLength()),
                new DangerousPatternChecker(QueryLanguage.JQL, DangerousPatterns.JQL),
                StructuralChecker.forJql(rules.maxNestingDepth()),
                new JqlFieldChecker(rules),
                new JqlFunctionChecker(rules),
                new SqlKeywordChecker());
        log.info("JQL 校验器已加载: {} 个字段, {} 个函数, 自定义字段范围 [{}, {}], 检查顺序 {}",
                rules.fields().size(), rules.functions().size(), rules.customFieldMin(), rules.customFieldMax(),
                checkerNames());
    }

    public static JqlValidator withDefaults() {
        return new JqlValidator(JqlRules.defaults());
    }

    /**
     * 检查器名称，按执行顺序
     */
    public List<String> checkerNames() {
        return checkers.stream().map(QueryChecker::name).toList();
    }

    /**
     * 校验 JQL 查询
     *
     * @return 去除首尾空白后的查询
     * @throws QueryValidationException 任一检查不通过
     */
    public String validateAndSanitize(String jql) {
        for (QueryChecker checker : checkers) {
            CheckResult result = checker.check(jql);
            if (result.violated()) {
                log.warn("拒绝 JQL 查询 [{}/{}] {}: {}", checker.name(), result.reason(), result.message(),
                        QueryTextUtils.abbreviate(jql));
                throw new QueryValidationException(result.reason(), result.message(), result.matchedText());
            }
        }
        String sanitized = jql.strip();
        log.debug("JQL 查询校验通过: {}", QueryTextUtils.abbreviate(sanitized));
        return sanitized;
    }

    /**
     * 转义后可安全嵌入 JQL 双引号字符串
     */
    public static String escapeStringValue(String value) {
        return LiteralEscapeUtils.escapeJql(value);
    }
}
