package com.queryguard.rule.checker;

import com.queryguard.model.RejectionReason;
import com.queryguard.parser.LiteralMasker;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL 关键字兜底检查。与危险模式扫描相互独立：只要空白包围的 SQL 关键字出现在查询语法部分即拒绝。
 * 字符串字面量内的内容不参与匹配。
 */
public class SqlKeywordChecker implements QueryChecker {

    private static final Pattern SQL_KEYWORD = Pattern.compile(
            "(?<!\\S)(select|from|where|join|union|insert|update|delete)(?!\\S)");

    @Override
    public String name() {
        return "SQL_KEYWORD";
    }

    @Override
    public CheckResult check(String query) {
        String code = LiteralMasker.maskJql(query).toLowerCase(Locale.ROOT);
        Matcher matcher = SQL_KEYWORD.matcher(code);
        if (matcher.find()) {
            return CheckResult.fail(RejectionReason.SQL_KEYWORD_NOT_ALLOWED,
                    "JQL 中不允许使用 SQL 关键字: " + matcher.group(1), matcher.group(1));
        }
        return CheckResult.pass();
    }
}
