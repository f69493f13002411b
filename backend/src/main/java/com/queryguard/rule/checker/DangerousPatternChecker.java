package com.queryguard.rule.checker;

import com.queryguard.model.QueryLanguage;
import com.queryguard.model.RejectionReason;
import com.queryguard.parser.LiteralMasker;
import com.queryguard.rule.DangerousPattern;
import com.queryguard.rule.DangerousPattern.Scope;

import java.util.List;
import java.util.regex.Matcher;

/**
 * 危险模式扫描：SQL 注释、脚本标签、模板插值、内省查询等
 */
public class DangerousPatternChecker implements QueryChecker {

    private final QueryLanguage language;
    private final List<DangerousPattern> patterns;

    public DangerousPatternChecker(QueryLanguage language, List<DangerousPattern> patterns) {
        this.language = language;
        this.patterns = List.copyOf(patterns);
    }

    @Override
    public String name() {
        return "DANGEROUS_PATTERN";
    }

    @Override
    public CheckResult check(String query) {
        String masked = null;
        for (DangerousPattern pattern : patterns) {
            String target;
            if (pattern.scope() == Scope.CODE) {
                if (masked == null) {
                    masked = LiteralMasker.mask(language, query);
                }
                target = masked;
            } else {
                target = query;
            }
            Matcher matcher = pattern.pattern().matcher(target);
            if (matcher.find()) {
                return CheckResult.fail(RejectionReason.DANGEROUS_PATTERN,
                        language.displayName() + " 查询包含危险模式 " + pattern.name() + ": " + matcher.group(),
                        matcher.group());
            }
        }
        return CheckResult.pass();
    }

    /**
     * 对一段普通文本（如变量值）应用全部模式，不区分作用域；未命中时返回 null
     */
    public DangerousPatternHit findIn(String text) {
        for (DangerousPattern pattern : patterns) {
            Matcher matcher = pattern.pattern().matcher(text);
            if (matcher.find()) {
                return new DangerousPatternHit(pattern.name(), matcher.group());
            }
        }
        return null;
    }

    public record DangerousPatternHit(String patternName, String matchedText) {
    }
}
