package com.queryguard.rule.checker;

import com.queryguard.model.QueryLanguage;
import com.queryguard.model.RejectionReason;

/**
 * 空输入与长度上限
 */
public class InputSizeChecker implements QueryChecker {

    private final QueryLanguage language;
    private final int maxLength;

    public InputSizeChecker(QueryLanguage language, int maxLength) {
        this.language = language;
        this.maxLength = maxLength;
    }

    @Override
    public String name() {
        return "INPUT_SIZE";
    }

    @Override
    public CheckResult check(String query) {
        if (query == null || query.isBlank()) {
            return CheckResult.fail(RejectionReason.EMPTY_INPUT,
                    language.displayName() + " 查询不能为空", null);
        }
        if (query.length() > maxLength) {
            return CheckResult.fail(RejectionReason.TOO_LONG,
                    language.displayName() + " 查询过长：" + query.length() + " 个字符，上限 " + maxLength,
                    null);
        }
        return CheckResult.pass();
    }
}
