package com.queryguard.rule.checker;

import com.queryguard.model.RejectionReason;

/**
 * 查询检查器接口。每个检查器只负责一类攻击面，独立扫描原始文本，不依赖其他检查器的中间结果。
 */
public interface QueryChecker {

    /**
     * 检查器名称，用于日志
     */
    String name();

    /**
     * 检查查询文本，通过时返回 {@link CheckResult#pass()}
     */
    CheckResult check(String query);

    record CheckResult(boolean violated, RejectionReason reason, String message, String matchedText) {
        public static CheckResult pass() {
            return new CheckResult(false, null, null, null);
        }

        public static CheckResult fail(RejectionReason reason, String message, String matchedText) {
            return new CheckResult(true, reason, message, matchedText);
        }
    }
}
