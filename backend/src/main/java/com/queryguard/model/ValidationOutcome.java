package com.queryguard.model;

/**
 * 一次校验的结果：要么是去除首尾空白后的原查询，要么是拒绝原因
 */
public record ValidationOutcome(boolean accepted, String sanitized, RejectionReason reason, String message,
        String matchedText) {

    public static ValidationOutcome sanitized(String sanitized) {
        return new ValidationOutcome(true, sanitized, null, null, null);
    }

    public static ValidationOutcome rejected(RejectionReason reason, String message, String matchedText) {
        return new ValidationOutcome(false, null, reason, message, matchedText);
    }
}
