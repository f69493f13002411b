package com.queryguard.model;

/**
 * 查询校验失败。在第一个不通过的检查处抛出，不做任何修复或重试。
 */
public class QueryValidationException extends IllegalArgumentException {

    private final RejectionReason reason;
    private final String matchedText;

    public QueryValidationException(RejectionReason reason, String message) {
        this(reason, message, null);
    }

    public QueryValidationException(RejectionReason reason, String message, String matchedText) {
        super(message);
        this.reason = reason;
        this.matchedText = matchedText;
    }

    public RejectionReason getReason() {
        return reason;
    }

    public String getMatchedText() {
        return matchedText;
    }
}
