package com.queryguard.util;

/**
 * 日志输出用的查询文本处理
 */
public final class QueryTextUtils {

    static final int MAX_LOGGED_LENGTH = 200;

    private QueryTextUtils() {
    }

    /**
     * 截断到 200 个字符，换行替换为空格，避免恶意载荷刷屏或伪造日志行
     */
    public static String abbreviate(String text) {
        if (text == null) {
            return "null";
        }
        String oneLine = text.replace('\r', ' ').replace('\n', ' ');
        if (oneLine.length() <= MAX_LOGGED_LENGTH) {
            return oneLine;
        }
        return oneLine.substring(0, MAX_LOGGED_LENGTH) + "...(共 " + text.length() + " 个字符)";
    }
}
