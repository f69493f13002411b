package com.queryguard.model;

/**
 * 查询被拒绝的原因分类，每个取值对应一类独立的攻击面或输入约束
 */
public enum RejectionReason {

    EMPTY_INPUT("查询为空"),
    TOO_LONG("查询过长"),
    DANGEROUS_PATTERN("包含危险模式"),
    UNBALANCED_QUOTES("引号不匹配"),
    UNBALANCED_DELIMITERS("括号不匹配"),
    NESTING_TOO_DEEP("嵌套层级过深"),
    UNKNOWN_FIELD("未知或不允许的字段"),
    UNKNOWN_FUNCTION("未知或不允许的函数"),
    UNKNOWN_OPERATION("未知或不允许的操作"),
    UNSUPPORTED_OPERATION("不支持的操作类型"),
    SQL_KEYWORD_NOT_ALLOWED("不允许使用 SQL 关键字"),
    INVALID_VARIABLE_NAME("变量名不合法"),
    TOO_MANY_VARIABLES("变量数量过多"),
    VARIABLE_TOO_LARGE("变量值过大"),
    UNSUPPORTED_VARIABLE_TYPE("不支持的变量类型");

    private final String label;

    RejectionReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
