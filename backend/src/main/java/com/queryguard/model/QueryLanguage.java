package com.queryguard.model;

/**
 * 受保护的查询语言
 */
public enum QueryLanguage {

    JQL("JQL"),
    GRAPHQL("GraphQL");

    private final String displayName;

    QueryLanguage(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
