package com.queryguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 校验接口的请求体
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationRequest {

    /** JQL 查询（/jql 接口使用） */
    private String jql;

    /** GraphQL 文档（/graphql 接口使用） */
    private String query;

    /** GraphQL 变量，可为空 */
    private Map<String, Object> variables;

    /** 期望调用的操作名，如 getTest；为空时只做通用校验 */
    private String operation;
}
