package com.queryguard.config;

import com.queryguard.rule.GraphQlRules;
import com.queryguard.rule.JqlRules;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * query-guard.* 配置。extra-* 只能在内置白名单上追加，不能删除内置项。
 */
@Data
@ConfigurationProperties(prefix = "query-guard")
public class QueryGuardProperties {

    private Jql jql = new Jql();
    private GraphQl graphql = new GraphQl();

    @Data
    public static class Jql {
        private int maxLength = JqlRules.DEFAULT_MAX_LENGTH;
        private int maxNestingDepth = JqlRules.DEFAULT_MAX_NESTING_DEPTH;
        private int customFieldMin = JqlRules.DEFAULT_CUSTOM_FIELD_MIN;
        private int customFieldMax = JqlRules.DEFAULT_CUSTOM_FIELD_MAX;
        private List<String> extraFields = new ArrayList<>();
        private List<String> extraFunctions = new ArrayList<>();
    }

    @Data
    public static class GraphQl {
        private int maxLength = GraphQlRules.DEFAULT_MAX_LENGTH;
        private int maxDepth = GraphQlRules.DEFAULT_MAX_DEPTH;
        private int maxVariables = GraphQlRules.DEFAULT_MAX_VARIABLES;
        private int maxStringLength = GraphQlRules.DEFAULT_MAX_STRING_LENGTH;
        private int maxListSize = GraphQlRules.DEFAULT_MAX_LIST_SIZE;
        private int maxObjectSize = GraphQlRules.DEFAULT_MAX_OBJECT_SIZE;
        private int maxVariableDepth = GraphQlRules.DEFAULT_MAX_VARIABLE_DEPTH;
        private List<String> extraFields = new ArrayList<>();
        private List<String> extraQueries = new ArrayList<>();
        private List<String> extraMutations = new ArrayList<>();
    }
}
