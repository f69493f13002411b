package com.queryguard.config;

import com.queryguard.rule.GraphQlRules;
import com.queryguard.rule.JqlRules;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 由内置白名单和 query-guard.* 配置构建只读的规则表
 */
@Configuration
@EnableConfigurationProperties(QueryGuardProperties.class)
public class QueryGuardConfig {

    @Bean
    public JqlRules jqlRules(QueryGuardProperties properties) {
        return jqlRulesOf(properties.getJql());
    }

    @Bean
    public GraphQlRules graphQlRules(QueryGuardProperties properties) {
        return graphQlRulesOf(properties.getGraphql());
    }

    static JqlRules jqlRulesOf(QueryGuardProperties.Jql jql) {
        return JqlRules.withExtras(jql.getExtraFields(), jql.getExtraFunctions(),
                jql.getMaxLength(), jql.getMaxNestingDepth(), jql.getCustomFieldMin(), jql.getCustomFieldMax());
    }

    static GraphQlRules graphQlRulesOf(QueryGuardProperties.GraphQl graphql) {
        return GraphQlRules.withExtras(graphql.getExtraFields(), graphql.getExtraQueries(),
                graphql.getExtraMutations(), graphql.getMaxLength(), graphql.getMaxDepth(),
                graphql.getMaxVariables(), graphql.getMaxStringLength(), graphql.getMaxListSize(),
                graphql.getMaxObjectSize(), graphql.getMaxVariableDepth());
    }
}
