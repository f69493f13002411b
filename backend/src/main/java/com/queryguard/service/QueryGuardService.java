package com.queryguard.service;

import com.queryguard.model.QueryValidationException;
import com.queryguard.model.ValidationOutcome;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.function.Supplier;

/**
 * 面向调用方的校验入口：把校验异常转换为 {@link ValidationOutcome}，被拒绝的查询不会抛出异常。
 */
@Service
public class QueryGuardService {

    private final JqlValidator jqlValidator;
    private final GraphQlValidator graphQlValidator;

    public QueryGuardService(JqlValidator jqlValidator, GraphQlValidator graphQlValidator) {
        this.jqlValidator = jqlValidator;
        this.graphQlValidator = graphQlValidator;
    }

    public ValidationOutcome checkJql(String jql) {
        return outcomeOf(() -> jqlValidator.validateAndSanitize(jql));
    }

    public ValidationOutcome checkGraphQl(String document, Map<String, ?> variables) {
        return outcomeOf(() -> graphQlValidator.validateQuery(document, variables));
    }

    public ValidationOutcome checkGraphQlOperation(String document, String operation, Map<String, ?> variables) {
        return outcomeOf(() -> graphQlValidator.validateForOperation(document, operation, variables));
    }

    public String escape(String value, String language) {
        if ("graphql".equalsIgnoreCase(language)) {
            return GraphQlValidator.escapeStringValue(value);
        }
        if ("jql".equalsIgnoreCase(language)) {
            return JqlValidator.escapeStringValue(value);
        }
        throw new IllegalArgumentException("不支持的查询语言: " + language + "，可选 jql / graphql");
    }

    private static ValidationOutcome outcomeOf(Supplier<String> validation) {
        try {
            return ValidationOutcome.sanitized(validation.get());
        } catch (QueryValidationException e) {
            return ValidationOutcome.rejected(e.getReason(), e.getMessage(), e.getMatchedText());
        }
    }
}
