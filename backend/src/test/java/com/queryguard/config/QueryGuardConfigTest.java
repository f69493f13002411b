package com.queryguard.config;

import com.queryguard.model.QueryValidationException;
import com.queryguard.model.RejectionReason;
import com.queryguard.rule.GraphQlRules;
import com.queryguard.rule.JqlRules;
import com.queryguard.service.GraphQlValidator;
import com.queryguard.service.JqlValidator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryGuardConfigTest {

    @Test
    void shouldBuildDefaultRulesFromEmptyProperties() {
        QueryGuardProperties properties = new QueryGuardProperties();

        JqlRules jql = QueryGuardConfig.jqlRulesOf(properties.getJql());
        GraphQlRules graphQl = QueryGuardConfig.graphQlRulesOf(properties.getGraphql());

        assertEquals(JqlRules.defaults(), jql);
        assertEquals(GraphQlRules.defaults(), graphQl);
    }

    @Test
    void shouldWidenJqlWhitelistWithExtras() {
        QueryGuardProperties.Jql props = new QueryGuardProperties.Jql();
        props.setExtraFields(List.of("storyPoints"));
        props.setExtraFunctions(List.of("myTeamMembers"));
        JqlValidator validator = new JqlValidator(QueryGuardConfig.jqlRulesOf(props));

        assertDoesNotThrow(() -> validator.validateAndSanitize("storyPoints > 3 AND assignee in myTeamMembers()"));
        assertDoesNotThrow(() -> validator.validateAndSanitize("project = TEST"));
        assertThrows(QueryValidationException.class,
                () -> JqlValidator.withDefaults().validateAndSanitize("storyPoints > 3"));
    }

    @Test
    void shouldWidenGraphQlWhitelistWithExtras() {
        QueryGuardProperties.GraphQl props = new QueryGuardProperties.GraphQl();
        props.setExtraQueries(List.of("getFolder"));
        props.setExtraFields(List.of("path"));
        props.setMaxDepth(2);
        GraphQlValidator validator = new GraphQlValidator(QueryGuardConfig.graphQlRulesOf(props));

        assertDoesNotThrow(() -> validator.validateQuery("query { getFolder { path } }", null));
        assertThrows(QueryValidationException.class,
                () -> validator.validateQuery("query { getTest { testType { name } } }", null));
    }

    @Test
    void shouldApplyConfiguredVariableDepth() {
        QueryGuardProperties.GraphQl props = new QueryGuardProperties.GraphQl();
        props.setMaxVariableDepth(1);
        GraphQlValidator validator = new GraphQlValidator(QueryGuardConfig.graphQlRulesOf(props));
        String query = "query { getTests { total } }";

        assertDoesNotThrow(() -> validator.validateQuery(query, Map.of("ids", List.of("a", "b"))));
        QueryValidationException e = assertThrows(QueryValidationException.class,
                () -> validator.validateQuery(query, Map.of("ids", List.of(List.of("a")))));
        assertEquals(RejectionReason.VARIABLE_TOO_LARGE, e.getReason());
        assertEquals("ids[0]", e.getMatchedText());
    }

    @Test
    void shouldRejectInvertedCustomFieldRange() {
        QueryGuardProperties.Jql props = new QueryGuardProperties.Jql();
        props.setCustomFieldMin(20000);
        props.setCustomFieldMax(10000);

        assertThrows(IllegalArgumentException.class, () -> QueryGuardConfig.jqlRulesOf(props));
    }
}
