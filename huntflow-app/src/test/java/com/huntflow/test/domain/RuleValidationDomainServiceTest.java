package com.huntflow.test.domain;

import com.huntflow.domain.agent.service.TolerantParseDomainService;
import com.huntflow.domain.rule.model.valobj.RuleValidationResult;
import com.huntflow.domain.rule.service.RuleDraftParser;
import com.huntflow.domain.rule.service.RuleValidationDomainService;
import com.huntflow.test.support.WorkflowTestFixture;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RuleValidationDomainServiceTest {

    private final RuleValidationDomainService service = new RuleValidationDomainService();
    private final RuleDraftParser parser = new RuleDraftParser(new TolerantParseDomainService());

    @Test
    public void shouldAcceptWellFormedRule() {
        RuleValidationResult result = service.validate(document(WorkflowTestFixture.VALID_RULE_YAML));

        assertTrue(result.valid(), result.joinedErrors());
    }

    @Test
    public void shouldCollectEveryStructuralError() {
        RuleValidationResult result = service.validate(document(WorkflowTestFixture.INVALID_RULE_YAML));

        assertFalse(result.valid());
        assertTrue(result.errors().contains("missing required field: logsource"));
        assertTrue(result.errors().contains("condition references undefined selection: filter"));
        assertTrue(result.errors().stream().anyMatch(error -> error.startsWith("invalid level: urgent")));
    }

    @Test
    public void shouldRejectAggregationAndTimeframe() {
        RuleValidationResult result = service.validate(document("""
                title: Brute force
                logsource:
                  product: windows
                  service: security
                detection:
                  selection:
                    EventID: 4625
                  timeframe: 5m
                  condition: selection | count() by TargetUserName > 10
                """));

        assertTrue(result.errors().contains("forbidden construct: timeframe"));
        assertTrue(result.errors().contains("forbidden construct: aggregation in condition"));
    }

    @Test
    public void shouldResolveWildcardSelections() {
        RuleValidationResult result = service.validate(document("""
                title: Wildcard
                logsource:
                  category: process_creation
                detection:
                  selection_img:
                    Image|endswith: '\\\\rundll32.exe'
                  selection_cli:
                    CommandLine|contains: 'javascript:'
                  condition: all of selection_* and not 1 of filter_*
                """));

        assertFalse(result.valid());
        assertEquals(1, result.errors().size());
        assertEquals("condition references undefined selection pattern: filter_*", result.errors().get(0));
    }

    @Test
    public void shouldRequireLogSourceKey() {
        RuleValidationResult result = service.validate(document("""
                title: No source key
                logsource:
                  definition: anything
                detection:
                  selection:
                    Image: x
                  condition: selection
                """));

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("logsource must define"));
    }

    private Map<String, Object> document(String yaml) {
        return parser.parse(yaml).getValue().document();
    }
}
