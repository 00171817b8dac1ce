package com.huntflow.test.domain;

import com.huntflow.domain.agent.model.valobj.ParseOutcome;
import com.huntflow.domain.agent.service.TolerantParseDomainService;
import com.huntflow.domain.rule.model.valobj.ParsedRule;
import com.huntflow.domain.rule.service.RuleDraftParser;
import com.huntflow.test.support.WorkflowTestFixture;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RuleDraftParserTest {

    private final RuleDraftParser parser = new RuleDraftParser(new TolerantParseDomainService());

    @Test
    public void shouldDropProseAndFencesBeforeFirstRuleKey() {
        String reply = "Here is the rule you asked for:\n```yaml\n" + WorkflowTestFixture.VALID_RULE_YAML + "```\nLet me know.";

        ParseOutcome<ParsedRule> outcome = parser.parse(reply);

        assertTrue(outcome.isSuccess());
        ParsedRule rule = outcome.getValue();
        assertTrue(rule.yaml().startsWith("title: Hidden Encoded PowerShell From Cmd"));
        assertEquals("high", rule.document().get("level"));
        assertTrue(rule.document().get("detection") instanceof Map);
    }

    @Test
    public void shouldDropLeadingExplanationWithoutFences() {
        ParseOutcome<ParsedRule> outcome = parser.parse("Sure! The rule:\ntitle: Short\nlogsource:\n  product: linux\n");

        assertTrue(outcome.isSuccess());
        assertEquals("Short", outcome.getValue().document().get("title"));
    }

    @Test
    public void shouldReportYamlSyntaxError() {
        ParseOutcome<ParsedRule> outcome = parser.parse("title: [unterminated\ndetection: {");

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.getError().startsWith("YAML parse error"));
    }

    @Test
    public void shouldRejectNonMappingDocument() {
        ParseOutcome<ParsedRule> outcome = parser.parse("- just\n- a list\n");

        assertFalse(outcome.isSuccess());
        assertEquals("rule YAML must be a mapping", outcome.getError());
    }
}
