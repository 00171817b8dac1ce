package com.huntflow.test.domain;

import com.huntflow.domain.extraction.model.valobj.SubAgentOutcome;
import com.huntflow.domain.extraction.model.valobj.SubAgentSpec;
import com.huntflow.domain.workflow.model.valobj.AgentInvocationContext;
import com.huntflow.test.support.WorkflowTestFixture;
import com.huntflow.types.enums.GatewayErrorTypeEnum;
import com.huntflow.types.enums.ObservableTypeEnum;
import com.huntflow.types.enums.SubAgentStatusEnum;
import com.huntflow.types.enums.WorkflowStepEnum;
import com.huntflow.types.exception.ModelGatewayException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SubAgentExtractionDomainServiceTest {

    private static final String CMDLINE_OUTPUT =
            "{\"observables\": [{\"value\": \"cmd.exe /c whoami\", \"source_reference\": \"ran whoami\"}]}";

    private final WorkflowTestFixture fixture = new WorkflowTestFixture();
    private final AgentInvocationContext context = new AgentInvocationContext(31L, WorkflowStepEnum.EXTRACT, fixture.config);
    private final SubAgentSpec cmdline = SubAgentSpec.defaultRoster().get(0);

    @AfterEach
    public void tearDown() {
        fixture.close();
    }

    @Test
    public void shouldAcceptCandidatesWhenQaPasses() {
        fixture.modelGateway.reply("CmdlineExtract", CMDLINE_OUTPUT);
        fixture.modelGateway.reply("CmdlineQA", "{\"verdict\": \"pass\", \"summary\": \"grounded\"}");

        SubAgentOutcome outcome = fixture.subAgentExtraction.run(context, cmdline, "ran whoami", "windows");

        assertEquals(SubAgentStatusEnum.DONE, outcome.getStatus());
        assertEquals(1, outcome.getAttempts());
        assertFalse(outcome.isQaExhausted());
        assertEquals(1, outcome.getObservables().size());
        assertEquals("cmd.exe /c whoami", outcome.getObservables().get(0).getValue());
        assertEquals(ObservableTypeEnum.COMMAND_LINE, outcome.getObservables().get(0).getType());
        assertEquals(2, fixture.attemptRepository.findByExecutionId(31L).size());
    }

    @Test
    public void shouldRetryExactlyMaxAttemptsWhenQaAlwaysRejects() {
        fixture.modelGateway.reply("CmdlineExtract", CMDLINE_OUTPUT);
        fixture.modelGateway.reply("CmdlineQA",
                "{\"verdict\": \"needs_revision\", \"summary\": \"missing parent process\", \"issues\": [\"no parent\"]}");

        SubAgentOutcome outcome = fixture.subAgentExtraction.run(context, cmdline, "ran whoami", "windows");

        int maxAttempts = fixture.config.getQaMaxAttempts();
        assertEquals(SubAgentStatusEnum.DONE, outcome.getStatus());
        assertTrue(outcome.isQaExhausted());
        assertEquals(maxAttempts, outcome.getAttempts());
        assertEquals(maxAttempts, fixture.modelGateway.callCount("CmdlineExtract"));
        assertEquals(maxAttempts, fixture.modelGateway.callCount("CmdlineQA"));
        assertEquals(1, outcome.getObservables().size());
        assertTrue(outcome.getWarnings().stream().anyMatch(warning -> warning.startsWith("qa_exhausted")));
        assertTrue(fixture.modelGateway.lastPrompt("CmdlineExtract").contains("missing parent process"));
    }

    @Test
    public void shouldFeedParseErrorBackIntoNextAttempt() {
        fixture.modelGateway.reply("CmdlineExtract", "Sorry, I cannot format that.", CMDLINE_OUTPUT);
        fixture.modelGateway.reply("CmdlineQA", "{\"verdict\": \"pass\"}");

        SubAgentOutcome outcome = fixture.subAgentExtraction.run(context, cmdline, "ran whoami", "windows");

        assertEquals(SubAgentStatusEnum.DONE, outcome.getStatus());
        assertEquals(2, outcome.getAttempts());
        assertTrue(fixture.modelGateway.lastPrompt("CmdlineExtract").contains("output was not valid JSON"));
    }

    @Test
    public void shouldFailWhenNoAttemptParses() {
        fixture.modelGateway.reply("CmdlineExtract", "no json here");

        SubAgentOutcome outcome = fixture.subAgentExtraction.run(context, cmdline, "ran whoami", "windows");

        assertEquals(SubAgentStatusEnum.FAILED, outcome.getStatus());
        assertFalse(outcome.isQaExhausted());
        assertEquals("invalid_response", outcome.getErrorType());
        assertEquals(0, fixture.modelGateway.callCount("CmdlineQA"));
    }

    @Test
    public void shouldFailOnGatewayErrorWithoutQaRetry() {
        fixture.modelGateway.fail("CmdlineExtract",
                new ModelGatewayException(GatewayErrorTypeEnum.INVALID_RESPONSE, "content policy"));

        SubAgentOutcome outcome = fixture.subAgentExtraction.run(context, cmdline, "ran whoami", "windows");

        assertEquals(SubAgentStatusEnum.FAILED, outcome.getStatus());
        assertEquals(1, outcome.getAttempts());
        assertEquals("invalid_response", outcome.getErrorType());
        assertTrue(fixture.attemptRepository.findByExecutionId(31L).get(0).hasError());
    }

    @Test
    public void shouldAcceptWithWarningWhenQaUnavailable() {
        fixture.modelGateway.reply("CmdlineExtract", CMDLINE_OUTPUT);
        fixture.modelGateway.fail("CmdlineQA", new ModelGatewayException(GatewayErrorTypeEnum.TIMEOUT, "slow"));

        SubAgentOutcome outcome = fixture.subAgentExtraction.run(context, cmdline, "ran whoami", "windows");

        assertEquals(SubAgentStatusEnum.DONE, outcome.getStatus());
        assertEquals(1, outcome.getObservables().size());
        assertTrue(outcome.getWarnings().contains("qa_unavailable: timeout"));
    }

    @Test
    public void shouldSkipQaWhenDisabled() {
        fixture.modelGateway.reply("CmdlineExtract", "[\"cmd.exe /c whoami\", \"cmd.exe /c whoami\", \"net user\"]");

        SubAgentOutcome outcome = fixture.subAgentExtraction.run(context,
                cmdline.toBuilder().qaEnabled(false).build(), "ran whoami", "windows");

        assertEquals(SubAgentStatusEnum.DONE, outcome.getStatus());
        assertEquals(2, outcome.getObservables().size());
        assertEquals(0, fixture.modelGateway.callCount("CmdlineQA"));
    }
}
