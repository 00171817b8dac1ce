package com.huntflow.test.domain;

import com.huntflow.domain.extraction.model.valobj.ExtractionResult;
import com.huntflow.domain.extraction.model.valobj.SubAgentOutcome;
import com.huntflow.domain.extraction.model.valobj.SubAgentSpec;
import com.huntflow.domain.extraction.service.ExtractionSupervisorDomainService;
import com.huntflow.domain.workflow.model.valobj.AgentInvocationContext;
import com.huntflow.domain.workflow.model.valobj.WorkflowConfig;
import com.huntflow.test.support.WorkflowTestFixture;
import com.huntflow.types.enums.GatewayErrorTypeEnum;
import com.huntflow.types.enums.SubAgentStatusEnum;
import com.huntflow.types.enums.WorkflowStepEnum;
import com.huntflow.types.exception.FatalConfigurationException;
import com.huntflow.types.exception.ModelGatewayException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExtractionSupervisorDomainServiceTest {

    private static final Long EXECUTION_ID = 41L;

    private final WorkflowTestFixture fixture = new WorkflowTestFixture();
    private final ExecutorService extractionPool = Executors.newFixedThreadPool(5);

    @AfterEach
    public void tearDown() {
        extractionPool.shutdownNow();
        fixture.close();
    }

    @Test
    public void shouldMergeInRosterOrderWhenRunningConcurrently() {
        fixture.scriptHappyPath();
        ExtractionSupervisorDomainService supervisor =
                new ExtractionSupervisorDomainService(fixture.subAgentExtraction, extractionPool);

        ExtractionResult result = supervisor.extract(context(fixture.config), WorkflowTestFixture.WINDOWS_REPORT, "windows");

        List<String> order = result.getOutcomes().stream().map(SubAgentOutcome::getAgentName).collect(Collectors.toList());
        assertEquals(List.of("CmdlineExtract", "HuntQueriesExtract", "EventIdExtract",
                "ProcTreeExtract", "RegistryExtract"), order);
        assertEquals(3, result.getSuccessCount());
        assertEquals(List.of("command_line", "event_id", "registry_operation"),
                List.copyOf(result.getObservables().keySet()));
        assertEquals("4688", result.getObservables().get("event_id").get(0).getValue());
        assertTrue(result.getWarnings().stream().anyMatch(warning -> warning.startsWith("HuntQueriesExtract failed")));
        assertFalse(result.isAllFailed());
    }

    @Test
    public void shouldSkipDisabledAgents() {
        fixture.scriptHappyPath();
        WorkflowConfig config = fixture.config.toBuilder()
                .disabledAgent("RegistryExtract")
                .disabledAgent("EventIdExtract")
                .build();

        ExtractionResult result = fixture.supervisor.extract(context(config), WorkflowTestFixture.WINDOWS_REPORT, "windows");

        assertEquals(SubAgentStatusEnum.SKIPPED, result.getOutcomes().get(4).getStatus());
        assertEquals(1, result.getSuccessCount());
        assertEquals(0, fixture.modelGateway.callCount("RegistryExtract"));
    }

    @Test
    public void shouldReportAllFailedWhenEverySubAgentFails() {
        ModelGatewayException refused = new ModelGatewayException(GatewayErrorTypeEnum.INVALID_RESPONSE, "refused");
        for (SubAgentSpec spec : SubAgentSpec.defaultRoster()) {
            fixture.modelGateway.fail(spec.getName(), refused);
        }

        ExtractionResult result = fixture.supervisor.extract(context(fixture.config), "text", "windows");

        assertTrue(result.isAllFailed());
        assertEquals(5, result.getOutcomes().size());
        assertEquals(0, result.totalObservables());
        assertEquals(5, result.getWarnings().size());
    }

    @Test
    public void shouldProceedWithSurvivingSubAgentObservables() {
        ModelGatewayException refused = new ModelGatewayException(GatewayErrorTypeEnum.INVALID_RESPONSE, "refused");
        for (SubAgentSpec spec : SubAgentSpec.defaultRoster()) {
            if (!"EventIdExtract".equals(spec.getName())) {
                fixture.modelGateway.fail(spec.getName(), refused);
            }
        }
        fixture.modelGateway.reply("EventIdExtract", "{\"observables\": [\"4688\", \"4104\"]}");
        fixture.modelGateway.reply("EventIdQA", "{\"verdict\": \"pass\", \"summary\": \"grounded\"}");

        ExtractionResult result = fixture.supervisor.extract(context(fixture.config), WorkflowTestFixture.WINDOWS_REPORT, "windows");

        assertFalse(result.isAllFailed());
        assertEquals(1, result.getSuccessCount());
        assertEquals(5, result.getOutcomes().size());
        assertEquals(SubAgentStatusEnum.DONE, result.getOutcomes().get(2).getStatus());
        assertEquals(List.of("event_id"), List.copyOf(result.getObservables().keySet()));
        assertEquals(2, result.totalObservables());
        assertEquals(4, result.getWarnings().size());
    }

    @Test
    public void shouldUseConfiguredRoster() {
        SubAgentSpec single = SubAgentSpec.defaultRoster().get(2).toBuilder().qaEnabled(false).build();
        WorkflowConfig config = fixture.config.toBuilder().rosterEntry(single).build();
        fixture.modelGateway.reply("EventIdExtract", "{\"event_ids\": [4688, 4104]}");

        ExtractionResult result = fixture.supervisor.extract(context(config), "text", "windows");

        assertEquals(1, result.getOutcomes().size());
        assertEquals(2, result.getObservables().get("event_id").size());
    }

    @Test
    public void shouldDefaultPromptTemplateFromObservableType() {
        SubAgentSpec untemplated = SubAgentSpec.defaultRoster().get(0).toBuilder()
                .promptTemplateId(" ")
                .qaEnabled(false)
                .build();
        WorkflowConfig config = fixture.config.toBuilder().rosterEntry(untemplated).build();
        fixture.modelGateway.reply("CmdlineExtract", "{\"observables\": [\"cmd.exe /c whoami\"]}");

        ExtractionResult result = fixture.supervisor.extract(context(config), "text", "windows");

        assertEquals(1, result.getSuccessCount());
        assertTrue(fixture.modelGateway.lastPrompt("CmdlineExtract").contains("literal command line"));
    }

    @Test
    public void shouldSettleSiblingsBeforeFailingOnFatalSubAgent() throws InterruptedException {
        SubAgentSpec broken = SubAgentSpec.defaultRoster().get(0).toBuilder()
                .promptTemplateId("no_such_template")
                .build();
        SubAgentSpec slow = SubAgentSpec.defaultRoster().get(2).toBuilder().qaEnabled(false).build();
        WorkflowConfig config = fixture.config.toBuilder().rosterEntry(broken).rosterEntry(slow).build();
        fixture.modelGateway.replyAfter("EventIdExtract", 200L, "not json at all");
        ExtractionSupervisorDomainService supervisor =
                new ExtractionSupervisorDomainService(fixture.subAgentExtraction, extractionPool);

        assertThrows(FatalConfigurationException.class,
                () -> supervisor.extract(context(config), "text", "windows"));
        int auditedAtFailure = fixture.attemptRepository.findByExecutionId(EXECUTION_ID).size();
        Thread.sleep(700L);

        assertEquals(auditedAtFailure, fixture.attemptRepository.findByExecutionId(EXECUTION_ID).size());
        assertEquals(0, fixture.modelGateway.callCount("CmdlineExtract"));
        assertTrue(fixture.modelGateway.callCount("EventIdExtract") <= 1);
    }

    private AgentInvocationContext context(WorkflowConfig config) {
        return new AgentInvocationContext(EXECUTION_ID, WorkflowStepEnum.EXTRACT, config);
    }
}
