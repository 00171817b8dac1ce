package com.huntflow.test.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.domain.agent.service.AgentInvocationDomainService;
import com.huntflow.domain.agent.service.ExternalCallDomainService;
import com.huntflow.domain.agent.service.TolerantParseDomainService;
import com.huntflow.domain.analysis.service.PlatformDetectionDomainService;
import com.huntflow.domain.analysis.service.RankingDomainService;
import com.huntflow.domain.extraction.service.ExtractionPromptCatalog;
import com.huntflow.domain.extraction.service.ExtractionSupervisorDomainService;
import com.huntflow.domain.extraction.service.SubAgentExtractionDomainService;
import com.huntflow.domain.filter.service.ChunkFeatureDomainService;
import com.huntflow.domain.filter.service.ContentFilterDomainService;
import com.huntflow.domain.rule.service.QueuePromotionDomainService;
import com.huntflow.domain.rule.service.RuleDraftParser;
import com.huntflow.domain.rule.service.RuleGenerationDomainService;
import com.huntflow.domain.rule.service.RuleSectionDomainService;
import com.huntflow.domain.rule.service.RuleValidationDomainService;
import com.huntflow.domain.rule.service.SimilarityMatchingDomainService;
import com.huntflow.domain.workflow.model.entity.WorkflowExecutionEntity;
import com.huntflow.domain.workflow.model.valobj.RetryPolicy;
import com.huntflow.domain.workflow.model.valobj.WorkflowConfig;
import com.huntflow.domain.workflow.service.ExecutionAuditDomainService;
import com.huntflow.domain.workflow.service.WorkflowPersistencePolicyDomainService;
import com.huntflow.domain.workflow.service.WorkflowTransitionDomainService;
import com.huntflow.trigger.application.command.QueueReviewCommandService;
import com.huntflow.trigger.application.command.WorkflowCommandService;
import com.huntflow.trigger.application.command.WorkflowRunApplicationService;
import com.huntflow.trigger.application.common.WorkflowConfigSnapshotAssembler;
import com.huntflow.trigger.application.common.WorkflowViewAssembler;
import com.huntflow.trigger.application.step.ExtractStepHandler;
import com.huntflow.trigger.application.step.FilterStepHandler;
import com.huntflow.trigger.application.step.GenerateStepHandler;
import com.huntflow.trigger.application.step.PlatformDetectStepHandler;
import com.huntflow.trigger.application.step.PromoteStepHandler;
import com.huntflow.trigger.application.step.RankStepHandler;
import com.huntflow.trigger.application.step.SimilarityStepHandler;
import com.huntflow.types.enums.ExecutionStatusEnum;
import com.huntflow.types.enums.GatewayErrorTypeEnum;
import com.huntflow.types.exception.ModelGatewayException;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 完整工作流对象图：真实领域服务与步骤处理器，外部依赖全部替换为内存实现。
 * <p>
 * 抽取子代理在调用线程内顺序执行，便于断言审计顺序；网关调用仍走带超时的线程池。
 * </p>
 */
public class WorkflowTestFixture implements AutoCloseable {

    public static final String OWNER = "test-worker";

    public static final String WINDOWS_REPORT = """
            Threat actors gained access and executed powershell.exe -nop -w hidden -enc SQBFAFgA from cmd.exe.
            Persistence was added under HKLM\\Software\\Microsoft\\Windows\\CurrentVersion\\Run with reg.exe add.
            Sysmon event id 4688 recorded the process creation; the parent process was winword.exe.
            Analysts hunted with: DeviceProcessEvents | where ProcessCommandLine has "-enc".
            """;

    public static final String VALID_RULE_YAML = """
            title: Hidden Encoded PowerShell From Cmd
            id: 7c1f0d3e-9a51-4b8e-a7f1-2f0c7a1e5b11
            description: Detects hidden encoded PowerShell launched by cmd.exe
            logsource:
              product: windows
              category: process_creation
            detection:
              selection:
                Image|endswith: '\\powershell.exe'
                CommandLine|contains|all:
                  - '-enc'
                  - '-w hidden'
              filter_admin:
                ParentImage|endswith: '\\sccm.exe'
              condition: selection and not filter_admin
            tags:
              - attack.execution
              - attack.t1059.001
            level: high
            """;

    public static final String INVALID_RULE_YAML = """
            title: Broken Rule
            detection:
              selection:
                CommandLine|contains: '-enc'
              condition: selection and filter
            level: urgent
            """;

    public final ObjectMapper objectMapper = new ObjectMapper();
    public final InMemoryWorkflowExecutionRepository executionRepository = new InMemoryWorkflowExecutionRepository();
    public final InMemoryExecutionAttemptRepository attemptRepository = new InMemoryExecutionAttemptRepository();
    public final InMemoryRuleDraftRepository draftRepository = new InMemoryRuleDraftRepository();
    public final InMemorySimilarityMatchRepository matchRepository = new InMemorySimilarityMatchRepository();
    public final InMemoryQueueItemRepository queueRepository = new InMemoryQueueItemRepository();
    public final InMemoryVectorIndex vectorIndex = new InMemoryVectorIndex();
    public final InMemoryDocumentStore documentStore = new InMemoryDocumentStore();
    public final ScriptedModelGateway modelGateway = new ScriptedModelGateway();
    public final HashingEmbeddingGateway embeddingGateway = new HashingEmbeddingGateway();

    public final WorkflowConfig config;
    public final WorkflowPersistencePolicyDomainService persistencePolicy = new WorkflowPersistencePolicyDomainService();
    public final WorkflowConfigSnapshotAssembler snapshotAssembler = new WorkflowConfigSnapshotAssembler(objectMapper);
    public final WorkflowViewAssembler viewAssembler = new WorkflowViewAssembler();
    public final TolerantParseDomainService tolerantParse = new TolerantParseDomainService();
    public final RuleDraftParser ruleDraftParser = new RuleDraftParser(tolerantParse);
    public final RuleValidationDomainService ruleValidation = new RuleValidationDomainService();
    public final RuleSectionDomainService ruleSections = new RuleSectionDomainService();
    public final ExecutionAuditDomainService audit;
    public final ExternalCallDomainService externalCall;
    public final AgentInvocationDomainService agentInvocation;
    public final RankingDomainService ranking;
    public final PlatformDetectionDomainService platformDetection;
    public final SubAgentExtractionDomainService subAgentExtraction;
    public final ExtractionSupervisorDomainService supervisor;
    public final RuleGenerationDomainService ruleGeneration;
    public final SimilarityMatchingDomainService similarity;
    public final QueuePromotionDomainService promotion;

    private final ExecutorService gatewayPool;
    private FixedClassifierProvider classifierProvider = FixedClassifierProvider.constant(0.9);

    public WorkflowTestFixture() {
        this(defaultConfig());
    }

    public WorkflowTestFixture(WorkflowConfig config) {
        this.config = config;
        this.gatewayPool = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "test-gateway-call");
            thread.setDaemon(true);
            return thread;
        });
        this.audit = new ExecutionAuditDomainService(attemptRepository);
        this.externalCall = new ExternalCallDomainService(gatewayPool);
        this.agentInvocation = new AgentInvocationDomainService(modelGateway, externalCall, audit);
        this.ranking = new RankingDomainService(agentInvocation, tolerantParse, audit);
        this.platformDetection = new PlatformDetectionDomainService(agentInvocation, audit);
        this.subAgentExtraction = new SubAgentExtractionDomainService(agentInvocation, tolerantParse, audit,
                new ExtractionPromptCatalog());
        this.supervisor = new ExtractionSupervisorDomainService(subAgentExtraction, Runnable::run);
        this.ruleGeneration = new RuleGenerationDomainService(agentInvocation, audit, ruleDraftParser, ruleValidation,
                draftRepository);
        this.similarity = new SimilarityMatchingDomainService(embeddingGateway, vectorIndex, matchRepository,
                externalCall, ruleSections);
        this.promotion = new QueuePromotionDomainService(queueRepository);
    }

    /**
     * 测试默认配置：不限制目标平台，退避为 0
     */
    public static WorkflowConfig defaultConfig() {
        return WorkflowConfig.builder()
                .version("test-v1")
                .rankingThreshold(60.0)
                .retryPolicy(RetryPolicy.builder().maxAttempts(2).initialBackoffMs(0L).callTimeoutMs(5_000L).build())
                .build()
                .validate();
    }

    public WorkflowTestFixture classifier(FixedClassifierProvider provider) {
        this.classifierProvider = provider;
        return this;
    }

    public WorkflowRunApplicationService runService() {
        return new WorkflowRunApplicationService(executionRepository, documentStore,
                new WorkflowTransitionDomainService(), persistencePolicy, snapshotAssembler, List.of(
                        new FilterStepHandler(new ContentFilterDomainService(new ChunkFeatureDomainService()),
                                classifierProvider, objectMapper),
                        new RankStepHandler(ranking),
                        new PlatformDetectStepHandler(platformDetection),
                        new ExtractStepHandler(supervisor, objectMapper),
                        new GenerateStepHandler(ruleGeneration, objectMapper),
                        new SimilarityStepHandler(draftRepository, similarity),
                        new PromoteStepHandler(draftRepository, matchRepository, promotion)));
    }

    public WorkflowCommandService commandService() {
        return new WorkflowCommandService(executionRepository, attemptRepository, draftRepository, matchRepository,
                persistencePolicy, snapshotAssembler, viewAssembler, config);
    }

    public QueueReviewCommandService queueReviewService() {
        return new QueueReviewCommandService(queueRepository, vectorIndex, ruleDraftParser, ruleValidation,
                ruleGeneration, ruleSections, similarity, persistencePolicy, viewAssembler, config);
    }

    /**
     * 新建执行并以 OWNER 领取，返回领取后的记录
     */
    public WorkflowExecutionEntity claimNew(Long documentId) {
        WorkflowExecutionEntity execution = WorkflowExecutionEntity.create(documentId, config.getVersion(),
                snapshotAssembler.snapshot(config));
        executionRepository.save(execution);
        return claim(execution.getId());
    }

    public WorkflowExecutionEntity claim(Long executionId) {
        WorkflowExecutionEntity execution = executionRepository.findById(executionId);
        if (execution.getStatus() != ExecutionStatusEnum.PENDING) {
            throw new IllegalStateException("Execution is not pending: " + executionId);
        }
        execution.claim(OWNER);
        return executionRepository.update(execution);
    }

    /**
     * 脚本：排序 85 分，三个子代理产出且 QA 通过，两个子代理网关失败，规则一次校验通过
     */
    public WorkflowTestFixture scriptHappyPath() {
        modelGateway.reply("RankAgent", "{\"score\": 85, \"reasoning\": \"Concrete command lines and registry keys.\"}");
        modelGateway.reply("CmdlineExtract", """
                {"observables": [{"value": "powershell.exe -nop -w hidden -enc SQBFAFgA", "source_reference": "executed powershell.exe"}]}""");
        modelGateway.reply("CmdlineQA", "{\"verdict\": \"pass\", \"summary\": \"grounded\"}");
        modelGateway.reply("EventIdExtract", "```json\n{\"observables\": [\"4688\"]}\n```");
        modelGateway.reply("EventIdQA", "{\"verdict\": \"pass\", \"summary\": \"ok\"}");
        modelGateway.reply("RegistryExtract", """
                {"observables": [{"value": "HKLM\\\\Software\\\\Microsoft\\\\Windows\\\\CurrentVersion\\\\Run"}]}""");
        modelGateway.reply("RegistryQA", "{\"verdict\": \"pass\"}");
        modelGateway.fail("HuntQueriesExtract", new ModelGatewayException(
                GatewayErrorTypeEnum.INVALID_RESPONSE, "model refused"));
        modelGateway.fail("ProcTreeExtract", new ModelGatewayException(
                GatewayErrorTypeEnum.INVALID_RESPONSE, "model refused"));
        modelGateway.reply("SigmaAgent", VALID_RULE_YAML);
        return this;
    }

    @Override
    public void close() {
        gatewayPool.shutdownNow();
    }
}
