package com.huntflow.domain.extraction.service;

import com.huntflow.domain.extraction.model.entity.SubAgentRunEntity;
import com.huntflow.domain.extraction.model.valobj.ExtractionResult;
import com.huntflow.domain.extraction.model.valobj.SubAgentOutcome;
import com.huntflow.domain.extraction.model.valobj.SubAgentSpec;
import com.huntflow.domain.workflow.model.valobj.AgentInvocationContext;
import com.huntflow.domain.workflow.model.valobj.WorkflowConfig;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 抽取监督者：在有界线程池上并发运行名册中启用的子代理，按名册顺序合并。
 * <p>
 * 任一子代理抛出异常（如致命配置错误）时，其余子代理不再开始新的尝试；
 * 监督者等待全部子代理结束后才向上抛出，步骤失败后不会再有模型调用或审计写入。
 * </p>
 */
@Slf4j
@Service
public class ExtractionSupervisorDomainService {

    private final SubAgentExtractionDomainService subAgentExtractionDomainService;
    private final Executor extractionWorker;

    public ExtractionSupervisorDomainService(SubAgentExtractionDomainService subAgentExtractionDomainService,
                                             @Qualifier("extractionWorker") Executor extractionWorker) {
        this.subAgentExtractionDomainService = subAgentExtractionDomainService;
        this.extractionWorker = extractionWorker;
    }

    public ExtractionResult extract(AgentInvocationContext context, String text, String platform) {
        WorkflowConfig config = context.getConfig();
        List<SubAgentSpec> roster = config.getRoster() == null || config.getRoster().isEmpty()
                ? SubAgentSpec.defaultRoster() : config.getRoster();

        AtomicBoolean aborted = new AtomicBoolean(false);
        List<CompletableFuture<SubAgentOutcome>> futures = new ArrayList<>(roster.size());
        for (SubAgentSpec spec : roster) {
            if (config.isAgentDisabled(spec.getName())) {
                futures.add(CompletableFuture.completedFuture(SubAgentRunEntity.skipped(spec).toOutcome()));
                continue;
            }
            futures.add(submit(context, spec, text, platform, aborted));
        }
        awaitAll(futures);

        ExtractionResult result = new ExtractionResult();
        for (int i = 0; i < roster.size(); i++) {
            SubAgentOutcome outcome = await(futures.get(i));
            merge(result, outcome);
        }
        log.info("Extraction finished. executionId={}, succeeded={}, total={}, observables={}",
                context.getExecutionId(), result.getSuccessCount(), roster.size(), result.totalObservables());
        return result;
    }

    private CompletableFuture<SubAgentOutcome> submit(AgentInvocationContext context, SubAgentSpec spec,
                                                      String text, String platform, AtomicBoolean aborted) {
        Map<String, String> mdcContext = MDC.getCopyOfContextMap();
        return CompletableFuture.supplyAsync(() -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (mdcContext != null) {
                MDC.setContextMap(mdcContext);
            }
            try {
                return subAgentExtractionDomainService.run(context, spec, text, platform, aborted::get);
            } catch (RuntimeException ex) {
                aborted.set(true);
                log.error("Sub-agent aborted extraction. executionId={}, agent={}, error={}",
                        context.getExecutionId(), spec.getName(), ex.getMessage());
                throw ex;
            } finally {
                restoreMdc(previous);
            }
        }, extractionWorker);
    }

    private void restoreMdc(Map<String, String> previous) {
        if (previous == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }

    /**
     * 等待全部子代理结束，异常留给按名册顺序的 await 抛出
     */
    private void awaitAll(List<CompletableFuture<SubAgentOutcome>> futures) {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> null)
                .join();
    }

    private SubAgentOutcome await(CompletableFuture<SubAgentOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw ex;
        }
    }

    private void merge(ExtractionResult result, SubAgentOutcome outcome) {
        result.getOutcomes().add(outcome);
        if (outcome.isSucceeded()) {
            result.setSuccessCount(result.getSuccessCount() + 1);
            result.getObservables()
                    .computeIfAbsent(outcome.getObservableType().getCode(), key -> new ArrayList<>())
                    .addAll(outcome.getObservables());
        } else if (outcome.getErrorMessage() != null) {
            result.getWarnings().add(outcome.getAgentName() + " failed: " + outcome.getErrorMessage());
        }
        for (String warning : outcome.getWarnings()) {
            result.getWarnings().add(outcome.getAgentName() + " " + warning);
        }
    }
}
