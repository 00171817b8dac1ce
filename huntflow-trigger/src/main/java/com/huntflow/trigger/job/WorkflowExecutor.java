package com.huntflow.trigger.job;

import com.huntflow.domain.workflow.adapter.repository.IWorkflowExecutionRepository;
import com.huntflow.domain.workflow.model.entity.WorkflowExecutionEntity;
import com.huntflow.domain.workflow.service.WorkflowPersistencePolicyDomainService;
import com.huntflow.trigger.application.command.WorkflowRunApplicationService;
import com.huntflow.types.enums.ExecutionStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 执行调度器：领取 pending 执行（令牌递增 + 乐观锁），提交到工作线程池推进步骤。
 */
@Slf4j
@Component
public class WorkflowExecutor {

    private final IWorkflowExecutionRepository workflowExecutionRepository;
    private final WorkflowRunApplicationService workflowRunApplicationService;
    private final WorkflowPersistencePolicyDomainService workflowPersistencePolicyDomainService;
    private final Executor workflowExecutionWorker;
    private final int claimBatchSize;
    private final String instanceId;

    public WorkflowExecutor(IWorkflowExecutionRepository workflowExecutionRepository,
                            WorkflowRunApplicationService workflowRunApplicationService,
                            WorkflowPersistencePolicyDomainService workflowPersistencePolicyDomainService,
                            @Qualifier("workflowExecutionWorker") Executor workflowExecutionWorker,
                            @Value("${huntflow.executor.claim-batch-size:16}") int claimBatchSize,
                            @Value("${huntflow.executor.instance-id:}") String instanceId) {
        this.workflowExecutionRepository = workflowExecutionRepository;
        this.workflowRunApplicationService = workflowRunApplicationService;
        this.workflowPersistencePolicyDomainService = workflowPersistencePolicyDomainService;
        this.workflowExecutionWorker = workflowExecutionWorker;
        this.claimBatchSize = claimBatchSize > 0 ? claimBatchSize : 16;
        this.instanceId = StringUtils.isBlank(instanceId) ? defaultInstanceId() : instanceId.trim();
    }

    @Scheduled(fixedDelayString = "${huntflow.executor.poll-interval-ms:1000}", scheduler = "workflowExecutorScheduler")
    public void dispatchPendingExecutions() {
        List<WorkflowExecutionEntity> pending = workflowExecutionRepository.findByStatus(ExecutionStatusEnum.PENDING, claimBatchSize);
        if (pending == null || pending.isEmpty()) {
            return;
        }
        for (WorkflowExecutionEntity execution : pending) {
            if (execution == null || execution.getStatus() != ExecutionStatusEnum.PENDING) {
                continue;
            }
            WorkflowExecutionEntity claimed = claim(execution);
            if (claimed == null) {
                continue;
            }
            if (!submit(claimed)) {
                break;
            }
        }
    }

    private WorkflowExecutionEntity claim(WorkflowExecutionEntity execution) {
        try {
            execution.claim(instanceId);
            return workflowExecutionRepository.update(execution);
        } catch (RuntimeException ex) {
            if (workflowPersistencePolicyDomainService.isOptimisticLockConflict(ex)) {
                log.debug("Execution claim skipped due to optimistic lock. executionId={}", execution.getId());
                return null;
            }
            log.warn("Failed to claim execution. executionId={}, error={}", execution.getId(), ex.getMessage());
            return null;
        }
    }

    private boolean submit(WorkflowExecutionEntity claimed) {
        Long executionId = claimed.getId();
        Integer token = claimed.getDispatchToken();
        try {
            workflowExecutionWorker.execute(() -> runSafely(executionId, token));
            log.debug("Execution dispatched. executionId={}, owner={}, token={}", executionId, instanceId, token);
            return true;
        } catch (RejectedExecutionException ex) {
            log.warn("Workflow worker saturated, releasing claim. executionId={}, error={}", executionId, ex.getMessage());
            releaseClaim(claimed);
            return false;
        }
    }

    private void runSafely(Long executionId, Integer token) {
        try {
            workflowRunApplicationService.run(executionId, instanceId, token);
        } catch (RuntimeException ex) {
            log.error("Execution worker crashed. executionId={}, token={}, error={}",
                    executionId, token, ex.getMessage(), ex);
        }
    }

    private void releaseClaim(WorkflowExecutionEntity claimed) {
        try {
            claimed.releaseClaim();
            workflowExecutionRepository.update(claimed);
        } catch (RuntimeException ex) {
            log.warn("Failed to release execution claim. executionId={}, error={}", claimed.getId(), ex.getMessage());
        }
    }

    String getInstanceId() {
        return instanceId;
    }

    private static String defaultInstanceId() {
        return ManagementFactory.getRuntimeMXBean().getName() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
