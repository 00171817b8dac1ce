package com.huntflow.trigger.application.command;

import com.huntflow.domain.workflow.adapter.gateway.IDocumentStore;
import com.huntflow.domain.workflow.adapter.repository.IWorkflowExecutionRepository;
import com.huntflow.domain.workflow.model.entity.WorkflowExecutionEntity;
import com.huntflow.domain.workflow.model.valobj.DocumentSnapshot;
import com.huntflow.domain.workflow.model.valobj.OwnershipGuard;
import com.huntflow.domain.workflow.model.valobj.StepOutcome;
import com.huntflow.domain.workflow.model.valobj.StepTransition;
import com.huntflow.domain.workflow.model.valobj.WorkflowConfig;
import com.huntflow.domain.workflow.service.WorkflowPersistencePolicyDomainService;
import com.huntflow.domain.workflow.service.WorkflowTransitionDomainService;
import com.huntflow.trigger.application.common.WorkflowConfigSnapshotAssembler;
import com.huntflow.trigger.application.step.WorkflowStepContext;
import com.huntflow.trigger.application.step.WorkflowStepHandler;
import com.huntflow.types.common.Constants;
import com.huntflow.types.enums.ExecutionStatusEnum;
import com.huntflow.types.enums.WorkflowStepEnum;
import com.huntflow.types.exception.FatalConfigurationException;
import com.huntflow.types.exception.ModelGatewayException;
import com.huntflow.types.exception.OwnershipLostException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 执行驱动写用例：已领取执行的逐步推进循环。
 * <p>
 * 每一步之前重新读取执行记录，确认仍为 running、派发持有者与令牌一致且停留在预期步骤，否则放弃且不写入；
 * 步骤内生成草稿、匹配记录与入队项之前再复核一次，被清扫或改派的工作者不会留下新行；
 * 取消请求在步骤边界生效；步骤结果与状态迁移通过 version 乐观锁条件写入。
 * </p>
 */
@Slf4j
@Service
public class WorkflowRunApplicationService {

    public static final String ERROR_FATAL_CONFIGURATION = "fatal_configuration";
    public static final String ERROR_INTERNAL = "internal_error";

    private final IWorkflowExecutionRepository workflowExecutionRepository;
    private final IDocumentStore documentStore;
    private final WorkflowTransitionDomainService workflowTransitionDomainService;
    private final WorkflowPersistencePolicyDomainService workflowPersistencePolicyDomainService;
    private final WorkflowConfigSnapshotAssembler workflowConfigSnapshotAssembler;
    private final Map<WorkflowStepEnum, WorkflowStepHandler> handlers;

    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter cancelledCounter;
    private final Counter ownershipLostCounter;

    public WorkflowRunApplicationService(IWorkflowExecutionRepository workflowExecutionRepository,
                                         IDocumentStore documentStore,
                                         WorkflowTransitionDomainService workflowTransitionDomainService,
                                         WorkflowPersistencePolicyDomainService workflowPersistencePolicyDomainService,
                                         WorkflowConfigSnapshotAssembler workflowConfigSnapshotAssembler,
                                         List<WorkflowStepHandler> stepHandlers) {
        this.workflowExecutionRepository = workflowExecutionRepository;
        this.documentStore = documentStore;
        this.workflowTransitionDomainService = workflowTransitionDomainService;
        this.workflowPersistencePolicyDomainService = workflowPersistencePolicyDomainService;
        this.workflowConfigSnapshotAssembler = workflowConfigSnapshotAssembler;
        this.handlers = new EnumMap<>(WorkflowStepEnum.class);
        for (WorkflowStepHandler handler : stepHandlers) {
            if (this.handlers.put(handler.step(), handler) != null) {
                throw new IllegalStateException("Duplicate step handler: " + handler.step().getCode());
            }
        }
        for (WorkflowStepEnum step : WorkflowStepEnum.values()) {
            if (!this.handlers.containsKey(step)) {
                throw new IllegalStateException("Missing step handler: " + step.getCode());
            }
        }
        this.completedCounter = Counter.builder("huntflow.workflow.execution.completed.total").register(Metrics.globalRegistry);
        this.failedCounter = Counter.builder("huntflow.workflow.execution.failed.total").register(Metrics.globalRegistry);
        this.cancelledCounter = Counter.builder("huntflow.workflow.execution.cancelled.total").register(Metrics.globalRegistry);
        this.ownershipLostCounter = Counter.builder("huntflow.workflow.ownership.lost.total").register(Metrics.globalRegistry);
    }

    /**
     * 推进一个已由 owner/token 领取的执行，直到终态或失去所有权
     */
    public RunResult run(Long executionId, String owner, Integer token) {
        MDC.put(Constants.MDC_EXECUTION_ID, String.valueOf(executionId));
        try {
            WorkflowExecutionEntity execution = workflowExecutionRepository.findById(executionId);
            if (execution == null || !execution.isOwnedBy(owner, token, null)) {
                return ownershipLost(executionId, null);
            }
            WorkflowStepEnum expectedStep = execution.getCurrentStep();
            WorkflowConfig config = null;
            DocumentSnapshot document = null;
            boolean documentLoaded = false;

            while (true) {
                execution = workflowExecutionRepository.findById(executionId);
                if (execution == null || !execution.isOwnedBy(owner, token, expectedStep)) {
                    return ownershipLost(executionId, expectedStep);
                }
                if (execution.isCancelRequested()) {
                    return cancelAtBoundary(execution, owner, token);
                }
                WorkflowStepEnum step = execution.getCurrentStep();
                MDC.put(Constants.MDC_STEP, step.getCode());
                long startTime = System.currentTimeMillis();
                log.info("Step started. executionId={}, step={}", executionId, step.getCode());

                StepOutcome outcome;
                try {
                    if (config == null) {
                        config = workflowConfigSnapshotAssembler.restore(execution);
                    }
                    if (!documentLoaded) {
                        document = documentStore.fetch(execution.getDocumentId());
                        documentLoaded = true;
                    }
                    outcome = handlers.get(step).handle(new WorkflowStepContext(execution, config, document,
                            ownershipGuard(executionId, owner, token, step)));
                } catch (OwnershipLostException ex) {
                    return ownershipLost(executionId, step);
                } catch (ModelGatewayException ex) {
                    outcome = StepOutcome.fail(ex.getErrorType().getCode(),
                            workflowPersistencePolicyDomainService.normalizeErrorMessage(ex), null);
                } catch (FatalConfigurationException ex) {
                    outcome = StepOutcome.fail(ERROR_FATAL_CONFIGURATION,
                            workflowPersistencePolicyDomainService.normalizeErrorMessage(ex), null);
                } catch (RuntimeException ex) {
                    log.error("Step raised unexpected error. executionId={}, step={}, error={}",
                            executionId, step.getCode(), ex.getMessage(), ex);
                    outcome = StepOutcome.fail(ERROR_INTERNAL,
                            workflowPersistencePolicyDomainService.normalizeErrorMessage(ex), null);
                }

                StepTransition transition = workflowTransitionDomainService.next(step, outcome);
                WorkflowExecutionEntity saved = persist(execution, step, outcome, transition, owner, token);
                if (saved == null) {
                    return ownershipLost(executionId, step);
                }
                logStepFinished(saved, step, outcome, System.currentTimeMillis() - startTime);
                if (saved.isTerminal()) {
                    return finished(saved);
                }
                expectedStep = transition.getNextStep();
            }
        } finally {
            MDC.remove(Constants.MDC_STEP);
            MDC.remove(Constants.MDC_EXECUTION_ID);
        }
    }

    /**
     * 条件写入步骤结果与状态迁移；版本冲突时重读，仍持有所有权则在最新记录上重放一次
     */
    private WorkflowExecutionEntity persist(WorkflowExecutionEntity execution, WorkflowStepEnum step,
                                            StepOutcome outcome, StepTransition transition,
                                            String owner, Integer token) {
        try {
            apply(execution, step, outcome, transition);
            return workflowExecutionRepository.update(execution);
        } catch (RuntimeException ex) {
            if (!workflowPersistencePolicyDomainService.isOptimisticLockConflict(ex)) {
                throw ex;
            }
        }
        WorkflowExecutionEntity latest = workflowExecutionRepository.findById(execution.getId());
        if (latest == null || !latest.isOwnedBy(owner, token, step)) {
            return null;
        }
        try {
            apply(latest, step, outcome, transition);
            return workflowExecutionRepository.update(latest);
        } catch (RuntimeException ex) {
            if (workflowPersistencePolicyDomainService.isOptimisticLockConflict(ex)) {
                log.warn("Step result write lost twice, giving up. executionId={}, step={}",
                        execution.getId(), step.getCode());
                return null;
            }
            throw ex;
        }
    }

    private OwnershipGuard ownershipGuard(Long executionId, String owner, Integer token, WorkflowStepEnum step) {
        return () -> {
            WorkflowExecutionEntity latest = workflowExecutionRepository.findById(executionId);
            if (latest == null || !latest.isOwnedBy(owner, token, step)) {
                throw new OwnershipLostException("Execution " + executionId + " no longer owned by " + owner
                        + "/" + token + " at step " + step.getCode());
            }
        };
    }

    private void apply(WorkflowExecutionEntity execution, WorkflowStepEnum step,
                       StepOutcome outcome, StepTransition transition) {
        execution.recordStepResult(step, outcome.getResult());
        if (outcome.isFilterDegraded()) {
            execution.markFilterDegraded();
        }
        switch (transition.getTargetStatus()) {
            case RUNNING -> execution.advanceTo(transition.getNextStep());
            case COMPLETED -> execution.complete(transition.getTerminationReason());
            case FAILED -> execution.fail(step, outcome.getErrorType(), outcome.getErrorMessage());
            default -> throw new IllegalStateException("Unsupported transition target: " + transition.getTargetStatus());
        }
    }

    private RunResult cancelAtBoundary(WorkflowExecutionEntity execution, String owner, Integer token) {
        WorkflowStepEnum step = execution.getCurrentStep();
        try {
            execution.cancel();
            workflowExecutionRepository.update(execution);
        } catch (RuntimeException ex) {
            if (workflowPersistencePolicyDomainService.isOptimisticLockConflict(ex)) {
                return ownershipLost(execution.getId(), step);
            }
            throw ex;
        }
        cancelledCounter.increment();
        log.info("Execution cancelled at step boundary. executionId={}, step={}, owner={}, token={}",
                execution.getId(), step.getCode(), owner, token);
        return RunResult.CANCELLED;
    }

    private RunResult finished(WorkflowExecutionEntity execution) {
        if (execution.getStatus() == ExecutionStatusEnum.FAILED) {
            failedCounter.increment();
            log.warn("Execution failed. executionId={}, failedStep={}, errorType={}, error={}",
                    execution.getId(), code(execution.getFailedStep()), execution.getErrorType(),
                    execution.getErrorMessage());
            return RunResult.FAILED;
        }
        completedCounter.increment();
        log.info("Execution completed. executionId={}, step={}, terminationReason={}",
                execution.getId(), code(execution.getCurrentStep()),
                execution.getTerminationReason() == null ? null : execution.getTerminationReason().getCode());
        return RunResult.COMPLETED;
    }

    private RunResult ownershipLost(Long executionId, WorkflowStepEnum step) {
        ownershipLostCounter.increment();
        log.warn("Execution ownership lost, worker stops without writing. executionId={}, expectedStep={}",
                executionId, code(step));
        return RunResult.OWNERSHIP_LOST;
    }

    private void logStepFinished(WorkflowExecutionEntity execution, WorkflowStepEnum step,
                                 StepOutcome outcome, long elapsedMs) {
        switch (outcome.getKind()) {
            case CONTINUE -> log.info("Step finished. executionId={}, step={}, next={}, elapsedMs={}",
                    execution.getId(), step.getCode(), code(execution.getCurrentStep()), elapsedMs);
            case TERMINATE -> log.info("Step terminated execution. executionId={}, step={}, reason={}, elapsedMs={}",
                    execution.getId(), step.getCode(), outcome.getTerminationReason().getCode(), elapsedMs);
            case FAIL -> log.warn("Step failed. executionId={}, step={}, errorType={}, elapsedMs={}",
                    execution.getId(), step.getCode(), outcome.getErrorType(), elapsedMs);
        }
    }

    private String code(WorkflowStepEnum step) {
        return step == null ? null : step.getCode();
    }

    public enum RunResult {
        COMPLETED,
        FAILED,
        CANCELLED,
        OWNERSHIP_LOST
    }
}
