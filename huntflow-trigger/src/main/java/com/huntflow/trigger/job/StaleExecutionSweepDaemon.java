package com.huntflow.trigger.job;

import com.huntflow.domain.workflow.adapter.repository.IWorkflowExecutionRepository;
import com.huntflow.domain.workflow.model.entity.WorkflowExecutionEntity;
import com.huntflow.domain.workflow.service.WorkflowPersistencePolicyDomainService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 过期执行清扫守护进程：心跳超时的 running 执行标记为 failed(stale_timeout)。
 * 清扫同样走乐观锁条件更新，存活的工作线程下一次写入会因所有权校验失败而放弃。
 */
@Slf4j
@Component
public class StaleExecutionSweepDaemon {

    private final IWorkflowExecutionRepository workflowExecutionRepository;
    private final WorkflowPersistencePolicyDomainService workflowPersistencePolicyDomainService;
    private final long staleTimeoutSeconds;
    private final int batchSize;
    private final Counter staleSweepCounter;

    public StaleExecutionSweepDaemon(IWorkflowExecutionRepository workflowExecutionRepository,
                                     WorkflowPersistencePolicyDomainService workflowPersistencePolicyDomainService,
                                     @Value("${huntflow.sweep.stale-timeout-seconds:900}") long staleTimeoutSeconds,
                                     @Value("${huntflow.sweep.batch-size:100}") int batchSize) {
        this.workflowExecutionRepository = workflowExecutionRepository;
        this.workflowPersistencePolicyDomainService = workflowPersistencePolicyDomainService;
        this.staleTimeoutSeconds = staleTimeoutSeconds > 0 ? staleTimeoutSeconds : 900L;
        this.batchSize = batchSize > 0 ? batchSize : 100;
        this.staleSweepCounter = Counter.builder("huntflow.workflow.stale.sweep.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${huntflow.sweep.poll-interval-ms:30000}", scheduler = "daemonScheduler")
    public void sweepStaleExecutions() {
        LocalDateTime cutoff = LocalDateTime.now().minusSeconds(staleTimeoutSeconds);
        List<WorkflowExecutionEntity> stale = workflowExecutionRepository.findStaleRunning(cutoff, batchSize);
        if (stale == null || stale.isEmpty()) {
            return;
        }
        for (WorkflowExecutionEntity execution : stale) {
            sweep(execution, cutoff);
        }
    }

    private void sweep(WorkflowExecutionEntity execution, LocalDateTime cutoff) {
        if (execution == null || execution.getHeartbeatAt() == null || !execution.getHeartbeatAt().isBefore(cutoff)) {
            return;
        }
        try {
            execution.markStale("No progress for more than " + staleTimeoutSeconds + "s, last heartbeat at "
                    + execution.getHeartbeatAt());
            workflowExecutionRepository.update(execution);
            staleSweepCounter.increment();
            log.warn("Stale execution swept. executionId={}, step={}, owner={}, token={}",
                    execution.getId(), execution.getCurrentStep().getCode(), execution.getDispatchOwner(),
                    execution.getDispatchToken());
        } catch (RuntimeException ex) {
            if (workflowPersistencePolicyDomainService.isOptimisticLockConflict(ex)) {
                log.debug("Stale sweep skipped due to optimistic lock. executionId={}", execution.getId());
                return;
            }
            log.warn("Stale sweep failed. executionId={}, error={}", execution.getId(), ex.getMessage());
        }
    }
}
