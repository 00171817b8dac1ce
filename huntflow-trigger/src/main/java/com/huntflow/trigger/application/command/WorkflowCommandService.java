package com.huntflow.trigger.application.command;

import com.huntflow.api.dto.ExecutionAttemptDTO;
import com.huntflow.api.dto.RuleDraftDTO;
import com.huntflow.api.dto.WorkflowExecutionDTO;
import com.huntflow.domain.rule.adapter.repository.IRuleDraftRepository;
import com.huntflow.domain.rule.adapter.repository.ISimilarityMatchRepository;
import com.huntflow.domain.rule.model.entity.RuleDraftEntity;
import com.huntflow.domain.workflow.adapter.repository.IExecutionAttemptRepository;
import com.huntflow.domain.workflow.adapter.repository.IWorkflowExecutionRepository;
import com.huntflow.domain.workflow.model.entity.WorkflowExecutionEntity;
import com.huntflow.domain.workflow.model.valobj.WorkflowConfig;
import com.huntflow.domain.workflow.service.WorkflowPersistencePolicyDomainService;
import com.huntflow.trigger.application.common.WorkflowConfigSnapshotAssembler;
import com.huntflow.trigger.application.common.WorkflowViewAssembler;
import com.huntflow.types.enums.ExecutionStatusEnum;
import com.huntflow.types.enums.ResponseCode;
import com.huntflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流执行写用例：触发、取消、外部重试与查询。
 */
@Slf4j
@Service
public class WorkflowCommandService {

    private static final int MAX_LIST_LIMIT = 500;

    private final IWorkflowExecutionRepository workflowExecutionRepository;
    private final IExecutionAttemptRepository executionAttemptRepository;
    private final IRuleDraftRepository ruleDraftRepository;
    private final ISimilarityMatchRepository similarityMatchRepository;
    private final WorkflowPersistencePolicyDomainService workflowPersistencePolicyDomainService;
    private final WorkflowConfigSnapshotAssembler workflowConfigSnapshotAssembler;
    private final WorkflowViewAssembler workflowViewAssembler;
    private final WorkflowConfig workflowConfig;

    public WorkflowCommandService(IWorkflowExecutionRepository workflowExecutionRepository,
                                  IExecutionAttemptRepository executionAttemptRepository,
                                  IRuleDraftRepository ruleDraftRepository,
                                  ISimilarityMatchRepository similarityMatchRepository,
                                  WorkflowPersistencePolicyDomainService workflowPersistencePolicyDomainService,
                                  WorkflowConfigSnapshotAssembler workflowConfigSnapshotAssembler,
                                  WorkflowViewAssembler workflowViewAssembler,
                                  WorkflowConfig workflowConfig) {
        this.workflowExecutionRepository = workflowExecutionRepository;
        this.executionAttemptRepository = executionAttemptRepository;
        this.ruleDraftRepository = ruleDraftRepository;
        this.similarityMatchRepository = similarityMatchRepository;
        this.workflowPersistencePolicyDomainService = workflowPersistencePolicyDomainService;
        this.workflowConfigSnapshotAssembler = workflowConfigSnapshotAssembler;
        this.workflowViewAssembler = workflowViewAssembler;
        this.workflowConfig = workflowConfig;
    }

    /**
     * 为文档创建待调度执行；同一 (文档, 配置版本) 已有 pending/running 执行时拒绝
     */
    public WorkflowExecutionDTO trigger(Long documentId) {
        if (documentId == null || documentId <= 0) {
            throw illegal("documentId 非法");
        }
        String configVersion = workflowConfig.getVersion();
        List<WorkflowExecutionEntity> active = workflowExecutionRepository.findActiveByDocumentAndConfig(documentId, configVersion);
        if (active != null && !active.isEmpty()) {
            throw conflict("文档已有进行中的执行: executionId=" + active.get(0).getId());
        }
        WorkflowExecutionEntity execution = WorkflowExecutionEntity.create(documentId, configVersion,
                workflowConfigSnapshotAssembler.snapshot(workflowConfig));
        WorkflowExecutionEntity saved;
        try {
            saved = workflowExecutionRepository.save(execution);
        } catch (DuplicateKeyException ex) {
            throw conflict("文档已有进行中的执行: documentId=" + documentId);
        }
        log.info("Execution triggered. executionId={}, documentId={}, configVersion={}",
                saved.getId(), documentId, configVersion);
        return workflowViewAssembler.toExecutionDTO(saved);
    }

    /**
     * 请求取消：pending 立即取消，running 在下一个步骤边界由执行器取消
     */
    public WorkflowExecutionDTO cancel(Long executionId) {
        WorkflowExecutionEntity execution = requireExecution(executionId);
        if (execution.getStatus() == ExecutionStatusEnum.CANCELLED) {
            return workflowViewAssembler.toExecutionDTO(execution);
        }
        try {
            execution.requestCancel();
        } catch (IllegalStateException ex) {
            throw conflict("当前执行状态不支持取消: " + ex.getMessage());
        }
        WorkflowExecutionEntity saved = updateOrConflict(execution);
        log.info("Execution cancel requested. executionId={}, status={}", executionId, saved.getStatus().getCode());
        return workflowViewAssembler.toExecutionDTO(saved);
    }

    /**
     * 外部重试：仅 failed 执行，从失败步骤续跑，之前的步骤结果保留
     */
    public WorkflowExecutionDTO retry(Long executionId) {
        WorkflowExecutionEntity execution = requireExecution(executionId);
        if (execution.getStatus() != ExecutionStatusEnum.FAILED) {
            throw conflict("仅 failed 执行支持重试, status=" + execution.getStatus().getCode());
        }
        List<WorkflowExecutionEntity> active = workflowExecutionRepository.findActiveByDocumentAndConfig(
                execution.getDocumentId(), execution.getConfigVersion());
        if (active != null && !active.isEmpty()) {
            throw conflict("文档已有进行中的执行: executionId=" + active.get(0).getId());
        }
        execution.retryFromFailed();
        WorkflowExecutionEntity saved = updateOrConflict(execution);
        log.info("Execution retry requested. executionId={}, resumeStep={}, retryCount={}",
                executionId, saved.getCurrentStep().getCode(), saved.getRetryCount());
        return workflowViewAssembler.toExecutionDTO(saved);
    }

    public WorkflowExecutionDTO get(Long executionId) {
        return workflowViewAssembler.toExecutionDTO(requireExecution(executionId));
    }

    public List<WorkflowExecutionDTO> list(String status, Integer limit) {
        ExecutionStatusEnum statusEnum = ExecutionStatusEnum.fromCode(status == null || status.isBlank() ? null : status.trim());
        if (statusEnum == null) {
            throw illegal("status 不能为空");
        }
        int normalizedLimit = limit == null || limit <= 0 ? 50 : Math.min(limit, MAX_LIST_LIMIT);
        return workflowExecutionRepository.findByStatus(statusEnum, normalizedLimit).stream()
                .map(workflowViewAssembler::toExecutionDTO)
                .collect(Collectors.toList());
    }

    public List<ExecutionAttemptDTO> attempts(Long executionId) {
        requireExecution(executionId);
        return executionAttemptRepository.findByExecutionId(executionId).stream()
                .map(workflowViewAssembler::toAttemptDTO)
                .collect(Collectors.toList());
    }

    public List<RuleDraftDTO> drafts(Long executionId) {
        requireExecution(executionId);
        List<RuleDraftEntity> drafts = ruleDraftRepository.findByExecutionId(executionId);
        return drafts.stream()
                .map(draft -> workflowViewAssembler.toDraftDTO(draft, similarityMatchRepository.findByRuleDraftId(draft.getId())))
                .collect(Collectors.toList());
    }

    private WorkflowExecutionEntity updateOrConflict(WorkflowExecutionEntity execution) {
        try {
            return workflowExecutionRepository.update(execution);
        } catch (RuntimeException ex) {
            if (workflowPersistencePolicyDomainService.isOptimisticLockConflict(ex)) {
                throw conflict("执行记录已被并发修改，请刷新后重试");
            }
            throw ex;
        }
    }

    private WorkflowExecutionEntity requireExecution(Long executionId) {
        WorkflowExecutionEntity execution = executionId == null ? null : workflowExecutionRepository.findById(executionId);
        if (execution == null) {
            throw illegal("执行不存在: " + executionId);
        }
        return execution;
    }

    private AppException illegal(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER, message);
    }

    private AppException conflict(String message) {
        return new AppException(ResponseCode.CONFLICT, message);
    }
}
