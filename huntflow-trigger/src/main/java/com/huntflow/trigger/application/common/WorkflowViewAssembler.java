package com.huntflow.trigger.application.common;

import com.huntflow.api.dto.ExecutionAttemptDTO;
import com.huntflow.api.dto.QueueItemDTO;
import com.huntflow.api.dto.RuleDraftDTO;
import com.huntflow.api.dto.SimilarityMatchDTO;
import com.huntflow.api.dto.WorkflowExecutionDTO;
import com.huntflow.domain.rule.model.entity.QueueItemEntity;
import com.huntflow.domain.rule.model.entity.RuleDraftEntity;
import com.huntflow.domain.rule.model.entity.SimilarityMatchEntity;
import com.huntflow.domain.workflow.model.entity.ExecutionAttemptEntity;
import com.huntflow.domain.workflow.model.entity.WorkflowExecutionEntity;
import org.springframework.stereotype.Component;

/**
 * 执行、审计、草稿与队列视图组装器。
 */
@Component
public class WorkflowViewAssembler {

    public WorkflowExecutionDTO toExecutionDTO(WorkflowExecutionEntity execution) {
        if (execution == null) {
            return null;
        }
        WorkflowExecutionDTO dto = new WorkflowExecutionDTO();
        dto.setExecutionId(execution.getId());
        dto.setDocumentId(execution.getDocumentId());
        dto.setConfigVersion(execution.getConfigVersion());
        dto.setStatus(execution.getStatus() == null ? null : execution.getStatus().getCode());
        dto.setCurrentStep(execution.getCurrentStep() == null ? null : execution.getCurrentStep().getCode());
        dto.setTerminationReason(execution.getTerminationReason() == null ? null : execution.getTerminationReason().getCode());
        dto.setFailedStep(execution.getFailedStep() == null ? null : execution.getFailedStep().getCode());
        dto.setErrorType(execution.getErrorType());
        dto.setErrorMessage(execution.getErrorMessage());
        dto.setFilterDegraded(execution.getFilterDegraded());
        dto.setCancelRequested(execution.getCancelRequested());
        dto.setRetryCount(execution.getRetryCount());
        dto.setStepResults(execution.getStepResults());
        dto.setVersion(execution.getVersion());
        dto.setCreatedAt(execution.getCreatedAt());
        dto.setStartedAt(execution.getStartedAt());
        dto.setHeartbeatAt(execution.getHeartbeatAt());
        dto.setUpdatedAt(execution.getUpdatedAt());
        dto.setCompletedAt(execution.getCompletedAt());
        return dto;
    }

    public ExecutionAttemptDTO toAttemptDTO(ExecutionAttemptEntity attempt) {
        ExecutionAttemptDTO dto = new ExecutionAttemptDTO();
        dto.setAttemptId(attempt.getId());
        dto.setExecutionId(attempt.getExecutionId());
        dto.setStep(attempt.getStep() == null ? null : attempt.getStep().getCode());
        dto.setAgentName(attempt.getAgentName());
        dto.setAttemptNumber(attempt.getAttemptNumber());
        dto.setPromptSnapshot(attempt.getPromptSnapshot());
        dto.setResponseRaw(attempt.getResponseRaw());
        dto.setValid(attempt.getIsValid());
        dto.setValidationFeedback(attempt.getValidationFeedback());
        dto.setErrorMessage(attempt.getErrorMessage());
        dto.setErrorType(attempt.getErrorType());
        dto.setExecutionTimeMs(attempt.getExecutionTimeMs());
        dto.setCreatedAt(attempt.getCreatedAt());
        return dto;
    }

    public RuleDraftDTO toDraftDTO(RuleDraftEntity draft, SimilarityMatchEntity match) {
        RuleDraftDTO dto = new RuleDraftDTO();
        dto.setDraftId(draft.getId());
        dto.setExecutionId(draft.getExecutionId());
        dto.setTitle(draft.getTitle());
        dto.setDescription(draft.getDescription());
        dto.setLogSource(draft.getLogSource());
        dto.setDetection(draft.getDetection());
        dto.setTags(draft.getTags());
        dto.setSeverity(draft.getSeverity());
        dto.setRawYaml(draft.getRawYaml());
        dto.setValidationStatus(draft.getValidationStatus() == null ? null : draft.getValidationStatus().getCode());
        dto.setValidationErrors(draft.getValidationErrors());
        dto.setAttemptCount(draft.getAttemptCount());
        dto.setCreatedAt(draft.getCreatedAt());
        if (match != null) {
            SimilarityMatchDTO matchDTO = new SimilarityMatchDTO();
            matchDTO.setMatchedRuleId(match.getMatchedRuleId());
            matchDTO.setSectionScores(match.getSectionScores());
            matchDTO.setAggregateScore(match.getAggregateScore());
            matchDTO.setClassification(match.getClassification() == null ? null : match.getClassification().getCode());
            dto.setSimilarityMatch(matchDTO);
        }
        return dto;
    }

    public QueueItemDTO toQueueItemDTO(QueueItemEntity item) {
        if (item == null) {
            return null;
        }
        QueueItemDTO dto = new QueueItemDTO();
        dto.setQueueItemId(item.getId());
        dto.setRuleDraftId(item.getRuleDraftId());
        dto.setExecutionId(item.getExecutionId());
        dto.setDocumentId(item.getDocumentId());
        dto.setRuleYaml(item.getRuleYaml());
        dto.setSimilarityContext(item.getSimilarityContext());
        dto.setMaxSimilarity(item.getMaxSimilarity());
        dto.setReviewStatus(item.getReviewStatus() == null ? null : item.getReviewStatus().getCode());
        dto.setReviewerComment(item.getReviewerComment());
        dto.setVersion(item.getVersion());
        dto.setCreatedAt(item.getCreatedAt());
        dto.setUpdatedAt(item.getUpdatedAt());
        dto.setReviewedAt(item.getReviewedAt());
        return dto;
    }
}
