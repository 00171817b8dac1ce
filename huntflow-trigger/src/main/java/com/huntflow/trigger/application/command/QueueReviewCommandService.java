package com.huntflow.trigger.application.command;

import com.huntflow.api.dto.QueueItemDTO;
import com.huntflow.domain.agent.model.valobj.ParseOutcome;
import com.huntflow.domain.rule.adapter.gateway.IVectorIndex;
import com.huntflow.domain.rule.adapter.repository.IQueueItemRepository;
import com.huntflow.domain.rule.model.entity.QueueItemEntity;
import com.huntflow.domain.rule.model.entity.RuleDraftEntity;
import com.huntflow.domain.rule.model.valobj.ParsedRule;
import com.huntflow.domain.rule.model.valobj.RuleValidationResult;
import com.huntflow.domain.rule.model.valobj.SectionEmbeddings;
import com.huntflow.domain.rule.service.RuleDraftParser;
import com.huntflow.domain.rule.service.RuleGenerationDomainService;
import com.huntflow.domain.rule.service.RuleSectionDomainService;
import com.huntflow.domain.rule.service.RuleValidationDomainService;
import com.huntflow.domain.rule.service.SimilarityMatchingDomainService;
import com.huntflow.domain.workflow.model.valobj.WorkflowConfig;
import com.huntflow.domain.workflow.service.WorkflowPersistencePolicyDomainService;
import com.huntflow.trigger.application.common.WorkflowViewAssembler;
import com.huntflow.types.enums.ResponseCode;
import com.huntflow.types.enums.ReviewStatusEnum;
import com.huntflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 审核队列写用例：批准（写入向量索引）、驳回、编辑（重新校验）。
 */
@Slf4j
@Service
public class QueueReviewCommandService {

    private static final int MAX_LIST_LIMIT = 500;
    private static final String RULE_ID_PREFIX = "huntflow-";

    private final IQueueItemRepository queueItemRepository;
    private final IVectorIndex vectorIndex;
    private final RuleDraftParser ruleDraftParser;
    private final RuleValidationDomainService ruleValidationDomainService;
    private final RuleGenerationDomainService ruleGenerationDomainService;
    private final RuleSectionDomainService ruleSectionDomainService;
    private final SimilarityMatchingDomainService similarityMatchingDomainService;
    private final WorkflowPersistencePolicyDomainService workflowPersistencePolicyDomainService;
    private final WorkflowViewAssembler workflowViewAssembler;
    private final WorkflowConfig workflowConfig;

    public QueueReviewCommandService(IQueueItemRepository queueItemRepository,
                                     IVectorIndex vectorIndex,
                                     RuleDraftParser ruleDraftParser,
                                     RuleValidationDomainService ruleValidationDomainService,
                                     RuleGenerationDomainService ruleGenerationDomainService,
                                     RuleSectionDomainService ruleSectionDomainService,
                                     SimilarityMatchingDomainService similarityMatchingDomainService,
                                     WorkflowPersistencePolicyDomainService workflowPersistencePolicyDomainService,
                                     WorkflowViewAssembler workflowViewAssembler,
                                     WorkflowConfig workflowConfig) {
        this.queueItemRepository = queueItemRepository;
        this.vectorIndex = vectorIndex;
        this.ruleDraftParser = ruleDraftParser;
        this.ruleValidationDomainService = ruleValidationDomainService;
        this.ruleGenerationDomainService = ruleGenerationDomainService;
        this.ruleSectionDomainService = ruleSectionDomainService;
        this.similarityMatchingDomainService = similarityMatchingDomainService;
        this.workflowPersistencePolicyDomainService = workflowPersistencePolicyDomainService;
        this.workflowViewAssembler = workflowViewAssembler;
        this.workflowConfig = workflowConfig;
    }

    public List<QueueItemDTO> list(String status, Integer limit) {
        ReviewStatusEnum statusEnum = StringUtils.isBlank(status)
                ? ReviewStatusEnum.PENDING : ReviewStatusEnum.fromCode(status.trim());
        int normalizedLimit = limit == null || limit <= 0 ? 50 : Math.min(limit, MAX_LIST_LIMIT);
        return queueItemRepository.findByReviewStatus(statusEnum, normalizedLimit).stream()
                .map(workflowViewAssembler::toQueueItemDTO)
                .collect(Collectors.toList());
    }

    public QueueItemDTO get(Long queueItemId) {
        return workflowViewAssembler.toQueueItemDTO(requireItem(queueItemId));
    }

    /**
     * 批准：先把规则分段嵌入写入向量索引（幂等 upsert），再持久化审核状态
     */
    public QueueItemDTO approve(Long queueItemId, String comment) {
        QueueItemEntity item = requireItem(queueItemId);
        try {
            item.approve(comment);
        } catch (IllegalStateException ex) {
            throw conflict("当前审核状态不支持批准: " + ex.getMessage());
        }
        ParsedRule parsed = parseOrIllegal(item.getRuleYaml());
        RuleDraftEntity rule = ruleGenerationDomainService.buildDraft(item.getExecutionId(), parsed, 1,
                RuleValidationResult.ok());
        SectionEmbeddings embeddings = similarityMatchingDomainService.embed(ruleSectionDomainService.sections(rule),
                workflowConfig.getRetryPolicy());
        String ruleId = resolveRuleId(parsed, item);
        vectorIndex.upsert(ruleId, rule.getTitle(), embeddings, LocalDateTime.now());

        QueueItemEntity saved = updateOrConflict(item);
        log.info("Queue item approved and indexed. queueItemId={}, ruleId={}", queueItemId, ruleId);
        return workflowViewAssembler.toQueueItemDTO(saved);
    }

    public QueueItemDTO reject(Long queueItemId, String comment) {
        QueueItemEntity item = requireItem(queueItemId);
        try {
            item.reject(comment);
        } catch (IllegalStateException ex) {
            throw conflict("当前审核状态不支持驳回: " + ex.getMessage());
        }
        QueueItemEntity saved = updateOrConflict(item);
        log.info("Queue item rejected. queueItemId={}", queueItemId);
        return workflowViewAssembler.toQueueItemDTO(saved);
    }

    /**
     * 编辑：新 YAML 必须通过同一套结构校验，否则拒绝
     */
    public QueueItemDTO edit(Long queueItemId, String ruleYaml, String comment) {
        if (StringUtils.isBlank(ruleYaml)) {
            throw illegal("ruleYaml 不能为空");
        }
        QueueItemEntity item = requireItem(queueItemId);
        ParsedRule parsed = parseOrIllegal(ruleYaml);
        RuleValidationResult validation = ruleValidationDomainService.validate(parsed.document());
        if (!validation.valid()) {
            throw illegal("编辑后的规则校验失败: " + validation.joinedErrors());
        }
        try {
            item.edit(parsed.yaml(), comment);
        } catch (IllegalStateException ex) {
            throw conflict("当前审核状态不支持编辑: " + ex.getMessage());
        }
        QueueItemEntity saved = updateOrConflict(item);
        log.info("Queue item edited. queueItemId={}", queueItemId);
        return workflowViewAssembler.toQueueItemDTO(saved);
    }

    private ParsedRule parseOrIllegal(String ruleYaml) {
        ParseOutcome<ParsedRule> parsed = ruleDraftParser.parse(ruleYaml);
        if (!parsed.isSuccess()) {
            throw illegal("规则 YAML 无法解析: " + parsed.getError());
        }
        return parsed.getValue();
    }

    private String resolveRuleId(ParsedRule parsed, QueueItemEntity item) {
        Object id = parsed.document().get("id");
        if (id != null && StringUtils.isNotBlank(String.valueOf(id))) {
            return String.valueOf(id).trim();
        }
        return RULE_ID_PREFIX + item.getId();
    }

    private QueueItemEntity updateOrConflict(QueueItemEntity item) {
        try {
            return queueItemRepository.update(item);
        } catch (RuntimeException ex) {
            if (workflowPersistencePolicyDomainService.isOptimisticLockConflict(ex)) {
                throw conflict("审核条目已被并发修改，请刷新后重试");
            }
            throw ex;
        }
    }

    private QueueItemEntity requireItem(Long queueItemId) {
        QueueItemEntity item = queueItemId == null ? null : queueItemRepository.findById(queueItemId);
        if (item == null) {
            throw illegal("审核条目不存在: " + queueItemId);
        }
        return item;
    }

    private AppException illegal(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER, message);
    }

    private AppException conflict(String message) {
        return new AppException(ResponseCode.CONFLICT, message);
    }
}
