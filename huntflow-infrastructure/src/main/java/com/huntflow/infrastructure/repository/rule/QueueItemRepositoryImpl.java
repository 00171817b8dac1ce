package com.huntflow.infrastructure.repository.rule;

import com.huntflow.domain.rule.adapter.repository.IQueueItemRepository;
import com.huntflow.domain.rule.model.entity.QueueItemEntity;
import com.huntflow.infrastructure.dao.QueueItemDao;
import com.huntflow.infrastructure.dao.po.QueueItemPO;
import com.huntflow.infrastructure.util.JsonCodec;
import com.huntflow.types.common.Constants;
import com.huntflow.types.enums.ReviewStatusEnum;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 审核队列仓储实现。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Repository
public class QueueItemRepositoryImpl implements IQueueItemRepository {

    private final QueueItemDao queueItemDao;
    private final JsonCodec jsonCodec;

    public QueueItemRepositoryImpl(QueueItemDao queueItemDao, JsonCodec jsonCodec) {
        this.queueItemDao = queueItemDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public QueueItemEntity save(QueueItemEntity entity) {
        entity.validate();
        QueueItemPO po = toPO(entity);
        queueItemDao.insert(po);
        return toEntity(po);
    }

    @Override
    public QueueItemEntity update(QueueItemEntity entity) {
        entity.validate();
        entity.incrementVersion();
        QueueItemPO po = toPO(entity);
        int affected = queueItemDao.updateWithVersion(po);
        if (affected == 0) {
            throw new RuntimeException(Constants.OPTIMISTIC_LOCK_FAILED + " for QueueItem: " + entity.getId());
        }
        return toEntity(po);
    }

    @Override
    public QueueItemEntity findById(Long id) {
        QueueItemPO po = queueItemDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public QueueItemEntity findByRuleDraftId(Long ruleDraftId) {
        QueueItemPO po = queueItemDao.selectByRuleDraftId(ruleDraftId);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<QueueItemEntity> findByReviewStatus(ReviewStatusEnum status, int limit) {
        return queueItemDao.selectByReviewStatus(status.getCode(), limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<QueueItemEntity> findByExecutionId(Long executionId) {
        return queueItemDao.selectByExecutionId(executionId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private QueueItemEntity toEntity(QueueItemPO po) {
        QueueItemEntity entity = new QueueItemEntity();
        entity.setId(po.getId());
        entity.setRuleDraftId(po.getRuleDraftId());
        entity.setExecutionId(po.getExecutionId());
        entity.setDocumentId(po.getDocumentId());
        entity.setRuleYaml(po.getRuleYaml());
        entity.setSimilarityContext(jsonCodec.readMap(po.getSimilarityContext()));
        entity.setMaxSimilarity(po.getMaxSimilarity());
        entity.setReviewStatus(ReviewStatusEnum.fromCode(po.getReviewStatus()));
        entity.setReviewerComment(po.getReviewerComment());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        entity.setReviewedAt(po.getReviewedAt());
        return entity;
    }

    private QueueItemPO toPO(QueueItemEntity entity) {
        return QueueItemPO.builder()
                .id(entity.getId())
                .ruleDraftId(entity.getRuleDraftId())
                .executionId(entity.getExecutionId())
                .documentId(entity.getDocumentId())
                .ruleYaml(entity.getRuleYaml())
                .similarityContext(jsonCodec.writeValue(entity.getSimilarityContext()))
                .maxSimilarity(entity.getMaxSimilarity())
                .reviewStatus(entity.getReviewStatus().getCode())
                .reviewerComment(entity.getReviewerComment())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .reviewedAt(entity.getReviewedAt())
                .build();
    }
}
