package com.huntflow.domain.rule.adapter.repository;

import com.huntflow.domain.rule.model.entity.QueueItemEntity;
import com.huntflow.types.enums.ReviewStatusEnum;

import java.util.List;

/**
 * 审核队列仓储接口。
 *
 * @author huntflow
 * @since 2026-03-02
 */
public interface IQueueItemRepository {

    QueueItemEntity save(QueueItemEntity entity);

    /**
     * 乐观锁更新；版本不匹配时抛出 "Optimistic lock failed" 异常
     */
    QueueItemEntity update(QueueItemEntity entity);

    QueueItemEntity findById(Long id);

    QueueItemEntity findByRuleDraftId(Long ruleDraftId);

    List<QueueItemEntity> findByReviewStatus(ReviewStatusEnum status, int limit);

    List<QueueItemEntity> findByExecutionId(Long executionId);
}
