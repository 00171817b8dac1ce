package com.huntflow.test.support;

import com.huntflow.domain.rule.adapter.repository.IQueueItemRepository;
import com.huntflow.domain.rule.model.entity.QueueItemEntity;
import com.huntflow.types.common.Constants;
import com.huntflow.types.enums.ReviewStatusEnum;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 内存审核队列仓储，update 按 version 条件写入。
 */
public class InMemoryQueueItemRepository implements IQueueItemRepository {

    private final Map<Long, QueueItemEntity> store = new LinkedHashMap<>();
    private long nextId = 1;
    private Runnable onLookup = () -> {
    };

    @Override
    public synchronized QueueItemEntity save(QueueItemEntity entity) {
        entity.validate();
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        store.put(entity.getId(), copy(entity));
        return entity;
    }

    @Override
    public synchronized QueueItemEntity update(QueueItemEntity entity) {
        entity.validate();
        QueueItemEntity stored = store.get(entity.getId());
        entity.incrementVersion();
        if (stored == null || stored.getVersion() + 1 != entity.getVersion()) {
            throw new RuntimeException(Constants.OPTIMISTIC_LOCK_FAILED + ": queueItemId=" + entity.getId());
        }
        store.put(entity.getId(), copy(entity));
        return entity;
    }

    @Override
    public synchronized QueueItemEntity findById(Long id) {
        QueueItemEntity stored = store.get(id);
        return stored == null ? null : copy(stored);
    }

    @Override
    public synchronized QueueItemEntity findByRuleDraftId(Long ruleDraftId) {
        onLookup.run();
        return store.values().stream()
                .filter(item -> Objects.equals(item.getRuleDraftId(), ruleDraftId))
                .findFirst()
                .map(this::copy)
                .orElse(null);
    }

    @Override
    public synchronized List<QueueItemEntity> findByReviewStatus(ReviewStatusEnum status, int limit) {
        return store.values().stream()
                .filter(item -> item.getReviewStatus() == status)
                .limit(limit)
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<QueueItemEntity> findByExecutionId(Long executionId) {
        return store.values().stream()
                .filter(item -> Objects.equals(item.getExecutionId(), executionId))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    /**
     * 每次按草稿查找前执行，入队写入前的最后一次读取
     */
    public synchronized void onLookup(Runnable hook) {
        this.onLookup = hook;
    }

    public synchronized List<QueueItemEntity> findAll() {
        return store.values().stream().map(this::copy).collect(Collectors.toCollection(ArrayList::new));
    }

    private QueueItemEntity copy(QueueItemEntity source) {
        QueueItemEntity target = new QueueItemEntity();
        target.setId(source.getId());
        target.setRuleDraftId(source.getRuleDraftId());
        target.setExecutionId(source.getExecutionId());
        target.setDocumentId(source.getDocumentId());
        target.setRuleYaml(source.getRuleYaml());
        target.setSimilarityContext(source.getSimilarityContext() == null
                ? null : new LinkedHashMap<>(source.getSimilarityContext()));
        target.setMaxSimilarity(source.getMaxSimilarity());
        target.setReviewStatus(source.getReviewStatus());
        target.setReviewerComment(source.getReviewerComment());
        target.setVersion(source.getVersion());
        target.setCreatedAt(source.getCreatedAt());
        target.setUpdatedAt(source.getUpdatedAt());
        target.setReviewedAt(source.getReviewedAt());
        return target;
    }
}
