package com.huntflow.domain.rule.adapter.repository;

import com.huntflow.domain.rule.model.entity.SimilarityMatchEntity;

import java.util.List;

/**
 * 相似度匹配仓储接口。
 *
 * @author huntflow
 * @since 2026-03-02
 */
public interface ISimilarityMatchRepository {

    SimilarityMatchEntity save(SimilarityMatchEntity entity);

    SimilarityMatchEntity findByRuleDraftId(Long ruleDraftId);

    List<SimilarityMatchEntity> findByExecutionId(Long executionId);
}
