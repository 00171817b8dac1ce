package com.huntflow.domain.rule.adapter.repository;

import com.huntflow.domain.rule.model.entity.RuleDraftEntity;

import java.util.List;

/**
 * 规则草稿仓储接口。
 *
 * @author huntflow
 * @since 2026-03-02
 */
public interface IRuleDraftRepository {

    RuleDraftEntity save(RuleDraftEntity entity);

    RuleDraftEntity findById(Long id);

    List<RuleDraftEntity> findByExecutionId(Long executionId);
}
