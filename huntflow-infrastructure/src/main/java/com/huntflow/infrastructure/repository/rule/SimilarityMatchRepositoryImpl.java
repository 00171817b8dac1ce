package com.huntflow.infrastructure.repository.rule;

import com.huntflow.domain.rule.adapter.repository.ISimilarityMatchRepository;
import com.huntflow.domain.rule.model.entity.SimilarityMatchEntity;
import com.huntflow.infrastructure.dao.SimilarityMatchDao;
import com.huntflow.infrastructure.dao.po.SimilarityMatchPO;
import com.huntflow.infrastructure.util.JsonCodec;
import com.huntflow.types.enums.SimilarityClassEnum;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 相似度匹配仓储实现。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Repository
public class SimilarityMatchRepositoryImpl implements ISimilarityMatchRepository {

    private final SimilarityMatchDao similarityMatchDao;
    private final JsonCodec jsonCodec;

    public SimilarityMatchRepositoryImpl(SimilarityMatchDao similarityMatchDao, JsonCodec jsonCodec) {
        this.similarityMatchDao = similarityMatchDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public SimilarityMatchEntity save(SimilarityMatchEntity entity) {
        SimilarityMatchPO po = toPO(entity);
        similarityMatchDao.insert(po);
        return toEntity(po);
    }

    @Override
    public SimilarityMatchEntity findByRuleDraftId(Long ruleDraftId) {
        SimilarityMatchPO po = similarityMatchDao.selectByRuleDraftId(ruleDraftId);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<SimilarityMatchEntity> findByExecutionId(Long executionId) {
        return similarityMatchDao.selectByExecutionId(executionId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private SimilarityMatchEntity toEntity(SimilarityMatchPO po) {
        SimilarityMatchEntity entity = new SimilarityMatchEntity();
        entity.setId(po.getId());
        entity.setRuleDraftId(po.getRuleDraftId());
        entity.setExecutionId(po.getExecutionId());
        entity.setMatchedRuleId(po.getMatchedRuleId());
        entity.setSectionScores(jsonCodec.readDoubleMap(po.getSectionScores()));
        entity.setAggregateScore(po.getAggregateScore());
        entity.setClassification(SimilarityClassEnum.fromCode(po.getClassification()));
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private SimilarityMatchPO toPO(SimilarityMatchEntity entity) {
        return SimilarityMatchPO.builder()
                .id(entity.getId())
                .ruleDraftId(entity.getRuleDraftId())
                .executionId(entity.getExecutionId())
                .matchedRuleId(entity.getMatchedRuleId())
                .sectionScores(jsonCodec.writeValue(entity.getSectionScores()))
                .aggregateScore(entity.getAggregateScore())
                .classification(entity.getClassification().getCode())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
