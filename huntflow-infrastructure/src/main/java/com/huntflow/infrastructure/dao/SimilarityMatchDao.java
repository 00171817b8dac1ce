package com.huntflow.infrastructure.dao;

import com.huntflow.infrastructure.dao.po.SimilarityMatchPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 相似度匹配 DAO
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Mapper
public interface SimilarityMatchDao {

    int insert(SimilarityMatchPO po);

    SimilarityMatchPO selectByRuleDraftId(@Param("ruleDraftId") Long ruleDraftId);

    List<SimilarityMatchPO> selectByExecutionId(@Param("executionId") Long executionId);
}
