package com.huntflow.infrastructure.dao;

import com.huntflow.infrastructure.dao.po.RuleDraftPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 规则草稿 DAO
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Mapper
public interface RuleDraftDao {

    int insert(RuleDraftPO po);

    RuleDraftPO selectById(@Param("id") Long id);

    List<RuleDraftPO> selectByExecutionId(@Param("executionId") Long executionId);
}
