package com.huntflow.infrastructure.dao;

import com.huntflow.infrastructure.dao.po.QueueItemPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 审核队列 DAO
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Mapper
public interface QueueItemDao {

    int insert(QueueItemPO po);

    /**
     * 根据 ID 更新 (带乐观锁)
     */
    int updateWithVersion(QueueItemPO po);

    QueueItemPO selectById(@Param("id") Long id);

    QueueItemPO selectByRuleDraftId(@Param("ruleDraftId") Long ruleDraftId);

    List<QueueItemPO> selectByReviewStatus(@Param("reviewStatus") String reviewStatus, @Param("limit") Integer limit);

    List<QueueItemPO> selectByExecutionId(@Param("executionId") Long executionId);
}
