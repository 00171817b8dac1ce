package com.huntflow.infrastructure.dao;

import com.huntflow.infrastructure.dao.po.WorkflowExecutionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 工作流执行 DAO
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Mapper
public interface WorkflowExecutionDao {

    /**
     * 插入执行
     */
    int insert(WorkflowExecutionPO po);

    /**
     * 根据 ID 更新 (带乐观锁，version 为更新后的值)
     */
    int updateWithVersion(WorkflowExecutionPO po);

    WorkflowExecutionPO selectById(@Param("id") Long id);

    List<WorkflowExecutionPO> selectByStatus(@Param("status") String status, @Param("limit") Integer limit);

    List<WorkflowExecutionPO> selectByDocumentId(@Param("documentId") Long documentId);

    /**
     * 查询同一 (文档, 配置版本) 下 pending/running 的执行
     */
    List<WorkflowExecutionPO> selectActiveByDocumentAndConfig(@Param("documentId") Long documentId,
                                                              @Param("configVersion") String configVersion);

    /**
     * 查询心跳过期的 running 执行
     */
    List<WorkflowExecutionPO> selectStaleRunning(@Param("heartbeatBefore") LocalDateTime heartbeatBefore,
                                                 @Param("limit") Integer limit);
}
