package com.huntflow.infrastructure.dao;

import com.huntflow.infrastructure.dao.po.ExecutionAttemptPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 调用尝试审计 DAO
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Mapper
public interface ExecutionAttemptDao {

    int insert(ExecutionAttemptPO po);

    /**
     * 根据执行 ID 查询，按创建时间升序
     */
    List<ExecutionAttemptPO> selectByExecutionId(@Param("executionId") Long executionId);

    List<ExecutionAttemptPO> selectByExecutionIdAndStep(@Param("executionId") Long executionId,
                                                       @Param("step") String step);
}
