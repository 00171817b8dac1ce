package com.huntflow.infrastructure.dao;

import com.huntflow.infrastructure.dao.po.DetectionRuleCorpusPO;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

/**
 * 检测规则语料 DAO
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Mapper
public interface DetectionRuleCorpusDao {

    /**
     * 按 rule_id 插入或覆盖
     */
    int upsert(DetectionRuleCorpusPO po);

    List<DetectionRuleCorpusPO> selectAll();
}
