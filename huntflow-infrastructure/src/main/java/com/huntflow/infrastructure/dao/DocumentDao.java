package com.huntflow.infrastructure.dao;

import com.huntflow.infrastructure.dao.po.DocumentPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 文档 DAO (只读)
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Mapper
public interface DocumentDao {

    DocumentPO selectById(@Param("id") Long id);
}
