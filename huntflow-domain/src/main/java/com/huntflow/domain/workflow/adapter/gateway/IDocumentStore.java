package com.huntflow.domain.workflow.adapter.gateway;

import com.huntflow.domain.workflow.model.valobj.DocumentSnapshot;

/**
 * 外部文档库，只读。
 */
public interface IDocumentStore {

    /**
     * 按 ID 读取文档，不存在返回 null
     */
    DocumentSnapshot fetch(Long documentId);
}
