package com.huntflow.infrastructure.document;

import com.huntflow.domain.workflow.adapter.gateway.IDocumentStore;
import com.huntflow.domain.workflow.model.valobj.DocumentSnapshot;
import com.huntflow.infrastructure.dao.DocumentDao;
import com.huntflow.infrastructure.dao.po.DocumentPO;
import com.huntflow.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 文档库只读适配。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Component
public class DocumentStoreImpl implements IDocumentStore {

    private final DocumentDao documentDao;
    private final JsonCodec jsonCodec;

    public DocumentStoreImpl(DocumentDao documentDao, JsonCodec jsonCodec) {
        this.documentDao = documentDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public DocumentSnapshot fetch(Long documentId) {
        if (documentId == null) {
            return null;
        }
        DocumentPO po = documentDao.selectById(documentId);
        if (po == null) {
            return null;
        }
        List<String> hints = jsonCodec.readStringList(po.getPlatformHints());
        return new DocumentSnapshot(po.getId(), po.getTitle(), po.getContent(), hints != null ? hints : new ArrayList<>());
    }
}
