package com.huntflow.infrastructure.vector;

import com.huntflow.domain.rule.model.valobj.SectionEmbeddings;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 语料中的已有检测规则，分段向量已解码。
 */
@Value
public class CorpusRule {

    String ruleId;
    String title;
    SectionEmbeddings embeddings;
    LocalDateTime updatedAt;
}
