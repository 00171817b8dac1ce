package com.huntflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 检测规则语料 PO
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionRuleCorpusPO {

    /**
     * 规则 ID
     */
    private String ruleId;

    private String title;

    /**
     * 分段向量 (JSONB)
     */
    private String sectionEmbeddings;

    private LocalDateTime updatedAt;
}
