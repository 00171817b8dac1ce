package com.huntflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 文档 PO (只读)
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentPO {

    private Long id;

    private String title;

    /**
     * 正文
     */
    private String content;

    /**
     * 平台提示 (JSONB)
     */
    private String platformHints;

    private LocalDateTime createdAt;
}
