package com.huntflow.domain.workflow.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 文档只读快照，由外部文档库提供。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DocumentSnapshot {

    private Long id;
    private String title;
    private String rawText;
    private List<String> platformHints;
}
