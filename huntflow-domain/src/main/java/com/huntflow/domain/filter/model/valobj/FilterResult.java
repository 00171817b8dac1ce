package com.huntflow.domain.filter.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 内容过滤结果。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FilterResult {

    private String filteredText;
    private List<ChunkDecision> decisions;
    private boolean degraded;
    private String classifierVersion;
    private int totalChunks;
    private int keptChunks;

    public int getRemovedChunks() {
        return totalChunks - keptChunks;
    }
}
