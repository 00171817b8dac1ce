package com.huntflow.domain.extraction.model.valobj;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 抽取汇总结果：子代理结果按名册顺序排列，observables 以类型 code 为 key，只含成功子代理的产出。
 */
@Data
public class ExtractionResult {

    private List<SubAgentOutcome> outcomes = new ArrayList<>();
    private Map<String, List<Observable>> observables = new LinkedHashMap<>();
    private List<String> warnings = new ArrayList<>();
    private int successCount;

    public int totalObservables() {
        return observables.values().stream().mapToInt(List::size).sum();
    }

    public List<Observable> allObservables() {
        List<Observable> all = new ArrayList<>();
        observables.values().forEach(all::addAll);
        return all;
    }

    @JsonIgnore
    public boolean isAllFailed() {
        return successCount == 0;
    }
}
