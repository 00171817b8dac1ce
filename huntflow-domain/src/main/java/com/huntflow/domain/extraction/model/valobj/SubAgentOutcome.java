package com.huntflow.domain.extraction.model.valobj;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.huntflow.types.enums.ObservableTypeEnum;
import com.huntflow.types.enums.SubAgentStatusEnum;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个子代理的最终结果，按名册顺序写入抽取步骤结果。
 */
@Data
public class SubAgentOutcome {

    private String agentName;
    private ObservableTypeEnum observableType;
    private SubAgentStatusEnum status;
    private int attempts;
    private boolean qaExhausted;
    private List<Observable> observables = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();
    private String errorType;
    private String errorMessage;

    @JsonIgnore
    public boolean isSucceeded() {
        return status == SubAgentStatusEnum.DONE;
    }
}
