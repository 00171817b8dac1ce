package com.huntflow.domain.workflow.model.valobj;

import com.huntflow.types.enums.TerminationReasonEnum;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个步骤的处理结果：继续、终止（带原因）或失败。
 */
@Getter
public final class StepOutcome {

    private final Kind kind;
    private final Map<String, Object> result;
    private final TerminationReasonEnum terminationReason;
    private final String errorType;
    private final String errorMessage;
    private final boolean filterDegraded;

    private StepOutcome(Kind kind, Map<String, Object> result, TerminationReasonEnum terminationReason,
                        String errorType, String errorMessage, boolean filterDegraded) {
        this.kind = kind;
        this.result = result == null ? new LinkedHashMap<>() : result;
        this.terminationReason = terminationReason;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.filterDegraded = filterDegraded;
    }

    public static StepOutcome proceed(Map<String, Object> result) {
        return new StepOutcome(Kind.CONTINUE, result, null, null, null, false);
    }

    public static StepOutcome proceedDegraded(Map<String, Object> result) {
        return new StepOutcome(Kind.CONTINUE, result, null, null, null, true);
    }

    public static StepOutcome terminate(TerminationReasonEnum reason, Map<String, Object> result) {
        return new StepOutcome(Kind.TERMINATE, result, reason, null, null, false);
    }

    public static StepOutcome fail(String errorType, String errorMessage, Map<String, Object> result) {
        return new StepOutcome(Kind.FAIL, result, null, errorType, errorMessage, false);
    }

    public enum Kind {
        CONTINUE,
        TERMINATE,
        FAIL
    }
}
