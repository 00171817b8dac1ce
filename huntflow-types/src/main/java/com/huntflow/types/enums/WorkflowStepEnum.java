package com.huntflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作流步骤枚举，声明顺序即执行顺序。
 *
 * @author huntflow
 * @since 2026-03-02
 */
public enum WorkflowStepEnum {

    FILTER("filter"),
    RANK("rank"),
    PLATFORM_DETECT("platform_detect"),
    EXTRACT("extract"),
    GENERATE("generate"),
    SIMILARITY("similarity"),
    PROMOTE("promote");

    private final String code;

    WorkflowStepEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 下一步骤；最后一步返回 null。
     */
    public WorkflowStepEnum next() {
        WorkflowStepEnum[] steps = values();
        int index = ordinal() + 1;
        return index < steps.length ? steps[index] : null;
    }

    public boolean isAfter(WorkflowStepEnum other) {
        return other != null && ordinal() > other.ordinal();
    }

    public static WorkflowStepEnum first() {
        return FILTER;
    }

    public static WorkflowStepEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (WorkflowStepEnum step : WorkflowStepEnum.values()) {
            if (step.code.equals(code)) {
                return step;
            }
        }
        throw new IllegalArgumentException("Unknown workflow step code: " + code);
    }
}
