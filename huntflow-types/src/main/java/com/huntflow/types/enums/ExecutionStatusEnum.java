package com.huntflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作流执行状态枚举
 *
 * @author huntflow
 * @since 2026-03-02
 */
public enum ExecutionStatusEnum {

    /**
     * 待调度 - 已触发，等待执行器领取
     */
    PENDING("pending"),

    /**
     * 运行中 - 执行器已领取并逐步推进
     */
    RUNNING("running"),

    /**
     * 已完成 - 正常走完或因终止原因提前结束
     */
    COMPLETED("completed"),

    /**
     * 失败 - 某个步骤失败或被过期清扫
     */
    FAILED("failed"),

    /**
     * 已取消
     */
    CANCELLED("cancelled");

    private final String code;

    ExecutionStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static ExecutionStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ExecutionStatusEnum status : ExecutionStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown execution status code: " + code);
    }
}
