package com.huntflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 可观测项类型枚举，每个抽取子代理负责一种。
 *
 * @author huntflow
 * @since 2026-03-02
 */
public enum ObservableTypeEnum {

    COMMAND_LINE("command_line"),
    QUERY_FRAGMENT("query_fragment"),
    EVENT_ID("event_id"),
    PROCESS_LINEAGE("process_lineage"),
    REGISTRY_OPERATION("registry_operation");

    private final String code;

    ObservableTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ObservableTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ObservableTypeEnum type : ObservableTypeEnum.values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown observable type code: " + code);
    }
}
