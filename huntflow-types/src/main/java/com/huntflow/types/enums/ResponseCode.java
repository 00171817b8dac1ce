package com.huntflow.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 状态冲突或乐观锁失败 */
    CONFLICT("0003", "状态冲突"),

    /** 致命配置错误（分类器产物或规则语料损坏） */
    FATAL_CONFIGURATION("0004", "致命配置错误"),

    /** 外部模型或索引网关失败 */
    GATEWAY_FAILURE("0005", "外部网关失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
