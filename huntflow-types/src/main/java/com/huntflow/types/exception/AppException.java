package com.huntflow.types.exception;

import com.huntflow.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用异常：携带 {@link ResponseCode} 编码与描述，API 层原样返回给调用方。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 4127094386521731740L;

    /** 响应码 */
    private String code;

    /** 描述信息 */
    private String info;

    public AppException(ResponseCode responseCode, String message) {
        this(responseCode.getCode(), message, null);
    }

    public AppException(ResponseCode responseCode, String message, Throwable cause) {
        this(responseCode.getCode(), message, cause);
    }

    public AppException(String code, String message) {
        this(code, message, null);
    }

    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code='" + code + "', info='" + info + "'}";
    }

}
