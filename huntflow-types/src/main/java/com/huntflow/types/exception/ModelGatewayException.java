package com.huntflow.types.exception;

import com.huntflow.types.enums.GatewayErrorTypeEnum;
import com.huntflow.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 模型、向量或嵌入网关调用失败。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Getter
public class ModelGatewayException extends AppException {

    private static final long serialVersionUID = -2918347560913372856L;

    private final GatewayErrorTypeEnum errorType;

    public ModelGatewayException(GatewayErrorTypeEnum errorType, String message) {
        super(ResponseCode.GATEWAY_FAILURE, message);
        this.errorType = errorType == null ? GatewayErrorTypeEnum.UNAVAILABLE : errorType;
    }

    public ModelGatewayException(GatewayErrorTypeEnum errorType, String message, Throwable cause) {
        super(ResponseCode.GATEWAY_FAILURE, message, cause);
        this.errorType = errorType == null ? GatewayErrorTypeEnum.UNAVAILABLE : errorType;
    }

    public boolean isTransientFailure() {
        return errorType.isTransientFailure();
    }
}
