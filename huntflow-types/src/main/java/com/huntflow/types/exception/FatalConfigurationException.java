package com.huntflow.types.exception;

import com.huntflow.types.enums.ResponseCode;

/**
 * 致命配置错误：分类器产物损坏、规则语料格式错误等，执行立即中止且不自动重试。
 *
 * @author huntflow
 * @since 2026-03-02
 */
public class FatalConfigurationException extends AppException {

    private static final long serialVersionUID = 6650228517938061244L;

    public FatalConfigurationException(String message) {
        super(ResponseCode.FATAL_CONFIGURATION, message);
    }

    public FatalConfigurationException(String message, Throwable cause) {
        super(ResponseCode.FATAL_CONFIGURATION, message, cause);
    }
}
