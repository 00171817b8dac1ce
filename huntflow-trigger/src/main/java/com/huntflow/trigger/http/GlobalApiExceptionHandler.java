package com.huntflow.trigger.http;

import com.huntflow.api.response.Response;
import com.huntflow.types.common.Constants;
import com.huntflow.types.enums.ResponseCode;
import com.huntflow.types.exception.AppException;
import com.huntflow.types.exception.FatalConfigurationException;
import com.huntflow.types.exception.ModelGatewayException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理：AppException 保留其响应码，参数类错误映射为 0002，其余为 0001。
 * 致命配置错误按 error 级别记录，网关错误附带失败类型。
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_INFO_LENGTH = 300;

    @ExceptionHandler(AppException.class)
    public Response<Object> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo());
        if (ex instanceof FatalConfigurationException) {
            log.error("Request rejected by fatal configuration. path={}, method={}, executionId={}, code={}, info={}",
                    resolvePath(request), resolveMethod(request), resolveExecutionId(), code, info, ex);
        } else if (ex instanceof ModelGatewayException gatewayException) {
            log.warn("Request failed at model gateway. path={}, method={}, executionId={}, gatewayErrorType={}, info={}",
                    resolvePath(request), resolveMethod(request), resolveExecutionId(),
                    gatewayException.getErrorType().getCode(), info);
        } else {
            log.warn("Request rejected. path={}, method={}, executionId={}, code={}, info={}",
                    resolvePath(request), resolveMethod(request), resolveExecutionId(), code, info);
        }
        return Response.failure(code, info);
    }

    @ExceptionHandler({
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public Response<Object> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()));
        log.warn("Request has illegal parameter. path={}, method={}, errorType={}, info={}",
                resolvePath(request), resolveMethod(request), ex.getClass().getSimpleName(), info);
        return Response.failure(ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("Request failed unexpectedly. path={}, method={}, executionId={}, errorType={}, error={}",
                resolvePath(request), resolveMethod(request), resolveExecutionId(),
                ex.getClass().getSimpleName(), truncate(ex.getMessage()), ex);
        return Response.failure(ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo());
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private String resolveMethod(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }

    private String resolveExecutionId() {
        return StringUtils.defaultIfBlank(MDC.get(Constants.MDC_EXECUTION_ID), "-");
    }

    private String truncate(String text) {
        if (StringUtils.isBlank(text) || text.length() <= MAX_INFO_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_INFO_LENGTH);
    }
}
