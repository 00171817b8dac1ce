package com.huntflow.domain.agent.service;

import com.huntflow.domain.workflow.model.valobj.RetryPolicy;
import com.huntflow.types.enums.GatewayErrorTypeEnum;
import com.huntflow.types.exception.AppException;
import com.huntflow.types.exception.ModelGatewayException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 外部调用领域服务：为模型、嵌入、向量索引调用统一提供超时与有界指数退避重试。
 * <p>
 * 只重试 UNAVAILABLE、RATE_LIMITED、TIMEOUT；INVALID_RESPONSE 与其它业务异常直接抛出。
 * </p>
 */
@Slf4j
@Service
public class ExternalCallDomainService {

    private final ExecutorService gatewayCallWorker;

    public ExternalCallDomainService(@Qualifier("gatewayCallWorker") ExecutorService gatewayCallWorker) {
        this.gatewayCallWorker = gatewayCallWorker;
    }

    public <T> T execute(String callName, Callable<T> call, RetryPolicy policy) {
        RetryPolicy effective = policy == null ? RetryPolicy.builder().build() : policy;
        int maxAttempts = effective.normalizedMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return invokeWithTimeout(callName, call, effective.getCallTimeoutMs());
            } catch (ModelGatewayException ex) {
                if (!ex.isTransientFailure() || attempt >= maxAttempts) {
                    log.warn("External call failed. call={}, attempt={}, maxAttempts={}, errorType={}, error={}",
                            callName, attempt, maxAttempts, ex.getErrorType().getCode(), ex.getMessage());
                    throw ex;
                }
                long backoffMs = effective.backoffMs(attempt);
                log.info("External call failed, retrying. call={}, attempt={}, maxAttempts={}, errorType={}, backoffMs={}",
                        callName, attempt, maxAttempts, ex.getErrorType().getCode(), backoffMs);
                sleepBackoff(backoffMs);
            }
        }
    }

    private <T> T invokeWithTimeout(String callName, Callable<T> call, long timeoutMs) {
        Map<String, String> mdcContext = MDC.getCopyOfContextMap();
        Future<T> future;
        try {
            future = gatewayCallWorker.submit(() -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (mdcContext != null) {
                    MDC.setContextMap(mdcContext);
                }
                try {
                    return call.call();
                } finally {
                    if (previous == null) {
                        MDC.clear();
                    } else {
                        MDC.setContextMap(previous);
                    }
                }
            });
        } catch (RejectedExecutionException ex) {
            throw new ModelGatewayException(GatewayErrorTypeEnum.UNAVAILABLE,
                    "Gateway call worker rejected call: " + callName, ex);
        }
        try {
            return timeoutMs > 0 ? future.get(timeoutMs, TimeUnit.MILLISECONDS) : future.get();
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new ModelGatewayException(GatewayErrorTypeEnum.TIMEOUT,
                    "External call timed out after " + timeoutMs + "ms: " + callName, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ModelGatewayException(GatewayErrorTypeEnum.UNAVAILABLE,
                    "Interrupted while waiting for external call: " + callName, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof AppException appException) {
                throw appException;
            }
            throw new ModelGatewayException(GatewayErrorTypeEnum.UNAVAILABLE,
                    "External call failed: " + callName + ", error=" + (cause == null ? ex.getMessage() : cause.getMessage()),
                    cause == null ? ex : cause);
        }
    }

    private void sleepBackoff(long backoffMs) {
        if (backoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ModelGatewayException(GatewayErrorTypeEnum.UNAVAILABLE, "Interrupted during retry backoff", ex);
        }
    }
}
