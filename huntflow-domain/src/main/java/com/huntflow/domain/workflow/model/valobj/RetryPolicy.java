package com.huntflow.domain.workflow.model.valobj;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 外部调用传输层重试策略：超时 + 有界指数退避，与 QA 反馈重试相互独立。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    long initialBackoffMs = 500L;

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    long maxBackoffMs = 8000L;

    @Builder.Default
    long callTimeoutMs = 120_000L;

    /**
     * 第 attempt 次失败后的等待时长，attempt 从 1 开始
     */
    public long backoffMs(int attempt) {
        if (initialBackoffMs <= 0) {
            return 0L;
        }
        double delay = initialBackoffMs * Math.pow(Math.max(multiplier, 1.0), Math.max(attempt - 1, 0));
        return (long) Math.min(delay, Math.max(maxBackoffMs, initialBackoffMs));
    }

    public int normalizedMaxAttempts() {
        return Math.max(maxAttempts, 1);
    }
}
