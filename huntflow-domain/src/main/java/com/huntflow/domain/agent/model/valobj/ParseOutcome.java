package com.huntflow.domain.agent.model.valobj;

/**
 * 容错解析结果：要么是结构化值，要么是明确的解析错误，不做猜测。
 *
 * @param <T> 解析值类型
 */
public final class ParseOutcome<T> {

    private final T value;
    private final String error;

    private ParseOutcome(T value, String error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ParseOutcome<T> success(T value) {
        return new ParseOutcome<>(value, null);
    }

    public static <T> ParseOutcome<T> error(String error) {
        return new ParseOutcome<>(null, error == null ? "parse error" : error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Parse failed: " + error);
        }
        return value;
    }

    public String getError() {
        return error;
    }
}
