package com.huntflow.domain.rule.model.valobj;

import java.util.List;

/**
 * 规则校验结果，校验失败不抛异常。
 */
public record RuleValidationResult(boolean valid, List<String> errors) {

    public RuleValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static RuleValidationResult ok() {
        return new RuleValidationResult(true, List.of());
    }

    public static RuleValidationResult failed(List<String> errors) {
        return new RuleValidationResult(false, errors);
    }

    public String joinedErrors() {
        return String.join("; ", errors);
    }
}
