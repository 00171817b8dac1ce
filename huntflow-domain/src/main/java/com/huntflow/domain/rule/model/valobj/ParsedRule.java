package com.huntflow.domain.rule.model.valobj;

import java.util.Map;

/**
 * 清洗后的规则 YAML 与其解析后的文档。
 */
public record ParsedRule(String yaml, Map<String, Object> document) {
}
