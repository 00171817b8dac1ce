package com.huntflow.domain.rule.service;

import com.huntflow.domain.rule.model.valobj.RuleValidationResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 规则结构校验：必填字段、日志源、条件引用、禁用结构与级别。
 */
@Service
public class RuleValidationDomainService {

    private static final Set<String> LEVELS = Set.of("informational", "low", "medium", "high", "critical");
    private static final Set<String> LOG_SOURCE_KEYS = Set.of("product", "category", "service");
    private static final Set<String> CONDITION_KEYWORDS = Set.of("and", "or", "not", "of", "all", "them", "any");
    private static final Set<String> RESERVED_DETECTION_KEYS = Set.of("condition", "timeframe");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_*][A-Za-z0-9_*]*");
    private static final Pattern NEAR = Pattern.compile("\\bnear\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern COUNT = Pattern.compile("\\bcount\\s*\\(", Pattern.CASE_INSENSITIVE);

    public RuleValidationResult validate(Map<String, Object> rule) {
        List<String> errors = new ArrayList<>();
        if (rule == null || rule.isEmpty()) {
            errors.add("rule is empty");
            return RuleValidationResult.failed(errors);
        }
        Object title = rule.get("title");
        if (!(title instanceof String) || ((String) title).isBlank()) {
            errors.add("missing required field: title");
        }
        validateLogSource(rule.get("logsource"), errors);
        validateDetection(rule.get("detection"), errors);
        if (rule.containsKey("timeframe")) {
            errors.add("forbidden construct: timeframe");
        }
        Object level = rule.get("level");
        if (level != null && !LEVELS.contains(String.valueOf(level).toLowerCase(Locale.ROOT))) {
            errors.add("invalid level: " + level + " (expected one of informational, low, medium, high, critical)");
        }
        return errors.isEmpty() ? RuleValidationResult.ok() : RuleValidationResult.failed(errors);
    }

    private void validateLogSource(Object logSource, List<String> errors) {
        if (!(logSource instanceof Map<?, ?> map) || map.isEmpty()) {
            errors.add("missing required field: logsource");
            return;
        }
        boolean hasKey = map.keySet().stream()
                .anyMatch(key -> LOG_SOURCE_KEYS.contains(String.valueOf(key)) && map.get(key) != null);
        if (!hasKey) {
            errors.add("logsource must define at least one of product, category, service");
        }
    }

    private void validateDetection(Object detection, List<String> errors) {
        if (!(detection instanceof Map<?, ?> map) || map.isEmpty()) {
            errors.add("missing required field: detection");
            return;
        }
        Set<String> selections = new LinkedHashSet<>();
        for (Object key : map.keySet()) {
            String name = String.valueOf(key);
            if (!RESERVED_DETECTION_KEYS.contains(name)) {
                selections.add(name);
            }
        }
        if (map.containsKey("timeframe")) {
            errors.add("forbidden construct: timeframe");
        }
        if (selections.isEmpty()) {
            errors.add("detection must define at least one selection");
        }
        Object condition = map.get("condition");
        if (condition == null || String.valueOf(condition).isBlank()) {
            errors.add("missing required field: detection.condition");
            return;
        }
        List<String> conditions = new ArrayList<>();
        if (condition instanceof List<?> list) {
            list.forEach(item -> conditions.add(String.valueOf(item)));
        } else {
            conditions.add(String.valueOf(condition));
        }
        for (String expression : conditions) {
            validateCondition(expression, selections, errors);
        }
    }

    private void validateCondition(String condition, Set<String> selections, List<String> errors) {
        if (condition.contains("|") || COUNT.matcher(condition).find()) {
            errors.add("forbidden construct: aggregation in condition");
        }
        if (NEAR.matcher(condition).find()) {
            errors.add("forbidden construct: near in condition");
        }
        Matcher matcher = IDENTIFIER.matcher(condition);
        while (matcher.find()) {
            String identifier = matcher.group();
            if (CONDITION_KEYWORDS.contains(identifier.toLowerCase(Locale.ROOT))
                    || identifier.equalsIgnoreCase("near") || identifier.equalsIgnoreCase("count")) {
                continue;
            }
            if (identifier.contains("*")) {
                Pattern wildcard = Pattern.compile(Pattern.quote(identifier).replace("*", "\\E.*\\Q"));
                if (selections.stream().noneMatch(selection -> wildcard.matcher(selection).matches())) {
                    errors.add("condition references undefined selection pattern: " + identifier);
                }
            } else if (!selections.contains(identifier)) {
                errors.add("condition references undefined selection: " + identifier);
            }
        }
    }
}
