package com.huntflow.domain.rule.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.huntflow.domain.agent.model.valobj.ParseOutcome;
import com.huntflow.domain.agent.service.TolerantParseDomainService;
import com.huntflow.domain.rule.model.valobj.ParsedRule;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 规则 YAML 容错解析：去代码围栏，丢弃首个顶层规则键之前的说明文字，再按 YAML 严格解析。
 */
@Component
public class RuleDraftParser {

    private static final Pattern FIRST_RULE_KEY = Pattern.compile(
            "^(title|id|name|status|description|author|logsource|detection):", Pattern.MULTILINE);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private final TolerantParseDomainService tolerantParseDomainService;

    public RuleDraftParser(TolerantParseDomainService tolerantParseDomainService) {
        this.tolerantParseDomainService = tolerantParseDomainService;
    }

    public ParseOutcome<ParsedRule> parse(String text) {
        if (StringUtils.isBlank(text)) {
            return ParseOutcome.error("empty response");
        }
        String yaml = clean(text);
        if (yaml.isEmpty()) {
            return ParseOutcome.error("no rule YAML found in response");
        }
        try {
            Object document = yamlMapper.readValue(yaml, Object.class);
            if (!(document instanceof Map)) {
                return ParseOutcome.error("rule YAML must be a mapping");
            }
            Map<String, Object> map = yamlMapper.convertValue(document, MAP_TYPE);
            return ParseOutcome.success(new ParsedRule(yaml, map));
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            return ParseOutcome.error("YAML parse error: " + firstLine(ex.getMessage()));
        }
    }

    String clean(String text) {
        String body = tolerantParseDomainService.stripCodeFences(text);
        Matcher matcher = FIRST_RULE_KEY.matcher(body);
        if (matcher.find()) {
            body = body.substring(matcher.start());
        }
        return body.strip();
    }

    private String firstLine(String message) {
        if (message == null) {
            return "unknown";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
