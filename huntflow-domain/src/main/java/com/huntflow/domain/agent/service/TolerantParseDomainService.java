package com.huntflow.domain.agent.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.domain.agent.model.valobj.ParseOutcome;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 模型输出容错解析。
 * <p>
 * 回退顺序：1) 整体严格解析；2) 取第一个 Markdown 代码块内容解析；
 * 3) 取第一个 '{' 到最后一个 '}'（或 '[' 到 ']'）之间的片段解析。
 * 全部失败时返回明确的 ParseError。
 * </p>
 */
@Service
public class TolerantParseDomainService {

    private static final Pattern CODE_FENCE = Pattern.compile("```[a-zA-Z0-9_-]*\\s*\\n?(.*?)```", Pattern.DOTALL);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ParseOutcome<JsonNode> parseJson(String text) {
        if (StringUtils.isBlank(text)) {
            return ParseOutcome.error("empty response");
        }
        String trimmed = text.trim();
        JsonNode node = parseStrict(trimmed);
        if (node != null) {
            return ParseOutcome.success(node);
        }
        String fenced = extractFencedBlock(trimmed);
        if (fenced != null) {
            node = parseStrict(fenced.trim());
            if (node != null) {
                return ParseOutcome.success(node);
            }
        }
        node = parseStrict(slice(trimmed, '{', '}'));
        if (node != null) {
            return ParseOutcome.success(node);
        }
        node = parseStrict(slice(trimmed, '[', ']'));
        if (node != null) {
            return ParseOutcome.success(node);
        }
        return ParseOutcome.error("no JSON value found in response");
    }

    /**
     * 解析 JSON 对象，数组或标量视为错误
     */
    public ParseOutcome<JsonNode> parseJsonObject(String text) {
        ParseOutcome<JsonNode> outcome = parseJson(text);
        if (!outcome.isSuccess()) {
            return outcome;
        }
        if (!outcome.getValue().isObject()) {
            return ParseOutcome.error("expected JSON object");
        }
        return outcome;
    }

    /**
     * 去掉 Markdown 代码围栏，返回第一个代码块内容；无围栏时原样返回
     */
    public String stripCodeFences(String text) {
        if (text == null) {
            return null;
        }
        String fenced = extractFencedBlock(text);
        return fenced != null ? fenced : text.replace("```", "");
    }

    private String extractFencedBlock(String text) {
        Matcher matcher = CODE_FENCE.matcher(text);
        if (matcher.find()) {
            return matcher.group(1);
        }
        return null;
    }

    private String slice(String text, char open, char close) {
        int start = text.indexOf(open);
        int end = text.lastIndexOf(close);
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }

    private JsonNode parseStrict(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        char first = text.charAt(0);
        if (first != '{' && first != '[') {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException ex) {
            return null;
        }
    }
}
