package com.huntflow.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.types.enums.ResponseCode;
import com.huntflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * JSONB 列编解码：执行步骤结果、配置快照、标签、分段得分与分段向量。
 * 解析失败抛出 AppException，由调用方决定是否升级为致命配置错误。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Double>> DOUBLE_MAP_REF = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST_REF = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, float[]>> SECTION_VECTORS_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> readMap(String json) {
        return readValue(json, MAP_REF);
    }

    public Map<String, Double> readDoubleMap(String json) {
        return readValue(json, DOUBLE_MAP_REF);
    }

    public List<String> readStringList(String json) {
        return readValue(json, STRING_LIST_REF);
    }

    /**
     * 分段嵌入列：key 为规则分段 code，value 为向量
     */
    public Map<String, float[]> readSectionVectors(String json) {
        return readValue(json, SECTION_VECTORS_REF);
    }

    public <T> T readValue(String json, TypeReference<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to parse json column", ex);
        }
    }

    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to write json column", ex);
        }
    }
}
