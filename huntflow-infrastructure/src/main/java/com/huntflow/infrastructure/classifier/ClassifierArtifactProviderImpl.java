package com.huntflow.infrastructure.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.domain.filter.adapter.gateway.IClassifierArtifact;
import com.huntflow.domain.filter.adapter.gateway.IClassifierArtifactProvider;
import com.huntflow.types.exception.FatalConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 从配置位置加载线性分类器 JSON 产物。
 * <p>
 * 产物缺失或无法读取时返回 empty，过滤降级放行；JSON 损坏、权重非有限值、版本缺失时抛出致命配置异常。
 * 加载成功后按位置缓存，同一版本只加载一次。
 * </p>
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Slf4j
@Component
public class ClassifierArtifactProviderImpl implements IClassifierArtifactProvider {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;

    private volatile LinearClassifierArtifact loaded;

    public ClassifierArtifactProviderImpl(ResourceLoader resourceLoader,
                                          ObjectMapper objectMapper,
                                          @Value("${huntflow.classifier.location:classpath:classifier/content-filter-v1.json}") String location) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = location;
    }

    @Override
    public Optional<IClassifierArtifact> current() {
        LinearClassifierArtifact artifact = loaded;
        if (artifact != null) {
            return Optional.of(artifact);
        }
        synchronized (this) {
            if (loaded == null) {
                loaded = load();
            }
            return Optional.ofNullable(loaded);
        }
    }

    private LinearClassifierArtifact load() {
        if (StringUtils.isBlank(location)) {
            log.warn("Classifier artifact location not configured, content filter degraded");
            return null;
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Classifier artifact missing, content filter degraded. location={}", location);
            return null;
        }
        JsonNode root;
        try (InputStream inputStream = resource.getInputStream()) {
            root = objectMapper.readTree(inputStream);
        } catch (JsonProcessingException ex) {
            throw new FatalConfigurationException("Classifier artifact is not valid JSON: " + location, ex);
        } catch (IOException ex) {
            log.warn("Classifier artifact unreadable, content filter degraded. location={}, error={}",
                    location, ex.getMessage());
            return null;
        }
        LinearClassifierArtifact artifact = parse(root);
        log.info("Classifier artifact loaded. location={}, version={}, vocabulary={}",
                location, artifact.version(), artifact.vocabularySize());
        return artifact;
    }

    LinearClassifierArtifact parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new FatalConfigurationException("Classifier artifact must be a JSON object: " + location);
        }
        String version = root.path("version").asText(null);
        if (StringUtils.isBlank(version)) {
            throw new FatalConfigurationException("Classifier artifact version missing: " + location);
        }
        JsonNode weightsNode = root.get("weights");
        if (weightsNode == null || !weightsNode.isObject() || weightsNode.isEmpty()) {
            throw new FatalConfigurationException("Classifier artifact weights missing: " + location);
        }
        Map<String, Double> weights = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = weightsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            weights.put(field.getKey().toLowerCase(), finite(field.getValue(), "weights." + field.getKey()));
        }
        return new LinearClassifierArtifact(version,
                finite(root.get("bias"), "bias"),
                weights,
                optionalFinite(root.get("huntableHitWeight"), "huntableHitWeight"),
                optionalFinite(root.get("notHuntableHitWeight"), "notHuntableHitWeight"));
    }

    private double optionalFinite(JsonNode node, String field) {
        return node == null || node.isNull() ? 0.0 : finite(node, field);
    }

    private double finite(JsonNode node, String field) {
        if (node == null || !node.isNumber()) {
            throw new FatalConfigurationException("Classifier artifact field is not numeric: " + field);
        }
        double value = node.asDouble();
        if (!Double.isFinite(value)) {
            throw new FatalConfigurationException("Classifier artifact field is not finite: " + field);
        }
        return value;
    }
}
