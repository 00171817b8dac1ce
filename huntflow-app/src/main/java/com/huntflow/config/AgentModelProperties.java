package com.huntflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 按代理名称覆盖模型参数：huntflow.agents.&lt;name&gt;.model / .temperature。
 */
@Data
@ConfigurationProperties(prefix = "huntflow")
public class AgentModelProperties {

    private Map<String, AgentOverride> agents = new LinkedHashMap<>();

    @Data
    public static class AgentOverride {

        private String model;

        private Double temperature;

        private Double topP;
    }

}
