package com.huntflow.trigger.application.common;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.domain.workflow.model.entity.WorkflowExecutionEntity;
import com.huntflow.domain.workflow.model.valobj.WorkflowConfig;
import com.huntflow.types.exception.FatalConfigurationException;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 配置快照组装器：触发时把当前 WorkflowConfig 序列化进执行记录，执行与重试时按快照还原，
 * 保证一次执行前后使用同一份配置。
 */
@Component
public class WorkflowConfigSnapshotAssembler {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public WorkflowConfigSnapshotAssembler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> snapshot(WorkflowConfig config) {
        return objectMapper.convertValue(config, MAP_TYPE);
    }

    public WorkflowConfig restore(WorkflowExecutionEntity execution) {
        Map<String, Object> snapshot = execution.getConfigSnapshot();
        if (snapshot == null || snapshot.isEmpty()) {
            throw new FatalConfigurationException("Config snapshot missing for execution " + execution.getId());
        }
        try {
            return objectMapper.convertValue(snapshot, WorkflowConfig.class).validate();
        } catch (IllegalArgumentException ex) {
            throw new FatalConfigurationException("Config snapshot unreadable for execution "
                    + execution.getId() + ": " + ex.getMessage(), ex);
        }
    }
}
