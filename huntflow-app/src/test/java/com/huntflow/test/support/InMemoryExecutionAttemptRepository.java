package com.huntflow.test.support;

import com.huntflow.domain.workflow.adapter.repository.IExecutionAttemptRepository;
import com.huntflow.domain.workflow.model.entity.ExecutionAttemptEntity;
import com.huntflow.types.enums.WorkflowStepEnum;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 内存审计仓储，按写入顺序保存。子代理并发写入，方法需同步。
 */
public class InMemoryExecutionAttemptRepository implements IExecutionAttemptRepository {

    private final List<ExecutionAttemptEntity> store = new ArrayList<>();
    private long nextId = 1;

    @Override
    public synchronized ExecutionAttemptEntity save(ExecutionAttemptEntity entity) {
        entity.validate();
        entity.setId(nextId++);
        store.add(entity);
        return entity;
    }

    @Override
    public synchronized List<ExecutionAttemptEntity> findByExecutionId(Long executionId) {
        return store.stream()
                .filter(item -> Objects.equals(item.getExecutionId(), executionId))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<ExecutionAttemptEntity> findByExecutionIdAndStep(Long executionId, WorkflowStepEnum step) {
        return store.stream()
                .filter(item -> Objects.equals(item.getExecutionId(), executionId))
                .filter(item -> item.getStep() == step)
                .collect(Collectors.toList());
    }

    public synchronized List<ExecutionAttemptEntity> findByAgentName(String agentName) {
        return store.stream()
                .filter(item -> Objects.equals(item.getAgentName(), agentName))
                .collect(Collectors.toList());
    }
}
