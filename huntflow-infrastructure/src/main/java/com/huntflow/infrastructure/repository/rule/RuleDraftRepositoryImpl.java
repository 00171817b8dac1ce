package com.huntflow.infrastructure.repository.rule;

import com.huntflow.domain.rule.adapter.repository.IRuleDraftRepository;
import com.huntflow.domain.rule.model.entity.RuleDraftEntity;
import com.huntflow.infrastructure.dao.RuleDraftDao;
import com.huntflow.infrastructure.dao.po.RuleDraftPO;
import com.huntflow.infrastructure.util.JsonCodec;
import com.huntflow.types.enums.ValidationStatusEnum;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 规则草稿仓储实现。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Repository
public class RuleDraftRepositoryImpl implements IRuleDraftRepository {

    private final RuleDraftDao ruleDraftDao;
    private final JsonCodec jsonCodec;

    public RuleDraftRepositoryImpl(RuleDraftDao ruleDraftDao, JsonCodec jsonCodec) {
        this.ruleDraftDao = ruleDraftDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public RuleDraftEntity save(RuleDraftEntity entity) {
        entity.validate();
        RuleDraftPO po = toPO(entity);
        ruleDraftDao.insert(po);
        return toEntity(po);
    }

    @Override
    public RuleDraftEntity findById(Long id) {
        RuleDraftPO po = ruleDraftDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<RuleDraftEntity> findByExecutionId(Long executionId) {
        return ruleDraftDao.selectByExecutionId(executionId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private RuleDraftEntity toEntity(RuleDraftPO po) {
        RuleDraftEntity entity = new RuleDraftEntity();
        entity.setId(po.getId());
        entity.setExecutionId(po.getExecutionId());
        entity.setTitle(po.getTitle());
        entity.setDescription(po.getDescription());
        entity.setSeverity(po.getSeverity());
        entity.setRawYaml(po.getRawYaml());
        entity.setValidationStatus(ValidationStatusEnum.fromCode(po.getValidationStatus()));
        entity.setAttemptCount(po.getAttemptCount());
        entity.setCreatedAt(po.getCreatedAt());

        // JSONB 字段转换
        entity.setLogSource(jsonCodec.readMap(po.getLogSource()));
        entity.setDetection(jsonCodec.readMap(po.getDetection()));
        List<String> tags = jsonCodec.readStringList(po.getTags());
        entity.setTags(tags != null ? tags : new ArrayList<>());
        List<String> errors = jsonCodec.readStringList(po.getValidationErrors());
        entity.setValidationErrors(errors != null ? errors : new ArrayList<>());
        return entity;
    }

    private RuleDraftPO toPO(RuleDraftEntity entity) {
        return RuleDraftPO.builder()
                .id(entity.getId())
                .executionId(entity.getExecutionId())
                .title(entity.getTitle())
                .description(entity.getDescription())
                .logSource(jsonCodec.writeValue(entity.getLogSource()))
                .detection(jsonCodec.writeValue(entity.getDetection()))
                .tags(jsonCodec.writeValue(entity.getTags()))
                .severity(entity.getSeverity())
                .rawYaml(entity.getRawYaml())
                .validationStatus(entity.getValidationStatus().getCode())
                .validationErrors(jsonCodec.writeValue(entity.getValidationErrors()))
                .attemptCount(entity.getAttemptCount())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
