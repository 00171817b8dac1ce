package com.huntflow.domain.extraction.model.valobj;

import com.huntflow.types.enums.ObservableTypeEnum;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 抽取子代理定义：名册中的一条数据，不通过继承扩展。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SubAgentSpec {

    /**
     * 子代理名称，同时作为审计中的 agentName
     */
    String name;

    /**
     * 负责的可观测项类型
     */
    ObservableTypeEnum observableType;

    /**
     * 提示词模板 ID
     */
    String promptTemplateId;

    /**
     * 是否启用 QA 复核
     */
    @Builder.Default
    boolean qaEnabled = true;

    /**
     * QA 代理名称，为空时使用 name 去掉 Extract 后缀再加 QA
     */
    String qaAgentName;

    public String resolveQaAgentName() {
        if (qaAgentName != null && !qaAgentName.isBlank()) {
            return qaAgentName;
        }
        String base = name.endsWith("Extract") ? name.substring(0, name.length() - "Extract".length()) : name;
        return base + "QA";
    }

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Sub-agent name cannot be empty");
        }
        if (observableType == null) {
            throw new IllegalArgumentException("Sub-agent observable type cannot be null: " + name);
        }
    }

    /**
     * 默认名册，顺序即合并顺序
     */
    public static List<SubAgentSpec> defaultRoster() {
        return List.of(
                of("CmdlineExtract", ObservableTypeEnum.COMMAND_LINE, "cmdline", "CmdlineQA"),
                of("HuntQueriesExtract", ObservableTypeEnum.QUERY_FRAGMENT, "hunt_queries", "HuntQueriesQA"),
                of("EventIdExtract", ObservableTypeEnum.EVENT_ID, "event_id", "EventIdQA"),
                of("ProcTreeExtract", ObservableTypeEnum.PROCESS_LINEAGE, "proc_tree", "ProcTreeQA"),
                of("RegistryExtract", ObservableTypeEnum.REGISTRY_OPERATION, "registry", "RegistryQA"));
    }

    private static SubAgentSpec of(String name, ObservableTypeEnum type, String templateId, String qaAgentName) {
        return SubAgentSpec.builder()
                .name(name)
                .observableType(type)
                .promptTemplateId(templateId)
                .qaAgentName(qaAgentName)
                .build();
    }
}
