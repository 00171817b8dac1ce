package com.huntflow.api.dto;

import lombok.Data;

/**
 * 触发工作流执行请求 DTO。
 */
@Data
public class WorkflowTriggerRequestDTO {

    private Long documentId;
}
