package com.huntflow.api.dto;

import lombok.Data;

/**
 * 审核操作请求 DTO，edit 时 ruleYaml 必填。
 */
@Data
public class QueueReviewRequestDTO {

    private String comment;
    private String ruleYaml;
}
