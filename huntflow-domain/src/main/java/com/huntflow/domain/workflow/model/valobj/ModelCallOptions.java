package com.huntflow.domain.workflow.model.valobj;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 单个代理的模型调用参数，空值表示使用网关默认值。
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelCallOptions {

    String model;

    Double temperature;

    Double topP;
}
