package com.huntflow.trigger.application.step;

import com.huntflow.domain.workflow.model.valobj.StepOutcome;
import com.huntflow.types.enums.WorkflowStepEnum;

/**
 * 单步骤处理器：读取上下文中已缓存的前序步骤结果，产出本步骤的 StepOutcome。
 * <p>
 * 处理器不写执行记录，状态推进统一由 WorkflowRunApplicationService 完成。
 * 网关失败以 ModelGatewayException 抛出，致命配置错误以 FatalConfigurationException 抛出。
 * </p>
 */
public interface WorkflowStepHandler {

    WorkflowStepEnum step();

    StepOutcome handle(WorkflowStepContext context);
}
