package com.huntflow.domain.rule.model.valobj;

import com.huntflow.domain.rule.model.entity.QueueItemEntity;
import com.huntflow.types.enums.TerminationReasonEnum;

/**
 * 入队判定结果，queueItem 仅在 queued 时非空。
 */
public record PromotionResult(TerminationReasonEnum reason, QueueItemEntity queueItem) {
}
