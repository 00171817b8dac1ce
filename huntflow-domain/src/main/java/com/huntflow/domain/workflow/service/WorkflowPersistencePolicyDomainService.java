package com.huntflow.domain.workflow.service;

import com.huntflow.types.common.Constants;
import org.springframework.stereotype.Service;

/**
 * 执行记录持久化策略：乐观锁冲突识别与错误信息规整。
 */
@Service
public class WorkflowPersistencePolicyDomainService {

    public boolean isOptimisticLockConflict(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            String message = current.getMessage();
            if (message != null && message.contains(Constants.OPTIMISTIC_LOCK_FAILED)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    public String normalizeErrorMessage(Throwable ex) {
        if (ex == null) {
            return "unknown";
        }
        String message = ex.getMessage();
        if (message == null || message.trim().isEmpty()) {
            return ex.getClass().getSimpleName();
        }
        return message.length() > 2000 ? message.substring(0, 2000) : message;
    }
}
