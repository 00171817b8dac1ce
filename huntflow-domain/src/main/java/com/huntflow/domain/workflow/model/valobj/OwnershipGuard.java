package com.huntflow.domain.workflow.model.valobj;

import com.huntflow.types.exception.OwnershipLostException;

/**
 * 副作用写入前的所有权复核，不再持有时抛 {@link OwnershipLostException}
 */
@FunctionalInterface
public interface OwnershipGuard {

    OwnershipGuard NONE = () -> {
    };

    void ensureOwned();
}
