package com.huntflow.types.exception;

import com.huntflow.types.enums.ResponseCode;

/**
 * 执行已被清扫或改派，当前工作者不再持有派发令牌；步骤内的副作用写入在此之前中止。
 *
 * @author huntflow
 * @since 2026-03-02
 */
public class OwnershipLostException extends AppException {

    private static final long serialVersionUID = 3309816224716530127L;

    public OwnershipLostException(String message) {
        super(ResponseCode.CONFLICT, message);
    }
}
