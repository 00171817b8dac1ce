package com.huntflow.types.common;

/**
 * 全局常量定义类。
 *
 * @author huntflow
 * @since 2026-03-02
 */
public class Constants {

    /** 逗号分隔符 */
    public final static String SPLIT = ",";

    /** MDC 键：执行 ID */
    public final static String MDC_EXECUTION_ID = "executionId";

    /** MDC 键：当前步骤 */
    public final static String MDC_STEP = "step";

    /** 乐观锁失败消息前缀，守护任务据此识别冲突 */
    public final static String OPTIMISTIC_LOCK_FAILED = "Optimistic lock failed";

}
