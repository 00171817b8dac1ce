package com.huntflow.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <ul>
 *   <li>workflowExecutionWorker：承载单个执行的整段步骤循环，与调度线程解耦</li>
 *   <li>extractionWorker：抽取阶段子代理并发，饱和时由调用线程执行</li>
 *   <li>gatewayCallWorker：外部模型调用的超时隔离线程</li>
 * </ul>
 *
 * @author huntflow
 * @since 2026-03-02
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    /**
     * 默认 queue-capacity=0，claim 后的执行尽快开始，池满时拒绝并释放 claim。
     */
    @Bean(name = "workflowExecutionWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "workflowExecutionWorker")
    public ThreadPoolExecutor workflowExecutionWorker(
            @Value("${huntflow.executor.worker.core-size:4}") int coreSize,
            @Value("${huntflow.executor.worker.max-size:4}") int maxSize,
            @Value("${huntflow.executor.worker.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${huntflow.executor.worker.queue-capacity:0}") int queueCapacity,
            @Value("${huntflow.executor.worker.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${huntflow.executor.worker.thread-name-prefix:workflow-exec-worker-}") String threadNamePrefix) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, threadNamePrefix);
    }

    @Bean(name = "extractionWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "extractionWorker")
    public ThreadPoolExecutor extractionWorker(
            @Value("${huntflow.extraction.worker.core-size:5}") int coreSize,
            @Value("${huntflow.extraction.worker.max-size:10}") int maxSize,
            @Value("${huntflow.extraction.worker.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${huntflow.extraction.worker.queue-capacity:50}") int queueCapacity,
            @Value("${huntflow.extraction.worker.rejection-policy:CallerRunsPolicy}") String rejectionPolicy,
            @Value("${huntflow.extraction.worker.thread-name-prefix:extraction-worker-}") String threadNamePrefix) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, threadNamePrefix);
    }

    @Bean(name = "gatewayCallWorker", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "gatewayCallWorker")
    public ThreadPoolExecutor gatewayCallWorker(
            @Value("${huntflow.gateway.worker.core-size:16}") int coreSize,
            @Value("${huntflow.gateway.worker.max-size:32}") int maxSize,
            @Value("${huntflow.gateway.worker.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${huntflow.gateway.worker.queue-capacity:256}") int queueCapacity,
            @Value("${huntflow.gateway.worker.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${huntflow.gateway.worker.thread-name-prefix:gateway-call-}") String threadNamePrefix) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, threadNamePrefix);
    }

    private ThreadPoolExecutor buildExecutor(int coreSize, int maxSize, long keepAliveSeconds, int queueCapacity,
                                             String rejectionPolicy, String threadNamePrefix) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        long normalizedKeepAliveSeconds = Math.max(keepAliveSeconds, 0L);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                normalizedKeepAliveSeconds,
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(rejectionPolicy));
        executor.allowCoreThreadTimeOut(false);
        return executor;
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy, fallback to AbortPolicy. policy={}", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
