package com.huntflow.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 调度器隔离：执行领取与过期清扫各用独立调度线程，清扫卡住时不影响派发。
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    /**
     * WorkflowExecutor 的领取与派发
     */
    @Bean(name = "workflowExecutorScheduler")
    public ThreadPoolTaskScheduler workflowExecutorScheduler(
            @Value("${huntflow.scheduling.workflow-executor.pool-size:1}") int poolSize,
            @Value("${huntflow.scheduling.workflow-executor.await-termination-seconds:30}") int awaitTerminationSeconds) {
        return scheduler("workflow-executor", poolSize, awaitTerminationSeconds);
    }

    /**
     * StaleExecutionSweepDaemon 等守护任务
     */
    @Bean(name = "daemonScheduler")
    public ThreadPoolTaskScheduler daemonScheduler(
            @Value("${huntflow.scheduling.daemon.pool-size:1}") int poolSize,
            @Value("${huntflow.scheduling.daemon.await-termination-seconds:30}") int awaitTerminationSeconds) {
        return scheduler("daemon", poolSize, awaitTerminationSeconds);
    }

    private ThreadPoolTaskScheduler scheduler(String name, int poolSize, int awaitTerminationSeconds) {
        Counter failureCounter = Counter.builder("huntflow.scheduler.job.failure.total")
                .tag("scheduler", name)
                .register(Metrics.globalRegistry);
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(poolSize, 1));
        scheduler.setThreadNamePrefix("huntflow-" + name + "-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(Math.max(awaitTerminationSeconds, 0));
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(throwable -> {
            failureCounter.increment();
            log.error("Scheduled job failed. scheduler={}, error={}", name, throwable.getMessage(), throwable);
        });
        return scheduler;
    }
}
