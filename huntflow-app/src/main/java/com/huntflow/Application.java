package com.huntflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Huntflow 分析工作流引擎启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到 domain、infrastructure、trigger 各模块中的组件；
 * 开启调度以驱动工作流执行器与过期执行清扫守护任务。
 * </p>
 *
 * @author huntflow
 * @since 2026-03-02
 */
@SpringBootApplication
@EnableScheduling
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
