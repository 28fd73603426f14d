package com.weiwo.bridge.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 定时任务配置类
 * 发现、提交、轮询、合同关联各占一个调度线程，慢任务不会拖延其他任务
 */
@Slf4j
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "app.sync", name = "scheduling-enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();

        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("sync-stage-");

        // 关闭时等待正在运行的任务完成
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(120);
        scheduler.setErrorHandler(t -> log.error("定时任务执行异常: {}", t.getMessage(), t));

        scheduler.initialize();
        return scheduler;
    }
}
