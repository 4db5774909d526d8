package com.imperium.astrocompanion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 生成 fan-out 与后台持久化共用的线程池。
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "generationExecutor")
    public ThreadPoolTaskExecutor generationExecutor(ContentPolicyProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getGenerationThreads());
        executor.setMaxPoolSize(properties.getGenerationThreads());
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("gen-");
        executor.setTaskDecorator(RequestIdSupport::propagate);
        // 队列满时由提交线程执行
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
