package com.example.automation.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    /**
     * 事件消费线程池。
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("Event-");
        executor.initialize();
        return executor;
    }

    /**
     * Webhook 投递线程池，线程数即最大并发投递数。
     * 队列满时由提交线程自己执行，形成背压而不是丢弃投递。
     */
    @Bean(name = "deliveryExecutor")
    public TaskExecutor deliveryExecutor(
            @Value("${app.webhooks.max-concurrent-deliveries:10}") int maxConcurrentDeliveries) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrentDeliveries);
        executor.setMaxPoolSize(maxConcurrentDeliveries);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("Delivery-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(35);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
