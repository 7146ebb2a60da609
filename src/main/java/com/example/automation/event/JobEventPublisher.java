package com.example.automation.event;

/**
 * 领域事件通道。发布方只负责入队，投递在消费侧异步进行，慢的 webhook 不会阻塞任务执行。
 */
public interface JobEventPublisher {

    void publish(JobEvent event);
}
