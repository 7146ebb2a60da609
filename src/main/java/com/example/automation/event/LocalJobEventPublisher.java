package com.example.automation.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * 单实例模式：经 Spring 事件总线投递给 {@link JobEventListener}。
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "app.events.mode", havingValue = "async", matchIfMissing = true)
public class LocalJobEventPublisher implements JobEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public void publish(JobEvent event) {
        log.debug("Publishing {} for project {} via local @Async", event.getEventType(), event.getProjectId());
        applicationEventPublisher.publishEvent(event);
    }
}
