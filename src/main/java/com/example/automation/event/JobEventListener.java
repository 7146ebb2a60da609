package com.example.automation.event;

import com.example.automation.service.WebhookDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * 本地事件消费者。
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "app.events.mode", havingValue = "async", matchIfMissing = true)
public class JobEventListener {

    private final WebhookDispatcher dispatcher;

    @Async("taskExecutor")
    @EventListener
    public void onJobEvent(JobEvent event) {
        try {
            dispatcher.dispatch(event);
        } catch (Exception e) {
            log.error("Failed to dispatch {} for project {}: {}",
                    event.getEventType(), event.getProjectId(), e.getMessage(), e);
        }
    }
}
