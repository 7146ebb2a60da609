package com.example.automation.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * 定时轮询到期的投递重试，把认领到的投递交回分发服务执行。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetryPollTask {

    private final RetryScheduler retryScheduler;
    private final WebhookDispatcher dispatcher;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.webhooks.retry-poll-interval-ms:15000}",
            initialDelayString = "${app.webhooks.retry-poll-interval-ms:15000}")
    public void poll() {
        try {
            int submitted = pollOnce();
            if (submitted > 0) {
                log.info("Submitted {} due webhook retries", submitted);
            }
        } catch (Exception e) {
            log.error("Retry poll failed: {}", e.getMessage(), e);
        }
    }

    /**
     * 执行一轮轮询。
     *
     * @return 提交的投递数
     */
    public int pollOnce() {
        List<DeliveryClaim> due = retryScheduler.dueRetries(clock.instant().truncatedTo(ChronoUnit.MILLIS));
        due.forEach(dispatcher::submitAttempt);
        return due.size();
    }
}
