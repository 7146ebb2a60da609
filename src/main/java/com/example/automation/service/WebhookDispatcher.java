package com.example.automation.service;

import com.example.automation.event.JobEvent;
import com.example.automation.model.DeliveryAttempt;
import com.example.automation.model.DeliveryStatus;
import com.example.automation.model.Webhook;
import com.example.automation.model.WebhookDelivery;
import com.example.automation.repository.DeliveryAttemptRepository;
import com.example.automation.repository.WebhookDeliveryRepository;
import com.example.automation.repository.WebhookRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Webhook 分发服务：匹配订阅、生成投递并执行每一次尝试。
 * <p>
 * 同一投递同一时刻只会有一个执行者：执行者持有 {@link DeliveryClaim}，发送前用它做一次条件认领，
 * 凭证过期的任务直接放弃。尝试记录、投递状态与 webhook 计数在同一个事务中写入，
 * 第 N+1 次尝试的到期时间随第 N 次尝试的记录一起提交。
 */
@Service
@Slf4j
public class WebhookDispatcher {

    private static final int MAX_RESPONSE_BODY = 1000;

    private final WebhookRepository webhookRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final DeliveryAttemptRepository attemptRepository;
    private final WebhookPayloadFactory payloadFactory;
    private final WebhookSender sender;
    private final RetryScheduler retryScheduler;
    private final TaskExecutor deliveryExecutor;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration timeout;
    private final int disableThreshold;

    public WebhookDispatcher(WebhookRepository webhookRepository,
            WebhookDeliveryRepository deliveryRepository,
            DeliveryAttemptRepository attemptRepository,
            WebhookPayloadFactory payloadFactory,
            WebhookSender sender,
            RetryScheduler retryScheduler,
            @Qualifier("deliveryExecutor") TaskExecutor deliveryExecutor,
            PlatformTransactionManager transactionManager,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${app.webhooks.timeout-seconds:30}") long timeoutSeconds,
            @Value("${app.webhooks.disable-threshold:5}") int disableThreshold) {
        this.webhookRepository = webhookRepository;
        this.deliveryRepository = deliveryRepository;
        this.attemptRepository = attemptRepository;
        this.payloadFactory = payloadFactory;
        this.sender = sender;
        this.retryScheduler = retryScheduler;
        this.deliveryExecutor = deliveryExecutor;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.disableThreshold = disableThreshold;
    }

    /**
     * 分发一个领域事件：为每个匹配的启用 webhook 创建投递，并提交第一次尝试。
     *
     * @param event 领域事件
     * @return 创建的投递 ID
     */
    public List<String> dispatch(JobEvent event) {
        return dispatch(event, null);
    }

    /**
     * 分发一个领域事件。sourceEventId 非空时按 (sourceEventId, webhook) 去重，
     * 同一来源记录被重复消费时只为尚未创建投递的 webhook 补建。
     *
     * @param event         领域事件
     * @param sourceEventId 来源记录 ID，可为空
     * @return 本次新创建的投递 ID
     */
    public List<String> dispatch(JobEvent event, String sourceEventId) {
        if (event.getEventType() == null || event.getUserId() == null) {
            log.warn("Ignoring event without type or user: {}", event);
            return List.of();
        }

        String eventType = event.getEventType().wireName();
        List<Webhook> webhooks = webhookRepository.findMatching(event.getUserId(), event.getProjectId(), eventType);
        if (webhooks.isEmpty()) {
            log.debug("No webhook subscribed to {} for user {}", eventType, event.getUserId());
            return List.of();
        }

        Instant now = now();
        Instant timestamp = event.getOccurredAt() != null ? event.getOccurredAt() : now;
        List<DeliveryClaim> claims = new ArrayList<>();

        for (Webhook webhook : webhooks) {
            if (sourceEventId != null
                    && deliveryRepository.existsBySourceEventIdAndWebhookId(sourceEventId, webhook.getId())) {
                log.debug("Event record {} already has a delivery for webhook {}", sourceEventId, webhook.getId());
                continue;
            }
            String deliveryId = UUID.randomUUID().toString();
            WebhookDelivery delivery = WebhookDelivery.builder()
                    .id(deliveryId)
                    .webhookId(webhook.getId())
                    .sourceEventId(sourceEventId)
                    .eventType(eventType)
                    .payload(payloadFactory.buildPayload(event, webhook.getId(), deliveryId, timestamp))
                    .status(DeliveryStatus.PENDING)
                    .attemptCount(0)
                    .sequenceStartedAt(now)
                    .sequenceStartAttempt(1)
                    .nextRetryAt(retryScheduler.initialLease(now))
                    .createdAt(now)
                    .build();
            try {
                delivery = deliveryRepository.save(delivery);
            } catch (DataIntegrityViolationException e) {
                log.info("Event record {} was dispatched to webhook {} concurrently, skipping",
                        sourceEventId, webhook.getId());
                continue;
            }
            claims.add(new DeliveryClaim(deliveryId, delivery.getVersion()));
        }

        log.info("Event {} for project {} matched {} webhook(s), {} new deliveries",
                eventType, event.getProjectId(), webhooks.size(), claims.size());
        claims.forEach(this::submitAttempt);
        return claims.stream().map(DeliveryClaim::deliveryId).toList();
    }

    /**
     * 把一次尝试交给投递线程池，并发数受线程池大小限制。
     */
    public void submitAttempt(DeliveryClaim claim) {
        deliveryExecutor.execute(() -> {
            try {
                attempt(claim);
            } catch (Exception e) {
                // 租约到期后由重试轮询重新认领
                log.error("Delivery {} attempt aborted: {}", claim.deliveryId(), e.getMessage(), e);
            }
        });
    }

    /**
     * 执行一次投递尝试并记录结果。
     *
     * @param claim 认领凭证
     * @return 本次尝试记录；凭证已过期、投递已终结或 webhook 已停用时返回 null
     */
    public DeliveryAttempt attempt(DeliveryClaim claim) {
        String deliveryId = claim.deliveryId();
        WebhookDelivery delivery = deliveryRepository.findById(deliveryId).orElse(null);
        if (delivery == null || delivery.getStatus().isTerminal()) {
            log.debug("Delivery {} is gone or already terminal, skipping", deliveryId);
            return null;
        }

        Optional<DeliveryClaim> renewed = retryScheduler.renew(claim, now());
        if (renewed.isEmpty()) {
            log.info("Delivery {} was claimed by another worker, dropping stale attempt", deliveryId);
            return null;
        }
        long held = renewed.get().version();

        Webhook webhook = webhookRepository.findById(delivery.getWebhookId()).orElse(null);
        if (webhook == null || !webhook.isEnabled()) {
            log.info("Closing delivery {}: webhook {} is disabled or deleted", deliveryId, delivery.getWebhookId());
            record(deliveryId, held, current -> {
                current.setStatus(DeliveryStatus.FAILED);
                current.setLastError("Webhook disabled");
                current.setNextRetryAt(null);
                current.setCompletedAt(now());
            });
            return null;
        }

        int attemptNumber = delivery.getAttemptCount() + 1;
        Instant attemptedAt = now();
        byte[] body = WebhookPayloadFactory.toBytes(delivery.getPayload());
        Map<String, String> headers = payloadFactory.buildHeaders(webhook, delivery, body, attemptedAt);

        WebhookResponse response = sender.send(URI.create(webhook.getUrl()), body, headers, timeout);
        boolean success = response.isSuccess();
        String error = success ? null : describeFailure(response);

        DeliveryAttempt attempt = DeliveryAttempt.builder()
                .deliveryId(deliveryId)
                .webhookId(webhook.getId())
                .attemptNumber(attemptNumber)
                .eventType(delivery.getEventType())
                .status(success ? DeliveryStatus.SUCCESS : DeliveryStatus.FAILED)
                .httpStatusCode(response.statusCode())
                .responseTimeMs(response.durationMs())
                .errorMessage(error)
                .responseBody(truncate(response.body()))
                .attemptedAt(attemptedAt)
                .build();

        boolean recorded = record(deliveryId, held, current -> {
            // 计数更新会清空持久化上下文，先于实体修改执行
            if (success) {
                webhookRepository.recordSuccess(webhook.getId(), attemptedAt, response.statusCode());
            } else {
                webhookRepository.recordFailure(webhook.getId(), attemptedAt, response.statusCode());
                if (webhookRepository.disableIfFailuresReached(webhook.getId(), disableThreshold) == 1) {
                    log.warn("Webhook {} disabled after {} consecutive failures", webhook.getId(), disableThreshold);
                }
            }

            current.setAttemptCount(attemptNumber);
            current.setLastAttemptAt(attemptedAt);
            current.setLastStatusCode(response.statusCode());
            current.setLastError(error);

            if (success) {
                current.setStatus(DeliveryStatus.SUCCESS);
                current.setNextRetryAt(null);
                current.setCompletedAt(attemptedAt);
                log.info("Webhook delivered: {} ({}) delivery={} attempt={}",
                        webhook.getUrl(), response.statusCode(), deliveryId, attemptNumber);
            } else if (retryScheduler.hasAttemptsLeft(current)) {
                Instant dueAt = retryScheduler.scheduleRetry(current, attemptNumber + 1);
                attempt.setNextRetryAt(dueAt);
                log.warn("Webhook delivery failed: {} ({}) delivery={} attempt={}, next attempt at {}",
                        webhook.getUrl(), error, deliveryId, attemptNumber, dueAt);
            } else {
                current.setStatus(DeliveryStatus.FAILED);
                current.setNextRetryAt(null);
                current.setCompletedAt(attemptedAt);
                log.warn("Webhook delivery failed permanently: {} ({}) delivery={} after attempt {}",
                        webhook.getUrl(), error, deliveryId, attemptNumber);
            }
            attemptRepository.save(attempt);
        });
        if (!recorded) {
            return null;
        }

        meterRegistry.counter("automation.webhook.attempts", "outcome", success ? "success" : "failure").increment();
        return attempt;
    }

    /**
     * 在一个事务中写回投递状态。version 已不是持有值时什么都不写。
     *
     * @return false 表示认领已失效
     */
    private boolean record(String deliveryId, long held, Consumer<WebhookDelivery> changes) {
        try {
            Boolean written = transactionTemplate.execute(status -> {
                WebhookDelivery current = deliveryRepository.findById(deliveryId).orElse(null);
                if (current == null || current.getVersion() == null || current.getVersion() != held) {
                    return false;
                }
                changes.accept(current);
                deliveryRepository.save(current);
                return true;
            });
            if (!Boolean.TRUE.equals(written)) {
                log.warn("Lost claim on delivery {} before its outcome was recorded", deliveryId);
                return false;
            }
            return true;
        } catch (OptimisticLockingFailureException e) {
            log.warn("Lost claim on delivery {} before its outcome was recorded", deliveryId);
            return false;
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static String describeFailure(WebhookResponse response) {
        if (response.error() != null) {
            return response.error();
        }
        return "HTTP " + response.statusCode();
    }

    private static String truncate(String body) {
        if (body == null) {
            return null;
        }
        return body.length() > MAX_RESPONSE_BODY ? body.substring(0, MAX_RESPONSE_BODY) : body;
    }
}
