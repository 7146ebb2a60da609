package com.example.automation.service;

import com.example.automation.dto.DeliveryDetail;
import com.example.automation.dto.WebhookRequest;
import com.example.automation.exception.ConflictException;
import com.example.automation.exception.InvalidRequestException;
import com.example.automation.exception.ResourceNotFoundException;
import com.example.automation.model.EventType;
import com.example.automation.model.Webhook;
import com.example.automation.model.WebhookDelivery;
import com.example.automation.model.WebhookTestResult;
import com.example.automation.repository.DeliveryAttemptRepository;
import com.example.automation.repository.WebhookDeliveryRepository;
import com.example.automation.repository.WebhookRepository;
import com.example.automation.utils.UrlValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Webhook 管理：增删改查、启停、测试推送与投递记录查询。
 * <p>
 * consecutiveFailures 只由分发服务修改；此处唯一的例外是重新启用时清零。
 */
@Service
@Slf4j
public class WebhookService {

    private final WebhookRepository webhookRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final DeliveryAttemptRepository attemptRepository;
    private final UrlValidator urlValidator;
    private final WebhookPayloadFactory payloadFactory;
    private final WebhookSender sender;
    private final RetryScheduler retryScheduler;
    private final WebhookDispatcher dispatcher;
    private final Clock clock;
    private final Duration testTimeout;

    public WebhookService(WebhookRepository webhookRepository,
            WebhookDeliveryRepository deliveryRepository,
            DeliveryAttemptRepository attemptRepository,
            UrlValidator urlValidator,
            WebhookPayloadFactory payloadFactory,
            WebhookSender sender,
            RetryScheduler retryScheduler,
            WebhookDispatcher dispatcher,
            Clock clock,
            @Value("${app.webhooks.test-timeout-seconds:10}") long testTimeoutSeconds) {
        this.webhookRepository = webhookRepository;
        this.deliveryRepository = deliveryRepository;
        this.attemptRepository = attemptRepository;
        this.urlValidator = urlValidator;
        this.payloadFactory = payloadFactory;
        this.sender = sender;
        this.retryScheduler = retryScheduler;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.testTimeout = Duration.ofSeconds(testTimeoutSeconds);
    }

    @Transactional
    public Webhook create(String userId, WebhookRequest request) {
        Webhook webhook = Webhook.builder()
                .userId(userId)
                .projectId(emptyToNull(request.getProjectId()))
                .url(validateUrl(request.getUrl()))
                .events(validateEvents(request.getEvents()))
                .secret(emptyToNull(request.getSecret()))
                .headers(validateHeaders(request.getHeaders()))
                .description(request.getDescription())
                .enabled(request.getEnabled() == null || request.getEnabled())
                .build();
        webhook = webhookRepository.save(webhook);
        log.info("Created webhook {} for user {} -> {} {}", webhook.getId(), userId, webhook.getUrl(), webhook.getEvents());
        return webhook;
    }

    public Webhook get(String userId, Long id) {
        return webhookRepository.findByIdAndUserId(id, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook not found: " + id));
    }

    public List<Webhook> list(String userId) {
        return webhookRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /**
     * 修改 webhook。未提供的字段保持原值；secret 传空字符串表示取消签名。
     */
    @Transactional
    public Webhook update(String userId, Long id, WebhookRequest request) {
        Webhook webhook = get(userId, id);
        if (request.getUrl() != null) {
            webhook.setUrl(validateUrl(request.getUrl()));
        }
        if (request.getEvents() != null) {
            webhook.getEvents().clear();
            webhook.getEvents().addAll(validateEvents(request.getEvents()));
        }
        if (request.getSecret() != null) {
            webhook.setSecret(emptyToNull(request.getSecret()));
        }
        if (request.getHeaders() != null) {
            webhook.getHeaders().clear();
            webhook.getHeaders().putAll(validateHeaders(request.getHeaders()));
        }
        if (request.getProjectId() != null) {
            webhook.setProjectId(emptyToNull(request.getProjectId()));
        }
        if (request.getDescription() != null) {
            webhook.setDescription(request.getDescription());
        }
        if (request.getEnabled() != null) {
            applyEnabled(webhook, request.getEnabled());
        }
        log.info("Updated webhook {}", id);
        return webhookRepository.save(webhook);
    }

    /**
     * 设置启用状态。重新启用时清零失败计数。
     */
    @Transactional
    public Webhook setEnabled(String userId, Long id, boolean enabled) {
        Webhook webhook = get(userId, id);
        applyEnabled(webhook, enabled);
        log.info("Webhook {} {}", id, enabled ? "enabled" : "disabled");
        return webhookRepository.save(webhook);
    }

    @Transactional
    public void delete(String userId, Long id) {
        Webhook webhook = get(userId, id);
        attemptRepository.deleteByWebhookId(id);
        deliveryRepository.deleteByWebhookId(id);
        webhookRepository.delete(webhook);
        log.info("Deleted webhook {}", id);
    }

    /**
     * 发送一次测试推送。不写投递记录，也不影响失败计数。
     */
    public WebhookTestResult test(String userId, Long id) {
        Webhook webhook = get(userId, id);
        Instant now = clock.instant();
        byte[] body = WebhookPayloadFactory.toBytes(payloadFactory.buildTestPayload(webhook.getId(), now));
        Map<String, String> headers = payloadFactory.buildHeaders(webhook, "test", "test", body, now);

        WebhookResponse response = sender.send(URI.create(webhook.getUrl()), body, headers, testTimeout);
        log.info("Test delivery to webhook {}: status={}, error={}", id, response.statusCode(), response.error());
        String error = response.isSuccess() ? null
                : response.error() != null ? response.error() : "HTTP " + response.statusCode();
        return new WebhookTestResult(response.isSuccess(), response.statusCode(), response.durationMs(), error);
    }

    public Page<WebhookDelivery> deliveries(String userId, Long id, int page, int pageSize) {
        get(userId, id);
        if (page < 1 || pageSize < 1) {
            throw new InvalidRequestException("page and pageSize must be positive");
        }
        return deliveryRepository.findByWebhookIdOrderByCreatedAtDesc(id,
                PageRequest.of(page - 1, Math.min(pageSize, ScheduleService.MAX_PAGE_SIZE)));
    }

    public DeliveryDetail delivery(String userId, String deliveryId) {
        WebhookDelivery delivery = findOwnedDelivery(userId, deliveryId);
        return new DeliveryDetail(delivery, attemptRepository.findByDeliveryIdOrderByAttemptNumberAsc(deliveryId));
    }

    /**
     * 手动重试终态失败的投递。
     *
     * @return 重新排队后的投递
     */
    public WebhookDelivery retryDelivery(String userId, String deliveryId) {
        WebhookDelivery delivery = findOwnedDelivery(userId, deliveryId);
        Webhook webhook = get(userId, delivery.getWebhookId());
        if (!webhook.isEnabled()) {
            throw new ConflictException("Webhook " + webhook.getId() + " is disabled; enable it before retrying");
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        DeliveryClaim claim = retryScheduler.requeue(delivery, now)
                .orElseThrow(() -> new ConflictException(
                        "Only failed deliveries can be retried, current status: " + delivery.getStatus()));
        dispatcher.submitAttempt(claim);
        return deliveryRepository.findById(deliveryId).orElse(delivery);
    }

    private WebhookDelivery findOwnedDelivery(String userId, String deliveryId) {
        WebhookDelivery delivery = deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> new ResourceNotFoundException("Delivery not found: " + deliveryId));
        if (webhookRepository.findByIdAndUserId(delivery.getWebhookId(), userId).isEmpty()) {
            throw new ResourceNotFoundException("Delivery not found: " + deliveryId);
        }
        return delivery;
    }

    private void applyEnabled(Webhook webhook, boolean enabled) {
        if (enabled && !webhook.isEnabled()) {
            webhook.setConsecutiveFailures(0);
        }
        webhook.setEnabled(enabled);
    }

    private String validateUrl(String url) {
        try {
            return urlValidator.validate(url).toString();
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Invalid webhook URL: " + e.getMessage());
        }
    }

    private Set<String> validateEvents(Set<String> events) {
        if (events == null || events.isEmpty()) {
            throw new InvalidRequestException("At least one event type is required");
        }
        Set<String> validated = new LinkedHashSet<>();
        for (String event : events) {
            EventType type = EventType.find(event)
                    .orElseThrow(() -> new InvalidRequestException("Unknown event type: " + event));
            validated.add(type.wireName());
        }
        return validated;
    }

    private Map<String, String> validateHeaders(Map<String, String> headers) {
        Map<String, String> validated = new LinkedHashMap<>();
        if (headers == null) {
            return validated;
        }
        headers.forEach((name, value) -> {
            if (name == null || name.isBlank()) {
                throw new InvalidRequestException("Header name cannot be empty");
            }
            if (WebhookPayloadFactory.RESERVED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                throw new InvalidRequestException("Header " + name + " is reserved");
            }
            validated.put(name, value);
        });
        return validated;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
