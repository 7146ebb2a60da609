package com.example.automation.service;

import com.example.automation.event.JobEvent;
import com.example.automation.model.Webhook;
import com.example.automation.model.WebhookDelivery;
import com.example.automation.security.WebhookSigner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 构造 webhook 请求体与请求头。
 * <p>
 * 请求体在创建投递时序列化一次并持久化，后续每次重试发送相同的字节，签名也针对这些字节计算。
 */
@Component
@Slf4j
public class WebhookPayloadFactory {

    public static final String HEADER_WEBHOOK_ID = "X-Webhook-ID";
    public static final String HEADER_DELIVERY_ID = "X-Delivery-ID";
    public static final String HEADER_EVENT = "X-Webhook-Event";
    public static final String HEADER_SIGNATURE = "X-Signature-256";
    public static final String HEADER_TIMESTAMP = "X-Timestamp";

    /**
     * 自定义请求头不能覆盖的名称（小写）。
     */
    public static final Set<String> RESERVED_HEADERS = Set.of(
            "content-type", "user-agent", "content-length", "host", "connection", "expect", "upgrade",
            HEADER_WEBHOOK_ID.toLowerCase(Locale.ROOT), HEADER_DELIVERY_ID.toLowerCase(Locale.ROOT),
            HEADER_EVENT.toLowerCase(Locale.ROOT), HEADER_SIGNATURE.toLowerCase(Locale.ROOT),
            HEADER_TIMESTAMP.toLowerCase(Locale.ROOT));

    private final ObjectMapper objectMapper;
    private final WebhookSigner signer;
    private final String userAgent;

    public WebhookPayloadFactory(ObjectMapper objectMapper, WebhookSigner signer,
            @Value("${app.webhooks.user-agent:JobAutomation-Webhooks/1.0}") String userAgent) {
        this.objectMapper = objectMapper;
        this.signer = signer;
        this.userAgent = userAgent;
    }

    /**
     * 序列化事件：{event, timestamp, data, metadata: {webhook_id, delivery_id}}。
     *
     * @param event      领域事件
     * @param webhookId  webhook ID
     * @param deliveryId 投递 ID
     * @param timestamp  事件时间
     * @return JSON 文本
     */
    public String buildPayload(JobEvent event, Long webhookId, String deliveryId, Instant timestamp) {
        Map<String, Object> data = new LinkedHashMap<>();
        putIfPresent(data, "project_id", event.getProjectId());
        putIfPresent(data, "project_name", event.getProjectName());
        putIfPresent(data, "job_id", event.getJobId());
        if (event.getData() != null) {
            data.putAll(event.getData());
        }
        return serialize(event.getEventType().wireName(), timestamp, data, webhookId, deliveryId);
    }

    /**
     * 测试推送使用的请求体。
     */
    public String buildTestPayload(Long webhookId, Instant timestamp) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("test", true);
        data.put("message", "This is a test webhook delivery");
        return serialize("test", timestamp, data, webhookId, "test");
    }

    /**
     * 构造请求头，自定义请求头先放入，保留请求头随后覆盖。
     *
     * @param webhook    webhook
     * @param deliveryId 投递 ID
     * @param eventType  事件类型
     * @param body       实际发送的 body
     * @param sentAt     发送时间
     * @return 请求头
     */
    public Map<String, String> buildHeaders(Webhook webhook, String deliveryId, String eventType,
            byte[] body, Instant sentAt) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (webhook.getHeaders() != null) {
            webhook.getHeaders().forEach((name, value) -> {
                if (!RESERVED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                    headers.put(name, value);
                }
            });
        }

        headers.put("Content-Type", "application/json");
        headers.put("User-Agent", userAgent);
        headers.put(HEADER_WEBHOOK_ID, String.valueOf(webhook.getId()));
        headers.put(HEADER_DELIVERY_ID, deliveryId);
        headers.put(HEADER_EVENT, eventType);
        headers.put(HEADER_TIMESTAMP, String.valueOf(sentAt.getEpochSecond()));

        if (webhook.getSecret() != null && !webhook.getSecret().isEmpty()) {
            headers.put(HEADER_SIGNATURE, signer.sign(body, webhook.getSecret()));
        }
        return headers;
    }

    public Map<String, String> buildHeaders(Webhook webhook, WebhookDelivery delivery, byte[] body, Instant sentAt) {
        return buildHeaders(webhook, delivery.getId(), delivery.getEventType(), body, sentAt);
    }

    public static byte[] toBytes(String payload) {
        return payload.getBytes(StandardCharsets.UTF_8);
    }

    private String serialize(String eventType, Instant timestamp, Map<String, Object> data,
            Long webhookId, String deliveryId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("webhook_id", webhookId);
        metadata.put("delivery_id", deliveryId);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", eventType);
        payload.put("timestamp", timestamp.toString());
        payload.put("data", data);
        payload.put("metadata", metadata);

        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event data is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
