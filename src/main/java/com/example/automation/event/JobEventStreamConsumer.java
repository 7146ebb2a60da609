package com.example.automation.event;

import com.example.automation.service.WebhookDispatcher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.stream.StreamListener;
import org.springframework.stereotype.Service;

/**
 * Redis Stream 事件消费者。
 * 分发成功后 ACK；分发抛错时不 ACK，消息留在 Pending List 中由 {@link PendingEventRecoveryTask} 重试。
 * 投递以记录 ID 去重，重新分发只补建上次未创建的投递。
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "app.events.mode", havingValue = "redis")
public class JobEventStreamConsumer implements StreamListener<String, MapRecord<String, String, String>> {

    public static final String GROUP_NAME = "automation-dispatchers";

    private final WebhookDispatcher dispatcher;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String streamKey;

    public JobEventStreamConsumer(WebhookDispatcher dispatcher, StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            @Value("${app.events.stream.key:automation:job-events}") String streamKey) {
        this.dispatcher = dispatcher;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.streamKey = streamKey;
    }

    @Override
    public void onMessage(MapRecord<String, String, String> message) {
        String json = message.getValue().get(RedisJobEventPublisher.EVENT_FIELD);
        if (json == null) {
            log.warn("Dropping stream record {} without event body", message.getId());
            acknowledge(message);
            return;
        }

        JobEvent event;
        try {
            event = objectMapper.readValue(json, JobEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable stream record {}: {}", message.getId(), e.getOriginalMessage());
            acknowledge(message);
            return;
        }

        try {
            dispatcher.dispatch(event, message.getId().getValue());
            acknowledge(message);
        } catch (Exception e) {
            log.error("Error dispatching stream record {}: {}. Message will remain pending for retry.",
                    message.getId(), e.getMessage(), e);
        }
    }

    private void acknowledge(MapRecord<String, String, String> message) {
        redisTemplate.opsForStream().acknowledge(streamKey, GROUP_NAME, message.getId());
        log.debug("Message acknowledged: {}", message.getId());
    }
}
