package com.example.automation.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Collections;

/**
 * 多实例模式：写入 Redis Stream，由消费组中的任一实例处理。
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "app.events.mode", havingValue = "redis")
public class RedisJobEventPublisher implements JobEventPublisher {

    public static final String EVENT_FIELD = "event";

    // 近似裁剪，保留最近约 10000 条
    private static final long MAX_STREAM_LENGTH = 10_000;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String streamKey;

    public RedisJobEventPublisher(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
            @Value("${app.events.stream.key:automation:job-events}") String streamKey) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.streamKey = streamKey;
    }

    @Override
    public void publish(JobEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event is not serializable: " + e.getMessage(), e);
        }

        redisTemplate.opsForStream().add(streamKey, Collections.singletonMap(EVENT_FIELD, json));
        redisTemplate.opsForStream().trim(streamKey, MAX_STREAM_LENGTH, true);
        log.info("Published {} for project {} to Redis Stream {}", event.getEventType(), event.getProjectId(), streamKey);
    }
}
