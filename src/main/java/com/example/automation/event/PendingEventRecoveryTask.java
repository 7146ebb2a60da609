package com.example.automation.event;

import com.example.automation.config.RedisStreamConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 定时任务：认领 Pending List 中长时间未 ACK 的事件并重新分发。
 * 超过最大投递次数的事件记录日志后 ACK 丢弃。
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "app.events.mode", havingValue = "redis")
public class PendingEventRecoveryTask {

    private static final Duration PENDING_IDLE_TIME = Duration.ofMinutes(1);
    private static final int MAX_RECOVER_COUNT = 100;
    private static final long MAX_DELIVERY_COUNT = 5;

    private final StringRedisTemplate redisTemplate;
    private final JobEventStreamConsumer consumer;
    private final String streamKey;

    public PendingEventRecoveryTask(StringRedisTemplate redisTemplate, JobEventStreamConsumer consumer,
            @Value("${app.events.stream.key:automation:job-events}") String streamKey) {
        this.redisTemplate = redisTemplate;
        this.consumer = consumer;
        this.streamKey = streamKey;
    }

    @Scheduled(fixedDelay = 30_000)
    public void recoverPendingEvents() {
        try {
            PendingMessages pendingMessages = redisTemplate.opsForStream().pending(
                    streamKey,
                    Consumer.from(JobEventStreamConsumer.GROUP_NAME, RedisStreamConfig.CONSUMER_NAME),
                    Range.unbounded(),
                    MAX_RECOVER_COUNT);

            for (PendingMessage pm : pendingMessages) {
                if (pm.getElapsedTimeSinceLastDelivery().compareTo(PENDING_IDLE_TIME) <= 0) {
                    continue;
                }

                List<MapRecord<String, Object, Object>> claimed = redisTemplate.opsForStream().claim(
                        streamKey,
                        JobEventStreamConsumer.GROUP_NAME,
                        RedisStreamConfig.CONSUMER_NAME,
                        PENDING_IDLE_TIME,
                        pm.getId());

                for (MapRecord<String, Object, Object> record : claimed) {
                    if (pm.getTotalDeliveryCount() >= MAX_DELIVERY_COUNT) {
                        log.warn("Event record {} exceeded {} deliveries, discarding", pm.getId(), MAX_DELIVERY_COUNT);
                        redisTemplate.opsForStream().acknowledge(streamKey, JobEventStreamConsumer.GROUP_NAME, pm.getId());
                        continue;
                    }
                    log.info("Recovering pending event record: id={}, deliveryCount={}",
                            pm.getId(), pm.getTotalDeliveryCount());
                    consumer.onMessage(toStringRecord(record));
                }
            }
        } catch (Exception e) {
            log.error("Error during pending event recovery: {}", e.getMessage(), e);
        }
    }

    private MapRecord<String, String, String> toStringRecord(MapRecord<String, Object, Object> record) {
        Map<String, String> values = record.getValue().entrySet().stream()
                .collect(Collectors.toMap(
                        e -> e.getKey().toString(),
                        e -> e.getValue() != null ? e.getValue().toString() : ""));
        return MapRecord.create(record.getStream(), values).withId(record.getId());
    }
}
