package com.example.automation.config;

import com.example.automation.event.JobEventStreamConsumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.stream.StreamMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

/**
 * 事件通道的 Redis Stream 配置（app.events.mode=redis）。
 */
@Configuration
@Slf4j
@ConditionalOnProperty(name = "app.events.mode", havingValue = "redis")
public class RedisStreamConfig {

        // 动态生成消费者名称，支持多实例部署
        public static final String CONSUMER_NAME = "dispatcher-" + UUID.randomUUID().toString().substring(0, 8);

        /**
         * 创建并启动流消费监听容器。
         *
         * @param connectionFactory Redis 连接工厂
         * @param consumer          消费者
         * @param streamKey         事件流 Key
         * @return 监听容器
         */
        @Bean(destroyMethod = "stop")
        public StreamMessageListenerContainer<String, MapRecord<String, String, String>> jobEventListenerContainer(
                        RedisConnectionFactory connectionFactory,
                        JobEventStreamConsumer consumer,
                        @Value("${app.events.stream.key:automation:job-events}") String streamKey) {

                try (RedisConnection connection = connectionFactory.getConnection()) {
                        connection.streamCommands().xGroupCreate(
                                        streamKey.getBytes(StandardCharsets.UTF_8),
                                        JobEventStreamConsumer.GROUP_NAME, ReadOffset.from("0"), true);
                } catch (RedisSystemException e) {
                        log.info("Stream group {} already exists, skipping initialization", JobEventStreamConsumer.GROUP_NAME);
                }

                StreamMessageListenerContainer.StreamMessageListenerContainerOptions<String, MapRecord<String, String, String>> options = StreamMessageListenerContainer.StreamMessageListenerContainerOptions
                                .builder()
                                .pollTimeout(Duration.ofSeconds(1))
                                .build();

                StreamMessageListenerContainer<String, MapRecord<String, String, String>> container = StreamMessageListenerContainer
                                .create(connectionFactory, options);

                container.receive(
                                Consumer.from(JobEventStreamConsumer.GROUP_NAME, CONSUMER_NAME),
                                StreamOffset.create(streamKey, ReadOffset.lastConsumed()),
                                consumer);

                container.start();
                return container;
        }
}
