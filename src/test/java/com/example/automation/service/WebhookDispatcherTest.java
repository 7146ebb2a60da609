package com.example.automation.service;

import com.example.automation.event.JobEvent;
import com.example.automation.exception.ConflictException;
import com.example.automation.model.DeliveryAttempt;
import com.example.automation.model.DeliveryStatus;
import com.example.automation.model.EventType;
import com.example.automation.model.Webhook;
import com.example.automation.model.WebhookDelivery;
import com.example.automation.repository.DeliveryAttemptRepository;
import com.example.automation.repository.WebhookDeliveryRepository;
import com.example.automation.repository.WebhookRepository;
import com.example.automation.security.WebhookSigner;
import com.example.automation.utils.UrlValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 分发、重试与自动停用的端到端流程，基于内存 H2、同步执行器与可拨动时钟。
 */
// 轮询由测试手动驱动
@DataJpaTest(properties = "app.webhooks.retry-poll-interval-ms=3600000")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({WebhookDispatcher.class, RetryScheduler.class, RetryPollTask.class, WebhookPayloadFactory.class,
        WebhookSigner.class, WebhookService.class, UrlValidator.class, WebhookDispatcherTest.Config.class})
class WebhookDispatcherTest {

    private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");

    @TestConfiguration
    static class Config {

        @Bean
        MutableClock clock() {
            return new MutableClock(T0);
        }

        @Bean
        RecordingWebhookSender webhookSender(MutableClock clock) {
            return new RecordingWebhookSender(clock);
        }

        @Bean(name = "deliveryExecutor")
        TaskExecutor deliveryExecutor() {
            return new SyncTaskExecutor();
        }

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper().registerModule(new JavaTimeModule());
        }
    }

    @Autowired
    private WebhookDispatcher dispatcher;

    @Autowired
    private RetryPollTask retryPollTask;

    @Autowired
    private WebhookService webhookService;

    @Autowired
    private WebhookRepository webhookRepository;

    @Autowired
    private WebhookDeliveryRepository deliveryRepository;

    @Autowired
    private DeliveryAttemptRepository attemptRepository;

    @Autowired
    private RecordingWebhookSender sender;

    @Autowired
    private MutableClock clock;

    @Autowired
    private WebhookSigner signer;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private WebhookPayloadFactory payloadFactory;

    @Autowired
    private RetryScheduler retryScheduler;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @BeforeEach
    void setUp() {
        clock.set(T0);
        sender.reset();
    }

    @AfterEach
    void tearDown() {
        attemptRepository.deleteAll();
        deliveryRepository.deleteAll();
        webhookRepository.deleteAll();
    }

    @Test
    void testFiveFailuresFollowBackoffTableAndEndFailed() {
        Webhook webhook = saveWebhook("user-1", null, "s3cret");
        double failuresBefore = meterRegistry.counter("automation.webhook.attempts", "outcome", "failure").count();

        List<String> ids = dispatcher.dispatch(event("user-1", "p1", EventType.JOB_COMPLETED));
        assertEquals(1, ids.size());
        String deliveryId = ids.get(0);

        // 未到期不会重试
        clock.set(T0.plusSeconds(59));
        assertEquals(0, retryPollTask.pollOnce());

        for (Duration offset : List.of(Duration.ofMinutes(1), Duration.ofMinutes(5),
                Duration.ofMinutes(30), Duration.ofHours(2))) {
            clock.set(T0.plus(offset));
            assertEquals(1, retryPollTask.pollOnce());
        }

        // 终态失败后不再自动重试
        clock.set(T0.plus(Duration.ofDays(1)));
        assertEquals(0, retryPollTask.pollOnce());

        List<DeliveryAttempt> attempts = attemptRepository.findByDeliveryIdOrderByAttemptNumberAsc(deliveryId);
        assertEquals(5, attempts.size());
        for (int i = 0; i < attempts.size(); i++) {
            DeliveryAttempt attempt = attempts.get(i);
            assertEquals(i + 1, attempt.getAttemptNumber());
            assertEquals(DeliveryStatus.FAILED, attempt.getStatus());
            assertEquals(500, attempt.getHttpStatusCode());
            assertEquals(T0.plus(RetryScheduler.offsetFor(i + 1)), attempt.getAttemptedAt());
        }
        assertEquals(T0.plus(Duration.ofMinutes(1)), attempts.get(0).getNextRetryAt());
        assertNull(attempts.get(4).getNextRetryAt());

        WebhookDelivery delivery = deliveryRepository.findById(deliveryId).orElseThrow();
        assertEquals(DeliveryStatus.FAILED, delivery.getStatus());
        assertEquals(5, delivery.getAttemptCount());
        assertNull(delivery.getNextRetryAt());
        assertEquals(T0.plus(Duration.ofHours(2)), delivery.getCompletedAt());

        assertEquals(5, sender.requests().size());
        assertEquals(failuresBefore + 5,
                meterRegistry.counter("automation.webhook.attempts", "outcome", "failure").count());
        Webhook reloaded = webhookRepository.findById(webhook.getId()).orElseThrow();
        assertEquals(5, reloaded.getConsecutiveFailures());
    }

    @Test
    void testRetriesSendIdenticalSignedBody() {
        Webhook webhook = saveWebhook("user-1", null, "s3cret");
        webhook.getHeaders().put("X-Env", "staging");
        webhookRepository.save(webhook);
        sender.respondWith(500, 200);

        String deliveryId = dispatcher.dispatch(event("user-1", "p1", EventType.JOB_FAILED)).get(0);
        clock.set(T0.plus(Duration.ofMinutes(1)));
        retryPollTask.pollOnce();

        assertEquals(2, sender.requests().size());
        RecordingWebhookSender.SentRequest first = sender.requests().get(0);
        RecordingWebhookSender.SentRequest second = sender.requests().get(1);
        assertEquals(first.body(), second.body());

        Map<String, String> headers = second.headers();
        assertEquals(deliveryId, headers.get(WebhookPayloadFactory.HEADER_DELIVERY_ID));
        assertEquals(String.valueOf(webhook.getId()), headers.get(WebhookPayloadFactory.HEADER_WEBHOOK_ID));
        assertEquals("job.failed", headers.get(WebhookPayloadFactory.HEADER_EVENT));
        assertEquals(String.valueOf(clock.instant().getEpochSecond()), headers.get(WebhookPayloadFactory.HEADER_TIMESTAMP));
        assertEquals("application/json", headers.get("Content-Type"));
        assertEquals("staging", headers.get("X-Env"));
        assertTrue(signer.verify(second.body().getBytes(StandardCharsets.UTF_8), "s3cret",
                headers.get(WebhookPayloadFactory.HEADER_SIGNATURE)));
    }

    @Test
    void testPayloadShape() throws Exception {
        Webhook webhook = saveWebhook("user-1", null, null);
        sender.respondWith(200);

        JobEvent event = event("user-1", "p1", EventType.JOB_PROGRESS);
        event.getData().put("progress", 50);
        String deliveryId = dispatcher.dispatch(event).get(0);

        RecordingWebhookSender.SentRequest request = sender.requests().get(0);
        assertFalse(request.headers().containsKey(WebhookPayloadFactory.HEADER_SIGNATURE));

        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("job.progress", body.get("event").asText());
        assertEquals(T0.toString(), body.get("timestamp").asText());
        assertEquals("p1", body.get("data").get("project_id").asText());
        assertEquals("job-42", body.get("data").get("job_id").asText());
        assertEquals(50, body.get("data").get("progress").asInt());
        assertEquals(webhook.getId().longValue(), body.get("metadata").get("webhook_id").asLong());
        assertEquals(deliveryId, body.get("metadata").get("delivery_id").asText());
    }

    @Test
    void testFailureThenSuccessResetsCounter() {
        Webhook webhook = saveWebhook("user-1", null, "s3cret");
        sender.respondWith(503, 200);

        String deliveryId = dispatcher.dispatch(event("user-1", "p1", EventType.JOB_COMPLETED)).get(0);
        assertEquals(1, webhookRepository.findById(webhook.getId()).orElseThrow().getConsecutiveFailures());

        clock.set(T0.plus(Duration.ofMinutes(1)));
        assertEquals(1, retryPollTask.pollOnce());

        WebhookDelivery delivery = deliveryRepository.findById(deliveryId).orElseThrow();
        assertEquals(DeliveryStatus.SUCCESS, delivery.getStatus());
        assertEquals(2, delivery.getAttemptCount());
        assertEquals(200, delivery.getLastStatusCode());

        List<DeliveryAttempt> attempts = attemptRepository.findByDeliveryIdOrderByAttemptNumberAsc(deliveryId);
        assertEquals(2, attempts.size());
        assertEquals(503, attempts.get(0).getHttpStatusCode());
        assertEquals(DeliveryStatus.SUCCESS, attempts.get(1).getStatus());
        assertEquals(T0.plus(Duration.ofMinutes(1)), attempts.get(1).getAttemptedAt());

        Webhook reloaded = webhookRepository.findById(webhook.getId()).orElseThrow();
        assertEquals(0, reloaded.getConsecutiveFailures());
        assertEquals(200, reloaded.getLastStatusCode());
        assertTrue(reloaded.isEnabled());
    }

    @Test
    void testFiveFailedEventsDisableWebhook() {
        Webhook webhook = saveWebhook("user-1", null, null);

        for (int i = 0; i < 5; i++) {
            assertTrue(webhookRepository.findById(webhook.getId()).orElseThrow().isEnabled());
            assertEquals(1, dispatcher.dispatch(event("user-1", "p" + i, EventType.JOB_FAILED)).size());
        }

        Webhook disabled = webhookRepository.findById(webhook.getId()).orElseThrow();
        assertFalse(disabled.isEnabled());
        assertEquals(5, disabled.getConsecutiveFailures());

        // 第 6 个事件不再匹配
        assertTrue(dispatcher.dispatch(event("user-1", "p5", EventType.JOB_FAILED)).isEmpty());

        // 已排队的重试直接关闭，不再发请求
        clock.set(T0.plus(Duration.ofMinutes(1)));
        assertEquals(5, retryPollTask.pollOnce());
        assertEquals(5, sender.requests().size());
        assertEquals(5, deliveryRepository.countByStatus(DeliveryStatus.FAILED));
        assertEquals(5, attemptRepository.count());
    }

    @Test
    void testMatchingIsScopedToUserProjectAndEventType() {
        Webhook global = saveWebhook("user-1", null, null);
        Webhook projectOnly = saveWebhook("user-1", "p1", null);
        Webhook otherProject = saveWebhook("user-1", "p2", null);
        Webhook otherUser = saveWebhook("user-2", null, null);
        sender.respondWith(200, 200, 200, 200);

        List<String> ids = dispatcher.dispatch(event("user-1", "p1", EventType.JOB_COMPLETED));

        assertEquals(2, ids.size());
        Set<Long> targeted = Set.of(
                deliveryRepository.findById(ids.get(0)).orElseThrow().getWebhookId(),
                deliveryRepository.findById(ids.get(1)).orElseThrow().getWebhookId());
        assertEquals(Set.of(global.getId(), projectOnly.getId()), targeted);
        assertFalse(targeted.contains(otherProject.getId()));
        assertFalse(targeted.contains(otherUser.getId()));

        assertTrue(dispatcher.dispatch(event("user-1", "p1", EventType.TARGET_ADDED)).isEmpty());
    }

    @Test
    void testManualRetryStartsNewSequence() {
        Webhook webhook = saveWebhook("user-1", null, null);
        String deliveryId = dispatcher.dispatch(event("user-1", "p1", EventType.JOB_COMPLETED)).get(0);
        for (Duration offset : List.of(Duration.ofMinutes(1), Duration.ofMinutes(5),
                Duration.ofMinutes(30), Duration.ofHours(2))) {
            clock.set(T0.plus(offset));
            retryPollTask.pollOnce();
        }
        assertEquals(DeliveryStatus.FAILED, deliveryRepository.findById(deliveryId).orElseThrow().getStatus());

        // 已被自动停用，需要先重新启用
        assertThrows(ConflictException.class, () -> webhookService.retryDelivery("user-1", deliveryId));
        webhookService.setEnabled("user-1", webhook.getId(), true);
        assertEquals(0, webhookRepository.findById(webhook.getId()).orElseThrow().getConsecutiveFailures());

        Instant retryAt = T0.plus(Duration.ofDays(1));
        clock.set(retryAt);
        sender.respondWith(502);
        webhookService.retryDelivery("user-1", deliveryId);

        WebhookDelivery delivery = deliveryRepository.findById(deliveryId).orElseThrow();
        assertEquals(DeliveryStatus.PENDING, delivery.getStatus());
        assertEquals(6, delivery.getAttemptCount());
        assertEquals(6, delivery.getSequenceStartAttempt());
        assertEquals(retryAt.plus(Duration.ofMinutes(1)), delivery.getNextRetryAt());

        sender.respondWith(200);
        clock.set(retryAt.plus(Duration.ofMinutes(1)));
        assertEquals(1, retryPollTask.pollOnce());

        List<DeliveryAttempt> attempts = attemptRepository.findByDeliveryIdOrderByAttemptNumberAsc(deliveryId);
        assertEquals(7, attempts.size());
        assertEquals(6, attempts.get(5).getAttemptNumber());
        assertEquals(retryAt, attempts.get(5).getAttemptedAt());
        assertEquals(DeliveryStatus.SUCCESS, attempts.get(6).getStatus());
        assertEquals(DeliveryStatus.SUCCESS, deliveryRepository.findById(deliveryId).orElseThrow().getStatus());

        // 非失败状态不能手动重试
        assertThrows(ConflictException.class, () -> webhookService.retryDelivery("user-1", deliveryId));
    }

    @Test
    void testExpiredLeaseIsReclaimed() {
        saveWebhook("user-1", null, null);
        sender.respondWith(200);

        // 模拟分发后进程崩溃：投递已创建但第一次尝试从未执行
        WebhookDelivery orphan = WebhookDelivery.builder()
                .id("orphan-1")
                .webhookId(webhookRepository.findAll().get(0).getId())
                .eventType("job.completed")
                .payload("{\"event\":\"job.completed\"}")
                .status(DeliveryStatus.PENDING)
                .sequenceStartedAt(T0)
                .nextRetryAt(T0.plus(Duration.ofMinutes(5)))
                .createdAt(T0)
                .build();
        deliveryRepository.save(orphan);

        clock.set(T0.plus(Duration.ofMinutes(4)));
        assertEquals(0, retryPollTask.pollOnce());
        clock.set(T0.plus(Duration.ofMinutes(5)));
        assertEquals(1, retryPollTask.pollOnce());

        WebhookDelivery delivery = deliveryRepository.findById("orphan-1").orElseThrow();
        assertEquals(DeliveryStatus.SUCCESS, delivery.getStatus());
        assertEquals(1, delivery.getAttemptCount());
    }

    @Test
    void testStaleQueuedAttemptDoesNotSendTwice() throws Exception {
        saveWebhook("user-1", null, null);
        sender.respondWith(200, 200);

        // 执行器只排队不执行，模拟第一次尝试在线程池里积压到租约过期
        List<Runnable> queued = new ArrayList<>();
        WebhookDispatcher queuingDispatcher = new WebhookDispatcher(webhookRepository, deliveryRepository,
                attemptRepository, payloadFactory, sender, retryScheduler, queued::add, transactionManager,
                meterRegistry, clock, 30, 5);
        RetryPollTask queuingPoll = new RetryPollTask(retryScheduler, queuingDispatcher, clock);

        String deliveryId = queuingDispatcher.dispatch(event("user-1", "p1", EventType.JOB_COMPLETED)).get(0);
        clock.set(T0.plus(Duration.ofMinutes(6)));
        assertEquals(1, queuingPoll.pollOnce());
        assertEquals(2, queued.size());

        CyclicBarrier barrier = new CyclicBarrier(queued.size());
        List<Thread> workers = new ArrayList<>();
        for (Runnable task : queued) {
            Thread worker = new Thread(() -> {
                try {
                    barrier.await(5, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
                task.run();
            });
            workers.add(worker);
            worker.start();
        }
        for (Thread worker : workers) {
            worker.join(10_000);
        }

        assertEquals(1, sender.requests().size());
        List<DeliveryAttempt> attempts = attemptRepository.findByDeliveryIdOrderByAttemptNumberAsc(deliveryId);
        assertEquals(1, attempts.size());
        assertEquals(1, attempts.get(0).getAttemptNumber());

        WebhookDelivery delivery = deliveryRepository.findById(deliveryId).orElseThrow();
        assertEquals(DeliveryStatus.SUCCESS, delivery.getStatus());
        assertEquals(1, delivery.getAttemptCount());
    }

    @Test
    void testClaimTokenIsSingleUse() {
        saveWebhook("user-1", null, null);
        sender.respondWith(503);

        List<Runnable> queued = new ArrayList<>();
        WebhookDispatcher queuingDispatcher = new WebhookDispatcher(webhookRepository, deliveryRepository,
                attemptRepository, payloadFactory, sender, retryScheduler, queued::add, transactionManager,
                meterRegistry, clock, 30, 5);
        String deliveryId = queuingDispatcher.dispatch(event("user-1", "p1", EventType.JOB_COMPLETED)).get(0);
        DeliveryClaim claim = new DeliveryClaim(deliveryId, 0L);

        assertNotNull(queuingDispatcher.attempt(claim));
        // 同一凭证再次执行不会发送
        assertNull(queuingDispatcher.attempt(claim));
        assertEquals(1, sender.requests().size());
        assertEquals(1, attemptRepository.findByDeliveryIdOrderByAttemptNumberAsc(deliveryId).size());
    }

    @Test
    void testOutcomeIsWrittenAtomically() {
        Webhook webhook = saveWebhook("user-1", null, null);
        sender.respondWith(500, 200);

        deliveryRepository.save(WebhookDelivery.builder()
                .id("d-fixed")
                .webhookId(webhook.getId())
                .eventType("job.completed")
                .payload("{\"event\":\"job.completed\"}")
                .status(DeliveryStatus.PENDING)
                .sequenceStartedAt(T0)
                .nextRetryAt(T0)
                .createdAt(T0)
                .build());
        // 占用第 1 次尝试的编号，使结果写入失败
        DeliveryAttempt conflicting = attemptRepository.save(DeliveryAttempt.builder()
                .deliveryId("d-fixed")
                .webhookId(webhook.getId())
                .attemptNumber(1)
                .eventType("job.completed")
                .status(DeliveryStatus.FAILED)
                .attemptedAt(T0)
                .build());

        assertEquals(1, retryPollTask.pollOnce());

        // 尝试记录、投递状态与 webhook 计数一起回滚
        assertEquals(0, webhookRepository.findById(webhook.getId()).orElseThrow().getConsecutiveFailures());
        WebhookDelivery delivery = deliveryRepository.findById("d-fixed").orElseThrow();
        assertEquals(DeliveryStatus.PENDING, delivery.getStatus());
        assertEquals(0, delivery.getAttemptCount());
        assertEquals(T0.plus(Duration.ofMinutes(5)), delivery.getNextRetryAt());
        assertEquals(1, attemptRepository.count());

        // 租约过期后同一编号的尝试重新执行
        attemptRepository.delete(conflicting);
        clock.set(T0.plus(Duration.ofMinutes(5)));
        assertEquals(1, retryPollTask.pollOnce());

        delivery = deliveryRepository.findById("d-fixed").orElseThrow();
        assertEquals(DeliveryStatus.SUCCESS, delivery.getStatus());
        assertEquals(1, delivery.getAttemptCount());
        List<DeliveryAttempt> attempts = attemptRepository.findByDeliveryIdOrderByAttemptNumberAsc("d-fixed");
        assertEquals(1, attempts.size());
        assertEquals(DeliveryStatus.SUCCESS, attempts.get(0).getStatus());
        assertEquals(2, sender.requests().size());
        assertEquals(0, webhookRepository.findById(webhook.getId()).orElseThrow().getConsecutiveFailures());
    }

    @Test
    void testRedeliveredStreamRecordIsDispatchedOnce() {
        Webhook first = saveWebhook("user-1", null, null);
        sender.respondWith(200, 200, 200);

        List<String> created = dispatcher.dispatch(event("user-1", "p1", EventType.JOB_COMPLETED), "1700000000000-0");
        assertEquals(1, created.size());

        // 第二个 webhook 在重复消费之前创建，只为它补建投递
        Webhook second = saveWebhook("user-1", "p1", null);
        List<String> redelivered = dispatcher.dispatch(event("user-1", "p1", EventType.JOB_COMPLETED), "1700000000000-0");
        assertEquals(1, redelivered.size());
        assertEquals(second.getId(), deliveryRepository.findById(redelivered.get(0)).orElseThrow().getWebhookId());

        assertTrue(dispatcher.dispatch(event("user-1", "p1", EventType.JOB_COMPLETED), "1700000000000-0").isEmpty());
        assertEquals(2, deliveryRepository.count());
        assertEquals(2, sender.requests().size());
        assertTrue(deliveryRepository.existsBySourceEventIdAndWebhookId("1700000000000-0", first.getId()));

        // 其他记录不受影响
        assertEquals(2, dispatcher.dispatch(event("user-1", "p1", EventType.JOB_COMPLETED), "1700000000001-0").size());
    }

    private Webhook saveWebhook(String userId, String projectId, String secret) {
        return webhookRepository.save(Webhook.builder()
                .userId(userId)
                .projectId(projectId)
                .url("https://hooks.example.com/in")
                .events(new LinkedHashSet<>(Set.of("job.completed", "job.failed", "job.progress")))
                .secret(secret)
                .build());
    }

    private JobEvent event(String userId, String projectId, EventType type) {
        return JobEvent.builder()
                .eventType(type)
                .userId(userId)
                .projectId(projectId)
                .projectName("Project " + projectId)
                .jobId("job-42")
                .occurredAt(clock.instant())
                .build();
    }
}
