package com.example.automation.service;

import com.example.automation.dto.WebhookRequest;
import com.example.automation.exception.ConflictException;
import com.example.automation.exception.InvalidRequestException;
import com.example.automation.model.DeliveryStatus;
import com.example.automation.model.Webhook;
import com.example.automation.model.WebhookDelivery;
import com.example.automation.repository.DeliveryAttemptRepository;
import com.example.automation.repository.WebhookDeliveryRepository;
import com.example.automation.repository.WebhookRepository;
import com.example.automation.utils.UrlValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Webhook 管理的输入校验与启停规则。
 */
class WebhookServiceTest {

    private WebhookRepository webhookRepository;
    private WebhookDeliveryRepository deliveryRepository;
    private RetryScheduler retryScheduler;
    private WebhookDispatcher dispatcher;
    private WebhookService service;

    @BeforeEach
    void setUp() {
        webhookRepository = mock(WebhookRepository.class);
        deliveryRepository = mock(WebhookDeliveryRepository.class);
        retryScheduler = mock(RetryScheduler.class);
        dispatcher = mock(WebhookDispatcher.class);
        when(webhookRepository.save(any(Webhook.class))).thenAnswer(invocation -> invocation.getArgument(0));

        service = new WebhookService(webhookRepository, deliveryRepository, mock(DeliveryAttemptRepository.class),
                new UrlValidator(false, ""), mock(WebhookPayloadFactory.class), mock(WebhookSender.class),
                retryScheduler, dispatcher, Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC), 10);
    }

    @Test
    void testCreateNormalisesEventsAndEmptySecret() {
        Webhook webhook = service.create("user-1", WebhookRequest.builder()
                .url("https://hooks.example.com/in")
                .events(Set.of("job.completed"))
                .secret("")
                .projectId("")
                .headers(Map.of("X-Team", "data"))
                .build());

        assertEquals(Set.of("job.completed"), webhook.getEvents());
        assertNull(webhook.getSecret());
        assertFalse(webhook.isSigned());
        assertNull(webhook.getProjectId());
        assertTrue(webhook.isEnabled());
        assertEquals("data", webhook.getHeaders().get("X-Team"));
    }

    @Test
    void testHttpUrlIsRejected() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class, () -> service.create("user-1",
                WebhookRequest.builder().url("http://hooks.example.com/in").events(Set.of("job.failed")).build()));
        assertTrue(e.getMessage().contains("HTTPS"));
        verify(webhookRepository, never()).save(any());
    }

    @Test
    void testUnknownOrMissingEventsAreRejected() {
        assertThrows(InvalidRequestException.class, () -> service.create("user-1",
                WebhookRequest.builder().url("https://hooks.example.com/in").events(Set.of("job.exploded")).build()));
        assertThrows(InvalidRequestException.class, () -> service.create("user-1",
                WebhookRequest.builder().url("https://hooks.example.com/in").events(Set.of()).build()));
    }

    @Test
    void testReservedHeaderIsRejected() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class, () -> service.create("user-1",
                WebhookRequest.builder()
                        .url("https://hooks.example.com/in")
                        .events(Set.of("job.completed"))
                        .headers(Map.of("X-Signature-256", "sha256=forged"))
                        .build()));
        assertTrue(e.getMessage().contains("reserved"));
    }

    @Test
    void testReEnableResetsFailureCounter() {
        Webhook disabled = Webhook.builder().id(7L).userId("user-1").url("https://hooks.example.com/in")
                .events(Set.of("job.completed")).enabled(false).consecutiveFailures(5).build();
        when(webhookRepository.findByIdAndUserId(7L, "user-1")).thenReturn(Optional.of(disabled));

        Webhook enabled = service.setEnabled("user-1", 7L, true);

        assertTrue(enabled.isEnabled());
        assertEquals(0, enabled.getConsecutiveFailures());
    }

    @Test
    void testDisableKeepsFailureCounter() {
        Webhook webhook = Webhook.builder().id(7L).userId("user-1").url("https://hooks.example.com/in")
                .events(Set.of("job.completed")).consecutiveFailures(3).build();
        when(webhookRepository.findByIdAndUserId(7L, "user-1")).thenReturn(Optional.of(webhook));

        Webhook disabled = service.setEnabled("user-1", 7L, false);

        assertFalse(disabled.isEnabled());
        assertEquals(3, disabled.getConsecutiveFailures());
    }

    @Test
    void testRetryOfDisabledWebhookIsConflict() {
        Webhook disabled = Webhook.builder().id(7L).userId("user-1").url("https://hooks.example.com/in")
                .events(Set.of("job.completed")).enabled(false).build();
        WebhookDelivery delivery = WebhookDelivery.builder().id("d-1").webhookId(7L).status(DeliveryStatus.FAILED).build();
        when(deliveryRepository.findById("d-1")).thenReturn(Optional.of(delivery));
        when(webhookRepository.findByIdAndUserId(7L, "user-1")).thenReturn(Optional.of(disabled));

        assertThrows(ConflictException.class, () -> service.retryDelivery("user-1", "d-1"));
        verify(retryScheduler, never()).requeue(any(WebhookDelivery.class), any());
        verify(dispatcher, never()).submitAttempt(any(DeliveryClaim.class));
    }

    @Test
    void testRetrySubmitsClaimFromRequeue() {
        Webhook webhook = Webhook.builder().id(7L).userId("user-1").url("https://hooks.example.com/in")
                .events(Set.of("job.completed")).build();
        WebhookDelivery delivery = WebhookDelivery.builder().id("d-1").webhookId(7L)
                .status(DeliveryStatus.FAILED).version(4L).build();
        when(deliveryRepository.findById("d-1")).thenReturn(Optional.of(delivery));
        when(webhookRepository.findByIdAndUserId(7L, "user-1")).thenReturn(Optional.of(webhook));
        when(retryScheduler.requeue(any(WebhookDelivery.class), any())).thenReturn(Optional.of(new DeliveryClaim("d-1", 5L)));

        service.retryDelivery("user-1", "d-1");

        verify(dispatcher).submitAttempt(new DeliveryClaim("d-1", 5L));
    }

    @Test
    void testRetryOfPendingDeliveryIsConflict() {
        Webhook webhook = Webhook.builder().id(7L).userId("user-1").url("https://hooks.example.com/in")
                .events(Set.of("job.completed")).build();
        WebhookDelivery delivery = WebhookDelivery.builder().id("d-1").webhookId(7L)
                .status(DeliveryStatus.PENDING).version(1L).build();
        when(deliveryRepository.findById("d-1")).thenReturn(Optional.of(delivery));
        when(webhookRepository.findByIdAndUserId(7L, "user-1")).thenReturn(Optional.of(webhook));
        when(retryScheduler.requeue(any(WebhookDelivery.class), any())).thenReturn(Optional.empty());

        assertThrows(ConflictException.class, () -> service.retryDelivery("user-1", "d-1"));
        verify(dispatcher, never()).submitAttempt(any(DeliveryClaim.class));
    }
}
