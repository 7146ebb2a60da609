package com.example.automation.controller;

import com.example.automation.dto.DeliveryDetail;
import com.example.automation.dto.ToggleRequest;
import com.example.automation.dto.WebhookRequest;
import com.example.automation.model.Webhook;
import com.example.automation.model.WebhookDelivery;
import com.example.automation.model.WebhookTestResult;
import com.example.automation.service.WebhookService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.example.automation.controller.ScheduleController.USER_HEADER;

/**
 * Webhook 管理接口。
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookService webhookService;

    @GetMapping
    public List<Webhook> list(@RequestHeader(USER_HEADER) String userId) {
        return webhookService.list(userId);
    }

    @PostMapping
    public ResponseEntity<Webhook> create(@RequestHeader(USER_HEADER) String userId,
            @RequestBody WebhookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(webhookService.create(userId, request));
    }

    @GetMapping("/{id}")
    public Webhook get(@RequestHeader(USER_HEADER) String userId, @PathVariable Long id) {
        return webhookService.get(userId, id);
    }

    @PutMapping("/{id}")
    public Webhook update(@RequestHeader(USER_HEADER) String userId, @PathVariable Long id,
            @RequestBody WebhookRequest request) {
        return webhookService.update(userId, id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(USER_HEADER) String userId, @PathVariable Long id) {
        webhookService.delete(userId, id);
        return ResponseEntity.noContent().build();
    }

    /**
     * 启用/停用。不带 enabled 时取反当前状态；重新启用会清零失败计数。
     */
    @PostMapping("/{id}/toggle")
    public Webhook toggle(@RequestHeader(USER_HEADER) String userId, @PathVariable Long id,
            @RequestBody(required = false) ToggleRequest request) {
        boolean enabled = request != null && request.getEnabled() != null
                ? request.getEnabled()
                : !webhookService.get(userId, id).isEnabled();
        return webhookService.setEnabled(userId, id, enabled);
    }

    @PostMapping("/{id}/test")
    public WebhookTestResult test(@RequestHeader(USER_HEADER) String userId, @PathVariable Long id) {
        return webhookService.test(userId, id);
    }

    @GetMapping("/{id}/deliveries")
    public Page<WebhookDelivery> deliveries(@RequestHeader(USER_HEADER) String userId, @PathVariable Long id,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int pageSize) {
        return webhookService.deliveries(userId, id, page, pageSize);
    }

    @GetMapping("/deliveries/{deliveryId}")
    public DeliveryDetail delivery(@RequestHeader(USER_HEADER) String userId, @PathVariable String deliveryId) {
        return webhookService.delivery(userId, deliveryId);
    }

    @PostMapping("/deliveries/{deliveryId}/retry")
    public ResponseEntity<WebhookDelivery> retry(@RequestHeader(USER_HEADER) String userId,
            @PathVariable String deliveryId) {
        return ResponseEntity.accepted().body(webhookService.retryDelivery(userId, deliveryId));
    }
}
