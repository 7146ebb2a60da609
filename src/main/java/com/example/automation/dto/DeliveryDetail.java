package com.example.automation.dto;

import com.example.automation.model.DeliveryAttempt;
import com.example.automation.model.WebhookDelivery;

import java.util.List;

/**
 * 投递详情：投递本身及其全部尝试记录。
 */
public record DeliveryDetail(WebhookDelivery delivery, List<DeliveryAttempt> attempts) {
}
